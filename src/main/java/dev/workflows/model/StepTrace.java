package dev.workflows.model;

/**
 * One per-step outcome reported by the execution runtime, keyed by step path.
 */
public record StepTrace(
    String stepPath,
    String stepType,
    String status,
    String errorMessage, // nullable
    Long durationMs // nullable
) {}
