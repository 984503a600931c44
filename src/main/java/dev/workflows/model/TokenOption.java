package dev.workflows.model;

/**
 * An interpolation placeholder a step may reference, e.g. {@code {{run.id}}}.
 */
public record TokenOption(String token, String label, TokenSource source) {}
