package dev.workflows.model;

/** Whether applying a template configures the trigger or adds a step. */
public enum TemplateTarget {
    STEP,
    TRIGGER
}
