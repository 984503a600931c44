package dev.workflows.model;

/** Which node kind the editor inspector shows. */
public enum InspectorFocus {
    TRIGGER,
    STEP
}
