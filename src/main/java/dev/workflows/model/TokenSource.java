package dev.workflows.model;

public enum TokenSource {
    TRIGGER,
    STEP,
    RUNTIME
}
