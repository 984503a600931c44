package dev.workflows.model;

import java.util.Arrays;

/**
 * The closed set of step variants, keyed by their wire tag.
 */
public enum StepKind {
    LOG_MESSAGE("log_message", "Log message", "Add a diagnostics log step."),
    CREATE_RUNTIME_RECORD("create_runtime_record", "Create record", "Create a new runtime record."),
    CONDITION("condition", "Condition", "Branch into Yes/No step paths.");

    private final String wireName;
    private final String label;
    private final String description;

    StepKind(String wireName, String label, String description) {
        this.wireName = wireName;
        this.label = label;
        this.description = description;
    }

    public String wireName() { return wireName; }
    public String label() { return label; }
    public String description() { return description; }

    public static StepKind fromWire(String wireName) {
        return Arrays.stream(values())
            .filter(kind -> kind.wireName.equals(wireName))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown step type: " + wireName));
    }
}
