package dev.workflows.model;

import java.util.Arrays;

public enum ConditionOperator {
    EQUALS("equals"),
    NOT_EQUALS("not_equals"),
    EXISTS("exists");

    private final String wireName;

    ConditionOperator(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() { return wireName; }

    /** Whether the condition compares against its {@code value}. */
    public boolean usesValue() {
        return this != EXISTS;
    }

    public static ConditionOperator fromWire(String wireName) {
        return Arrays.stream(values())
            .filter(op -> op.wireName.equals(wireName))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown condition operator: " + wireName));
    }
}
