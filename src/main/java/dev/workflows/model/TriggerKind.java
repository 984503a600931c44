package dev.workflows.model;

import java.util.Arrays;

public enum TriggerKind {
    MANUAL("manual", "Manual trigger"),
    RECORD_CREATED("runtime_record_created", "Record created"),
    RECORD_UPDATED("runtime_record_updated", "Record updated"),
    RECORD_DELETED("runtime_record_deleted", "Record deleted"),
    SCHEDULE_TICK("schedule_tick", "Schedule tick");

    private final String wireName;
    private final String label;

    TriggerKind(String wireName, String label) {
        this.wireName = wireName;
        this.label = label;
    }

    public String wireName() { return wireName; }
    public String label() { return label; }

    /** Every kind except manual needs an entity logical name or a schedule key. */
    public boolean requiresTarget() {
        return this != MANUAL;
    }

    public static TriggerKind fromWire(String wireName) {
        return Arrays.stream(values())
            .filter(kind -> kind.wireName.equals(wireName))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown trigger type: " + wireName));
    }
}
