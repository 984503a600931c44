package dev.workflows.model;

import java.util.Objects;

/**
 * What starts a workflow. {@code target} is the entity logical name for
 * record triggers and the schedule key for schedule ticks; it is empty for
 * manual triggers.
 */
public record Trigger(TriggerKind kind, String target) {

    public Trigger {
        Objects.requireNonNull(kind, "kind");
        target = target == null ? "" : target;
    }

    public static Trigger manual() {
        return new Trigger(TriggerKind.MANUAL, "");
    }

    public static Trigger of(TriggerKind kind, String target) {
        return new Trigger(kind, target);
    }
}
