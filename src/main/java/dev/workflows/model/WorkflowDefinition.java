package dev.workflows.model;

import java.util.List;
import java.util.Objects;

/**
 * A trigger plus the root step sequence. Only condition steps open further
 * sequences, so the whole is a forest of ordered sequences, never a graph.
 */
public record WorkflowDefinition(Trigger trigger, List<Step> steps) {

    public WorkflowDefinition {
        Objects.requireNonNull(trigger, "trigger");
        steps = List.copyOf(steps);
    }

    public static WorkflowDefinition empty() {
        return new WorkflowDefinition(Trigger.manual(), List.of());
    }

    public WorkflowDefinition withSteps(List<Step> steps) {
        return new WorkflowDefinition(trigger, steps);
    }

    public WorkflowDefinition withTrigger(Trigger trigger) {
        return new WorkflowDefinition(trigger, steps);
    }
}
