package dev.workflows.model;

import java.util.List;
import java.util.Objects;

/**
 * Whole editor state captured for undo/redo: the definition plus the selection.
 */
public record EditorSnapshot(
    Trigger trigger,
    List<Step> steps,
    String selectedStepId, // nullable
    InspectorFocus inspectorFocus
) {
    public EditorSnapshot {
        Objects.requireNonNull(trigger, "trigger");
        Objects.requireNonNull(inspectorFocus, "inspectorFocus");
        steps = List.copyOf(steps);
    }

    public static EditorSnapshot of(WorkflowDefinition definition, String selectedStepId, InspectorFocus focus) {
        return new EditorSnapshot(definition.trigger(), definition.steps(), selectedStepId, focus);
    }

    public WorkflowDefinition definition() {
        return new WorkflowDefinition(trigger, steps);
    }
}
