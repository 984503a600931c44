package dev.workflows.engine;

import dev.workflows.model.ConditionOperator;
import dev.workflows.model.IdGenerator;
import dev.workflows.model.JsonText;
import dev.workflows.model.Step;
import dev.workflows.model.StepKind;

import java.util.List;

/**
 * Builds fresh steps. Ids always come from the caller's generator.
 */
public final class StepFactory {

    private StepFactory() {}

    /**
     * The default draft for a step kind, as added from the step library.
     */
    public static Step createDraft(StepKind kind, IdGenerator ids) {
        switch (kind) {
            case LOG_MESSAGE:
                return log(ids, "workflow fired");
            case CREATE_RUNTIME_RECORD:
                return createRecord(ids, "task", """
                    {
                      "title": "Follow-up"
                    }""");
            case CONDITION:
                String conditionId = ids.nextId();
                return new Step.ConditionStep(
                    conditionId, "status", ConditionOperator.EQUALS, JsonText.of("\"open\""), "Yes", "No",
                    List.of(log(ids, "matched condition")),
                    List.of(log(ids, "did not match condition")));
            default:
                throw new IllegalArgumentException("Unsupported step kind " + kind);
        }
    }

    public static Step.LogStep log(IdGenerator ids, String message) {
        return new Step.LogStep(ids.nextId(), message);
    }

    public static Step.CreateRecordStep createRecord(IdGenerator ids, String entityLogicalName, String dataJson) {
        return new Step.CreateRecordStep(ids.nextId(), entityLogicalName, JsonText.of(dataJson));
    }
}
