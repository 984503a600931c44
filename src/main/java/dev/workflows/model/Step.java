package dev.workflows.model;

import java.util.List;
import java.util.Objects;

/**
 * One executable or branching unit of a workflow. The variant set is closed;
 * every recursive operation dispatches through {@link Visitor} so adding a
 * variant breaks the build until each operation handles it.
 */
public sealed interface Step {

    /** Globally unique, assigned at creation, never recomputed on edit. */
    String id();

    StepKind kind();

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitLog(LogStep step);

        R visitCreateRecord(CreateRecordStep step);

        R visitCondition(ConditionStep step);
    }

    /** Writes a diagnostics message. */
    record LogStep(String id, String message) implements Step {
        public LogStep {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(message, "message");
        }

        @Override
        public StepKind kind() { return StepKind.LOG_MESSAGE; }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitLog(this); }

        public LogStep withMessage(String message) {
            return new LogStep(id, message);
        }
    }

    /** Creates a runtime record of the given entity from a JSON object. */
    record CreateRecordStep(String id, String entityLogicalName, JsonText data) implements Step {
        public CreateRecordStep {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(entityLogicalName, "entityLogicalName");
            Objects.requireNonNull(data, "data");
        }

        @Override
        public StepKind kind() { return StepKind.CREATE_RUNTIME_RECORD; }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitCreateRecord(this); }

        public CreateRecordStep withEntityLogicalName(String entityLogicalName) {
            return new CreateRecordStep(id, entityLogicalName, data);
        }

        public CreateRecordStep withData(JsonText data) {
            return new CreateRecordStep(id, entityLogicalName, data);
        }
    }

    /**
     * Tests a trigger payload field and continues down exactly one of two
     * branches. With {@link ConditionOperator#EXISTS} there is nothing to
     * compare against and {@code value} is always JSON {@code null}.
     */
    record ConditionStep(
        String id,
        String fieldPath,
        ConditionOperator operator,
        JsonText value,
        String thenLabel,
        String elseLabel,
        List<Step> thenSteps,
        List<Step> elseSteps
    ) implements Step {
        public ConditionStep {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(fieldPath, "fieldPath");
            Objects.requireNonNull(operator, "operator");
            Objects.requireNonNull(value, "value");
            if (!operator.usesValue()) {
                value = JsonText.nullValue();
            }
            Objects.requireNonNull(thenLabel, "thenLabel");
            Objects.requireNonNull(elseLabel, "elseLabel");
            thenSteps = List.copyOf(thenSteps);
            elseSteps = List.copyOf(elseSteps);
        }

        @Override
        public StepKind kind() { return StepKind.CONDITION; }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitCondition(this); }

        public List<Step> branch(Branch branch) {
            return branch == Branch.THEN ? thenSteps : elseSteps;
        }

        public ConditionStep withBranch(Branch branch, List<Step> steps) {
            return branch == Branch.THEN
                ? new ConditionStep(id, fieldPath, operator, value, thenLabel, elseLabel, steps, elseSteps)
                : new ConditionStep(id, fieldPath, operator, value, thenLabel, elseLabel, thenSteps, steps);
        }

        public ConditionStep withBranches(List<Step> thenSteps, List<Step> elseSteps) {
            return new ConditionStep(id, fieldPath, operator, value, thenLabel, elseLabel, thenSteps, elseSteps);
        }

        public ConditionStep withId(String id) {
            return new ConditionStep(id, fieldPath, operator, value, thenLabel, elseLabel, thenSteps, elseSteps);
        }

        public ConditionStep withTest(String fieldPath, ConditionOperator operator, JsonText value) {
            return new ConditionStep(id, fieldPath, operator, value, thenLabel, elseLabel, thenSteps, elseSteps);
        }

        public String label(Branch branch) {
            return branch == Branch.THEN ? thenLabel : elseLabel;
        }
    }
}
