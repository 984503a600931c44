package dev.workflows.engine;

import dev.workflows.model.IssueLevel;
import dev.workflows.model.Step;
import dev.workflows.model.Trigger;
import dev.workflows.model.TriggerKind;
import dev.workflows.model.ValidationIssue;
import dev.workflows.model.WorkflowDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Static checks on a workflow definition. Findings are advisory: they gate
 * publishing, never editing. Whole-definition issues come first, then step
 * issues in canonical visit order, then duplicate ids.
 */
public final class WorkflowValidator {

    private static final Logger log = LoggerFactory.getLogger(WorkflowValidator.class);

    private static final String ISSUE_ID_PREFIX = "workflow_issue_";

    private WorkflowValidator() {}

    /**
     * Validate a definition. Returns an empty list if it can be published.
     */
    public static List<ValidationIssue> validate(WorkflowDefinition definition) {
        var issues = new Issues();

        if (definition.steps().isEmpty()) {
            issues.error(null, "Flow canvas requires at least one step.");
        }

        Trigger trigger = definition.trigger();
        if (trigger.kind().requiresTarget() && AuthoredText.isBlank(trigger.target())) {
            issues.error(null, trigger.kind() == TriggerKind.SCHEDULE_TICK
                ? "Schedule tick trigger requires a schedule key."
                : "Runtime record trigger requires an entity logical name.");
        }

        StepTree.walk(definition.steps(), (step, depth) -> step.accept(new StepRules(issues)));

        for (String duplicate : StepTreeOps.duplicateIds(definition.steps())) {
            issues.error(duplicate, "Step id '%s' is used by more than one step.".formatted(duplicate));
        }

        log.debug("Validated workflow: {} steps, {} issues",
            StepTree.count(definition.steps()), issues.list.size());
        return Collections.unmodifiableList(issues.list);
    }

    public static boolean hasErrors(List<ValidationIssue> issues) {
        return issues.stream().anyMatch(ValidationIssue::isError);
    }

    /**
     * Per-step rules. Branches are reached by the surrounding walk, not here.
     */
    private static final class StepRules implements Step.Visitor<Void> {
        private final Issues issues;

        StepRules(Issues issues) {
            this.issues = issues;
        }

        @Override
        public Void visitLog(Step.LogStep step) {
            if (AuthoredText.isBlank(step.message())) {
                issues.error(step.id(), "Log message step is empty.");
            }
            return null;
        }

        @Override
        public Void visitCreateRecord(Step.CreateRecordStep step) {
            if (AuthoredText.isBlank(step.entityLogicalName())) {
                issues.error(step.id(), "Create record step is missing an entity logical name.");
            }
            if (!step.data().isValid()) {
                issues.error(step.id(), "Create record step data contains invalid JSON.");
            } else if (!step.data().isObject()) {
                issues.error(step.id(), "Create record step data must be a JSON object.");
            }
            return null;
        }

        @Override
        public Void visitCondition(Step.ConditionStep step) {
            if (AuthoredText.isBlank(step.fieldPath())) {
                issues.error(step.id(), "Condition step requires a payload field path.");
            }
            if (step.operator().usesValue() && !step.value().isValid()) {
                issues.error(step.id(), "Condition value must be valid JSON for non-exists operators.");
            }
            if (step.thenSteps().isEmpty() && step.elseSteps().isEmpty()) {
                issues.error(step.id(), "Condition step must include at least one action in a branch.");
            }
            return null;
        }
    }

    private static final class Issues {
        private final List<ValidationIssue> list = new ArrayList<>();

        void error(String stepId, String message) {
            add(stepId, IssueLevel.ERROR, message);
        }

        void add(String stepId, IssueLevel level, String message) {
            list.add(new ValidationIssue(ISSUE_ID_PREFIX + (list.size() + 1), stepId, level, message));
        }
    }
}
