package dev.workflows.engine;

import dev.workflows.model.Branch;
import dev.workflows.model.Step;
import dev.workflows.model.StepPathIndex;
import dev.workflows.model.WorkflowDefinition;

import java.util.List;

/**
 * One-line descriptions of steps and a plain text outline of a definition.
 */
public final class StepSummaries {

    private static final String INDENT = "  ";

    private StepSummaries() {}

    public static String summarize(Step step) {
        return step.accept(new Step.Visitor<String>() {
            @Override
            public String visitLog(Step.LogStep logStep) {
                return AuthoredText.isBlank(logStep.message()) ? "Log message" : "Log: " + logStep.message();
            }

            @Override
            public String visitCreateRecord(Step.CreateRecordStep create) {
                return AuthoredText.isBlank(create.entityLogicalName())
                    ? "Create runtime record"
                    : "Create: " + create.entityLogicalName();
            }

            @Override
            public String visitCondition(Step.ConditionStep condition) {
                String field = condition.fieldPath().isEmpty() ? "[field path]" : condition.fieldPath();
                return field + " " + condition.operator().wireName();
            }
        });
    }

    /**
     * Indented outline, one line per step, each prefixed with its step path.
     */
    public static String outline(WorkflowDefinition definition) {
        StepPathIndex paths = StepPathIndexer.index(definition.steps());
        var sb = new StringBuilder();
        sb.append("Trigger: ").append(definition.trigger().kind().label());
        if (!definition.trigger().target().isEmpty()) {
            sb.append(" (").append(definition.trigger().target()).append(")");
        }
        sb.append("\n");
        appendSequence(sb, definition.steps(), paths, 1);
        return sb.toString();
    }

    private static void appendSequence(StringBuilder sb, List<Step> steps, StepPathIndex paths, int level) {
        for (Step step : steps) {
            sb.append(INDENT.repeat(level))
              .append(paths.pathOf(step.id()).orElse("?"))
              .append("  ")
              .append(summarize(step))
              .append("\n");
            if (step instanceof Step.ConditionStep condition) {
                for (Branch branch : Branch.values()) {
                    sb.append(INDENT.repeat(level + 1))
                      .append(branch.segment()).append(" [").append(condition.label(branch)).append("]");
                    if (condition.branch(branch).isEmpty()) {
                        sb.append(" (empty)");
                    }
                    sb.append("\n");
                    appendSequence(sb, condition.branch(branch), paths, level + 2);
                }
            }
        }
    }
}
