package dev.workflows.engine;

import dev.workflows.model.Step;
import dev.workflows.model.TokenOption;
import dev.workflows.model.TokenSource;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lists the interpolation tokens a step may reference. Every step sees the
 * trigger and run tokens; a selected step additionally sees the output of each
 * step visited before it in canonical order. Steps of a sibling branch count as
 * "before" even though only one branch runs; that is left to the runtime.
 */
public final class TokenResolver {

    private static final List<TokenOption> BASE_TOKENS = List.of(
        new TokenOption("{{trigger.type}}", "Trigger type", TokenSource.TRIGGER),
        new TokenOption("{{trigger.entity}}", "Trigger entity", TokenSource.TRIGGER),
        new TokenOption("{{trigger.payload.id}}", "Trigger payload id", TokenSource.TRIGGER),
        new TokenOption("{{trigger.payload.status}}", "Trigger payload status", TokenSource.TRIGGER),
        new TokenOption("{{run.id}}", "Run id", TokenSource.RUNTIME),
        new TokenOption("{{run.attempt}}", "Run attempt", TokenSource.RUNTIME),
        new TokenOption("{{now.iso}}", "Current time (ISO)", TokenSource.RUNTIME)
    );

    private TokenResolver() {}

    /**
     * @param steps                     root step sequence
     * @param selectedStepId            the step being configured, or null for none
     * @param triggerPayloadFieldPaths  known trigger payload fields, e.g. {@code email}
     * @return tokens in offer order, unique by token string
     */
    public static List<TokenOption> tokensForStep(
            List<Step> steps, String selectedStepId, List<String> triggerPayloadFieldPaths) {
        Map<String, TokenOption> tokens = new LinkedHashMap<>();
        BASE_TOKENS.forEach(option -> tokens.putIfAbsent(option.token(), option));
        for (String fieldPath : triggerPayloadFieldPaths) {
            tokens.putIfAbsent("{{trigger.payload." + fieldPath + "}}", new TokenOption(
                "{{trigger.payload." + fieldPath + "}}", "Trigger payload " + fieldPath, TokenSource.TRIGGER));
        }

        if (selectedStepId != null) {
            for (Step previous : stepsBefore(steps, selectedStepId)) {
                String token = stepOutputToken(previous.id());
                tokens.putIfAbsent(token, new TokenOption(token, stepLabel(previous) + " output", TokenSource.STEP));
            }
        }
        return List.copyOf(tokens.values());
    }

    public static List<TokenOption> tokensForStep(List<Step> steps, String selectedStepId) {
        return tokensForStep(steps, selectedStepId, List.of());
    }

    public static String stepOutputToken(String stepId) {
        return "{{steps." + stepId + ".output}}";
    }

    /**
     * Steps strictly before the selected one in visit order; empty when the
     * selection is not in the tree.
     */
    private static List<Step> stepsBefore(List<Step> steps, String selectedStepId) {
        List<Step> flattened = StepTree.flatten(steps);
        var before = new ArrayList<Step>();
        for (Step step : flattened) {
            if (step.id().equals(selectedStepId)) {
                return before;
            }
            before.add(step);
        }
        return List.of();
    }

    private static String stepLabel(Step step) {
        return step.accept(new Step.Visitor<String>() {
            @Override
            public String visitLog(Step.LogStep logStep) {
                return "Log step (" + logStep.id() + ")";
            }

            @Override
            public String visitCreateRecord(Step.CreateRecordStep create) {
                String entity = create.entityLogicalName().isEmpty() ? create.id() : create.entityLogicalName();
                return "Create record (" + entity + ")";
            }

            @Override
            public String visitCondition(Step.ConditionStep condition) {
                return "Condition (" + condition.id() + ")";
            }
        });
    }
}
