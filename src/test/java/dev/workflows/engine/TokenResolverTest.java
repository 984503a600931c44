package dev.workflows.engine;

import dev.workflows.model.Step;
import dev.workflows.model.TokenOption;
import dev.workflows.model.TokenSource;
import org.junit.jupiter.api.Test;

import java.util.List;

import static dev.workflows.engine.Flows.create;
import static dev.workflows.engine.Flows.log;
import static dev.workflows.engine.Flows.nested;
import static org.assertj.core.api.Assertions.assertThat;

class TokenResolverTest {

    private static final List<String> BASE = List.of(
        "{{trigger.type}}", "{{trigger.entity}}", "{{trigger.payload.id}}", "{{trigger.payload.status}}",
        "{{run.id}}", "{{run.attempt}}", "{{now.iso}}");

    private static List<String> tokens(List<TokenOption> options) {
        return options.stream().map(TokenOption::token).toList();
    }

    @Test
    void noSelectionOffersBaseTokensOnly() {
        assertThat(tokens(TokenResolver.tokensForStep(nested(), null))).isEqualTo(BASE);
    }

    @Test
    void firstStepSeesNoStepOutputs() {
        assertThat(tokens(TokenResolver.tokensForStep(nested(), "a"))).isEqualTo(BASE);
    }

    @Test
    void nestedStepSeesEverythingVisitedBeforeIt() {
        List<TokenOption> options = TokenResolver.tokensForStep(nested(), "c2");

        assertThat(tokens(options)).endsWith(
            "{{steps.a.output}}", "{{steps.c1.output}}", "{{steps.t1.output}}");
        assertThat(options).hasSize(BASE.size() + 3);
        assertThat(options).filteredOn(option -> option.source() == TokenSource.STEP).hasSize(3);
    }

    @Test
    void elseBranchSeesSiblingThenBranchOutputs() {
        assertThat(tokens(TokenResolver.tokensForStep(nested(), "e1")))
            .contains("{{steps.t1.output}}", "{{steps.t2.output}}")
            .doesNotContain("{{steps.e1.output}}", "{{steps.z.output}}");
    }

    @Test
    void payloadFieldsFollowBaseTokensWithoutDuplicates() {
        List<TokenOption> options = TokenResolver.tokensForStep(nested(), null, List.of("email", "status", "email"));

        assertThat(tokens(options)).containsExactly(
            "{{trigger.type}}", "{{trigger.entity}}", "{{trigger.payload.id}}", "{{trigger.payload.status}}",
            "{{run.id}}", "{{run.attempt}}", "{{now.iso}}", "{{trigger.payload.email}}");
        assertThat(options.get(options.size() - 1).label()).isEqualTo("Trigger payload email");
    }

    @Test
    void unknownSelectionFallsBackToBaseTokens() {
        assertThat(tokens(TokenResolver.tokensForStep(nested(), "gone"))).isEqualTo(BASE);
    }

    @Test
    void labelsDescribeTheProducingStep() {
        List<Step> steps = List.of(log("l", "x"), create("r", "task", "{}"), create("q", "", "{}"), log("last", "y"));

        List<String> labels = TokenResolver.tokensForStep(steps, "last").stream()
            .filter(option -> option.source() == TokenSource.STEP)
            .map(TokenOption::label)
            .toList();

        assertThat(labels).containsExactly("Log step (l) output", "Create record (task) output", "Create record (q) output");
        assertThat(TokenResolver.stepOutputToken("r")).isEqualTo("{{steps.r.output}}");
    }
}
