package dev.workflows.engine;

import dev.workflows.model.Branch;
import dev.workflows.model.Step;
import dev.workflows.model.StepPathIndex;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static dev.workflows.engine.Flows.condition;
import static dev.workflows.engine.Flows.log;
import static dev.workflows.engine.Flows.nested;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

class StepPathIndexerTest {

    @Test
    void indexesEveryStepWithItsPath() {
        StepPathIndex index = StepPathIndexer.index(nested());

        assertThat(index.idToPath()).containsExactly(
            entry("a", "0"),
            entry("c1", "1"),
            entry("t1", "1.then.0"),
            entry("c2", "1.then.1"),
            entry("t2", "1.then.1.then.0"),
            entry("e1", "1.else.0"),
            entry("z", "2"));
    }

    @Test
    void pathsResolveBackToSteps() {
        StepPathIndex index = StepPathIndexer.index(nested());

        assertThat(index.stepAt("1.else.0")).map(Step::id).contains("e1");
        assertThat(index.stepAt("1.else.1")).isEmpty();
        index.idToPath().forEach((id, path) ->
            assertThat(index.stepAt(path)).map(Step::id).contains(id));
    }

    @Test
    void emptyTreeHasEmptyIndex() {
        StepPathIndex index = StepPathIndexer.index(List.of());

        assertThat(index.idToPath()).isEmpty();
        assertThat(index.pathToStep()).isEmpty();
    }

    @Test
    void firstOccurrenceOfDuplicateIdKeepsItsPath() {
        List<Step> steps = List.of(
            log("a", "x"),
            condition("c", "status", List.of(log("a", "again")), List.of()));

        StepPathIndex index = StepPathIndexer.index(steps);

        assertThat(index.pathOf("a")).contains("0");
        assertThat(index.stepAt("1.then.0")).map(Step::id).contains("a");
    }

    @Test
    void buildsChildAndBranchPaths() {
        assertThat(StepPathIndexer.childPath("", 3)).isEqualTo("3");
        assertThat(StepPathIndexer.branchPrefix("3", Branch.ELSE)).isEqualTo("3.else");
        assertThat(StepPathIndexer.childPath("3.else", 0)).isEqualTo("3.else.0");
    }

    @Test
    void pathOrderComparesIndicesNumerically() {
        assertThat(StepPathIndexer.comparePaths("10", "2")).isPositive();
        assertThat(StepPathIndexer.comparePaths("1.then.2", "1.then.10")).isNegative();
        assertThat(StepPathIndexer.comparePaths("1", "1.then.0")).isNegative();
        assertThat(StepPathIndexer.comparePaths("1.then.5", "1.else.0")).isNegative();
        assertThat(StepPathIndexer.comparePaths("1.else.3", "2")).isNegative();
        assertThat(StepPathIndexer.comparePaths("1.then.0", "1.then.0")).isZero();
    }

    @Test
    void pathOrderAgreesWithVisitOrder() {
        StepPathIndex index = StepPathIndexer.index(nested());
        List<String> visitOrder = StepTree.flatten(nested()).stream()
            .map(step -> index.pathOf(step.id()).orElseThrow())
            .toList();

        List<String> shuffled = new ArrayList<>(visitOrder);
        Collections.reverse(shuffled);
        shuffled.sort(StepPathIndexer.PATH_ORDER);

        assertThat(shuffled).isEqualTo(visitOrder);
    }
}
