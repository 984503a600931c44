package dev.workflows.engine;

import dev.workflows.model.Branch;
import dev.workflows.model.DuplicateResult;
import dev.workflows.model.ExtractResult;
import dev.workflows.model.InsertMode;
import dev.workflows.model.InsertResult;
import dev.workflows.model.SequentialIdGenerator;
import dev.workflows.model.Step;
import org.junit.jupiter.api.Test;

import java.util.List;

import static dev.workflows.engine.Flows.condition;
import static dev.workflows.engine.Flows.log;
import static dev.workflows.engine.Flows.nested;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StepTreeOpsTest {

    private static List<String> ids(List<Step> steps) {
        return StepTree.flatten(steps).stream().map(Step::id).toList();
    }

    @Test
    void findsStepsAtAnyDepth() {
        assertThat(StepTreeOps.findStepById(nested(), "t2")).map(Step::id).contains("t2");
        assertThat(StepTreeOps.findStepById(nested(), "e1")).isPresent();
        assertThat(StepTreeOps.findStepById(nested(), "missing")).isEmpty();
    }

    @Test
    void stepContainsIdCoversNestedBranches() {
        Step c1 = StepTreeOps.findStepById(nested(), "c1").orElseThrow();

        assertThat(StepTreeOps.stepContainsId(c1, "c1")).isTrue();
        assertThat(StepTreeOps.stepContainsId(c1, "t2")).isTrue();
        assertThat(StepTreeOps.stepContainsId(c1, "e1")).isTrue();
        assertThat(StepTreeOps.stepContainsId(c1, "z")).isFalse();
    }

    @Test
    void updateRewritesNestedStepAndSharesUntouchedSiblings() {
        List<Step> original = nested();

        List<Step> updated = StepTreeOps.updateStepById(original, "t2",
            step -> ((Step.LogStep) step).withMessage("changed"));

        assertThat(StepTreeOps.findStepById(updated, "t2")).contains(log("t2", "changed"));
        assertThat(StepTreeOps.findStepById(original, "t2")).contains(log("t2", "has priority"));
        assertThat(updated.get(0)).isSameAs(original.get(0));
        assertThat(updated.get(2)).isSameAs(original.get(2));
        assertThat(ids(updated)).isEqualTo(ids(original));
    }

    @Test
    void updateOfMissingIdReturnsInputUnchanged() {
        List<Step> original = nested();

        assertThat(StepTreeOps.updateStepById(original, "missing", step -> step)).isSameAs(original);
    }

    @Test
    void updateMayNotChangeTheId() {
        assertThatThrownBy(() -> StepTreeOps.updateStepById(nested(), "a", step -> log("other", "x")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("'a'");
    }

    @Test
    void removingConditionDropsItsWholeSubtree() {
        List<Step> result = StepTreeOps.removeStepById(nested(), "c1");

        assertThat(ids(result)).containsExactly("a", "z");
    }

    @Test
    void removingNestedStepKeepsSiblings() {
        List<Step> result = StepTreeOps.removeStepById(nested(), "t1");

        assertThat(ids(result)).containsExactly("a", "c1", "c2", "t2", "e1", "z");
    }

    @Test
    void removeOfMissingIdReturnsSameInstance() {
        List<Step> original = nested();

        assertThat(StepTreeOps.removeStepById(original, "missing")).isSameAs(original);
    }

    @Test
    void extractReturnsRemovedSubtree() {
        ExtractResult result = StepTreeOps.extractStepById(nested(), "c2");

        assertThat(result.found()).isTrue();
        assertThat(result.extracted().id()).isEqualTo("c2");
        assertThat(ids(result.steps())).containsExactly("a", "c1", "t1", "e1", "z");
    }

    @Test
    void extractOfMissingIdReportsNotFound() {
        List<Step> original = nested();

        ExtractResult result = StepTreeOps.extractStepById(original, "missing");

        assertThat(result.found()).isFalse();
        assertThat(result.extracted()).isNull();
        assertThat(result.steps()).isSameAs(original);
    }

    @Test
    void extractThenInsertBeforeNextSiblingRestoresTree() {
        List<Step> original = nested();

        ExtractResult extracted = StepTreeOps.extractStepById(original, "t1");
        InsertResult restored = StepTreeOps.insertStepRelativeToTarget(
            extracted.steps(), "c2", InsertMode.BEFORE, extracted.extracted());

        assertThat(restored.inserted()).isTrue();
        assertThat(restored.steps()).isEqualTo(original);
    }

    @Test
    void insertsBeforeAndAfterNestedTarget() {
        InsertResult before = StepTreeOps.insertStepRelativeToTarget(nested(), "e1", InsertMode.BEFORE, log("n", "x"));
        InsertResult after = StepTreeOps.insertStepRelativeToTarget(nested(), "e1", InsertMode.AFTER, log("n", "x"));

        assertThat(ids(before.steps())).containsExactly("a", "c1", "t1", "c2", "t2", "n", "e1", "z");
        assertThat(ids(after.steps())).containsExactly("a", "c1", "t1", "c2", "t2", "e1", "n", "z");
    }

    @Test
    void insertIntoThenBranchAppendsAfterExistingSteps() {
        Step.ConditionStep c = condition("c", "status", List.of(log("x", "first")), List.of());

        InsertResult result = StepTreeOps.insertStepRelativeToTarget(List.of(c), "c", InsertMode.THEN, log("y", "second"));

        assertThat(result.inserted()).isTrue();
        Step.ConditionStep updated = (Step.ConditionStep) result.steps().get(0);
        assertThat(updated.thenSteps()).hasSize(2);
        assertThat(updated.thenSteps().get(0).id()).isEqualTo("x");
        assertThat(updated.thenSteps().get(1).id()).isEqualTo("y");
        assertThat(updated.elseSteps()).isEmpty();
    }

    @Test
    void insertIntoElseBranchOfNestedCondition() {
        InsertResult result = StepTreeOps.insertStepRelativeToTarget(nested(), "c2", InsertMode.ELSE, log("n", "x"));

        assertThat(result.inserted()).isTrue();
        assertThat(StepPathIndexer.index(result.steps()).pathOf("n")).contains("1.then.1.else.0");
    }

    @Test
    void branchInsertOnNonConditionIsRejected() {
        List<Step> original = nested();

        InsertResult result = StepTreeOps.insertStepRelativeToTarget(original, "a", InsertMode.THEN, log("n", "x"));

        assertThat(result.inserted()).isFalse();
        assertThat(result.steps()).isSameAs(original);
    }

    @Test
    void insertWithMissingTargetIsRejected() {
        List<Step> original = nested();

        InsertResult result = StepTreeOps.insertStepRelativeToTarget(original, "gone", InsertMode.AFTER, log("n", "x"));

        assertThat(result.inserted()).isFalse();
        assertThat(result.steps()).isSameAs(original);
    }

    @Test
    void appendToBranchIgnoresNonConditions() {
        InsertResult onCondition = StepTreeOps.appendStepToBranch(nested(), "c1", Branch.ELSE, log("n", "x"));
        InsertResult onLog = StepTreeOps.appendStepToBranch(nested(), "t1", Branch.ELSE, log("n", "x"));

        assertThat(onCondition.inserted()).isTrue();
        assertThat(StepPathIndexer.index(onCondition.steps()).pathOf("n")).contains("1.else.1");
        assertThat(onLog.inserted()).isFalse();
    }

    @Test
    void duplicateInsertsFreshCopyAfterOriginal() {
        DuplicateResult result = StepTreeOps.duplicateStepById(nested(), "c1", new SequentialIdGenerator("copy"));

        assertThat(result.found()).isTrue();
        assertThat(result.duplicateId()).isEqualTo("copy_1");
        assertThat(result.steps()).extracting(Step::id).containsExactly("a", "c1", "copy_1", "z");
        assertThat(ids(result.steps())).containsSubsequence("copy_1", "copy_2", "copy_3", "copy_4", "copy_5");
        assertThat(StepTree.count(result.steps())).isEqualTo(12);
        assertThat(StepTreeOps.duplicateIds(result.steps())).isEmpty();
    }

    @Test
    void duplicateKeepsContentOtherThanIds() {
        DuplicateResult result = StepTreeOps.duplicateStepById(nested(), "e1", new SequentialIdGenerator("copy"));

        Step.CreateRecordStep original = (Step.CreateRecordStep) StepTreeOps.findStepById(result.steps(), "e1").orElseThrow();
        Step.CreateRecordStep copy = (Step.CreateRecordStep) StepTreeOps.findStepById(result.steps(), "copy_1").orElseThrow();
        assertThat(copy.entityLogicalName()).isEqualTo(original.entityLogicalName());
        assertThat(copy.data()).isEqualTo(original.data());
    }

    @Test
    void duplicateOfMissingIdReportsNotFound() {
        List<Step> original = nested();

        DuplicateResult result = StepTreeOps.duplicateStepById(original, "missing", new SequentialIdGenerator("copy"));

        assertThat(result.found()).isFalse();
        assertThat(result.steps()).isSameAs(original);
    }

    @Test
    void editsPreserveIdsOfUntouchedSteps() {
        List<Step> original = nested();

        List<Step> edited = StepTreeOps.insertStepRelativeToTarget(original, "t1", InsertMode.AFTER, log("n", "x")).steps();
        edited = StepTreeOps.removeStepById(edited, "e1");

        assertThat(ids(edited)).containsExactly("a", "c1", "t1", "n", "c2", "t2", "z");
    }

    @Test
    void moveStepIntoBranch() {
        InsertResult result = StepTreeOps.moveStep(nested(), "z", "c2", InsertMode.ELSE);

        assertThat(result.inserted()).isTrue();
        assertThat(StepPathIndexer.index(result.steps()).pathOf("z")).contains("1.then.1.else.0");
        assertThat(StepTree.count(result.steps())).isEqualTo(7);
    }

    @Test
    void moveIntoOwnSubtreeIsRefused() {
        List<Step> original = nested();

        InsertResult result = StepTreeOps.moveStep(original, "c1", "t2", InsertMode.AFTER);

        assertThat(result.inserted()).isFalse();
        assertThat(result.steps()).isSameAs(original);
    }

    @Test
    void moveToMissingTargetLeavesTreeIntact() {
        List<Step> original = nested();

        InsertResult result = StepTreeOps.moveStep(original, "a", "gone", InsertMode.AFTER);

        assertThat(result.inserted()).isFalse();
        assertThat(result.steps()).isSameAs(original);
    }

    @Test
    void reportsDuplicateIds() {
        List<Step> steps = List.of(
            log("a", "x"),
            condition("c", "status", List.of(log("a", "again")), List.of(log("b", "y"))),
            log("b", "z"));

        assertThat(StepTreeOps.duplicateIds(steps)).containsExactly("a", "b");
        assertThat(StepTreeOps.duplicateIds(nested())).isEmpty();
    }
}
