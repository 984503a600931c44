package dev.workflows.engine;

import dev.workflows.model.Branch;
import dev.workflows.model.DuplicateResult;
import dev.workflows.model.ExtractResult;
import dev.workflows.model.IdGenerator;
import dev.workflows.model.InsertMode;
import dev.workflows.model.InsertResult;
import dev.workflows.model.Step;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Immutable edits over a step forest. Every operation returns a new forest and
 * leaves its input untouched; unchanged subtrees are shared, not copied.
 *
 * <p>A missing target id is never an error: editor selection can go stale
 * relative to the tree, so each operation reports "not found" through its
 * result and returns the input forest as is. Operations that look up a single
 * target act on the first match in canonical visit order. Step ids are assumed
 * unique; see {@link #duplicateIds(List)}.
 */
public final class StepTreeOps {

    private static final Logger log = LoggerFactory.getLogger(StepTreeOps.class);

    private StepTreeOps() {}

    public static Optional<Step> findStepById(List<Step> steps, String stepId) {
        for (Step step : steps) {
            if (step.id().equals(stepId)) {
                return Optional.of(step);
            }
            if (step instanceof Step.ConditionStep condition) {
                Optional<Step> nested = findStepById(condition.thenSteps(), stepId);
                if (nested.isEmpty()) {
                    nested = findStepById(condition.elseSteps(), stepId);
                }
                if (nested.isPresent()) {
                    return nested;
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Whether {@code stepId} is this step or any step inside its branches.
     */
    public static boolean stepContainsId(Step step, String stepId) {
        if (step.id().equals(stepId)) {
            return true;
        }
        if (step instanceof Step.ConditionStep condition) {
            return condition.thenSteps().stream().anyMatch(nested -> stepContainsId(nested, stepId))
                || condition.elseSteps().stream().anyMatch(nested -> stepContainsId(nested, stepId));
        }
        return false;
    }

    /**
     * Replace the first step with {@code stepId} by {@code updater(step)}. Only
     * the ancestors of the target are rebuilt. The updater must keep the id.
     *
     * @throws IllegalArgumentException if the updater changes the step id
     */
    public static List<Step> updateStepById(List<Step> steps, String stepId, UnaryOperator<Step> updater) {
        Objects.requireNonNull(updater, "updater");
        List<Step> updated = updateFirst(steps, stepId, updater);
        if (updated == null) {
            log.debug("No step with id {}; update ignored", stepId);
            return steps;
        }
        return updated;
    }

    private static List<Step> updateFirst(List<Step> steps, String stepId, UnaryOperator<Step> updater) {
        for (int i = 0; i < steps.size(); i++) {
            Step step = steps.get(i);
            if (step.id().equals(stepId)) {
                Step replacement = Objects.requireNonNull(updater.apply(step), "updater returned null");
                if (!replacement.id().equals(stepId)) {
                    throw new IllegalArgumentException(
                        "Updater changed step id '%s' to '%s'".formatted(stepId, replacement.id()));
                }
                return replaceAt(steps, i, replacement);
            }
            if (step instanceof Step.ConditionStep condition) {
                Step.ConditionStep rebuilt = updateInBranches(condition, stepId, updater);
                if (rebuilt != null) {
                    return replaceAt(steps, i, rebuilt);
                }
            }
        }
        return null;
    }

    private static Step.ConditionStep updateInBranches(
            Step.ConditionStep condition, String stepId, UnaryOperator<Step> updater) {
        for (Branch branch : Branch.values()) {
            List<Step> updated = updateFirst(condition.branch(branch), stepId, updater);
            if (updated != null) {
                return condition.withBranch(branch, updated);
            }
        }
        return null;
    }

    /**
     * Delete every step with {@code stepId}. A deleted condition takes its
     * branches with it.
     */
    public static List<Step> removeStepById(List<Step> steps, String stepId) {
        List<Step> result = removeAll(steps, stepId);
        if (result == steps) {
            log.debug("No step with id {}; remove ignored", stepId);
        }
        return result;
    }

    private static List<Step> removeAll(List<Step> steps, String stepId) {
        List<Step> next = new ArrayList<>(steps.size());
        boolean changed = false;
        for (Step step : steps) {
            if (step.id().equals(stepId)) {
                changed = true;
                continue;
            }
            if (step instanceof Step.ConditionStep condition) {
                List<Step> thenSteps = removeAll(condition.thenSteps(), stepId);
                List<Step> elseSteps = removeAll(condition.elseSteps(), stepId);
                if (thenSteps != condition.thenSteps() || elseSteps != condition.elseSteps()) {
                    next.add(condition.withBranches(thenSteps, elseSteps));
                    changed = true;
                    continue;
                }
            }
            next.add(step);
        }
        return changed ? List.copyOf(next) : steps;
    }

    /**
     * Remove the first step with {@code stepId} and hand it back, so a caller
     * can reinsert it elsewhere.
     */
    public static ExtractResult extractStepById(List<Step> steps, String stepId) {
        Step[] extracted = new Step[1];
        List<Step> result = extractFirst(steps, stepId, extracted);
        if (result == null) {
            log.debug("No step with id {}; extract ignored", stepId);
            return new ExtractResult(steps, null);
        }
        return new ExtractResult(result, extracted[0]);
    }

    private static List<Step> extractFirst(List<Step> steps, String stepId, Step[] extracted) {
        for (int i = 0; i < steps.size(); i++) {
            Step step = steps.get(i);
            if (step.id().equals(stepId)) {
                extracted[0] = step;
                List<Step> next = new ArrayList<>(steps);
                next.remove(i);
                return List.copyOf(next);
            }
            if (step instanceof Step.ConditionStep condition) {
                for (Branch branch : Branch.values()) {
                    List<Step> updated = extractFirst(condition.branch(branch), stepId, extracted);
                    if (updated != null) {
                        return replaceAt(steps, i, condition.withBranch(branch, updated));
                    }
                }
            }
        }
        return null;
    }

    /**
     * Place {@code newStep} relative to the first step with {@code targetId}.
     * {@code THEN}/{@code ELSE} append to the end of that branch and need a
     * condition target; on any other target nothing is inserted.
     */
    public static InsertResult insertStepRelativeToTarget(
            List<Step> steps, String targetId, InsertMode mode, Step newStep) {
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(newStep, "newStep");
        List<Step> result = insertFirst(steps, targetId, mode, newStep);
        if (result == null) {
            log.debug("No {} target with id {}; insert ignored", mode, targetId);
            return new InsertResult(steps, false);
        }
        return new InsertResult(result, true);
    }

    private static List<Step> insertFirst(List<Step> steps, String targetId, InsertMode mode, Step newStep) {
        for (int i = 0; i < steps.size(); i++) {
            Step step = steps.get(i);
            if (step.id().equals(targetId)) {
                switch (mode) {
                    case BEFORE:
                        return insertAt(steps, i, newStep);
                    case AFTER:
                        return insertAt(steps, i + 1, newStep);
                    case THEN:
                    case ELSE:
                        if (!(step instanceof Step.ConditionStep condition)) {
                            return null;
                        }
                        Branch branch = mode == InsertMode.THEN ? Branch.THEN : Branch.ELSE;
                        return replaceAt(steps, i, append(condition, branch, newStep));
                    default:
                        throw new IllegalStateException("Unhandled insert mode " + mode);
                }
            }
            if (step instanceof Step.ConditionStep condition) {
                for (Branch branch : Branch.values()) {
                    List<Step> updated = insertFirst(condition.branch(branch), targetId, mode, newStep);
                    if (updated != null) {
                        return replaceAt(steps, i, condition.withBranch(branch, updated));
                    }
                }
            }
        }
        return null;
    }

    /**
     * Append {@code step} to a branch of the condition {@code conditionId},
     * independent of any selection.
     */
    public static InsertResult appendStepToBranch(List<Step> steps, String conditionId, Branch branch, Step step) {
        Objects.requireNonNull(branch, "branch");
        Objects.requireNonNull(step, "step");
        List<Step> result = appendFirst(steps, conditionId, branch, step);
        if (result == null) {
            log.debug("No condition with id {}; append to {} ignored", conditionId, branch);
            return new InsertResult(steps, false);
        }
        return new InsertResult(result, true);
    }

    private static List<Step> appendFirst(List<Step> steps, String conditionId, Branch branch, Step newStep) {
        for (int i = 0; i < steps.size(); i++) {
            Step step = steps.get(i);
            if (!(step instanceof Step.ConditionStep condition)) {
                continue;
            }
            if (condition.id().equals(conditionId)) {
                return replaceAt(steps, i, append(condition, branch, newStep));
            }
            for (Branch nested : Branch.values()) {
                List<Step> updated = appendFirst(condition.branch(nested), conditionId, branch, newStep);
                if (updated != null) {
                    return replaceAt(steps, i, condition.withBranch(nested, updated));
                }
            }
        }
        return null;
    }

    /**
     * Clone the subtree rooted at {@code stepId} with fresh ids for every node
     * and insert the clone right after the original.
     */
    public static DuplicateResult duplicateStepById(List<Step> steps, String stepId, IdGenerator ids) {
        Objects.requireNonNull(ids, "ids");
        String[] duplicateId = new String[1];
        List<Step> result = duplicateFirst(steps, stepId, ids, duplicateId);
        if (result == null) {
            log.debug("No step with id {}; duplicate ignored", stepId);
            return new DuplicateResult(steps, null);
        }
        return new DuplicateResult(result, duplicateId[0]);
    }

    private static List<Step> duplicateFirst(List<Step> steps, String stepId, IdGenerator ids, String[] duplicateId) {
        for (int i = 0; i < steps.size(); i++) {
            Step step = steps.get(i);
            if (step.id().equals(stepId)) {
                Step copy = withFreshIds(step, ids);
                duplicateId[0] = copy.id();
                return insertAt(steps, i + 1, copy);
            }
            if (step instanceof Step.ConditionStep condition) {
                for (Branch branch : Branch.values()) {
                    List<Step> updated = duplicateFirst(condition.branch(branch), stepId, ids, duplicateId);
                    if (updated != null) {
                        return replaceAt(steps, i, condition.withBranch(branch, updated));
                    }
                }
            }
        }
        return null;
    }

    /**
     * Deep copy of {@code step} where every node, nested branches included,
     * gets a new id. Ids are drawn parent first, then branch steps in visit order.
     */
    public static Step withFreshIds(Step step, IdGenerator ids) {
        return step.accept(new Step.Visitor<Step>() {
            @Override
            public Step visitLog(Step.LogStep logStep) {
                return new Step.LogStep(ids.nextId(), logStep.message());
            }

            @Override
            public Step visitCreateRecord(Step.CreateRecordStep create) {
                return new Step.CreateRecordStep(ids.nextId(), create.entityLogicalName(), create.data());
            }

            @Override
            public Step visitCondition(Step.ConditionStep condition) {
                Step.ConditionStep renamed = condition.withId(ids.nextId());
                List<Step> thenSteps = condition.thenSteps().stream().map(nested -> withFreshIds(nested, ids)).toList();
                List<Step> elseSteps = condition.elseSteps().stream().map(nested -> withFreshIds(nested, ids)).toList();
                return renamed.withBranches(thenSteps, elseSteps);
            }
        });
    }

    /**
     * Move a step next to, or into a branch of, another step. Refuses (returns
     * {@code inserted == false} with the input forest) when either id is missing
     * or the target lies inside the moved subtree.
     */
    public static InsertResult moveStep(List<Step> steps, String stepId, String targetId, InsertMode mode) {
        Optional<Step> moving = findStepById(steps, stepId);
        if (moving.isEmpty() || stepContainsId(moving.get(), targetId)) {
            log.debug("Cannot move step {} {} {}", stepId, mode, targetId);
            return new InsertResult(steps, false);
        }
        ExtractResult extracted = extractStepById(steps, stepId);
        InsertResult inserted = insertStepRelativeToTarget(extracted.steps(), targetId, mode, extracted.extracted());
        return inserted.inserted() ? inserted : new InsertResult(steps, false);
    }

    /**
     * Ids used by more than one step, in the order their second use is visited.
     */
    public static Set<String> duplicateIds(List<Step> steps) {
        Set<String> seen = new HashSet<>();
        Set<String> duplicates = new LinkedHashSet<>();
        StepTree.walk(steps, (step, depth) -> {
            if (!seen.add(step.id())) {
                duplicates.add(step.id());
            }
        });
        return duplicates;
    }

    private static Step.ConditionStep append(Step.ConditionStep condition, Branch branch, Step step) {
        List<Step> branchSteps = new ArrayList<>(condition.branch(branch));
        branchSteps.add(step);
        return condition.withBranch(branch, branchSteps);
    }

    private static List<Step> replaceAt(List<Step> steps, int index, Step replacement) {
        List<Step> next = new ArrayList<>(steps);
        next.set(index, replacement);
        return List.copyOf(next);
    }

    private static List<Step> insertAt(List<Step> steps, int index, Step step) {
        List<Step> next = new ArrayList<>(steps);
        next.add(index, step);
        return List.copyOf(next);
    }
}
