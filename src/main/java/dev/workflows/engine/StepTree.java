package dev.workflows.engine;

import dev.workflows.model.Step;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.ObjIntConsumer;

/**
 * Canonical visit order over a step forest: each sequence in order, and for a
 * condition its then branch, then its else branch, before the next sibling.
 * Layout, validation and token visibility all agree on this order.
 */
public final class StepTree {

    private StepTree() {}

    /**
     * Visit every step with its nesting depth (root sequence is depth 0).
     */
    public static void walk(List<Step> steps, ObjIntConsumer<Step> visitor) {
        walk(steps, 0, visitor);
    }

    private static void walk(List<Step> steps, int depth, ObjIntConsumer<Step> visitor) {
        for (Step step : steps) {
            visitor.accept(step, depth);
            if (step instanceof Step.ConditionStep condition) {
                walk(condition.thenSteps(), depth + 1, visitor);
                walk(condition.elseSteps(), depth + 1, visitor);
            }
        }
    }

    /**
     * All steps in canonical visit order.
     */
    public static List<Step> flatten(List<Step> steps) {
        var flattened = new ArrayList<Step>();
        walk(steps, (step, depth) -> flattened.add(step));
        return Collections.unmodifiableList(flattened);
    }

    public static int count(List<Step> steps) {
        int[] count = {0};
        walk(steps, (step, depth) -> count[0]++);
        return count[0];
    }

    /**
     * Deepest nesting level in the forest, -1 for an empty forest.
     */
    public static int maxDepth(List<Step> steps) {
        int[] max = {-1};
        walk(steps, (step, depth) -> max[0] = Math.max(max[0], depth));
        return max[0];
    }
}
