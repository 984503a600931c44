package dev.workflows.engine;

import dev.workflows.model.Branch;
import dev.workflows.model.Step;
import dev.workflows.model.StepPathIndex;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes step paths. Root steps are {@code 0}, {@code 1}, ...; a branch step
 * extends its condition's path with {@code .then} or {@code .else} and its
 * index, e.g. {@code 1.then.0}. The execution runtime reports step outcomes
 * under the same paths, so this format must not change.
 */
public final class StepPathIndexer {

    private static final String SEPARATOR = ".";

    /**
     * Orders paths the way canonical visit order orders their steps: a parent
     * before its branches, {@code then} before {@code else}, indices numerically.
     */
    public static final Comparator<String> PATH_ORDER = StepPathIndexer::comparePaths;

    private StepPathIndexer() {}

    public static StepPathIndex index(List<Step> steps) {
        var idToPath = new LinkedHashMap<String, String>();
        var pathToStep = new LinkedHashMap<String, Step>();
        visit(steps, "", idToPath, pathToStep);
        return new StepPathIndex(idToPath, pathToStep);
    }

    private static void visit(List<Step> steps, String prefix,
                              Map<String, String> idToPath, Map<String, Step> pathToStep) {
        for (int i = 0; i < steps.size(); i++) {
            Step step = steps.get(i);
            String path = childPath(prefix, i);
            idToPath.putIfAbsent(step.id(), path);
            pathToStep.put(path, step);
            if (step instanceof Step.ConditionStep condition) {
                visit(condition.thenSteps(), branchPrefix(path, Branch.THEN), idToPath, pathToStep);
                visit(condition.elseSteps(), branchPrefix(path, Branch.ELSE), idToPath, pathToStep);
            }
        }
    }

    public static String childPath(String sequencePrefix, int index) {
        return sequencePrefix.isEmpty() ? Integer.toString(index) : sequencePrefix + SEPARATOR + index;
    }

    public static String branchPrefix(String conditionPath, Branch branch) {
        return conditionPath + SEPARATOR + branch.segment();
    }

    public static int comparePaths(String left, String right) {
        String[] a = left.split("\\.");
        String[] b = right.split("\\.");
        int shared = Math.min(a.length, b.length);
        for (int i = 0; i < shared; i++) {
            int cmp = compareSegments(a[i], b[i]);
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(a.length, b.length);
    }

    private static int compareSegments(String a, String b) {
        boolean aIndex = isIndex(a);
        boolean bIndex = isIndex(b);
        if (aIndex && bIndex) {
            return Integer.compare(Integer.parseInt(a), Integer.parseInt(b));
        }
        if (aIndex != bIndex) {
            return aIndex ? -1 : 1;
        }
        return Integer.compare(branchRank(a), branchRank(b));
    }

    private static boolean isIndex(String segment) {
        return !segment.isEmpty() && segment.chars().allMatch(Character::isDigit);
    }

    private static int branchRank(String segment) {
        for (Branch branch : Branch.values()) {
            if (branch.segment().equals(segment)) {
                return branch.ordinal();
            }
        }
        throw new IllegalArgumentException("Not a step path segment: " + segment);
    }
}
