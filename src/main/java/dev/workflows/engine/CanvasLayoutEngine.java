package dev.workflows.engine;

import dev.workflows.model.CanvasEdge;
import dev.workflows.model.CanvasLayout;
import dev.workflows.model.CanvasPosition;
import dev.workflows.model.LayoutConfig;
import dev.workflows.model.Step;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Assigns every canvas node a position in one deterministic depth-first pass.
 *
 * <p>Nodes sit on a grid of lanes (x) and rows (y). The trigger is pinned at
 * lane 0, row 0; the root sequence runs down lane 1 and each branch level one
 * lane further right. Every lane hands out rows in increasing order, so no two
 * nodes ever share a cell. A condition's then branch prefers to start one row
 * above the condition and its else branch below the whole then subtree; the
 * step after a condition starts below everything the condition spans.
 */
public final class CanvasLayoutEngine {

    private static final Logger log = LoggerFactory.getLogger(CanvasLayoutEngine.class);

    private static final int TRIGGER_LANE = 0;
    private static final int ROOT_LANE = 1;

    private CanvasLayoutEngine() {}

    public static CanvasLayout layout(List<Step> steps) {
        return layout(steps, LayoutConfig.defaults());
    }

    public static CanvasLayout layout(List<Step> steps, LayoutConfig config) {
        var placement = new Placement(config);
        CanvasPosition trigger = placement.position(TRIGGER_LANE, placement.reserve(TRIGGER_LANE, 0));
        // a null entry node is the trigger
        placement.sequence(steps, ROOT_LANE, 0, null, null);

        var layout = new CanvasLayout(trigger, placement.positions, placement.edges, placement.maxRow + 1);
        log.debug("Laid out {} nodes over {} rows", layout.nodeCount(), layout.rowCount());
        return layout;
    }

    /**
     * Mutable state of a single layout pass.
     */
    private static final class Placement {
        private final LayoutConfig config;
        private final Map<String, CanvasPosition> positions = new LinkedHashMap<>();
        private final List<CanvasEdge> edges = new ArrayList<>();
        private final Map<Integer, Integer> nextFreeRow = new HashMap<>();
        private int maxRow;

        Placement(LayoutConfig config) {
            this.config = config;
        }

        int reserve(int lane, int preferredRow) {
            int row = Math.max(preferredRow, nextFreeRow.getOrDefault(lane, 0));
            nextFreeRow.put(lane, row + 1);
            maxRow = Math.max(maxRow, row);
            return row;
        }

        CanvasPosition position(int lane, int row) {
            return new CanvasPosition(config.laneX(lane), config.rowY(row));
        }

        void place(String stepId, int lane, int row) {
            positions.put(stepId, position(lane, row));
        }

        /**
         * Lays out one sequence and returns the lowest row it and its branches
         * occupy, or {@code preferredRow - 1} when it is empty.
         */
        int sequence(List<Step> steps, int lane, int preferredRow, String entryFrom, String entryLabel) {
            int cursor = preferredRow;
            int bottom = preferredRow - 1;
            String previous = entryFrom;
            String edgeLabel = entryLabel;

            for (Step step : steps) {
                int row = reserve(lane, cursor);
                place(step.id(), lane, row);
                edges.add(new CanvasEdge(previous, step.id(), edgeLabel));
                previous = step.id();
                edgeLabel = null;
                bottom = Math.max(bottom, row);
                cursor = row + 1;

                if (step instanceof Step.ConditionStep condition) {
                    int thenBottom = sequence(condition.thenSteps(), lane + 1, Math.max(0, row - 1),
                        condition.id(), condition.thenLabel());
                    int elseBottom = sequence(condition.elseSteps(), lane + 1, Math.max(row + 1, thenBottom + 1),
                        condition.id(), condition.elseLabel());
                    bottom = Math.max(bottom, Math.max(thenBottom, elseBottom));
                    cursor = bottom + 1;
                }
            }
            return bottom;
        }
    }
}
