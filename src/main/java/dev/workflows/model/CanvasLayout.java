package dev.workflows.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Position of the trigger node and of every step, steps keyed by id in
 * canonical visit order, plus the connectors between them. The trigger is kept
 * apart from the step map so that no step id can shadow it.
 */
public record CanvasLayout(
    CanvasPosition trigger,
    Map<String, CanvasPosition> positions,
    List<CanvasEdge> edges,
    int rowCount
) {
    public CanvasLayout {
        positions = Collections.unmodifiableMap(new LinkedHashMap<>(positions));
        edges = List.copyOf(edges);
    }

    /** Position of the step {@code stepId}, or null when it was not laid out. */
    public CanvasPosition positionOf(String stepId) {
        return positions.get(stepId);
    }

    /** Number of nodes on the canvas, trigger included. */
    public int nodeCount() {
        return positions.size() + 1;
    }
}
