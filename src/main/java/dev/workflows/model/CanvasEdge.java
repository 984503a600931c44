package dev.workflows.model;

/**
 * A connector drawn between two canvas nodes.
 */
public record CanvasEdge(
    String from, // null when the edge leaves the trigger node
    String to,
    String label // set on branch entry edges only
) {
    public static CanvasEdge fromTrigger(String to) {
        return new CanvasEdge(null, to, null);
    }

    public boolean startsAtTrigger() {
        return from == null;
    }
}
