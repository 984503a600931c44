package dev.workflows.engine;

/**
 * A workflow document that cannot be turned into a step tree, or a tree that
 * cannot be written as one. Unlike validation issues this is not recoverable:
 * the definition is corrupt.
 */
public class WorkflowFormatException extends IllegalArgumentException {

    private final String location;

    public WorkflowFormatException(String location, String message) {
        super(location + ": " + message);
        this.location = location;
    }

    public WorkflowFormatException(String location, String message, Throwable cause) {
        super(location + ": " + message, cause);
        this.location = location;
    }

    /** Where in the document the problem is, e.g. {@code steps[1].then_steps[0]}. */
    public String location() {
        return location;
    }
}
