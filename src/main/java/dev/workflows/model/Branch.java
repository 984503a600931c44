package dev.workflows.model;

/**
 * One of the two named child sequences of a condition step. The segment is
 * the literal used in step paths ({@code 1.then.0}).
 */
public enum Branch {
    THEN("then"),
    ELSE("else");

    private final String segment;

    Branch(String segment) {
        this.segment = segment;
    }

    public String segment() { return segment; }
}
