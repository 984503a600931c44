package dev.workflows.model;

/**
 * One validation finding. {@code stepId} points at the offending step so an
 * editor can focus it.
 */
public record ValidationIssue(
    String id,
    String stepId, // null for whole-definition issues
    IssueLevel level,
    String message
) {
    public boolean isError() {
        return level == IssueLevel.ERROR;
    }
}
