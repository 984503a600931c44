package dev.workflows.model;

public enum IssueLevel {
    ERROR("error"),
    WARNING("warning");

    private final String wireName;

    IssueLevel(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() { return wireName; }
}
