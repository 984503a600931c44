package dev.workflows.model;

import java.util.List;

public record DuplicateResult(
    List<Step> steps,
    String duplicateId // root id of the clone; null when the source was not found
) {
    public boolean found() {
        return duplicateId != null;
    }
}
