package dev.workflows.model;

import java.util.List;

public record ExtractResult(
    List<Step> steps,
    Step extracted // null when the id was not found
) {
    public boolean found() {
        return extracted != null;
    }
}
