package dev.workflows.model;

import java.util.List;

/**
 * A named, searchable starting point for a trigger or a step.
 */
public record FlowTemplate(
    String id,
    String label,
    String description,
    TemplateCategory category,
    List<String> keywords,
    TemplateTarget target
) {
    public FlowTemplate {
        keywords = List.copyOf(keywords);
    }
}
