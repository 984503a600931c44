package dev.workflows.model;

import java.util.Arrays;

public enum TemplateCategory {
    TRIGGER("trigger"),
    LOGIC("logic"),
    INTEGRATION("integration"),
    DATA("data"),
    OPERATIONS("operations");

    private final String wireName;

    TemplateCategory(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() { return wireName; }

    public static TemplateCategory fromWire(String wireName) {
        return Arrays.stream(values())
            .filter(category -> category.wireName.equals(wireName))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown template category: " + wireName));
    }
}
