package dev.workflows.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Both directions of the step path mapping for one tree shape. Recomputed on
 * every edit; only step ids are durable. Both maps iterate in canonical visit
 * order.
 */
public record StepPathIndex(Map<String, String> idToPath, Map<String, Step> pathToStep) {

    public StepPathIndex {
        idToPath = Collections.unmodifiableMap(new LinkedHashMap<>(idToPath));
        pathToStep = Collections.unmodifiableMap(new LinkedHashMap<>(pathToStep));
    }

    public Optional<String> pathOf(String stepId) {
        return Optional.ofNullable(idToPath.get(stepId));
    }

    public Optional<Step> stepAt(String path) {
        return Optional.ofNullable(pathToStep.get(path));
    }
}
