package dev.workflows.engine;

import dev.workflows.model.StepPathIndex;
import dev.workflows.model.StepTrace;
import dev.workflows.model.WorkflowDefinition;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Joins runtime step traces, keyed by step path, to the steps of the current
 * definition.
 */
public final class TraceCorrelator {

    private TraceCorrelator() {}

    /**
     * Traces by step path. A later trace for the same path replaces an earlier one.
     */
    public static Map<String, StepTrace> byPath(List<StepTrace> traces) {
        var byPath = new LinkedHashMap<String, StepTrace>();
        for (StepTrace trace : traces) {
            byPath.put(trace.stepPath(), trace);
        }
        return byPath;
    }

    /**
     * Traces by the id of the step currently at each trace's path. Traces whose
     * path no longer exists in the definition are dropped.
     */
    public static Map<String, StepTrace> byStepId(WorkflowDefinition definition, List<StepTrace> traces) {
        StepPathIndex index = StepPathIndexer.index(definition.steps());
        Map<String, StepTrace> tracesByPath = byPath(traces);
        var byStepId = new LinkedHashMap<String, StepTrace>();
        index.idToPath().forEach((stepId, path) -> {
            StepTrace trace = tracesByPath.get(path);
            if (trace != null) {
                byStepId.put(stepId, trace);
            }
        });
        return byStepId;
    }
}
