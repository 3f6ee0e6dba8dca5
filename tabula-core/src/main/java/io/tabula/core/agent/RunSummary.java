package io.tabula.core.agent;

import io.tabula.core.tool.ToolRegistry;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record RunSummary(
    FinishReason finishReason,
    RunPhase phase,
    int iterations,
    boolean dataUpdated,
    int datasetVersion,
    List<String> suggestions,
    String sessionTitle,
    List<Map<String, Object>> metrics
) {
    public RunSummary {
        phase = phase == null ? RunPhase.DONE : phase;
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
        metrics = metrics == null ? List.of() : List.copyOf(metrics);
    }

    static RunSummary of(FinishReason reason, TurnState state) {
        return new RunSummary(
            reason,
            state.phase(),
            state.iteration(),
            state.dataUpdated(),
            state.datasetVersion(),
            state.suggestions(),
            state.sessionTitle(),
            state.metricMaps()
        );
    }

    /**
     * Payload of the terminal {@code done} event.
     */
    public Map<String, Object> toDoneData() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("iterations", iterations);
        data.put("data_updated", dataUpdated);
        data.put("dataset_version", datasetVersion);
        data.put("finish_reason", finishReason.wireName());
        data.put("phase", phase.wireName());
        data.put("suggestions", suggestions);
        data.put("session_title", sessionTitle);
        data.put("metrics", metrics);
        data.put("schema_version", ToolRegistry.SCHEMA_VERSION);
        return data;
    }
}
