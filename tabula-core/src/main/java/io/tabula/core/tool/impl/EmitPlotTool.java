package io.tabula.core.tool.impl;

import io.tabula.core.event.AgentEvent;
import io.tabula.core.event.EventType;
import io.tabula.core.model.ToolInvocation;
import io.tabula.core.model.ToolResult;
import io.tabula.core.tool.EmitPlotArguments;
import io.tabula.core.tool.Tool;
import io.tabula.core.tool.ToolContext;
import io.tabula.core.tool.ToolName;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class EmitPlotTool implements Tool {
    public static final int MAX_DATA_VALUES = 100;

    @Override
    public String name() {
        return ToolName.EMIT_PLOT.wireName();
    }

    @Override
    public String description() {
        return "Show a chart to the user. Provide a Vega-Lite v5 spec with the data inlined under data.values.";
    }

    @Override
    public Map<String, Object> schema() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("title", Map.of("type", "string"));
        properties.put("vega_lite_spec", Map.of("type", "object", "description", "Vega-Lite spec with inline data.values"));
        return Map.of("type", "object", "properties", properties, "required", List.of("vega_lite_spec"));
    }

    @Override
    public ToolResult execute(ToolInvocation invocation, ToolContext context) {
        EmitPlotArguments args = EmitPlotArguments.from(invocation.arguments());
        Map<String, Object> spec = new LinkedHashMap<>(args.spec());
        spec.remove("$schema");

        int dropped = 0;
        if (spec.get("data") instanceof Map<?, ?> inline && inline.get("values") instanceof List<?> values
            && values.size() > MAX_DATA_VALUES) {
            Map<String, Object> capped = new LinkedHashMap<>();
            inline.forEach((key, value) -> capped.put(String.valueOf(key), value));
            capped.put("values", new ArrayList<>(values.subList(0, MAX_DATA_VALUES)));
            spec.put("data", capped);
            dropped = values.size() - MAX_DATA_VALUES;
        }

        String title = args.title();
        if ((title == null || title.isBlank()) && spec.get("title") instanceof String specTitle) {
            title = specTitle;
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("title", title);
        data.put("spec", spec);
        context.state().recordPlot(title);
        context.events().emit(AgentEvent.of(EventType.PLOT, data));

        String content = "Plot sent to user.";
        if (dropped > 0) {
            content += " Only the first " + MAX_DATA_VALUES + " data points were kept (" + dropped + " dropped); aggregate before plotting.";
        }
        String label = title == null || title.isBlank() ? "Plot" : title;
        return ToolResult.success(invocation, content).withRecord(label, data);
    }
}
