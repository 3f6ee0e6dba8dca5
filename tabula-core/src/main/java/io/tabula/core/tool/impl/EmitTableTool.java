package io.tabula.core.tool.impl;

import io.tabula.core.event.AgentEvent;
import io.tabula.core.event.EventType;
import io.tabula.core.model.ToolInvocation;
import io.tabula.core.model.ToolResult;
import io.tabula.core.tool.EmitTableArguments;
import io.tabula.core.tool.Tool;
import io.tabula.core.tool.ToolContext;
import io.tabula.core.tool.ToolName;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class EmitTableTool implements Tool {
    public static final int DEFAULT_MAX_ROWS = 200;

    private final int maxRows;

    public EmitTableTool() {
        this(DEFAULT_MAX_ROWS);
    }

    public EmitTableTool(int maxRows) {
        this.maxRows = maxRows <= 0 ? DEFAULT_MAX_ROWS : maxRows;
    }

    @Override
    public String name() {
        return ToolName.EMIT_TABLE.wireName();
    }

    @Override
    public String description() {
        return "Show a structured table to the user. Provide column headers and rows of cell values.";
    }

    @Override
    public Map<String, Object> schema() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("title", Map.of("type", "string"));
        properties.put("headers", Map.of("type", "array", "items", Map.of("type", "string")));
        properties.put("rows", Map.of("type", "array", "items", Map.of("type", "array")));
        return Map.of("type", "object", "properties", properties, "required", List.of("headers", "rows"));
    }

    @Override
    public ToolResult execute(ToolInvocation invocation, ToolContext context) {
        EmitTableArguments args = EmitTableArguments.from(invocation.arguments());
        int width = args.headers().size();
        List<List<Object>> rows = new ArrayList<>();
        for (List<Object> raw : args.rows()) {
            if (rows.size() == maxRows) {
                break;
            }
            List<Object> row = new ArrayList<>(width);
            for (int i = 0; i < width; i++) {
                row.add(i < raw.size() ? raw.get(i) : null);
            }
            rows.add(row);
        }
        boolean truncated = args.rows().size() > rows.size();

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("title", args.title());
        data.put("headers", args.headers());
        data.put("rows", rows);
        data.put("total_rows", args.rows().size());
        data.put("truncated", truncated);
        context.events().emit(AgentEvent.of(EventType.TABLE, data));

        String content = "Table sent to user (" + rows.size() + " rows).";
        if (truncated) {
            content += " Truncated from " + args.rows().size() + " rows to the first " + maxRows + ".";
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("title", args.title());
        payload.put("headers", args.headers());
        payload.put("rows", rows);
        String label = args.title() == null || args.title().isBlank() ? "Table" : args.title();
        return ToolResult.success(invocation, content).withRecord(label, payload);
    }
}
