package io.tabula.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public record ToolResult(
    String invocationId,
    String toolName,
    String content,
    boolean error,
    String recordText,
    Map<String, Object> recordPayload
) {
    public ToolResult {
        Objects.requireNonNull(invocationId, "invocationId must not be null");
        toolName = toolName == null ? "" : toolName;
        content = content == null ? "" : content;
        recordText = recordText == null ? "" : recordText;
        recordPayload = recordPayload == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(recordPayload));
    }

    public static ToolResult success(ToolInvocation invocation, String content) {
        return new ToolResult(invocation.id(), invocation.name(), content, false, "", Map.of());
    }

    public static ToolResult failure(ToolInvocation invocation, String content) {
        return new ToolResult(invocation.id(), invocation.name(), content, true, "", Map.of());
    }

    public ToolResult withRecord(String text, Map<String, Object> payload) {
        return new ToolResult(invocationId, toolName, content, error, text, payload);
    }
}
