package io.tabula.core.provider;

import io.tabula.core.model.ContentBlock;
import io.tabula.core.model.TextBlock;
import io.tabula.core.model.ToolInvocation;
import io.tabula.core.model.ToolUseBlock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

public record LlmResponse(List<ContentBlock> content, String stopReason, Map<String, Object> usage) {
    public static final String END_TURN = "end_turn";
    public static final String TOOL_USE = "tool_use";

    public LlmResponse {
        content = content == null ? List.of() : List.copyOf(content);
        stopReason = stopReason == null ? "" : stopReason;
        usage = usage == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(usage));
    }

    public static LlmResponse text(String text) {
        return new LlmResponse(List.of(new TextBlock(text)), END_TURN, Map.of());
    }

    public String text() {
        return content.stream()
            .filter(TextBlock.class::isInstance)
            .map(block -> ((TextBlock) block).text())
            .collect(Collectors.joining());
    }

    public List<ToolInvocation> toolInvocations() {
        return content.stream()
            .filter(ToolUseBlock.class::isInstance)
            .map(block -> ((ToolUseBlock) block).invocation())
            .toList();
    }
}
