package io.tabula.core.provider;

import io.tabula.core.model.ChatMessage;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public record LlmRequest(
    String model,
    String systemPrompt,
    List<ChatMessage> messages,
    List<Map<String, Object>> tools,
    int maxTokens
) {
    public LlmRequest {
        Objects.requireNonNull(model, "model must not be null");
        systemPrompt = systemPrompt == null ? "" : systemPrompt;
        messages = messages == null ? List.of() : List.copyOf(messages);
        tools = tools == null ? List.of() : List.copyOf(tools);
        maxTokens = maxTokens <= 0 ? 4096 : maxTokens;
    }
}
