package io.tabula.core.model;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

public record ChatMessage(MessageRole role, List<ContentBlock> content) {
    public ChatMessage {
        Objects.requireNonNull(role, "role must not be null");
        content = content == null ? List.of() : List.copyOf(content);
    }

    public static ChatMessage user(String text) {
        return new ChatMessage(MessageRole.USER, List.of(new TextBlock(text)));
    }

    public static ChatMessage assistant(String text) {
        return new ChatMessage(MessageRole.ASSISTANT, List.of(new TextBlock(text)));
    }

    public static ChatMessage assistant(List<ContentBlock> blocks) {
        return new ChatMessage(MessageRole.ASSISTANT, blocks);
    }

    public static ChatMessage toolResults(List<ToolResult> results) {
        return new ChatMessage(
            MessageRole.USER,
            results.stream()
                .map(result -> (ContentBlock) new ToolResultBlock(result.invocationId(), result.content(), result.error()))
                .toList()
        );
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
