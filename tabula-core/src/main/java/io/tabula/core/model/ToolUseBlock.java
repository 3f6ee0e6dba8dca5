package io.tabula.core.model;

import java.util.Objects;

public record ToolUseBlock(ToolInvocation invocation) implements ContentBlock {
    public ToolUseBlock {
        Objects.requireNonNull(invocation, "invocation must not be null");
    }
}
