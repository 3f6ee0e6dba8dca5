package io.tabula.core.model;

import java.util.Objects;

public record ToolResultBlock(String toolUseId, String content, boolean error) implements ContentBlock {
    public ToolResultBlock {
        Objects.requireNonNull(toolUseId, "toolUseId must not be null");
        content = content == null ? "" : content;
    }
}
