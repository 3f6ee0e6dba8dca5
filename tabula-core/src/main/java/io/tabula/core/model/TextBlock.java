package io.tabula.core.model;

public record TextBlock(String text) implements ContentBlock {
    public TextBlock {
        text = text == null ? "" : text;
    }
}
