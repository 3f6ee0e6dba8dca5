package io.tabula.core.model;

public enum MessageRole {
    USER,
    ASSISTANT
}
