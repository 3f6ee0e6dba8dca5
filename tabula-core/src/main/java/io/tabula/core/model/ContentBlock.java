package io.tabula.core.model;

public interface ContentBlock {
}
