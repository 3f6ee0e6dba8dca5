package io.tabula.core.dataset;

import java.util.Objects;

public record ColumnSchema(String name, ColumnType type) {
    public ColumnSchema {
        Objects.requireNonNull(name, "name must not be null");
        type = type == null ? ColumnType.NULL : type;
    }
}
