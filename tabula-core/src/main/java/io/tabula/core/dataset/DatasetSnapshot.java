package io.tabula.core.dataset;

import java.util.Objects;

public record DatasetSnapshot(int version, Table table) {
    public DatasetSnapshot {
        if (version < 0) {
            throw new IllegalArgumentException("version must not be negative");
        }
        Objects.requireNonNull(table, "table must not be null");
    }

    public int rowCount() {
        return table.rowCount();
    }
}
