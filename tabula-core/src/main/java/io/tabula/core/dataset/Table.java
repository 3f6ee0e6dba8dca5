package io.tabula.core.dataset;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

public record Table(List<ColumnSchema> columns, List<List<Object>> rows) {
    public Table {
        columns = columns == null ? List.of() : List.copyOf(columns);
        rows = rows == null ? List.of() : copyRows(rows, columns.size());
    }

    public static Table empty() {
        return new Table(List.of(), List.of());
    }

    /**
     * Builds a table from column names and raw rows, inferring each column's type from its values.
     */
    public static Table of(List<String> columnNames, List<? extends List<?>> rawRows) {
        Objects.requireNonNull(columnNames, "columnNames must not be null");
        List<List<Object>> normalized = new ArrayList<>();
        if (rawRows != null) {
            for (List<?> raw : rawRows) {
                List<Object> row = new ArrayList<>(columnNames.size());
                for (int i = 0; i < columnNames.size(); i++) {
                    row.add(i < raw.size() ? ColumnType.normalize(raw.get(i)) : null);
                }
                normalized.add(row);
            }
        }
        List<ColumnSchema> schema = new ArrayList<>();
        for (int i = 0; i < columnNames.size(); i++) {
            int index = i;
            schema.add(new ColumnSchema(
                columnNames.get(i),
                ColumnType.infer(normalized.stream().map(row -> row.get(index)).toList())
            ));
        }
        return new Table(schema, normalized);
    }

    public int rowCount() {
        return rows.size();
    }

    public int columnCount() {
        return columns.size();
    }

    public List<String> columnNames() {
        return columns.stream().map(ColumnSchema::name).toList();
    }

    public boolean hasColumn(String name) {
        return columns.stream().anyMatch(column -> column.name().equals(name));
    }

    public Table head(int limit) {
        if (limit >= rows.size()) {
            return this;
        }
        return new Table(columns, rows.subList(0, Math.max(0, limit)));
    }

    public boolean allNull() {
        return rows.stream().allMatch(row -> row.stream().allMatch(Objects::isNull));
    }

    public long nonNullCells() {
        return rows.stream().flatMap(List::stream).filter(Objects::nonNull).count();
    }

    private static List<List<Object>> copyRows(List<List<Object>> source, int width) {
        List<List<Object>> copy = new ArrayList<>(source.size());
        for (List<Object> row : source) {
            if (row.size() != width) {
                throw new IllegalArgumentException("row has " + row.size() + " cells, expected " + width);
            }
            copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        return Collections.unmodifiableList(copy);
    }
}
