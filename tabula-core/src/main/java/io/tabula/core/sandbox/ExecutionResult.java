package io.tabula.core.sandbox;

import io.tabula.core.dataset.Table;
import java.util.Map;
import java.util.Optional;

public record ExecutionResult(boolean success, Object value, ResultKind kind, String preview, String error, int totalRows) {
    public ExecutionResult {
        kind = kind == null ? ResultKind.NONE : kind;
        preview = preview == null ? "" : preview;
        error = error == null ? "" : error;
        totalRows = Math.max(0, totalRows);
    }

    public static ExecutionResult failure(String error) {
        return new ExecutionResult(false, null, ResultKind.NONE, "", error == null || error.isBlank() ? "execution failed" : error, 0);
    }

    public static ExecutionResult scalar(Object value, String preview) {
        return new ExecutionResult(true, value, ResultKind.SCALAR, preview, "", 1);
    }

    public static ExecutionResult table(ResultKind kind, Table table, String preview) {
        return new ExecutionResult(true, table, kind, preview, "", table.rowCount());
    }

    /**
     * A read-only view of the first rows of a larger result. Never a transform.
     */
    public static ExecutionResult truncatedTable(Table table, int totalRows, String preview) {
        return new ExecutionResult(true, table, ResultKind.TABLE, preview, "", Math.max(totalRows, table.rowCount()));
    }

    public static ExecutionResult figure(Map<String, Object> figure, String preview) {
        return new ExecutionResult(true, figure, ResultKind.FIGURE, preview, "", 0);
    }

    public static ExecutionResult none() {
        return new ExecutionResult(true, null, ResultKind.NONE, "(no result)", "", 0);
    }

    public Optional<Table> table() {
        return value instanceof Table table ? Optional.of(table) : Optional.empty();
    }

    public int rowCount() {
        return success ? totalRows : 0;
    }

    public boolean truncated() {
        return table().map(table -> table.rowCount() < totalRows).orElse(false);
    }
}
