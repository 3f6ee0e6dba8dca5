package io.tabula.core.dataset;

import java.util.ArrayList;
import java.util.List;

public final class DatasetSummary {
    private static final int SAMPLE_ROWS = 3;

    private DatasetSummary() {
    }

    public static String describe(DatasetSnapshot snapshot, String tableName) {
        Table table = snapshot.table();
        List<String> lines = new ArrayList<>();
        lines.add("## Dataset");
        lines.add("Table: `" + tableName + "`");
        lines.add("Rows: " + table.rowCount());
        lines.add("Columns (" + table.columnCount() + "):");
        for (ColumnSchema column : table.columns()) {
            lines.add("  - " + column.name() + ": " + column.type().name());
        }
        if (table.rowCount() > 0 && table.columnCount() > 0) {
            lines.add("Sample rows:");
            for (List<Object> row : table.head(SAMPLE_ROWS).rows()) {
                lines.add("  " + row);
            }
        }
        if (snapshot.version() > 0) {
            lines.add("Dataset version: " + snapshot.version() + " (modified during this session)");
        }
        return String.join("\n", lines);
    }
}
