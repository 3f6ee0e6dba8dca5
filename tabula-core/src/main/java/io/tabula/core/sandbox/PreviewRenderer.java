package io.tabula.core.sandbox;

import io.tabula.core.dataset.Table;
import java.util.List;
import java.util.stream.Collectors;

public final class PreviewRenderer {
    static final String TRUNCATED_MARKER = "... (truncated)";

    private final int maxRows;
    private final int maxChars;

    public PreviewRenderer(int maxRows, int maxChars) {
        this.maxRows = Math.max(1, maxRows);
        this.maxChars = Math.max(TRUNCATED_MARKER.length() + 1, maxChars);
    }

    public String render(Table table) {
        StringBuilder out = new StringBuilder();
        out.append(String.join(" | ", table.columnNames())).append('\n');
        List<List<Object>> rows = table.rows();
        int shown = Math.min(rows.size(), maxRows);
        for (int i = 0; i < shown; i++) {
            out.append(rows.get(i).stream().map(ValueFormat::format).collect(Collectors.joining(" | "))).append('\n');
            if (out.length() > maxChars) {
                break;
            }
        }
        if (rows.size() > shown) {
            out.append("... (").append(rows.size() - shown).append(" more rows)\n");
        }
        return cap(out.toString().stripTrailing());
    }

    public String renderScalar(Object value) {
        return cap(ValueFormat.format(value));
    }

    public String cap(String text) {
        if (text.length() <= maxChars) {
            return text;
        }
        return text.substring(0, maxChars - TRUNCATED_MARKER.length() - 1) + "\n" + TRUNCATED_MARKER;
    }
}
