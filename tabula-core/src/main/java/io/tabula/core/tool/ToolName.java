package io.tabula.core.tool;

import java.util.Arrays;
import java.util.Optional;

public enum ToolName {
    QUERY("query"),
    EMIT_TEXT("emit_text"),
    EMIT_TABLE("emit_table"),
    EMIT_PLOT("emit_plot"),
    FINALIZE("finalize");

    private final String wireName;

    ToolName(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<ToolName> fromWireName(String name) {
        return Arrays.stream(values())
            .filter(tool -> tool.wireName.equals(name))
            .findFirst();
    }
}
