package io.tabula.core.tool;

import io.tabula.core.evaluation.CodeLanguage;
import java.util.Locale;
import java.util.Map;

public record QueryArguments(String query, String description, CodeLanguage language) {

    public static QueryArguments from(Map<String, Object> args) {
        String query = ToolArguments.requireText(args, "query");
        String description = ToolArguments.optionalText(args, "description");
        String language = ToolArguments.optionalText(args, "language");
        return new QueryArguments(query.strip(), description == null ? "" : description.strip(), language(language));
    }

    private static CodeLanguage language(String raw) {
        if (raw == null || raw.isBlank()) {
            return CodeLanguage.SQL;
        }
        return switch (raw.strip().toLowerCase(Locale.ROOT)) {
            case "sql" -> CodeLanguage.SQL;
            case "script", "python" -> CodeLanguage.SCRIPT;
            default -> throw new ToolArgumentException("'language' must be 'sql' or 'script', got '" + raw + "'");
        };
    }
}
