package io.tabula.core.tool;

import java.util.List;
import java.util.Map;

public record FinalizeArguments(String sessionTitle, List<String> suggestions) {

    public static FinalizeArguments from(Map<String, Object> args) {
        String title = ToolArguments.optionalText(args, "session_title");
        List<String> suggestions = ToolArguments.stringList(args, "suggestions").stream()
            .map(String::strip)
            .filter(value -> !value.isEmpty())
            .toList();
        return new FinalizeArguments(title == null || title.isBlank() ? null : title.strip(), suggestions);
    }
}
