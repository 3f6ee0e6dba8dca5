package io.tabula.core.tool;

import java.util.List;
import java.util.Map;

public record EmitTableArguments(String title, List<String> headers, List<List<Object>> rows) {

    public static EmitTableArguments from(Map<String, Object> args) {
        List<String> headers = ToolArguments.stringList(args, "headers");
        if (headers.isEmpty()) {
            throw new ToolArgumentException("'headers' must list at least one column");
        }
        return new EmitTableArguments(
            ToolArguments.optionalText(args, "title"),
            headers,
            ToolArguments.rows(args, "rows")
        );
    }
}
