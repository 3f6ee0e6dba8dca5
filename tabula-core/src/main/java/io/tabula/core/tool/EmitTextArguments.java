package io.tabula.core.tool;

import java.util.Map;

public record EmitTextArguments(String text) {

    public static EmitTextArguments from(Map<String, Object> args) {
        return new EmitTextArguments(ToolArguments.requireText(args, "text"));
    }
}
