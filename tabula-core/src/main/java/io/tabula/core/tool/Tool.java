package io.tabula.core.tool;

import io.tabula.core.model.ToolInvocation;
import io.tabula.core.model.ToolResult;
import java.util.Map;

public interface Tool {
    String name();

    String description();

    default Map<String, Object> schema() {
        return Map.of("type", "object", "properties", Map.of());
    }

    /**
     * Runs one invocation. Recoverable failures come back as error results; a
     * {@link ToolArgumentException} may be thrown for malformed input.
     */
    ToolResult execute(ToolInvocation invocation, ToolContext context);
}
