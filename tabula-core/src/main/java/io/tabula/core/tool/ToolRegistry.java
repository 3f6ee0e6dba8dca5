package io.tabula.core.tool;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class ToolRegistry {
    public static final String SCHEMA_VERSION = "2026-10-01";

    private final Map<String, Tool> tools = new LinkedHashMap<>();

    public synchronized void register(Tool tool) {
        tools.put(tool.name(), tool);
    }

    public synchronized Optional<Tool> find(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    public synchronized Collection<Tool> all() {
        return List.copyOf(tools.values());
    }

    public synchronized List<String> names() {
        return new ArrayList<>(tools.keySet());
    }

    public synchronized List<Map<String, Object>> definitions() {
        return tools.values().stream()
            .map(tool -> Map.<String, Object>of(
                "name", tool.name(),
                "description", tool.description(),
                "input_schema", tool.schema()))
            .toList();
    }
}
