package io.tabula.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public record ToolInvocation(String id, String name, Map<String, Object> arguments) {
    public ToolInvocation {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(name, "name must not be null");
        // model-produced arguments may carry JSON nulls, which Map.copyOf rejects
        arguments = arguments == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
    }
}
