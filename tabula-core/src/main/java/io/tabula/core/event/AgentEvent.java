package io.tabula.core.event;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public record AgentEvent(EventType type, Map<String, Object> data, Instant timestamp) {
    public AgentEvent {
        Objects.requireNonNull(type, "type must not be null");
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
        timestamp = timestamp == null ? Instant.now() : timestamp;
    }

    public static AgentEvent of(EventType type, Map<String, Object> data) {
        return new AgentEvent(type, data, Instant.now());
    }

    public static AgentEvent status(String message) {
        return of(EventType.STATUS, Map.of("message", message == null ? "" : message));
    }

    public static AgentEvent text(String text) {
        return of(EventType.TEXT, Map.of("text", text == null ? "" : text));
    }

    public static AgentEvent error(String message) {
        return of(EventType.ERROR, Map.of("message", message == null ? "" : message));
    }

    /**
     * Transport shape {@code {"event": type, "data": {...}}}.
     */
    public Map<String, Object> toWire() {
        Map<String, Object> wire = new LinkedHashMap<>();
        wire.put("event", type.wireName());
        wire.put("data", data);
        return wire;
    }
}
