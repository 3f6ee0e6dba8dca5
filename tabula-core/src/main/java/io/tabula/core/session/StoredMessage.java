package io.tabula.core.session;

import io.tabula.core.model.MessageRole;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public record StoredMessage(
    String sessionId,
    Instant createdAt,
    MessageRole role,
    String type,
    String text,
    Map<String, Object> payload
) {
    public StoredMessage {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(role, "role must not be null");
        createdAt = createdAt == null ? Instant.now() : createdAt;
        type = type == null || type.isBlank() ? MessageTypes.TEXT : type;
        text = text == null ? "" : text;
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }
}
