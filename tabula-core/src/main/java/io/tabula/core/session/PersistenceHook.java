package io.tabula.core.session;

import io.tabula.core.model.MessageRole;
import java.util.Map;

@FunctionalInterface
public interface PersistenceHook {
    PersistenceHook NOOP = (role, text, type, payload) -> {
    };

    void save(MessageRole role, String text, String type, Map<String, Object> payload);
}
