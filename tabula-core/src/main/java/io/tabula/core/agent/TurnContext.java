package io.tabula.core.agent;

import io.tabula.core.model.ChatMessage;
import io.tabula.core.session.PersistenceHook;
import java.util.List;

public record TurnContext(List<ChatMessage> history, boolean initialAnalysis, PersistenceHook persistence) {
    public TurnContext {
        history = history == null ? List.of() : List.copyOf(history);
        persistence = persistence == null ? PersistenceHook.NOOP : persistence;
    }

    public static TurnContext fresh() {
        return new TurnContext(List.of(), false, PersistenceHook.NOOP);
    }
}
