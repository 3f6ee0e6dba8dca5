package io.tabula.core.session;

import io.tabula.core.model.ChatMessage;
import io.tabula.core.model.MessageRole;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public final class ConversationReplay {
    static final String SESSION_OPENER = "[Dataset loaded]";

    public List<ChatMessage> replay(List<StoredMessage> stored) {
        List<ChatMessage> history = new ArrayList<>();
        if (stored == null) {
            return history;
        }

        MessageRole pendingRole = null;
        StringBuilder pending = new StringBuilder();
        for (StoredMessage message : stored) {
            String content = render(message);
            if (content == null || content.isBlank()) {
                continue;
            }
            if (message.role() != pendingRole) {
                flush(history, pendingRole, pending);
                pendingRole = message.role();
            } else {
                pending.append("\n\n");
            }
            pending.append(content);
        }
        flush(history, pendingRole, pending);

        if (!history.isEmpty() && history.get(0).role() == MessageRole.ASSISTANT) {
            history.add(0, ChatMessage.user(SESSION_OPENER));
        }
        return history;
    }

    private String render(StoredMessage message) {
        if (message.role() == MessageRole.USER) {
            return message.text();
        }
        return switch (message.type()) {
            case MessageTypes.REASONING, MessageTypes.FINALIZE -> null;
            case MessageTypes.QUERY_RESULT -> renderQuery(message);
            case MessageTypes.TABLE -> "[Table output]: " + message.text();
            case MessageTypes.PLOT -> "[Plot output]: " + message.text();
            default -> message.text();
        };
    }

    private String renderQuery(StoredMessage message) {
        Map<String, Object> payload = message.payload();
        Object query = payload.get("query");
        if (query == null) {
            return "[Query result]: " + message.text();
        }
        Object rowCount = payload.getOrDefault("row_count", 0);
        return "[Query: " + query + "]\n"
            + "[Result: " + rowCount + " rows returned]\n"
            + message.text();
    }

    private void flush(List<ChatMessage> history, MessageRole role, StringBuilder pending) {
        if (role == null || pending.length() == 0) {
            return;
        }
        history.add(role == MessageRole.USER
            ? ChatMessage.user(pending.toString())
            : ChatMessage.assistant(pending.toString()));
        pending.setLength(0);
    }
}
