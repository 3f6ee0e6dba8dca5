package io.tabula.core.session;

import static org.assertj.core.api.Assertions.assertThat;

import io.tabula.core.model.ChatMessage;
import io.tabula.core.model.MessageRole;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ConversationReplayTest {
    private final ConversationReplay replay = new ConversationReplay();

    @Test
    void shouldSkipReasoningAndMergeAssistantRecords() {
        List<ChatMessage> history = replay.replay(List.of(
            message(MessageRole.USER, MessageTypes.TEXT, "Average price?", Map.of()),
            message(MessageRole.ASSISTANT, MessageTypes.REASONING, "Let me check.", Map.of()),
            message(MessageRole.ASSISTANT, MessageTypes.QUERY_RESULT, "avg: 87.7",
                Map.of("query", "SELECT AVG(price) AS avg FROM data", "row_count", 1)),
            message(MessageRole.ASSISTANT, MessageTypes.TEXT, "The average is 87.7.", Map.of()),
            message(MessageRole.ASSISTANT, MessageTypes.FINALIZE, "Prices", Map.of())
        ));

        assertThat(history).hasSize(2);
        assertThat(history.get(0).text()).isEqualTo("Average price?");
        assertThat(history.get(1).role()).isEqualTo(MessageRole.ASSISTANT);
        assertThat(history.get(1).text()).isEqualTo(
            "[Query: SELECT AVG(price) AS avg FROM data]\n[Result: 1 rows returned]\navg: 87.7\n\nThe average is 87.7."
        );
    }

    @Test
    void shouldLabelTablesPlotsAndLegacyQueryRecords() {
        List<ChatMessage> history = replay.replay(List.of(
            message(MessageRole.USER, MessageTypes.TEXT, "Show me", Map.of()),
            message(MessageRole.ASSISTANT, MessageTypes.TABLE, "Scores", Map.of()),
            message(MessageRole.ASSISTANT, MessageTypes.PLOT, "Trend", Map.of()),
            message(MessageRole.ASSISTANT, MessageTypes.QUERY_RESULT, "n: 3", Map.of())
        ));

        assertThat(history.get(1).text())
            .isEqualTo("[Table output]: Scores\n\n[Plot output]: Trend\n\n[Query result]: n: 3");
    }

    @Test
    void shouldOpenWithUserMessageWhenLogStartsWithAssistant() {
        List<ChatMessage> history = replay.replay(List.of(
            message(MessageRole.ASSISTANT, MessageTypes.TEXT, "Here is an overview.", Map.of()),
            message(MessageRole.USER, MessageTypes.TEXT, "Thanks", Map.of())
        ));

        assertThat(history).extracting(ChatMessage::role)
            .containsExactly(MessageRole.USER, MessageRole.ASSISTANT, MessageRole.USER);
        assertThat(history.get(0).text()).isEqualTo(ConversationReplay.SESSION_OPENER);
    }

    private StoredMessage message(MessageRole role, String type, String text, Map<String, Object> payload) {
        return new StoredMessage("s1", Instant.EPOCH, role, type, text, payload);
    }
}
