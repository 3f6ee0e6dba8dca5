package io.tabula.core.session;

import static org.assertj.core.api.Assertions.assertThat;

import io.tabula.core.model.MessageRole;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SqliteMessageStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldPersistMessagesWithPayload() throws Exception {
        SqliteMessageStore store = new SqliteMessageStore(tempDir.resolve("sessions/tabula.db"));
        store.append(new StoredMessage(
            "s1",
            Instant.parse("2026-01-01T00:00:00Z"),
            MessageRole.ASSISTANT,
            MessageTypes.QUERY_RESULT,
            "n: 3",
            Map.of("query", "SELECT COUNT(*) AS n FROM data", "row_count", 1)
        ));

        List<StoredMessage> saved = store.list("s1");

        assertThat(saved).hasSize(1);
        StoredMessage message = saved.get(0);
        assertThat(message.role()).isEqualTo(MessageRole.ASSISTANT);
        assertThat(message.type()).isEqualTo(MessageTypes.QUERY_RESULT);
        assertThat(message.createdAt()).isEqualTo(Instant.parse("2026-01-01T00:00:00Z"));
        assertThat(message.payload()).containsEntry("query", "SELECT COUNT(*) AS n FROM data").containsEntry("row_count", 1);
    }

    @Test
    void shouldKeepInsertionOrderAndSeparateSessions() throws Exception {
        SqliteMessageStore store = new SqliteMessageStore(tempDir.resolve("tabula.db"));
        PersistenceHook first = store.hook("s1");
        PersistenceHook second = store.hook("s2");

        first.save(MessageRole.USER, "question", MessageTypes.TEXT, Map.of());
        second.save(MessageRole.USER, "other session", MessageTypes.TEXT, Map.of());
        first.save(MessageRole.ASSISTANT, "answer", MessageTypes.TEXT, Map.of());

        assertThat(store.list("s1")).extracting(StoredMessage::text).containsExactly("question", "answer");
        assertThat(store.list("s2")).extracting(StoredMessage::text).containsExactly("other session");
    }

    @Test
    void shouldReturnEmptyListForFreshDatabase() throws Exception {
        SqliteMessageStore store = new SqliteMessageStore(tempDir.resolve("tabula.db"));
        assertThat(store.list("missing")).isEmpty();
    }
}
