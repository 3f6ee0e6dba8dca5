package io.tabula.core.session;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.tabula.core.model.MessageRole;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class SqliteMessageStore implements MessageStore {
    private static final Logger LOG = LoggerFactory.getLogger(SqliteMessageStore.class);
    private static final TypeReference<Map<String, Object>> PAYLOAD = new TypeReference<>() {
    };

    private final String jdbcUrl;
    private final ObjectMapper mapper;

    public SqliteMessageStore(Path dbPath) throws IOException {
        if (dbPath == null) {
            throw new IllegalArgumentException("dbPath must not be null");
        }
        Path parent = dbPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        this.jdbcUrl = "jdbc:sqlite:" + dbPath.toAbsolutePath();
        this.mapper = new ObjectMapper();
        init();
    }

    @Override
    public synchronized void append(StoredMessage message) throws IOException {
        Objects.requireNonNull(message, "message must not be null");
        String sql = """
            INSERT INTO messages (session_id, created_at, role, type, text, payload_json)
            VALUES (?, ?, ?, ?, ?, ?)
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, message.sessionId());
            statement.setString(2, message.createdAt().toString());
            statement.setString(3, message.role().name().toLowerCase(Locale.ROOT));
            statement.setString(4, message.type());
            statement.setString(5, message.text());
            statement.setString(6, message.payload().isEmpty() ? null : mapper.writeValueAsString(message.payload()));
            statement.executeUpdate();
        } catch (SQLException e) {
            throw new IOException("Failed to append message for session " + message.sessionId(), e);
        }
    }

    @Override
    public synchronized List<StoredMessage> list(String sessionId) throws IOException {
        String sql = """
            SELECT session_id, created_at, role, type, text, payload_json
            FROM messages
            WHERE session_id = ?
            ORDER BY id ASC
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, sessionId);
            try (ResultSet resultSet = statement.executeQuery()) {
                List<StoredMessage> messages = new ArrayList<>();
                while (resultSet.next()) {
                    String payloadJson = resultSet.getString("payload_json");
                    Map<String, Object> payload = payloadJson == null || payloadJson.isBlank()
                        ? Map.of()
                        : mapper.readValue(payloadJson, PAYLOAD);
                    messages.add(new StoredMessage(
                        resultSet.getString("session_id"),
                        Instant.parse(resultSet.getString("created_at")),
                        MessageRole.valueOf(resultSet.getString("role").toUpperCase(Locale.ROOT)),
                        resultSet.getString("type"),
                        resultSet.getString("text"),
                        payload
                    ));
                }
                return messages;
            }
        } catch (SQLException e) {
            throw new IOException("Failed to list messages for session " + sessionId, e);
        }
    }

    @Override
    public PersistenceHook hook(String sessionId) {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        return (role, text, type, payload) -> {
            try {
                append(new StoredMessage(sessionId, Instant.now(), role, type, text, payload));
            } catch (IOException e) {
                LOG.warn("Failed to persist {} message for session {}: {}", type, sessionId, e.getMessage());
            }
        };
    }

    private Connection openConnection() throws SQLException {
        Connection connection = DriverManager.getConnection(jdbcUrl);
        try (Statement statement = connection.createStatement()) {
            statement.execute("PRAGMA journal_mode=WAL;");
            statement.execute("PRAGMA synchronous=NORMAL;");
        }
        return connection;
    }

    private void init() throws IOException {
        String ddl = """
            CREATE TABLE IF NOT EXISTS messages (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                session_id TEXT NOT NULL,
                created_at TEXT NOT NULL,
                role TEXT NOT NULL,
                type TEXT NOT NULL,
                text TEXT NOT NULL,
                payload_json TEXT
            )
            """;
        String idx = """
            CREATE INDEX IF NOT EXISTS idx_messages_session
            ON messages(session_id, id)
            """;
        try (Connection connection = openConnection();
             Statement statement = connection.createStatement()) {
            statement.execute(ddl);
            statement.execute(idx);
        } catch (SQLException e) {
            throw new IOException("Failed to initialize SQLite message store", e);
        }
    }
}
