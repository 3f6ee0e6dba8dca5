package io.tabula.core.sandbox;

import io.tabula.core.dataset.DatasetSnapshot;
import io.tabula.core.dataset.Table;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs validated SELECT queries against a private in-memory SQLite copy of the snapshot.
 * The copy is opened with {@code query_only}, so even a statement that slipped past validation
 * cannot write, and nothing outside the snapshot is reachable from it.
 */
public final class SqlQuerySandbox implements QuerySandbox, AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(SqlQuerySandbox.class);
    private static final int INSERT_BATCH = 500;

    private final SandboxSettings settings;
    private final SqlQueryValidator validator;
    private final ResultClassifier classifier;
    private final PreviewRenderer previews;
    private final ExecutorService workers;

    public SqlQuerySandbox(SandboxSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.validator = new SqlQueryValidator();
        this.classifier = new ResultClassifier();
        this.previews = new PreviewRenderer(settings.maxPreviewRows(), settings.maxPreviewChars());
        this.workers = Executors.newFixedThreadPool(settings.workerThreads(), new WorkerThreadFactory());
    }

    @Override
    public ExecutionResult execute(String code, DatasetSnapshot snapshot) {
        ValidatedQuery query;
        try {
            query = validator.validate(code);
        } catch (QueryRejectedException e) {
            LOG.debug("Rejected query: {}", e.getMessage());
            return ExecutionResult.failure(e.getMessage());
        }

        AtomicReference<Statement> running = new AtomicReference<>();
        Future<Fetched> future;
        try {
            future = workers.submit(() -> run(query, snapshot.table(), running));
        } catch (RuntimeException e) {
            return ExecutionResult.failure("Query executor unavailable: " + e.getMessage());
        }

        Fetched fetched;
        long timeoutMs = settings.queryTimeout().toMillis();
        try {
            fetched = future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            abort(future, running);
            return ExecutionResult.failure("Query timed out after " + settings.queryTimeout().toSeconds() + "s");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abort(future, running);
            return ExecutionResult.failure("Query interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            return ExecutionResult.failure(cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage());
        }

        Table result = fetched.table();
        if (fetched.truncated()) {
            // a partial table is only ever a view; committing it would drop rows
            LOG.debug("Query result capped at {} of {} rows", result.rowCount(), fetched.totalRows());
            String preview = previews.render(result) + "\n(result capped at " + result.rowCount() + " of "
                + fetched.totalRows() + " rows)";
            return ExecutionResult.truncatedTable(result, fetched.totalRows(), previews.cap(preview));
        }
        ResultKind kind = classifier.classify(result, snapshot.table(), query);
        if (kind == ResultKind.SCALAR) {
            Object value = result.rows().get(0).get(0);
            return ExecutionResult.scalar(value, result.columnNames().get(0) + ": " + previews.renderScalar(value));
        }
        if (kind == ResultKind.NONE) {
            return ExecutionResult.none();
        }
        return ExecutionResult.table(kind, result, previews.render(result));
    }

    @Override
    public void close() {
        workers.shutdownNow();
    }

    private Fetched run(ValidatedQuery query, Table source, AtomicReference<Statement> running) throws SQLException {
        int cap = settings.maxResultRows();
        try (Connection connection = DriverManager.getConnection("jdbc:sqlite::memory:")) {
            materialize(connection, source);
            try (Statement pragma = connection.createStatement()) {
                pragma.execute("PRAGMA query_only = ON");
            }
            try (Statement statement = connection.createStatement()) {
                running.set(statement);
                // one row past the cap tells a complete result from a cut-off one
                statement.setMaxRows(cap + 1);
                Table table;
                try (ResultSet resultSet = statement.executeQuery(query.sql())) {
                    table = read(resultSet);
                }
                if (table.rowCount() <= cap) {
                    return new Fetched(table, table.rowCount());
                }
                statement.setMaxRows(0);
                try (ResultSet count = statement.executeQuery("SELECT COUNT(*) FROM (\n" + query.sql() + "\n)")) {
                    int total = count.next() ? count.getInt(1) : cap + 1;
                    return new Fetched(table.head(cap), total);
                }
            } finally {
                running.set(null);
            }
        }
    }

    private void materialize(Connection connection, Table source) throws SQLException {
        String table = quote(settings.tableName());
        String columns = source.columns().stream()
            .map(column -> (quote(column.name()) + " " + column.type().sqlType()).trim())
            .collect(Collectors.joining(", "));
        try (Statement ddl = connection.createStatement()) {
            ddl.execute("CREATE TABLE " + table + " (" + columns + ")");
        }
        if (source.rowCount() == 0) {
            return;
        }
        String placeholders = source.columns().stream().map(column -> "?").collect(Collectors.joining(", "));
        connection.setAutoCommit(false);
        try (PreparedStatement insert = connection.prepareStatement("INSERT INTO " + table + " VALUES (" + placeholders + ")")) {
            int pending = 0;
            for (List<Object> row : source.rows()) {
                for (int i = 0; i < row.size(); i++) {
                    insert.setObject(i + 1, row.get(i));
                }
                insert.addBatch();
                if (++pending == INSERT_BATCH) {
                    insert.executeBatch();
                    pending = 0;
                }
            }
            if (pending > 0) {
                insert.executeBatch();
            }
        }
        connection.commit();
        connection.setAutoCommit(true);
    }

    private Table read(ResultSet resultSet) throws SQLException {
        ResultSetMetaData meta = resultSet.getMetaData();
        List<String> names = new ArrayList<>();
        for (int i = 1; i <= meta.getColumnCount(); i++) {
            names.add(meta.getColumnLabel(i));
        }
        List<List<Object>> rows = new ArrayList<>();
        while (resultSet.next()) {
            List<Object> row = new ArrayList<>(names.size());
            for (int i = 1; i <= names.size(); i++) {
                row.add(resultSet.getObject(i));
            }
            rows.add(row);
        }
        return Table.of(names, rows);
    }

    private void abort(Future<Fetched> future, AtomicReference<Statement> running) {
        Statement statement = running.get();
        if (statement != null) {
            try {
                statement.cancel();
            } catch (SQLException e) {
                LOG.debug("Failed to cancel running query: {}", e.getMessage());
            }
        }
        future.cancel(true);
    }

    static String quote(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    private record Fetched(Table table, int totalRows) {
        boolean truncated() {
            return totalRows > table.rowCount();
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "tabula-sql-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
