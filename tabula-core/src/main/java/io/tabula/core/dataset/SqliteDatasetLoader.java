package io.tabula.core.dataset;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

public final class SqliteDatasetLoader {
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final int maxRows;

    public SqliteDatasetLoader(int maxRows) {
        this.maxRows = Math.max(1, maxRows);
    }

    public Table load(Path dbPath, String tableName) throws IOException {
        if (dbPath == null || !Files.isRegularFile(dbPath)) {
            throw new IOException("Database file not found: " + dbPath);
        }
        if (tableName == null || !IDENTIFIER.matcher(tableName).matches()) {
            throw new IllegalArgumentException("Invalid table name: " + tableName);
        }
        String sql = "SELECT * FROM \"" + tableName + "\" LIMIT " + ((long) maxRows + 1);
        try (Connection connection = DriverManager.getConnection("jdbc:sqlite:" + dbPath.toAbsolutePath());
             PreparedStatement statement = connection.prepareStatement(sql);
             ResultSet resultSet = statement.executeQuery()) {
            ResultSetMetaData meta = resultSet.getMetaData();
            List<String> names = new ArrayList<>();
            for (int i = 1; i <= meta.getColumnCount(); i++) {
                names.add(meta.getColumnLabel(i));
            }
            List<List<Object>> rows = new ArrayList<>();
            while (resultSet.next()) {
                if (rows.size() == maxRows) {
                    throw new IOException("Table " + tableName + " has more than " + maxRows
                        + " rows; raise sandbox.max_dataset_rows or load a smaller table");
                }
                List<Object> row = new ArrayList<>(names.size());
                for (int i = 1; i <= names.size(); i++) {
                    row.add(resultSet.getObject(i));
                }
                rows.add(row);
            }
            return Table.of(names, rows);
        } catch (SQLException e) {
            throw new IOException("Failed to load table " + tableName + " from " + dbPath, e);
        }
    }
}
