package io.tabula.core.sandbox;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.tabula.core.dataset.DatasetSnapshot;
import io.tabula.core.dataset.Table;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs analysis scripts in a separate interpreter process.
 *
 * <p>The configured command receives a JSON request on stdin:
 * {@code {"code": "...", "table": "data", "columns": [...], "rows": [[...]]}} and must print one JSON
 * object on stdout: {@code {"kind": "scalar|table|figure|none", "value": ..., "columns": [...],
 * "rows": [[...]], "figure": {...}, "error": "..."}}. The process runs in a throwaway working
 * directory with a minimal environment and is killed when it exceeds the timeout.
 */
public final class ProcessScriptSandbox implements QuerySandbox {
    private static final Logger LOG = LoggerFactory.getLogger(ProcessScriptSandbox.class);
    private static final String SAFE_PATH = "/usr/local/bin:/usr/bin:/bin";
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final List<String> command;
    private final Duration timeout;
    private final String tableName;
    private final ScriptValidator validator;
    private final ResultClassifier classifier;
    private final PreviewRenderer previews;
    private final ObjectMapper mapper;

    public ProcessScriptSandbox(List<String> command, Duration timeout, SandboxSettings settings) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("command must not be empty");
        }
        this.command = List.copyOf(command);
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        this.tableName = settings.tableName();
        this.validator = new ScriptValidator();
        this.classifier = new ResultClassifier();
        this.previews = new PreviewRenderer(settings.maxPreviewRows(), settings.maxPreviewChars());
        this.mapper = new ObjectMapper();
    }

    @Override
    public ExecutionResult execute(String code, DatasetSnapshot snapshot) {
        try {
            validator.validate(code);
        } catch (QueryRejectedException e) {
            return ExecutionResult.failure(e.getMessage());
        }

        Path workDir = null;
        try {
            workDir = Files.createTempDirectory("tabula-script-");
            Path request = workDir.resolve("request.json");
            Path output = workDir.resolve("output.json");
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("code", code);
            payload.put("table", tableName);
            payload.put("columns", snapshot.table().columnNames());
            payload.put("rows", snapshot.table().rows());
            Files.writeString(request, mapper.writeValueAsString(payload), StandardCharsets.UTF_8);

            ProcessBuilder builder = new ProcessBuilder(command)
                .directory(workDir.toFile())
                .redirectInput(request.toFile())
                .redirectOutput(output.toFile())
                .redirectError(workDir.resolve("stderr.txt").toFile());
            builder.environment().clear();
            builder.environment().put("PATH", SAFE_PATH);
            Process process = builder.start();

            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                return ExecutionResult.failure("Script timed out after " + timeout.toSeconds() + "s");
            }
            String stdout = Files.readString(output, StandardCharsets.UTF_8);
            if (process.exitValue() != 0 && stdout.isBlank()) {
                String stderr = Files.readString(workDir.resolve("stderr.txt"), StandardCharsets.UTF_8);
                return ExecutionResult.failure("Script exited with code " + process.exitValue() + ": " + previews.cap(stderr.strip()));
            }
            try {
                return parse(stdout, snapshot);
            } catch (IllegalArgumentException e) {
                LOG.debug("Unusable script output: {}", e.getMessage());
                return ExecutionResult.failure("Script returned malformed output: " + previews.cap(String.valueOf(e.getMessage())));
            }
        } catch (IOException e) {
            return ExecutionResult.failure("Script execution failed: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ExecutionResult.failure("Script interrupted");
        } finally {
            deleteQuietly(workDir);
        }
    }

    private ExecutionResult parse(String stdout, DatasetSnapshot snapshot) throws IOException {
        if (stdout.isBlank()) {
            return ExecutionResult.none();
        }
        JsonNode root = mapper.readTree(stdout);
        String error = root.path("error").asText("");
        if (!error.isBlank()) {
            return ExecutionResult.failure(previews.cap(error));
        }
        String kind = root.path("kind").asText("none");
        return switch (kind) {
            case "scalar" -> {
                Object value = mapper.convertValue(root.path("value"), Object.class);
                yield ExecutionResult.scalar(value, previews.renderScalar(value));
            }
            case "figure" -> {
                Map<String, Object> converted = mapper.convertValue(root.path("figure"), MAP_TYPE);
                Map<String, Object> figure = converted == null ? Map.of() : converted;
                yield ExecutionResult.figure(figure, "figure: " + figure.getOrDefault("mark", "chart"));
            }
            case "table" -> tableResult(root, snapshot);
            default -> ExecutionResult.none();
        };
    }

    private ExecutionResult tableResult(JsonNode root, DatasetSnapshot snapshot) {
        List<String> columns = new ArrayList<>();
        root.path("columns").forEach(node -> columns.add(node.asText()));
        List<List<Object>> rows = new ArrayList<>();
        for (JsonNode rowNode : root.path("rows")) {
            List<Object> row = new ArrayList<>();
            rowNode.forEach(cell -> row.add(mapper.convertValue(cell, Object.class)));
            rows.add(row);
        }
        Table table = Table.of(columns, rows);
        ResultKind resultKind = classifier.classify(table, snapshot.table(), null);
        if (resultKind == ResultKind.SCALAR) {
            Object value = table.rows().get(0).get(0);
            return ExecutionResult.scalar(value, previews.renderScalar(value));
        }
        if (resultKind == ResultKind.NONE) {
            return ExecutionResult.none();
        }
        return ExecutionResult.table(resultKind, table, previews.render(table));
    }

    private void deleteQuietly(Path dir) {
        if (dir == null) {
            return;
        }
        try (Stream<Path> paths = Files.walk(dir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> path.toFile().delete());
        } catch (IOException e) {
            LOG.debug("Failed to clean script work dir {}: {}", dir, e.getMessage());
        }
    }
}
