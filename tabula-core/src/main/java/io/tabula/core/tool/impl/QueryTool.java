package io.tabula.core.tool.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.tabula.core.dataset.DatasetConflictException;
import io.tabula.core.dataset.DatasetHandle;
import io.tabula.core.dataset.DatasetSnapshot;
import io.tabula.core.dataset.Table;
import io.tabula.core.evaluation.CodeLanguage;
import io.tabula.core.evaluation.CodeSafetyEvaluator;
import io.tabula.core.evaluation.EvaluationReport;
import io.tabula.core.evaluation.ResultValidityEvaluator;
import io.tabula.core.event.AgentEvent;
import io.tabula.core.event.EventType;
import io.tabula.core.model.ToolInvocation;
import io.tabula.core.model.ToolResult;
import io.tabula.core.observability.AuditEventTypes;
import io.tabula.core.observability.ObservabilityService;
import io.tabula.core.sandbox.ExecutionResult;
import io.tabula.core.sandbox.PreviewRenderer;
import io.tabula.core.sandbox.QuerySandbox;
import io.tabula.core.sandbox.ResultKind;
import io.tabula.core.tool.QueryArguments;
import io.tabula.core.tool.Tool;
import io.tabula.core.tool.ToolContext;
import io.tabula.core.tool.ToolName;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a read-only query against the current dataset snapshot.
 *
 * <p>Order per call: safety check, sandbox execution, validity check, then for a
 * complete {@link ResultKind#TABLE_TRANSFORM} a compare-and-set commit on the dataset handle. The model gets
 * the bounded preview and the quality block; the full result only reaches the event sink and the
 * persistence record.
 */
public final class QueryTool implements Tool {
    private static final Logger LOG = LoggerFactory.getLogger(QueryTool.class);
    private static final int EVENT_ROWS = 50;
    private static final int RECORD_ROWS = 20;
    private static final PreviewRenderer ERRORS = new PreviewRenderer(1, 2000);

    private final QuerySandbox sqlSandbox;
    private final QuerySandbox scriptSandbox;
    private final CodeSafetyEvaluator safety;
    private final ResultValidityEvaluator validity;
    private final ObservabilityService observability;
    private final ObjectMapper mapper = new ObjectMapper();

    public QueryTool(QuerySandbox sqlSandbox) {
        this(sqlSandbox, null, null);
    }

    public QueryTool(QuerySandbox sqlSandbox, QuerySandbox scriptSandbox, ObservabilityService observability) {
        this.sqlSandbox = Objects.requireNonNull(sqlSandbox, "sqlSandbox must not be null");
        this.scriptSandbox = scriptSandbox;
        this.safety = new CodeSafetyEvaluator();
        this.validity = new ResultValidityEvaluator();
        this.observability = observability;
    }

    @Override
    public String name() {
        return ToolName.QUERY.wireName();
    }

    @Override
    public String description() {
        String base = "Run a read-only SQL query (SQLite dialect) against the dataset table. "
            + "Returns a preview of the result plus quality metrics. A query that keeps every original "
            + "column and adds or redefines columns replaces the working dataset.";
        return scriptSandbox == null ? base : base + " Set language to 'script' to run an analysis script instead.";
    }

    @Override
    public Map<String, Object> schema() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("query", Map.of("type", "string", "description", "SELECT or WITH query to execute"));
        properties.put("description", Map.of("type", "string", "description", "Short status line shown while the query runs"));
        properties.put("language", Map.of(
            "type", "string",
            "enum", scriptSandbox == null ? List.of("sql") : List.of("sql", "script"),
            "description", "Query language, defaults to sql"
        ));
        return Map.of("type", "object", "properties", properties, "required", List.of("query"));
    }

    @Override
    public ToolResult execute(ToolInvocation invocation, ToolContext context) {
        QueryArguments args = QueryArguments.from(invocation.arguments());
        context.events().emit(AgentEvent.status(args.description().isBlank() ? "Running query" : args.description()));

        QuerySandbox sandbox = args.language() == CodeLanguage.SCRIPT ? scriptSandbox : sqlSandbox;
        if (sandbox == null) {
            return ToolResult.failure(invocation, "Script execution is disabled. Use language 'sql'.");
        }

        EvaluationReport safetyReport = safety.evaluate(args.query(), args.language());
        if (!safetyReport.allPassed()) {
            context.state().addChecks(safetyReport);
            LOG.warn("Blocked {} query: {}", args.language(), safetyReport.checks().get(0).detail());
            audit(AuditEventTypes.QUERY_BLOCKED, Map.of("language", args.language().name(), "detail", safetyReport.checks().get(0).detail()));
            return ToolResult.failure(invocation, "Query blocked by safety check.\n\n" + safetyReport.toFeedback())
                .withRecord("Query blocked", recordPayload(args, null, 0, context.snapshot().version()));
        }

        DatasetHandle dataset = context.dataset();
        DatasetSnapshot base = context.snapshot();
        ExecutionResult result = sandbox.execute(args.query(), base);
        EvaluationReport report = safetyReport.merge(validity.evaluate(result, args.description()));
        context.state().addChecks(report);

        if (!result.success()) {
            String error = ERRORS.cap(result.error());
            LOG.debug("Query failed: {}", error);
            context.events().emit(AgentEvent.of(EventType.QUERY_RESULT, failureEvent(args, error, report)));
            return ToolResult.failure(invocation, "Error: " + error + "\n\n" + report.toFeedback())
                .withRecord(error, recordPayload(args, result, 0, base.version()));
        }

        context.state().addPreview(result.preview());
        Map<String, Object> change = null;
        int version = base.version();
        if (result.kind() == ResultKind.TABLE_TRANSFORM && !result.truncated()) {
            Table transformed = result.table().orElseThrow();
            try {
                DatasetSnapshot committed = dataset.commit(base, transformed);
                version = committed.version();
                context.state().markDataUpdated(version);
                change = describeChange(base.table(), transformed);
                LOG.info("Dataset updated to version {}", version);
            } catch (DatasetConflictException e) {
                LOG.warn("Transform lost a commit race: {}", e.getMessage());
                return ToolResult.failure(invocation, "Dataset changed while the query ran (based on version "
                    + e.expectedVersion() + ", now " + e.actualVersion() + "). Re-run the query against the current data.");
            }
        }

        context.events().emit(AgentEvent.of(EventType.QUERY_RESULT, successEvent(args, result, report, change, version)));
        String content = renderContent(result, change, version) + "\n\n" + report.toFeedback();
        return ToolResult.success(invocation, content)
            .withRecord(result.preview(), recordPayload(args, result, result.rowCount(), version));
    }

    private Map<String, Object> successEvent(
        QueryArguments args,
        ExecutionResult result,
        EvaluationReport report,
        Map<String, Object> change,
        int version
    ) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("query", args.query());
        data.put("description", args.description());
        data.put("language", args.language().name().toLowerCase(Locale.ROOT));
        data.put("success", true);
        data.put("kind", result.kind().wireName());
        data.put("row_count", result.rowCount());
        if (result.truncated()) {
            data.put("truncated", true);
        }
        result.table().ifPresent(table -> {
            data.put("columns", table.columnNames());
            data.put("rows", table.head(EVENT_ROWS).rows());
        });
        if (result.kind() == ResultKind.SCALAR) {
            data.put("value", result.value());
        }
        if (result.kind() == ResultKind.FIGURE) {
            data.put("figure", result.value());
        }
        data.put("preview", result.preview());
        data.put("data_updated", change != null);
        data.put("dataset_version", version);
        if (change != null) {
            data.put("change", change);
        }
        data.put("metrics", report.toMaps());
        return data;
    }

    private Map<String, Object> failureEvent(QueryArguments args, String error, EvaluationReport report) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("query", args.query());
        data.put("description", args.description());
        data.put("language", args.language().name().toLowerCase(Locale.ROOT));
        data.put("success", false);
        data.put("error", error);
        data.put("metrics", report.toMaps());
        return data;
    }

    private String renderContent(ExecutionResult result, Map<String, Object> change, int version) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("kind", result.kind().wireName());
        body.put("row_count", result.rowCount());
        if (result.truncated()) {
            body.put("truncated", true);
        }
        result.table().ifPresent(table -> body.put("columns", table.columnNames()));
        if (result.kind() == ResultKind.SCALAR) {
            body.put("value", result.value());
        }
        body.put("preview", result.preview());
        if (change != null) {
            body.put("data_updated", true);
            body.put("dataset_version", version);
            body.put("change", change);
        }
        try {
            return mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            LOG.debug("Falling back to raw preview: {}", e.getOriginalMessage());
            return result.preview();
        }
    }

    static Map<String, Object> describeChange(Table before, Table after) {
        List<String> added = new ArrayList<>();
        for (String column : after.columnNames()) {
            if (!before.hasColumn(column)) {
                added.add(column);
            }
        }
        List<String> removed = new ArrayList<>();
        for (String column : before.columnNames()) {
            if (!after.hasColumn(column)) {
                removed.add(column);
            }
        }
        Map<String, Object> change = new LinkedHashMap<>();
        change.put("added_columns", added);
        change.put("removed_columns", removed);
        change.put("rows_before", before.rowCount());
        change.put("rows_after", after.rowCount());
        change.put("row_delta", after.rowCount() - before.rowCount());
        return change;
    }

    private Map<String, Object> recordPayload(QueryArguments args, ExecutionResult result, int rowCount, int version) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("query", args.query());
        payload.put("description", args.description());
        payload.put("row_count", rowCount);
        payload.put("dataset_version", version);
        if (result != null && result.success()) {
            payload.put("kind", result.kind().wireName());
            result.table().ifPresent(table -> {
                payload.put("columns", table.columnNames());
                payload.put("rows", table.head(RECORD_ROWS).rows());
            });
        }
        return payload;
    }

    private void audit(String type, Map<String, Object> attributes) {
        if (observability != null) {
            observability.recordQuietly(type, attributes);
        }
    }
}
