package io.tabula.core.tool.impl;

import static org.assertj.core.api.Assertions.assertThat;

import io.tabula.core.agent.TurnState;
import io.tabula.core.dataset.DatasetHandle;
import io.tabula.core.dataset.DatasetSnapshot;
import io.tabula.core.dataset.Table;
import io.tabula.core.event.AgentEvent;
import io.tabula.core.event.EventType;
import io.tabula.core.event.InMemoryEventChannel;
import io.tabula.core.model.ToolInvocation;
import io.tabula.core.model.ToolResult;
import io.tabula.core.sandbox.ExecutionResult;
import io.tabula.core.sandbox.SandboxSettings;
import io.tabula.core.sandbox.SqlQuerySandbox;
import io.tabula.core.tool.ToolContext;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class QueryToolTest {
    private SqlQuerySandbox sandbox;
    private QueryTool tool;
    private DatasetHandle dataset;
    private TurnState state;
    private InMemoryEventChannel events;
    private ToolContext context;

    @BeforeEach
    void setUp() {
        sandbox = new SqlQuerySandbox(SandboxSettings.defaults());
        tool = new QueryTool(sandbox);
        dataset = new DatasetHandle(Table.of(
            List.of("city", "temp_c"),
            List.of(List.of("Oslo", 4.5), List.of("Rome", 18.0), List.of("Lima", 21.5))
        ));
        state = new TurnState("convert", 0);
        events = new InMemoryEventChannel();
        context = new ToolContext(state, dataset, events);
    }

    @AfterEach
    void tearDown() {
        sandbox.close();
    }

    @Test
    void shouldReturnPreviewAndMetricsForScalar() {
        ToolResult result = tool.execute(query("SELECT MAX(temp_c) AS hottest FROM data", "Find the hottest"), context);

        assertThat(result.error()).isFalse();
        assertThat(result.content())
            .contains("\"kind\":\"scalar\"", "\"preview\":\"hottest: 21.5\"")
            .contains("QUALITY METRICS:", "unsafe_code: PASS", "valid_answer: PASS");
        assertThat(state.previews()).containsExactly("hottest: 21.5");

        List<AgentEvent> emitted = events.drain();
        assertThat(emitted.get(0).type()).isEqualTo(EventType.STATUS);
        assertThat(emitted.get(0).data()).containsEntry("message", "Find the hottest");
        assertThat(emitted.get(1).type()).isEqualTo(EventType.QUERY_RESULT);
        assertThat(emitted.get(1).data()).containsEntry("value", 21.5).containsEntry("data_updated", false);
    }

    @Test
    void shouldCommitTransformAndDescribeChange() {
        ToolResult result = tool.execute(
            query("SELECT *, temp_c * 1.8 + 32 AS temp_f FROM data", ""),
            context
        );

        assertThat(result.error()).isFalse();
        assertThat(dataset.current().version()).isEqualTo(1);
        assertThat(dataset.current().table().columnNames()).containsExactly("city", "temp_c", "temp_f");
        assertThat(state.dataUpdated()).isTrue();
        assertThat(result.content()).contains("\"data_updated\":true", "\"added_columns\":[\"temp_f\"]");
        assertThat(result.recordPayload()).containsEntry("dataset_version", 1);
    }

    @Test
    void shouldRejectTransformBasedOnStaleSnapshot() {
        DatasetSnapshot stale = dataset.current();
        dataset.commit(stale, stale.table());

        ToolResult result = tool.execute(
            query("SELECT *, temp_c * 2 AS doubled FROM data", ""),
            context.pinned(stale)
        );

        assertThat(result.error()).isTrue();
        assertThat(result.content())
            .isEqualTo("Dataset changed while the query ran (based on version 0, now 1). Re-run the query against the current data.");
        assertThat(dataset.current().version()).isEqualTo(1);
        assertThat(state.dataUpdated()).isFalse();
    }

    @Test
    void shouldBlockUnsafeQueryBeforeExecution() {
        ToolResult result = tool.execute(query("DELETE FROM data", ""), context);

        assertThat(result.error()).isTrue();
        assertThat(result.content()).startsWith("Query blocked by safety check.").contains("unsafe_code: FAIL");
        assertThat(events.drain()).extracting(AgentEvent::type).containsExactly(EventType.STATUS);
        assertThat(dataset.current().table().rowCount()).isEqualTo(3);
    }

    @Test
    void shouldRefuseScriptsWhenNoScriptSandboxIsConfigured() {
        ToolResult result = tool.execute(
            new ToolInvocation("s1", "query", Map.of("query", "result = df.mean()", "language", "script")),
            context
        );

        assertThat(result.error()).isTrue();
        assertThat(result.content()).isEqualTo("Script execution is disabled. Use language 'sql'.");
    }

    @Test
    void shouldSuggestRetryForEmptyResult() {
        ToolResult result = tool.execute(query("SELECT city FROM data WHERE temp_c > 40", "hot cities"), context);

        assertThat(result.error()).isFalse();
        assertThat(result.content()).contains("valid_answer: FAIL", "RECOMMENDATION: Retry with a different approach.");
    }

    @Test
    void shouldNeverCommitRowCappedResult() {
        SqlQuerySandbox capped = new SqlQuerySandbox(new SandboxSettings("data", 50, 4000, 2, Duration.ofSeconds(5), 1));
        try {
            ToolResult result = new QueryTool(capped).execute(
                query("SELECT *, temp_c * 1.8 + 32 AS temp_f FROM data", "to fahrenheit"),
                context
            );

            assertThat(result.error()).isFalse();
            assertThat(result.content()).contains("\"kind\":\"table\"", "\"row_count\":3", "\"truncated\":true");
            assertThat(dataset.current().version()).isZero();
            assertThat(dataset.current().table().columnNames()).containsExactly("city", "temp_c");
            assertThat(state.dataUpdated()).isFalse();
            AgentEvent event = events.drain().get(1);
            assertThat(event.data())
                .containsEntry("row_count", 3)
                .containsEntry("truncated", true)
                .containsEntry("data_updated", false);
        } finally {
            capped.close();
        }
    }

    @Test
    void shouldCapLongEngineErrors() {
        String longError = "no such column: " + "x".repeat(10_000);
        QueryTool failing = new QueryTool((code, snapshot) -> ExecutionResult.failure(longError));

        ToolResult result = failing.execute(query("SELECT x FROM data", ""), context);

        assertThat(result.error()).isTrue();
        assertThat(result.content()).startsWith("Error: no such column: ").contains("... (truncated)");
        assertThat(result.content()).doesNotContain(longError);
        assertThat(result.recordText()).hasSizeLessThanOrEqualTo(2000);
        assertThat((String) events.drain().get(1).data().get("error")).hasSizeLessThanOrEqualTo(2000);
    }

    @Test
    void shouldDescribeRowAndColumnDelta() {
        Table before = Table.of(List.of("a", "b"), List.of(List.of(1, 2), List.of(3, 4)));
        Table after = Table.of(List.of("a", "c"), List.of(List.of(1, 5)));

        Map<String, Object> change = QueryTool.describeChange(before, after);

        assertThat(change)
            .containsEntry("added_columns", List.of("c"))
            .containsEntry("removed_columns", List.of("b"))
            .containsEntry("rows_before", 2)
            .containsEntry("rows_after", 1)
            .containsEntry("row_delta", -1);
    }

    private ToolInvocation query(String sql, String description) {
        return new ToolInvocation("q1", "query", Map.of("query", sql, "description", description));
    }
}
