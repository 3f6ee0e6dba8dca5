package io.tabula.core.tool;

import static org.assertj.core.api.Assertions.assertThat;

import io.tabula.core.agent.TurnState;
import io.tabula.core.dataset.DatasetHandle;
import io.tabula.core.dataset.Table;
import io.tabula.core.event.InMemoryEventChannel;
import io.tabula.core.model.MessageRole;
import io.tabula.core.model.ToolInvocation;
import io.tabula.core.model.ToolResult;
import io.tabula.core.observability.AuditEvent;
import io.tabula.core.observability.FileAuditStore;
import io.tabula.core.observability.ObservabilityService;
import io.tabula.core.sandbox.SandboxSettings;
import io.tabula.core.sandbox.SqlQuerySandbox;
import io.tabula.core.session.MessageTypes;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ToolDispatcherTest {

    @TempDir
    Path tempDir;

    private SqlQuerySandbox sandbox;
    private ObservabilityService observability;
    private ToolDispatcher dispatcher;
    private List<SavedMessage> saved;
    private ToolContext context;

    @BeforeEach
    void setUp() {
        sandbox = new SqlQuerySandbox(SandboxSettings.defaults());
        observability = new ObservabilityService(new FileAuditStore(tempDir.resolve("audit.json")), Clock.systemUTC());
        dispatcher = new ToolDispatcher(DefaultToolset.create(sandbox), observability);
        saved = new ArrayList<>();
        DatasetHandle dataset = new DatasetHandle(Table.of(
            List.of("team", "score"),
            List.of(List.of("red", 10), List.of("blue", 14))
        ));
        context = new ToolContext(
            new TurnState("who won?", 0),
            dataset,
            new InMemoryEventChannel(),
            (role, text, type, payload) -> saved.add(new SavedMessage(role, text, type, payload))
        );
    }

    @AfterEach
    void tearDown() {
        sandbox.close();
    }

    @Test
    void shouldListAvailableToolsForUnknownName() {
        ToolResult result = dispatcher.dispatch(new ToolInvocation("x1", "delete_everything", Map.of()), context);

        assertThat(result.error()).isTrue();
        assertThat(result.content())
            .isEqualTo("Unknown tool: delete_everything. Available tools: query, emit_text, emit_table, emit_plot, finalize");
        assertThat(saved).isEmpty();
    }

    @Test
    void shouldTurnArgumentProblemsIntoErrorResults() {
        ToolResult result = dispatcher.dispatch(new ToolInvocation("t1", "emit_table", Map.of("rows", List.of())), context);

        assertThat(result.error()).isTrue();
        assertThat(result.content()).isEqualTo("Invalid arguments for emit_table: 'headers' must list at least one column");
        assertThat(saved).isEmpty();
    }

    @Test
    void shouldCatchUnexpectedToolFailures() {
        ToolRegistry registry = new ToolRegistry();
        registry.register(new Tool() {
            @Override
            public String name() {
                return "boom";
            }

            @Override
            public String description() {
                return "always fails";
            }

            @Override
            public ToolResult execute(ToolInvocation invocation, ToolContext ctx) {
                throw new IllegalStateException("kaboom");
            }
        });

        ToolResult result = new ToolDispatcher(registry).dispatch(new ToolInvocation("b1", "boom", Map.of()), context);

        assertThat(result.error()).isTrue();
        assertThat(result.content()).isEqualTo("Error executing tool 'boom': kaboom");
    }

    @Test
    void shouldPersistSuccessfulQueryWithPayload() {
        ToolResult result = dispatcher.dispatch(
            new ToolInvocation("q1", "query", Map.of("query", "SELECT team FROM data ORDER BY score DESC LIMIT 1")),
            context
        );

        assertThat(result.error()).isFalse();
        assertThat(saved).singleElement().satisfies(message -> {
            assertThat(message.role()).isEqualTo(MessageRole.ASSISTANT);
            assertThat(message.type()).isEqualTo(MessageTypes.QUERY_RESULT);
            assertThat(message.text()).isEqualTo("team: blue");
            assertThat(message.payload()).containsEntry("query", "SELECT team FROM data ORDER BY score DESC LIMIT 1");
        });
    }

    @Test
    void shouldPersistFailedQueryFlaggedAsError() {
        ToolResult result = dispatcher.dispatch(
            new ToolInvocation("q1", "query", Map.of("query", "SELECT missing FROM data")),
            context
        );

        assertThat(result.error()).isTrue();
        assertThat(result.content()).startsWith("Error: ").contains("QUALITY METRICS:");
        assertThat(saved).singleElement().satisfies(message -> {
            assertThat(message.type()).isEqualTo(MessageTypes.QUERY_RESULT);
            assertThat(message.payload()).containsEntry("error", true);
        });
    }

    @Test
    void shouldAuditToolLifecycle() throws Exception {
        dispatcher.dispatch(new ToolInvocation("t1", "emit_text", Map.of("text", "Blue won.")), context);
        dispatcher.dispatch(new ToolInvocation("q1", "query", Map.of("query", "DROP TABLE data")), context);

        List<String> types = observability.recent(20).stream().map(AuditEvent::type).toList();

        assertThat(types).contains("tool_started", "tool_succeeded", "tool_failed", "query_blocked", "grounding_checked");
        assertThat(observability.summary().toolCalls()).isEqualTo(2);
        assertThat(observability.summary().blockedQueries()).isEqualTo(1);
    }

    private record SavedMessage(MessageRole role, String text, String type, Map<String, Object> payload) {
    }
}
