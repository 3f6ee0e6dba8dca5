package io.tabula.core.tool.impl;

import static org.assertj.core.api.Assertions.assertThat;

import io.tabula.core.agent.TurnState;
import io.tabula.core.dataset.DatasetHandle;
import io.tabula.core.dataset.Table;
import io.tabula.core.event.AgentEvent;
import io.tabula.core.event.EventType;
import io.tabula.core.event.InMemoryEventChannel;
import io.tabula.core.model.ToolInvocation;
import io.tabula.core.model.ToolResult;
import io.tabula.core.tool.ToolContext;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class EmitTableToolTest {
    private final InMemoryEventChannel events = new InMemoryEventChannel();
    private final ToolContext context = new ToolContext(new TurnState("", 0), new DatasetHandle(Table.empty()), events);

    @Test
    void shouldPadShortRowsToHeaderWidth() {
        ToolResult result = new EmitTableTool().execute(new ToolInvocation("t1", "emit_table", Map.of(
            "title", "Scores",
            "headers", List.of("team", "score", "rank"),
            "rows", List.of(List.of("red", 10), List.of("blue", 14, 1, "extra"))
        )), context);

        assertThat(result.content()).isEqualTo("Table sent to user (2 rows).");
        AgentEvent event = events.drain().get(0);
        assertThat(event.type()).isEqualTo(EventType.TABLE);
        assertThat(event.data().get("rows")).isEqualTo(List.of(
            Arrays.asList("red", 10, null),
            List.of("blue", 14, 1)
        ));
        assertThat(event.data()).containsEntry("truncated", false);
    }

    @Test
    void shouldTruncateLongTables() {
        List<List<Object>> rows = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            rows.add(List.of("row" + i));
        }

        ToolResult result = new EmitTableTool(5).execute(new ToolInvocation("t1", "emit_table", Map.of(
            "headers", List.of("name"),
            "rows", rows
        )), context);

        assertThat(result.content()).isEqualTo("Table sent to user (5 rows). Truncated from 12 rows to the first 5.");
        assertThat(events.drain().get(0).data()).containsEntry("total_rows", 12).containsEntry("truncated", true);
    }
}
