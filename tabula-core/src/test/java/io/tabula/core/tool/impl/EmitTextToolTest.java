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
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class EmitTextToolTest {
    private final InMemoryEventChannel events = new InMemoryEventChannel();
    private final TurnState state = new TurnState("What is the average price?", 0);
    private final ToolContext context = new ToolContext(state, new DatasetHandle(Table.empty()), events);

    @Test
    void shouldSendTextWithoutFeedbackWhenNothingWasQueried() {
        ToolResult result = new EmitTextTool().execute(text("Hello there."), context);

        assertThat(result.content()).isEqualTo("Text sent to user.");
        assertThat(result.recordText()).isEqualTo("Hello there.");
        assertThat(state.textCount()).isEqualTo(1);
        List<AgentEvent> emitted = events.drain();
        assertThat(emitted).extracting(AgentEvent::type).containsExactly(EventType.TEXT, EventType.JUDGE);
        assertThat(emitted.get(1).data()).containsEntry("source", "grounding");
    }

    @Test
    void shouldAttachAdvisoryGroundingAfterQueries() {
        state.addPreview("avg_price: 87.7");

        ToolResult result = new EmitTextTool().execute(text("The average price is 999.9."), context);

        assertThat(result.error()).isFalse();
        assertThat(result.content())
            .startsWith("Text sent to user.")
            .contains("numeric_grounding (advisory): 0/1 numbers verified, unverified: 999.9");
        assertThat(state.metrics()).hasSize(1);
    }

    @Test
    void shouldCountTextBeforeSinkSeesIt() {
        List<Integer> countsAtEmit = new ArrayList<>();
        ToolContext observing = new ToolContext(state, new DatasetHandle(Table.empty()), event -> {
            if (event.type() == EventType.TEXT) {
                countsAtEmit.add(state.textCount());
            }
        });

        new EmitTextTool().execute(text("Visible right away."), observing);

        assertThat(countsAtEmit).containsExactly(1);
    }

    private ToolInvocation text(String value) {
        return new ToolInvocation("t1", "emit_text", Map.of("text", value));
    }
}
