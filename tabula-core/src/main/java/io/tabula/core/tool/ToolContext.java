package io.tabula.core.tool;

import io.tabula.core.agent.TurnState;
import io.tabula.core.dataset.DatasetHandle;
import io.tabula.core.dataset.DatasetSnapshot;
import io.tabula.core.event.EventSink;
import io.tabula.core.session.PersistenceHook;
import java.util.Objects;

public record ToolContext(
    TurnState state,
    DatasetHandle dataset,
    EventSink events,
    PersistenceHook persistence,
    DatasetSnapshot pinnedSnapshot
) {

    public ToolContext {
        Objects.requireNonNull(state, "state must not be null");
        Objects.requireNonNull(dataset, "dataset must not be null");
        Objects.requireNonNull(events, "events must not be null");
        persistence = persistence == null ? PersistenceHook.NOOP : persistence;
    }

    public ToolContext(TurnState state, DatasetHandle dataset, EventSink events) {
        this(state, dataset, events, PersistenceHook.NOOP, null);
    }

    public ToolContext(TurnState state, DatasetHandle dataset, EventSink events, PersistenceHook persistence) {
        this(state, dataset, events, persistence, null);
    }

    public DatasetSnapshot snapshot() {
        return pinnedSnapshot != null ? pinnedSnapshot : dataset.current();
    }

    public ToolContext pinned(DatasetSnapshot snapshot) {
        return new ToolContext(state, dataset, events, persistence, snapshot);
    }
}
