package io.tabula.core.event;

import java.util.Locale;

public enum EventType {
    STATUS,
    TEXT,
    TEXT_DELTA,
    TABLE,
    PLOT,
    QUERY_RESULT,
    JUDGE,
    ERROR,
    SESSION_UPDATE,
    /** Always the last event of a run, emitted exactly once. */
    DONE;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean visibleOutput() {
        return this == TEXT || this == PLOT;
    }
}
