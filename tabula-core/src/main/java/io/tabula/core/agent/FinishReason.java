package io.tabula.core.agent;

import java.util.Locale;

public enum FinishReason {
    FINALIZE,
    END_TURN,
    ITERATION_LIMIT,
    ERROR,
    CANCELLED;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
