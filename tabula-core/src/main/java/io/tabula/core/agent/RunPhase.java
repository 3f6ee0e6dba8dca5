package io.tabula.core.agent;

import java.util.Locale;

public enum RunPhase {
    PLANNING,
    EXECUTING,
    FINALIZING,
    DONE,
    ERROR;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
