package io.tabula.core.sandbox;

import java.util.Locale;

public enum ResultKind {
    SCALAR,
    TABLE,
    /** Marks a result the caller should commit as the new canonical dataset. */
    TABLE_TRANSFORM,
    FIGURE,
    NONE;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
