package io.tabula.core.session;

public final class MessageTypes {
    public static final String TEXT = "text";
    public static final String REASONING = "reasoning";
    public static final String QUERY_RESULT = "query_result";
    public static final String TABLE = "table";
    public static final String PLOT = "plot";
    public static final String FINALIZE = "finalize";

    private MessageTypes() {
    }
}
