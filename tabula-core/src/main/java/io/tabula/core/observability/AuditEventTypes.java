package io.tabula.core.observability;

public final class AuditEventTypes {
    public static final String RUN_STARTED = "run_started";
    public static final String RUN_COMPLETED = "run_completed";
    public static final String RUN_FAILED = "run_failed";
    public static final String TOOL_STARTED = "tool_started";
    public static final String TOOL_SUCCEEDED = "tool_succeeded";
    public static final String TOOL_FAILED = "tool_failed";
    public static final String QUERY_BLOCKED = "query_blocked";
    public static final String GROUNDING_CHECKED = "grounding_checked";

    private AuditEventTypes() {
    }
}
