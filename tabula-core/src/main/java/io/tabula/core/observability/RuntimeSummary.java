package io.tabula.core.observability;

public record RuntimeSummary(
    int runsStarted,
    int runsCompleted,
    int runsFailed,
    int toolCalls,
    int toolFailures,
    double querySuccessRate,
    double p50ToolLatencyMs,
    double p95ToolLatencyMs,
    int blockedQueries,
    int groundingChecks,
    double groundingPassRate,
    int auditEvents
) {
}
