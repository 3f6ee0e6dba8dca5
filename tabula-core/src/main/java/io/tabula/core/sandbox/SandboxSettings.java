package io.tabula.core.sandbox;

import java.time.Duration;

public record SandboxSettings(
    String tableName,
    int maxPreviewRows,
    int maxPreviewChars,
    int maxResultRows,
    Duration queryTimeout,
    int workerThreads
) {
    public SandboxSettings {
        tableName = tableName == null || tableName.isBlank() ? "data" : tableName.trim();
        maxPreviewRows = maxPreviewRows <= 0 ? 50 : maxPreviewRows;
        maxPreviewChars = maxPreviewChars <= 0 ? 4000 : maxPreviewChars;
        maxResultRows = maxResultRows <= 0 ? 100_000 : maxResultRows;
        queryTimeout = queryTimeout == null || queryTimeout.isNegative() || queryTimeout.isZero()
            ? Duration.ofSeconds(30)
            : queryTimeout;
        workerThreads = workerThreads <= 0 ? 4 : workerThreads;
    }

    public static SandboxSettings defaults() {
        return new SandboxSettings("data", 50, 4000, 100_000, Duration.ofSeconds(30), 4);
    }
}
