package io.tabula.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.tabula.core.sandbox.SandboxSettings;
import java.time.Duration;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SandboxConfig(
    @JsonAlias({"table_name"}) String tableName,
    @JsonAlias({"max_preview_rows"}) int maxPreviewRows,
    @JsonAlias({"max_preview_chars"}) int maxPreviewChars,
    @JsonAlias({"max_result_rows"}) int maxResultRows,
    @JsonAlias({"max_dataset_rows"}) int maxDatasetRows,
    @JsonAlias({"max_table_rows"}) int maxTableRows,
    @JsonAlias({"query_timeout_seconds"}) int queryTimeoutSeconds,
    @JsonAlias({"worker_threads"}) int workerThreads,
    ScriptConfig script
) {
    public SandboxConfig {
        script = script == null ? ScriptConfig.defaults() : script;
    }

    public static SandboxConfig defaults() {
        return new SandboxConfig("data", 50, 4000, 100_000, 1_000_000, 200, 30, 4, ScriptConfig.defaults());
    }

    public SandboxSettings toSettings() {
        return new SandboxSettings(
            tableName,
            maxPreviewRows,
            maxPreviewChars,
            maxResultRows,
            Duration.ofSeconds(queryTimeoutSeconds),
            workerThreads
        );
    }
}
