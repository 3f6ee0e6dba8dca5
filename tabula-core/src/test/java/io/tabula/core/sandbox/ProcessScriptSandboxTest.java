package io.tabula.core.sandbox;

import static org.assertj.core.api.Assertions.assertThat;

import io.tabula.core.dataset.DatasetSnapshot;
import io.tabula.core.dataset.Table;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

@EnabledOnOs({OS.LINUX, OS.MAC})
class ProcessScriptSandboxTest {
    private final DatasetSnapshot snapshot = new DatasetSnapshot(0, Table.of(
        List.of("a", "b"),
        List.of(List.of(1, 2), List.of(3, 4))
    ));

    @Test
    void shouldParseScalarOutput() {
        ProcessScriptSandbox sandbox = sandboxPrinting("{\"kind\":\"scalar\",\"value\":42}");

        ExecutionResult result = sandbox.execute("result = df['a'].sum()", snapshot);

        assertThat(result.success()).isTrue();
        assertThat(result.kind()).isEqualTo(ResultKind.SCALAR);
        assertThat(result.preview()).isEqualTo("42");
    }

    @Test
    void shouldClassifyTableOutput() {
        ProcessScriptSandbox sandbox = sandboxPrinting(
            "{\"kind\":\"table\",\"columns\":[\"a\",\"b\",\"c\"],\"rows\":[[1,2,3],[3,4,7]]}"
        );

        ExecutionResult result = sandbox.execute("df['c'] = df['a'] + df['b']", snapshot);

        assertThat(result.kind()).isEqualTo(ResultKind.TABLE_TRANSFORM);
        assertThat(result.rowCount()).isEqualTo(2);
    }

    @Test
    void shouldSurfaceScriptError() {
        ProcessScriptSandbox sandbox = sandboxPrinting("{\"error\":\"KeyError: zzz\"}");

        ExecutionResult result = sandbox.execute("df['zzz']", snapshot);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("KeyError: zzz");
    }

    @Test
    void shouldReportFigureThatIsNotAnObjectAsFailure() {
        ProcessScriptSandbox sandbox = sandboxPrinting("{\"kind\":\"figure\",\"figure\":\"oops\"}");

        ExecutionResult result = sandbox.execute("result = 'oops'", snapshot);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).startsWith("Script returned malformed output: ");
    }

    @Test
    void shouldReportRaggedTableAsFailure() {
        ProcessScriptSandbox sandbox = sandboxPrinting("{\"kind\":\"table\",\"columns\":[\"a\",\"b\"],\"rows\":[[1,2],[3]]}");

        ExecutionResult result = sandbox.execute("result = df", snapshot);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).contains("row has 1 cells, expected 2");
    }

    @Test
    void shouldCapLongScriptError() {
        ProcessScriptSandbox sandbox = sandboxPrinting("{\"error\":\"" + "x".repeat(10_000) + "\"}");

        ExecutionResult result = sandbox.execute("df['zzz']", snapshot);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).hasSizeLessThanOrEqualTo(SandboxSettings.defaults().maxPreviewChars())
            .endsWith(PreviewRenderer.TRUNCATED_MARKER);
    }

    @Test
    void shouldRejectBeforeSpawningProcess() {
        ProcessScriptSandbox sandbox = new ProcessScriptSandbox(
            List.of("/bin/sh", "-c", "exit 3"),
            Duration.ofSeconds(5),
            SandboxSettings.defaults()
        );

        ExecutionResult result = sandbox.execute("import os\nos.remove('x')", snapshot);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).contains("not allowed");
    }

    @Test
    void shouldKillProcessOnTimeout() {
        ProcessScriptSandbox sandbox = new ProcessScriptSandbox(
            List.of("/bin/sh", "-c", "sleep 5"),
            Duration.ofSeconds(1),
            SandboxSettings.defaults()
        );

        ExecutionResult result = sandbox.execute("result = 1", snapshot);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("Script timed out after 1s");
    }

    private ProcessScriptSandbox sandboxPrinting(String json) {
        return new ProcessScriptSandbox(
            List.of("/bin/sh", "-c", "printf '%s' '" + json + "'"),
            Duration.ofSeconds(10),
            SandboxSettings.defaults()
        );
    }
}
