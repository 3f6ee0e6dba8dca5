package io.tabula.cli;

import io.tabula.core.config.ConfigPaths;
import io.tabula.core.config.model.TabulaConfig;
import io.tabula.core.observability.RuntimeSummary;
import java.nio.file.Files;
import java.util.Locale;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show configuration and runtime status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            TabulaConfig config = context.configService().load(context.configPath());
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Data dir: " + ConfigPaths.resolveDataDir(config.agent().dataDir()));
            System.out.println("Default provider: " + config.agent().provider());
            System.out.println("Default model: " + config.agent().model());
            System.out.println("Max iterations: " + config.agent().maxIterations());
            System.out.println("Anthropic configured: " + config.providers().anthropic().configured());
            System.out.println("Script sandbox enabled: " + config.sandbox().script().enabled());
            System.out.println("Judge enabled: " + config.judge().enabled());

            RuntimeSummary summary = AnalysisRuntime.observability(config).summary();
            System.out.println("Runs: " + summary.runsStarted() + " started, " + summary.runsCompleted()
                + " completed, " + summary.runsFailed() + " failed");
            System.out.println("Tool calls: " + summary.toolCalls() + " (" + summary.toolFailures() + " failed)");
            System.out.println("Query success rate: " + percent(summary.querySuccessRate()));
            System.out.println("Tool latency p50/p95: " + Math.round(summary.p50ToolLatencyMs()) + "ms / "
                + Math.round(summary.p95ToolLatencyMs()) + "ms");
            System.out.println("Blocked queries: " + summary.blockedQueries());
            System.out.println("Grounding pass rate: " + percent(summary.groundingPassRate())
                + " of " + summary.groundingChecks() + " checks");
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }

    private static String percent(double value) {
        return String.format(Locale.ROOT, "%.0f%%", value);
    }
}
