package io.tabula.cli;

import io.tabula.core.agent.AgentSettings;
import io.tabula.core.agent.TurnOrchestrator;
import io.tabula.core.config.ConfigPaths;
import io.tabula.core.config.model.JudgeConfig;
import io.tabula.core.config.model.ScriptConfig;
import io.tabula.core.config.model.TabulaConfig;
import io.tabula.core.evaluation.LlmJudge;
import io.tabula.core.observability.FileAuditStore;
import io.tabula.core.observability.ObservabilityService;
import io.tabula.core.provider.ProviderRegistry;
import io.tabula.core.sandbox.ProcessScriptSandbox;
import io.tabula.core.sandbox.QuerySandbox;
import io.tabula.core.sandbox.SandboxSettings;
import io.tabula.core.sandbox.SqlQuerySandbox;
import io.tabula.core.session.MessageStore;
import io.tabula.core.session.SqliteMessageStore;
import io.tabula.core.tool.DefaultToolset;
import io.tabula.core.tool.ToolDispatcher;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class AnalysisRuntime implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(AnalysisRuntime.class);

    private final SqlQuerySandbox sqlSandbox;
    private final TurnOrchestrator orchestrator;
    private final MessageStore messageStore;

    private AnalysisRuntime(
        SqlQuerySandbox sqlSandbox,
        TurnOrchestrator orchestrator,
        MessageStore messageStore
    ) {
        this.sqlSandbox = sqlSandbox;
        this.orchestrator = orchestrator;
        this.messageStore = messageStore;
    }

    static Path dataDir(TabulaConfig config) throws IOException {
        Path dataDir = ConfigPaths.resolveDataDir(config.agent().dataDir());
        Files.createDirectories(dataDir);
        return dataDir;
    }

    static MessageStore messageStore(TabulaConfig config) throws IOException {
        return new SqliteMessageStore(dataDir(config).resolve("sessions.db"));
    }

    static ObservabilityService observability(TabulaConfig config) throws IOException {
        return new ObservabilityService(
            new FileAuditStore(dataDir(config).resolve("audit-events.json")),
            Clock.systemUTC()
        );
    }

    static AnalysisRuntime create(TabulaConfig config, AgentSettings settings, ProviderRegistry providers)
        throws IOException {
        SandboxSettings sandboxSettings = config.sandbox().toSettings();
        MessageStore store = messageStore(config);
        ObservabilityService observability = observability(config);

        SqlQuerySandbox sqlSandbox = new SqlQuerySandbox(sandboxSettings);
        QuerySandbox scriptSandbox = null;
        ScriptConfig script = config.sandbox().script();
        if (script.enabled() && !script.command().isEmpty()) {
            scriptSandbox = new ProcessScriptSandbox(
                script.command(),
                Duration.ofSeconds(script.timeoutSeconds()),
                sandboxSettings
            );
            LOG.info("Script sandbox enabled with command {}", script.command());
        }

        LlmJudge judge = null;
        JudgeConfig judgeConfig = config.judge();
        if (judgeConfig.enabled()) {
            judge = new LlmJudge(providers.resolve(judgeConfig.provider()), judgeConfig.model());
        }

        ToolDispatcher dispatcher = new ToolDispatcher(
            DefaultToolset.create(sqlSandbox, scriptSandbox, judge, observability, config.sandbox().maxTableRows()),
            observability
        );
        TurnOrchestrator orchestrator = new TurnOrchestrator(
            providers.resolve(settings.provider()),
            dispatcher,
            settings,
            judge,
            observability
        );
        return new AnalysisRuntime(sqlSandbox, orchestrator, store);
    }

    TurnOrchestrator orchestrator() {
        return orchestrator;
    }

    MessageStore messageStore() {
        return messageStore;
    }

    @Override
    public void close() {
        orchestrator.close();
        sqlSandbox.close();
    }
}
