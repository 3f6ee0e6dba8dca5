package io.tabula.cli;

import io.tabula.core.agent.AgentSettings;
import io.tabula.core.agent.FinishReason;
import io.tabula.core.agent.RunHandle;
import io.tabula.core.agent.RunSummary;
import io.tabula.core.agent.TurnContext;
import io.tabula.core.config.model.TabulaConfig;
import io.tabula.core.dataset.DatasetHandle;
import io.tabula.core.dataset.SqliteDatasetLoader;
import io.tabula.core.dataset.Table;
import io.tabula.core.model.ChatMessage;
import io.tabula.core.session.ConversationReplay;
import java.nio.file.Path;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "analyze", description = "Ask a question about a table in a SQLite database")
public final class AnalyzeCommand implements Callable<Integer> {
    private static final Logger LOG = LoggerFactory.getLogger(AnalyzeCommand.class);

    private final CliContext context;

    @Parameters(index = "0", arity = "0..1", description = "Question to ask; omit for an initial overview")
    String question;

    @Option(names = "--db", required = true, description = "SQLite database holding the dataset")
    Path database;

    @Option(names = {"-t", "--table"}, defaultValue = "data", description = "Source table to load (default: ${DEFAULT-VALUE})")
    String table;

    @Option(names = {"-s", "--session"}, description = "Session id; reuses its history when it exists")
    String session;

    @Option(names = "--initial", description = "Run the initial-analysis prompt")
    boolean initial;

    @Option(names = {"-m", "--model"}, description = "Model override")
    String model;

    @Option(names = {"-p", "--provider"}, description = "Provider override")
    String provider;

    @Option(names = "--max-iterations", description = "Iteration ceiling override")
    Integer maxIterations;

    @Option(names = "--json", description = "Print every event as a JSON line")
    boolean json;

    public AnalyzeCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            TabulaConfig config = context.configService().load(context.configPath());
            AgentSettings settings = new AgentSettings(
                provider != null ? provider : config.agent().provider(),
                model != null ? model : config.agent().model(),
                config.agent().maxTokens(),
                maxIterations != null ? maxIterations : config.agent().maxIterations(),
                config.agent().parallelQueries(),
                config.sandbox().tableName()
            );

            Table loaded = new SqliteDatasetLoader(config.sandbox().maxDatasetRows()).load(database, table);
            LOG.info("Loaded {} rows from {}.{}", loaded.rowCount(), database, table);

            try (AnalysisRuntime runtime = AnalysisRuntime.create(config, settings, context.providers())) {
                String sessionId = session == null || session.isBlank() ? UUID.randomUUID().toString() : session;
                List<ChatMessage> history = new ConversationReplay().replay(runtime.messageStore().list(sessionId));
                String prompt = question == null ? "" : question;
                TurnContext turnContext = new TurnContext(
                    history,
                    initial || (prompt.isBlank() && history.isEmpty()),
                    runtime.messageStore().hook(sessionId)
                );

                RunHandle handle = runtime.orchestrator().start(
                    prompt,
                    new DatasetHandle(loaded),
                    turnContext,
                    new ConsoleEventPrinter(System.out, System.err, json)
                );
                RunSummary summary = awaitWithInterruptHook(handle);
                System.err.println("Session: " + sessionId);
                return summary.finishReason() == FinishReason.ERROR ? 1 : 0;
            }
        } catch (Exception e) {
            System.err.println("Analyze command failed: " + e.getMessage());
            return 1;
        }
    }

    private RunSummary awaitWithInterruptHook(RunHandle handle) throws InterruptedException {
        Thread hook = new Thread(handle::cancel, "tabula-cancel");
        Runtime.getRuntime().addShutdownHook(hook);
        try {
            return handle.await();
        } finally {
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException e) {
                LOG.debug("JVM already shutting down, cancel hook stays registered");
            }
        }
    }
}
