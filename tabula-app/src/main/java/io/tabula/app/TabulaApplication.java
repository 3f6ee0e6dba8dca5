package io.tabula.app;

import io.tabula.cli.AnalyzeCommand;
import io.tabula.cli.CliContext;
import io.tabula.cli.HistoryCommand;
import io.tabula.cli.OnboardCommand;
import io.tabula.cli.StatusCommand;
import io.tabula.cli.TabulaCliCommand;
import io.tabula.core.config.ConfigPaths;
import io.tabula.core.config.ConfigService;
import io.tabula.core.config.model.ProviderConfig;
import io.tabula.core.config.model.TabulaConfig;
import io.tabula.core.provider.AnthropicProvider;
import io.tabula.core.provider.DisabledProvider;
import io.tabula.core.provider.LlmProvider;
import io.tabula.core.provider.ProviderRegistry;
import java.io.IOException;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class TabulaApplication {
    private static final Logger LOG = LoggerFactory.getLogger(TabulaApplication.class);
    private static final String ANTHROPIC_BASE = "https://api.anthropic.com/v1/";

    private TabulaApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        Path configPath = ConfigPaths.defaultConfigPath();
        TabulaConfig config = loadConfig(configService, configPath);

        ProviderRegistry providerRegistry = new ProviderRegistry();
        providerRegistry.register(buildAnthropicProvider("anthropic", config.providers().anthropic()));

        CliContext context = new CliContext(configService, configPath, providerRegistry);

        CommandLine commandLine = new CommandLine(new TabulaCliCommand());
        commandLine.addSubcommand("onboard", new OnboardCommand(context));
        commandLine.addSubcommand("analyze", new AnalyzeCommand(context));
        commandLine.addSubcommand("history", new HistoryCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));

        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private static TabulaConfig loadConfig(ConfigService configService, Path configPath) {
        try {
            return configService.load(configPath);
        } catch (IOException | RuntimeException e) {
            LOG.warn("Falling back to default config, {} is unreadable: {}", configPath, e.getMessage());
            return TabulaConfig.defaults();
        }
    }

    private static LlmProvider buildAnthropicProvider(String name, ProviderConfig providerConfig) {
        String envKey = System.getenv("ANTHROPIC_API_KEY");
        String apiKey = providerConfig != null && providerConfig.configured() ? providerConfig.apiKey() : envKey;
        if (apiKey == null || apiKey.isBlank()) {
            return new DisabledProvider(name, "missing API key");
        }
        String apiBase = providerConfig == null || providerConfig.apiBase() == null || providerConfig.apiBase().isBlank()
            ? ANTHROPIC_BASE
            : providerConfig.apiBase();
        return new AnthropicProvider(name, apiKey, apiBase);
    }
}
