package io.tabula.cli;

import io.tabula.core.config.ConfigService;
import io.tabula.core.provider.ProviderRegistry;
import java.nio.file.Path;

public record CliContext(
    ConfigService configService,
    Path configPath,
    ProviderRegistry providers
) {
}
