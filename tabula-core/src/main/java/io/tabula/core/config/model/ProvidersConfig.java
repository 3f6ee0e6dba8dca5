package io.tabula.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ProvidersConfig(ProviderConfig anthropic) {

    public ProvidersConfig {
        anthropic = anthropic == null ? ProviderConfig.defaults() : anthropic;
    }

    public static ProvidersConfig defaults() {
        return new ProvidersConfig(ProviderConfig.defaults());
    }
}
