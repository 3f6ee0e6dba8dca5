package io.tabula.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ProviderConfig(
    @JsonAlias({"api_key"}) String apiKey,
    @JsonAlias({"api_base"}) String apiBase
) {

    public static ProviderConfig defaults() {
        return new ProviderConfig("", "https://api.anthropic.com/v1/");
    }

    public boolean configured() {
        return apiKey != null && !apiKey.isBlank();
    }
}
