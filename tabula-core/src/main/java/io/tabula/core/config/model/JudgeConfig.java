package io.tabula.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record JudgeConfig(boolean enabled, String provider, String model) {

    public static JudgeConfig defaults() {
        return new JudgeConfig(false, "anthropic", "claude-haiku-4-5");
    }
}
