package io.tabula.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentDefaults(
    String provider,
    String model,
    @JsonAlias({"max_tokens"}) int maxTokens,
    @JsonAlias({"max_iterations"}) int maxIterations,
    @JsonAlias({"parallel_queries"}) boolean parallelQueries,
    @JsonAlias({"data_dir"}) String dataDir
) {

    public static AgentDefaults defaults() {
        return new AgentDefaults(
            "anthropic",
            "claude-sonnet-4-5",
            4096,
            15,
            true,
            "~/.tabula/data"
        );
    }
}
