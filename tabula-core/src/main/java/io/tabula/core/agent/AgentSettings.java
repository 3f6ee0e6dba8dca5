package io.tabula.core.agent;

public record AgentSettings(
    String provider,
    String model,
    int maxTokens,
    int maxIterations,
    boolean parallelQueries,
    String tableName
) {
    public static final int DEFAULT_MAX_ITERATIONS = 15;

    public AgentSettings {
        provider = provider == null || provider.isBlank() ? "anthropic" : provider;
        model = model == null || model.isBlank() ? "claude-sonnet-4-5" : model;
        maxTokens = maxTokens <= 0 ? 4096 : maxTokens;
        maxIterations = maxIterations <= 0 ? DEFAULT_MAX_ITERATIONS : maxIterations;
        tableName = tableName == null || tableName.isBlank() ? "data" : tableName;
    }

    public static AgentSettings defaults() {
        return new AgentSettings("anthropic", "claude-sonnet-4-5", 4096, DEFAULT_MAX_ITERATIONS, true, "data");
    }

    public AgentSettings withModel(String model) {
        return new AgentSettings(provider, model, maxTokens, maxIterations, parallelQueries, tableName);
    }

    public AgentSettings withMaxIterations(int maxIterations) {
        return new AgentSettings(provider, model, maxTokens, maxIterations, parallelQueries, tableName);
    }
}
