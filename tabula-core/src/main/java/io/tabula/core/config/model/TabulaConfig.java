package io.tabula.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TabulaConfig(
    AgentDefaults agent,
    ProvidersConfig providers,
    SandboxConfig sandbox,
    JudgeConfig judge
) {
    public TabulaConfig {
        agent = agent == null ? AgentDefaults.defaults() : agent;
        providers = providers == null ? ProvidersConfig.defaults() : providers;
        sandbox = sandbox == null ? SandboxConfig.defaults() : sandbox;
        judge = judge == null ? JudgeConfig.defaults() : judge;
    }

    public static TabulaConfig defaults() {
        return new TabulaConfig(
            AgentDefaults.defaults(),
            ProvidersConfig.defaults(),
            SandboxConfig.defaults(),
            JudgeConfig.defaults()
        );
    }
}
