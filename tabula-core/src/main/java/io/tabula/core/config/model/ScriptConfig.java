package io.tabula.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ScriptConfig(
    boolean enabled,
    List<String> command,
    @JsonAlias({"timeout_seconds"}) int timeoutSeconds
) {
    public ScriptConfig {
        command = command == null ? List.of() : List.copyOf(command);
        timeoutSeconds = timeoutSeconds <= 0 ? 30 : timeoutSeconds;
    }

    public static ScriptConfig defaults() {
        return new ScriptConfig(false, List.of("python3", "-m", "tabula_runner"), 30);
    }
}
