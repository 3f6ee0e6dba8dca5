package io.tabula.core.tool;

import io.tabula.core.model.MessageRole;
import io.tabula.core.model.ToolInvocation;
import io.tabula.core.model.ToolResult;
import io.tabula.core.observability.AuditEventTypes;
import io.tabula.core.observability.ObservabilityService;
import io.tabula.core.session.MessageTypes;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ToolDispatcher {
    private static final Logger LOG = LoggerFactory.getLogger(ToolDispatcher.class);

    private final ToolRegistry registry;
    private final ObservabilityService observability;

    public ToolDispatcher(ToolRegistry registry) {
        this(registry, null);
    }

    public ToolDispatcher(ToolRegistry registry, ObservabilityService observability) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.observability = observability;
    }

    public ToolRegistry registry() {
        return registry;
    }

    public ToolResult dispatch(ToolInvocation invocation, ToolContext context) {
        Optional<Tool> tool = registry.find(invocation.name());
        if (tool.isEmpty()) {
            LOG.warn("Model requested unknown tool {}", invocation.name());
            return ToolResult.failure(
                invocation,
                "Unknown tool: " + invocation.name() + ". Available tools: " + String.join(", ", registry.names())
            );
        }

        long started = System.currentTimeMillis();
        audit(AuditEventTypes.TOOL_STARTED, invocation, started, null);
        ToolResult result;
        try {
            result = tool.get().execute(invocation, context);
        } catch (ToolArgumentException e) {
            LOG.warn("Invalid arguments for tool {}: {}", invocation.name(), e.getMessage());
            result = ToolResult.failure(invocation, "Invalid arguments for " + invocation.name() + ": " + e.getMessage());
        } catch (RuntimeException e) {
            LOG.warn("Tool {} failed", invocation.name(), e);
            String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            result = ToolResult.failure(invocation, "Error executing tool '" + invocation.name() + "': " + message);
        }

        audit(
            result.error() ? AuditEventTypes.TOOL_FAILED : AuditEventTypes.TOOL_SUCCEEDED,
            invocation,
            started,
            result.error() ? firstLine(result.content()) : null
        );
        persist(result, context);
        return result;
    }

    private void persist(ToolResult result, ToolContext context) {
        Optional<ToolName> tool = ToolName.fromWireName(result.toolName());
        if (tool.isEmpty() || (result.error() && tool.get() != ToolName.QUERY)) {
            return;
        }
        String type = switch (tool.get()) {
            case QUERY -> MessageTypes.QUERY_RESULT;
            case EMIT_TEXT -> MessageTypes.TEXT;
            case EMIT_TABLE -> MessageTypes.TABLE;
            case EMIT_PLOT -> MessageTypes.PLOT;
            case FINALIZE -> MessageTypes.FINALIZE;
        };
        String text = result.recordText().isBlank() ? result.content() : result.recordText();
        Map<String, Object> payload = new LinkedHashMap<>(result.recordPayload());
        if (result.error()) {
            payload.put("error", true);
        }
        try {
            context.persistence().save(MessageRole.ASSISTANT, text, type, payload);
        } catch (RuntimeException e) {
            LOG.warn("Persistence hook failed for {} result: {}", type, e.getMessage());
        }
    }

    private void audit(String type, ToolInvocation invocation, long startedAtMillis, String error) {
        if (observability == null) {
            return;
        }
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("tool_name", invocation.name());
        attrs.put("invocation_id", invocation.id());
        attrs.put("duration_ms", Math.max(0, System.currentTimeMillis() - startedAtMillis));
        if (error != null && !error.isBlank()) {
            attrs.put("error", error);
        }
        observability.recordQuietly(type, attrs);
    }

    private String firstLine(String content) {
        int newline = content.indexOf('\n');
        return newline < 0 ? content : content.substring(0, newline);
    }
}
