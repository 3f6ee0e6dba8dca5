package io.tabula.core.tool.impl;

import io.tabula.core.event.AgentEvent;
import io.tabula.core.event.EventType;
import io.tabula.core.model.ToolInvocation;
import io.tabula.core.model.ToolResult;
import io.tabula.core.tool.FinalizeArguments;
import io.tabula.core.tool.Tool;
import io.tabula.core.tool.ToolContext;
import io.tabula.core.tool.ToolName;
import java.util.LinkedHashMap;
import java.util.Map;

public final class FinalizeTool implements Tool {

    @Override
    public String name() {
        return ToolName.FINALIZE.wireName();
    }

    @Override
    public String description() {
        return "End the turn once the question is fully answered. Optionally name the session and suggest follow-up questions.";
    }

    @Override
    public Map<String, Object> schema() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("session_title", Map.of("type", "string", "description", "Short descriptive title, only for a new session"));
        properties.put("suggestions", Map.of("type", "array", "items", Map.of("type", "string")));
        return Map.of("type", "object", "properties", properties);
    }

    @Override
    public ToolResult execute(ToolInvocation invocation, ToolContext context) {
        FinalizeArguments args = FinalizeArguments.from(invocation.arguments());
        context.state().finish(args.sessionTitle(), args.suggestions());
        if (args.sessionTitle() != null) {
            context.events().emit(AgentEvent.of(EventType.SESSION_UPDATE, Map.of("session_title", args.sessionTitle())));
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("session_title", args.sessionTitle());
        payload.put("suggestions", args.suggestions());
        return ToolResult.success(invocation, "Turn finalized.")
            .withRecord(args.sessionTitle() == null ? "" : args.sessionTitle(), payload);
    }
}
