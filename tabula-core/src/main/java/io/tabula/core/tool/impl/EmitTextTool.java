package io.tabula.core.tool.impl;

import io.tabula.core.evaluation.EvaluationReport;
import io.tabula.core.evaluation.JudgeVerdict;
import io.tabula.core.evaluation.LlmJudge;
import io.tabula.core.evaluation.NumericGroundingEvaluator;
import io.tabula.core.event.AgentEvent;
import io.tabula.core.event.EventType;
import io.tabula.core.model.ToolInvocation;
import io.tabula.core.model.ToolResult;
import io.tabula.core.observability.AuditEventTypes;
import io.tabula.core.observability.ObservabilityService;
import io.tabula.core.tool.EmitTextArguments;
import io.tabula.core.tool.Tool;
import io.tabula.core.tool.ToolContext;
import io.tabula.core.tool.ToolName;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class EmitTextTool implements Tool {
    private static final Logger LOG = LoggerFactory.getLogger(EmitTextTool.class);

    private final NumericGroundingEvaluator grounding;
    private final LlmJudge judge;
    private final ObservabilityService observability;

    public EmitTextTool() {
        this(new NumericGroundingEvaluator(), null, null);
    }

    public EmitTextTool(NumericGroundingEvaluator grounding, LlmJudge judge, ObservabilityService observability) {
        this.grounding = grounding == null ? new NumericGroundingEvaluator() : grounding;
        this.judge = judge;
        this.observability = observability;
    }

    @Override
    public String name() {
        return ToolName.EMIT_TEXT.wireName();
    }

    @Override
    public String description() {
        return "Send markdown prose to the user: findings, explanations, interpretation. "
            + "Quote numbers exactly as they appear in query results.";
    }

    @Override
    public Map<String, Object> schema() {
        return Map.of(
            "type", "object",
            "properties", Map.of("text", Map.of("type", "string", "description", "Markdown text shown to the user")),
            "required", List.of("text")
        );
    }

    @Override
    public ToolResult execute(ToolInvocation invocation, ToolContext context) {
        EmitTextArguments args = EmitTextArguments.from(invocation.arguments());
        context.state().recordText(args.text());
        context.events().emit(AgentEvent.text(args.text()));

        List<String> previews = context.state().previews();
        EvaluationReport report = grounding.evaluate(args.text(), previews);
        context.state().addChecks(report);
        boolean passed = report.allPassed();
        LOG.info("Grounding check: {}", report.checks().get(0).detail());
        context.events().emit(AgentEvent.of(EventType.JUDGE, judgeEvent("grounding", "checks", report.toMaps())));
        if (observability != null) {
            observability.recordQuietly(AuditEventTypes.GROUNDING_CHECKED, Map.of(
                "passed", passed,
                "score", report.checks().get(0).score()
            ));
        }

        if (judge != null && !previews.isEmpty()) {
            JudgeVerdict verdict = judge.evaluateResponse(context.state().userMessage(), previews, args.text());
            context.events().emit(AgentEvent.of(EventType.JUDGE, judgeEvent("llm_judge", "verdict", verdict.toMap())));
        }

        String content = "Text sent to user.";
        if (!previews.isEmpty()) {
            content += "\n\n" + report.toFeedback();
        }
        return ToolResult.success(invocation, content).withRecord(args.text(), Map.of());
    }

    private Map<String, Object> judgeEvent(String source, String key, Object value) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("source", source);
        data.put(key, value);
        return data;
    }
}
