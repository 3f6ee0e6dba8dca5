package io.tabula.core.tool;

import io.tabula.core.evaluation.LlmJudge;
import io.tabula.core.evaluation.NumericGroundingEvaluator;
import io.tabula.core.observability.ObservabilityService;
import io.tabula.core.sandbox.QuerySandbox;
import io.tabula.core.tool.impl.EmitPlotTool;
import io.tabula.core.tool.impl.EmitTableTool;
import io.tabula.core.tool.impl.EmitTextTool;
import io.tabula.core.tool.impl.FinalizeTool;
import io.tabula.core.tool.impl.QueryTool;

public final class DefaultToolset {

    private DefaultToolset() {
    }

    public static ToolRegistry create(QuerySandbox sqlSandbox) {
        return create(sqlSandbox, null, null, null, EmitTableTool.DEFAULT_MAX_ROWS);
    }

    /**
     * @param scriptSandbox optional; when null the query tool only accepts SQL
     * @param judge optional per-response judge
     * @param observability optional audit trail
     */
    public static ToolRegistry create(
        QuerySandbox sqlSandbox,
        QuerySandbox scriptSandbox,
        LlmJudge judge,
        ObservabilityService observability,
        int maxTableRows
    ) {
        ToolRegistry registry = new ToolRegistry();
        registry.register(new QueryTool(sqlSandbox, scriptSandbox, observability));
        registry.register(new EmitTextTool(new NumericGroundingEvaluator(), judge, observability));
        registry.register(new EmitTableTool(maxTableRows));
        registry.register(new EmitPlotTool());
        registry.register(new FinalizeTool());
        return registry;
    }
}
