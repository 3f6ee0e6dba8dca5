package io.tabula.core.evaluation;

import io.tabula.core.dataset.Table;
import io.tabula.core.sandbox.ExecutionResult;
import io.tabula.core.sandbox.ResultKind;

public final class ResultValidityEvaluator {
    static final String NAME = EvaluationReport.VALID_ANSWER;
    private static final double PASS_THRESHOLD = 0.5;

    public EvaluationReport evaluate(ExecutionResult result, String intent) {
        if (!result.success()) {
            return report(0.0, "query failed with error");
        }
        if (result.kind() == ResultKind.NONE) {
            return report(0.2, "no result returned" + forIntent(intent));
        }
        if (result.kind() == ResultKind.SCALAR) {
            Object value = result.value();
            if (value == null) {
                return report(0.3, "result is null");
            }
            if (value instanceof Double d && d.isNaN()) {
                return report(0.3, "result is NaN");
            }
            return report(1.0, "value=" + value);
        }
        if (result.kind() == ResultKind.FIGURE) {
            return report(1.0, "figure produced");
        }

        Table table = result.table().orElse(Table.empty());
        if (table.rowCount() == 0) {
            return report(0.2, "result has 0 rows" + forIntent(intent));
        }
        String shape = table.rowCount() + " rows x " + table.columnCount() + " cols";
        if (table.allNull()) {
            return report(0.3, shape + ", all values are null");
        }
        double cells = (double) table.rowCount() * Math.max(1, table.columnCount());
        double nonNullRatio = table.nonNullCells() / cells;
        double score = 0.5 + 0.5 * nonNullRatio;
        return report(score, shape + ", " + Math.round(nonNullRatio * 100) + "% non-null");
    }

    private EvaluationReport report(double score, String detail) {
        return EvaluationReport.of(CheckResult.blocking(NAME, score >= PASS_THRESHOLD, score, detail));
    }

    private String forIntent(String intent) {
        return intent == null || intent.isBlank() ? "" : " for '" + intent.strip() + "'";
    }
}
