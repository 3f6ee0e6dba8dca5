package io.tabula.core.evaluation;

import static org.assertj.core.api.Assertions.assertThat;

import io.tabula.core.dataset.Table;
import io.tabula.core.sandbox.ExecutionResult;
import io.tabula.core.sandbox.ResultKind;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class ResultValidityEvaluatorTest {
    private final ResultValidityEvaluator evaluator = new ResultValidityEvaluator();

    @Test
    void shouldFailOnExecutionError() {
        CheckResult check = evaluator.evaluate(ExecutionResult.failure("no such column"), "avg").checks().get(0);

        assertThat(check.passed()).isFalse();
        assertThat(check.score()).isZero();
    }

    @Test
    void shouldRecommendRetryForEmptyResult() {
        Table empty = Table.of(List.of("a"), List.of());
        EvaluationReport report = evaluator.evaluate(ExecutionResult.table(ResultKind.TABLE, empty, ""), "top customers");

        assertThat(report.checks().get(0).score()).isEqualTo(0.2);
        assertThat(report.shouldRetry()).isTrue();
        assertThat(report.toFeedback())
            .contains("valid_answer: FAIL (result has 0 rows for 'top customers')")
            .contains("RECOMMENDATION: Retry with a different approach.");
    }

    @Test
    void shouldScoreNoneKindAsEmpty() {
        assertThat(evaluator.evaluate(ExecutionResult.none(), null).checks().get(0).score()).isEqualTo(0.2);
    }

    @Test
    void shouldPenalizeNullScalar() {
        CheckResult check = evaluator.evaluate(ExecutionResult.scalar(null, "NULL"), "").checks().get(0);

        assertThat(check.score()).isEqualTo(0.3);
        assertThat(check.passed()).isFalse();
    }

    @Test
    void shouldScaleWithNonNullRatio() {
        Table table = Table.of(List.of("a", "b"), List.of(Arrays.asList(1, null), Arrays.asList(2, 3)));

        CheckResult check = evaluator.evaluate(ExecutionResult.table(ResultKind.TABLE, table, ""), "").checks().get(0);

        assertThat(check.score()).isEqualTo(0.875);
        assertThat(check.passed()).isTrue();
        assertThat(check.detail()).isEqualTo("2 rows x 2 cols, 75% non-null");
    }
}
