package io.tabula.core.evaluation;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class CodeSafetyEvaluatorTest {
    private final CodeSafetyEvaluator evaluator = new CodeSafetyEvaluator();

    @Test
    void shouldPassReadOnlySql() {
        EvaluationReport report = evaluator.evaluate("SELECT * FROM data WHERE status = 'deleted'", CodeLanguage.SQL);

        assertThat(report.allPassed()).isTrue();
        assertThat(report.checks()).singleElement().extracting(CheckResult::name).isEqualTo("unsafe_code");
    }

    @Test
    void shouldListEveryViolation() {
        EvaluationReport report = evaluator.evaluate("DELETE FROM data; drop table data", CodeLanguage.SQL);

        CheckResult check = report.checks().get(0);
        assertThat(check.passed()).isFalse();
        assertThat(check.advisory()).isFalse();
        assertThat(check.detail()).contains("uses DROP statement", "uses DELETE statement");
    }

    @Test
    void shouldFlagScriptFileAccess() {
        EvaluationReport report = evaluator.evaluate("data = open('secrets.txt').read()", CodeLanguage.SCRIPT);

        assertThat(report.allPassed()).isFalse();
        assertThat(report.checks().get(0).detail()).contains("opens files");
    }
}
