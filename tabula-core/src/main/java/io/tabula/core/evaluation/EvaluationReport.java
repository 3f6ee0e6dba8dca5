package io.tabula.core.evaluation;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public record EvaluationReport(List<CheckResult> checks) {
    static final String VALID_ANSWER = "valid_answer";

    public EvaluationReport {
        checks = checks == null ? List.of() : List.copyOf(checks);
    }

    public static EvaluationReport of(CheckResult... checks) {
        return new EvaluationReport(List.of(checks));
    }

    public EvaluationReport merge(EvaluationReport other) {
        List<CheckResult> merged = new ArrayList<>(checks);
        merged.addAll(other.checks());
        return new EvaluationReport(merged);
    }

    public boolean allPassed() {
        return checks.stream().allMatch(CheckResult::passed);
    }

    /**
     * True when a non-advisory check failed in a way a different query could fix.
     */
    public boolean shouldRetry() {
        return checks.stream().anyMatch(check -> !check.passed() && !check.advisory() && VALID_ANSWER.equals(check.name()));
    }

    public String toFeedback() {
        if (checks.isEmpty()) {
            return "";
        }
        StringBuilder out = new StringBuilder("QUALITY METRICS:");
        for (CheckResult check : checks) {
            out.append("\n  - ").append(check.name());
            if (check.advisory()) {
                out.append(" (advisory): ").append(check.detail());
            } else {
                out.append(": ").append(check.passed() ? "PASS" : "FAIL").append(" (").append(check.detail()).append(')');
            }
        }
        if (shouldRetry()) {
            out.append("\n  >> RECOMMENDATION: Retry with a different approach.");
        }
        return out.toString();
    }

    public List<Map<String, Object>> toMaps() {
        return checks.stream().map(CheckResult::toMap).toList();
    }
}
