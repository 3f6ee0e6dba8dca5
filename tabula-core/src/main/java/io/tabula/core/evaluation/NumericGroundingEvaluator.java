package io.tabula.core.evaluation;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Checks that numbers quoted in prose can be traced to execution previews. The check is advisory:
 * derived figures such as totals and percentages legitimately do not appear verbatim, so a low
 * score is reported and logged but never blocks or contradicts the answer.
 */
public final class NumericGroundingEvaluator {
    static final String NAME = "numeric_grounding";
    private static final Pattern NUMBER = Pattern.compile("(?<![\\w.])(\\d{1,3}(?:,\\d{3})+(?:\\.\\d+)?|\\d+(?:\\.\\d+)?)");
    private static final int MAX_LISTED = 5;

    private final double ordinalCeiling;
    private final double passRatio;

    public NumericGroundingEvaluator() {
        this(20, 0.3);
    }

    public NumericGroundingEvaluator(double ordinalCeiling, double passRatio) {
        this.ordinalCeiling = ordinalCeiling;
        this.passRatio = passRatio;
    }

    public EvaluationReport evaluate(String text, List<String> previews) {
        if (text == null || text.isBlank() || previews == null || previews.isEmpty()) {
            return EvaluationReport.of(CheckResult.advisory(NAME, true, 1.0, "no query result to compare (skipped)"));
        }
        Set<String> numbers = significantNumbers(text);
        if (numbers.isEmpty()) {
            return EvaluationReport.of(CheckResult.advisory(NAME, true, 1.0, "no significant numbers in text"));
        }

        String haystack = String.join("\n", previews);
        int found = 0;
        List<String> unverified = new ArrayList<>();
        for (String number : numbers) {
            if (appears(number, haystack)) {
                found++;
            } else {
                unverified.add(number);
            }
        }

        double score = (double) found / numbers.size();
        String detail = found + "/" + numbers.size() + " numbers verified";
        if (!unverified.isEmpty()) {
            detail += ", unverified: " + String.join(", ", unverified.subList(0, Math.min(MAX_LISTED, unverified.size())));
        }
        return EvaluationReport.of(CheckResult.advisory(NAME, score >= passRatio, score, detail));
    }

    Set<String> significantNumbers(String text) {
        Set<String> numbers = new LinkedHashSet<>();
        Matcher matcher = NUMBER.matcher(text);
        while (matcher.find()) {
            String literal = matcher.group(1);
            double value = Double.parseDouble(literal.replace(",", ""));
            if (literal.contains(".") || value > ordinalCeiling) {
                numbers.add(literal);
            }
        }
        return numbers;
    }

    private boolean appears(String literal, String haystack) {
        if (haystack.contains(literal)) {
            return true;
        }
        String plain = literal.replace(",", "");
        if (haystack.contains(plain)) {
            return true;
        }
        double value = Double.parseDouble(plain);
        for (int decimals = 0; decimals <= 2; decimals++) {
            if (haystack.contains(String.format(Locale.ROOT, "%." + decimals + "f", value))
                || haystack.contains(String.format(Locale.US, "%,." + decimals + "f", value))) {
                return true;
            }
        }
        return false;
    }
}
