package io.tabula.core.evaluation;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

public record JudgeVerdict(int relevance, int accuracy, int completeness, String verdict, String feedback) {
    public static final String PASS = "pass";
    public static final String WARN = "warn";
    public static final String RETRY = "retry";
    private static final Set<String> VERDICTS = Set.of(PASS, WARN, RETRY);

    public JudgeVerdict {
        relevance = clamp(relevance);
        accuracy = clamp(accuracy);
        completeness = clamp(completeness);
        String normalized = verdict == null ? "" : verdict.trim().toLowerCase(Locale.ROOT);
        verdict = VERDICTS.contains(normalized) ? normalized : PASS;
        feedback = feedback == null ? "" : feedback;
    }

    public static JudgeVerdict fallback(String feedback) {
        return new JudgeVerdict(5, 5, 5, PASS, feedback);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("relevance", relevance);
        map.put("accuracy", accuracy);
        map.put("completeness", completeness);
        map.put("verdict", verdict);
        map.put("feedback", feedback);
        return map;
    }

    private static int clamp(int score) {
        return Math.max(0, Math.min(10, score));
    }
}
