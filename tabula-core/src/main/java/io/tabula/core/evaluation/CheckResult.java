package io.tabula.core.evaluation;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public record CheckResult(String name, boolean passed, double score, String detail, boolean advisory) {
    public CheckResult {
        Objects.requireNonNull(name, "name must not be null");
        score = Math.max(0.0, Math.min(1.0, score));
        detail = detail == null ? "" : detail;
    }

    public static CheckResult blocking(String name, boolean passed, double score, String detail) {
        return new CheckResult(name, passed, score, detail, false);
    }

    public static CheckResult advisory(String name, boolean passed, double score, String detail) {
        return new CheckResult(name, passed, score, detail, true);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", name);
        map.put("passed", passed);
        map.put("score", Math.round(score * 1000.0) / 1000.0);
        map.put("detail", detail);
        map.put("advisory", advisory);
        return map;
    }
}
