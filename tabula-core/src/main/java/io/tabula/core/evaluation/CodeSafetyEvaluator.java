package io.tabula.core.evaluation;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

public final class CodeSafetyEvaluator {
    static final String NAME = "unsafe_code";

    private static final Pattern SQL_NOISE = Pattern.compile(
        "'(?:[^']|'')*'|\"(?:[^\"]|\"\")*\"|--[^\\n]*|/\\*.*?\\*/",
        Pattern.DOTALL
    );
    private static final List<Rule> SQL_RULES = List.of(
        sql("DROP"), sql("DELETE"), sql("INSERT"), sql("UPDATE"), sql("ALTER"), sql("CREATE"),
        sql("TRUNCATE"), sql("GRANT"), sql("REVOKE"), sql("COPY"), sql("MERGE"), sql("ATTACH"),
        sql("DETACH"), sql("PRAGMA"), sql("LOAD_EXTENSION")
    );
    private static final List<Rule> SCRIPT_RULES = List.of(
        new Rule(Pattern.compile("\\bexec\\s*\\("), "calls exec"),
        new Rule(Pattern.compile("\\beval\\s*\\("), "calls eval"),
        new Rule(Pattern.compile("__import__|\\bimportlib\\b"), "uses dynamic import"),
        new Rule(Pattern.compile("\\bopen\\s*\\("), "opens files"),
        new Rule(Pattern.compile("\\bos\\.|\\bshutil\\b|\\bpathlib\\b"), "touches the filesystem"),
        new Rule(Pattern.compile("\\bsubprocess\\b|\\bsocket\\b"), "spawns processes or sockets"),
        new Rule(Pattern.compile("\\bsys\\.|\\benviron\\b|\\bgetenv\\b"), "reads interpreter or environment state")
    );

    public EvaluationReport evaluate(String code, CodeLanguage language) {
        String source = code == null ? "" : code;
        List<Rule> rules = language == CodeLanguage.SCRIPT ? SCRIPT_RULES : SQL_RULES;
        String scanned = language == CodeLanguage.SCRIPT ? source : SQL_NOISE.matcher(source).replaceAll(" ");

        List<String> violations = new ArrayList<>();
        for (Rule rule : rules) {
            if (rule.pattern().matcher(scanned).find()) {
                violations.add(rule.description());
            }
        }
        if (violations.isEmpty()) {
            return EvaluationReport.of(CheckResult.blocking(NAME, true, 1.0, "no forbidden patterns detected"));
        }
        return EvaluationReport.of(CheckResult.blocking(NAME, false, 0.0, "violations: " + String.join(", ", violations)));
    }

    private static Rule sql(String keyword) {
        return new Rule(Pattern.compile("\\b" + keyword + "\\b", Pattern.CASE_INSENSITIVE), "uses " + keyword + " statement");
    }

    private record Rule(Pattern pattern, String description) {
    }
}
