package io.tabula.core.sandbox;

import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class ScriptValidator {
    static final Set<String> ALLOWED_MODULES = Set.of(
        "pandas", "numpy", "math", "statistics", "datetime", "json", "re", "collections", "plotly", "altair"
    );

    private static final List<DenyRule> DENY_RULES = List.of(
        new DenyRule(Pattern.compile("\\bexec\\s*\\("), "exec()"),
        new DenyRule(Pattern.compile("\\beval\\s*\\("), "eval()"),
        new DenyRule(Pattern.compile("\\bcompile\\s*\\("), "compile()"),
        new DenyRule(Pattern.compile("__import__"), "dynamic import"),
        new DenyRule(Pattern.compile("\\bimportlib\\b"), "dynamic import"),
        new DenyRule(Pattern.compile("\\bopen\\s*\\("), "file access"),
        new DenyRule(Pattern.compile("\\bos\\."), "os access"),
        new DenyRule(Pattern.compile("\\bsubprocess\\b"), "process access"),
        new DenyRule(Pattern.compile("\\bsys\\."), "interpreter access"),
        new DenyRule(Pattern.compile("\\bsocket\\b"), "network access"),
        new DenyRule(Pattern.compile("\\bshutil\\b"), "file access"),
        new DenyRule(Pattern.compile("\\bpathlib\\b"), "file access"),
        new DenyRule(Pattern.compile("\\bglobals\\s*\\("), "namespace access"),
        new DenyRule(Pattern.compile("__builtins__|\\bbuiltins\\b"), "builtins access"),
        new DenyRule(Pattern.compile("\\benviron\\b|\\bgetenv\\b"), "environment access")
    );
    private static final Pattern IMPORT = Pattern.compile(
        "^\\s*(?:from\\s+([A-Za-z_][\\w.]*)\\s+import|import\\s+([A-Za-z_][\\w.]*(?:\\s*,\\s*[A-Za-z_][\\w.]*)*))",
        Pattern.MULTILINE
    );

    public String validate(String code) throws QueryRejectedException {
        if (code == null || code.isBlank()) {
            throw new QueryRejectedException("Script is empty");
        }
        for (DenyRule rule : DENY_RULES) {
            if (rule.pattern().matcher(code).find()) {
                throw new QueryRejectedException("Forbidden operation: " + rule.label() + " is not allowed in analysis scripts");
            }
        }
        Matcher imports = IMPORT.matcher(code);
        while (imports.find()) {
            String modules = imports.group(1) != null ? imports.group(1) : imports.group(2);
            for (String module : modules.split(",")) {
                String root = module.trim().split("\\.")[0];
                if (!ALLOWED_MODULES.contains(root)) {
                    throw new QueryRejectedException("Import of '" + root + "' is not allowed; permitted modules: " + ALLOWED_MODULES);
                }
            }
        }
        return code;
    }

    private record DenyRule(Pattern pattern, String label) {
    }
}
