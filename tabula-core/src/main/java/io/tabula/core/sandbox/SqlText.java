package io.tabula.core.sandbox;

final class SqlText {

    private SqlText() {
    }

    /**
     * Returns {@code sql} with comments and the contents of quoted literals replaced by spaces.
     * Quote characters are kept and every character keeps its index, so positions found in the
     * masked text are valid in the original.
     */
    static String mask(String sql) {
        int n = sql.length();
        StringBuilder out = new StringBuilder(n);
        int i = 0;
        while (i < n) {
            char c = sql.charAt(i);
            char next = i + 1 < n ? sql.charAt(i + 1) : '\0';
            if (c == '-' && next == '-') {
                int end = sql.indexOf('\n', i);
                end = end < 0 ? n : end;
                blank(out, end - i);
                i = end;
            } else if (c == '/' && next == '*') {
                int end = sql.indexOf("*/", i + 2);
                end = end < 0 ? n : end + 2;
                blank(out, end - i);
                i = end;
            } else if (c == '\'' || c == '"' || c == '`' || c == '[') {
                int end = closingQuote(sql, i, c == '[' ? ']' : c);
                out.append(c);
                if (end < n) {
                    blank(out, end - i - 1);
                    out.append(sql.charAt(end));
                    i = end + 1;
                } else {
                    blank(out, n - i - 1);
                    i = n;
                }
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }

    private static int closingQuote(String sql, int open, char close) {
        int i = open + 1;
        while (i < sql.length()) {
            if (sql.charAt(i) == close) {
                // doubled quote is an escaped quote inside the literal
                if (close != ']' && i + 1 < sql.length() && sql.charAt(i + 1) == close) {
                    i += 2;
                    continue;
                }
                return i;
            }
            i++;
        }
        return sql.length();
    }

    private static void blank(StringBuilder out, int count) {
        for (int k = 0; k < count; k++) {
            out.append(' ');
        }
    }
}
