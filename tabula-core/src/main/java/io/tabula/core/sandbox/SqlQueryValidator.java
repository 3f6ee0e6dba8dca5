package io.tabula.core.sandbox;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.select.Select;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class SqlQueryValidator {
    private static final Logger LOG = LoggerFactory.getLogger(SqlQueryValidator.class);

    static final List<String> FORBIDDEN_KEYWORDS = List.of(
        "DROP", "DELETE", "INSERT", "UPDATE", "ALTER", "CREATE", "TRUNCATE", "COPY", "GRANT", "REVOKE",
        "ATTACH", "DETACH", "PRAGMA", "LOAD", "LOAD_EXTENSION", "INSTALL", "MERGE", "VACUUM", "REINDEX"
    );
    private static final Set<String> ENTRY_KEYWORDS = Set.of("SELECT", "WITH");
    private static final Pattern FORBIDDEN = Pattern.compile(
        "\\b(" + String.join("|", FORBIDDEN_KEYWORDS) + ")\\b",
        Pattern.CASE_INSENSITIVE
    );
    private static final Pattern LEADING_KEYWORD = Pattern.compile("^[\\s(]*([A-Za-z_]+)");

    public ValidatedQuery validate(String sql) throws QueryRejectedException {
        if (sql == null || sql.isBlank()) {
            throw new QueryRejectedException("Query is empty");
        }
        String masked = SqlText.mask(sql);
        if (masked.isBlank()) {
            throw new QueryRejectedException("Query is empty");
        }

        int separator = masked.indexOf(';');
        if (separator >= 0) {
            if (!masked.substring(separator).replace(';', ' ').isBlank()) {
                throw new QueryRejectedException("Multiple statements are not allowed; send one SELECT query per call");
            }
            sql = sql.substring(0, separator);
            masked = masked.substring(0, separator);
        }

        Matcher forbidden = FORBIDDEN.matcher(masked);
        if (forbidden.find()) {
            String keyword = forbidden.group(1).toUpperCase(Locale.ROOT);
            throw new QueryRejectedException("Forbidden keyword '" + keyword + "': only read-only SELECT queries are allowed");
        }

        Matcher leading = LEADING_KEYWORD.matcher(masked);
        if (!leading.find() || !ENTRY_KEYWORDS.contains(leading.group(1).toUpperCase(Locale.ROOT))) {
            throw new QueryRejectedException("Query must start with SELECT or WITH");
        }

        String query = sql.strip();
        try {
            Statement statement = CCJSqlParserUtil.parse(query);
            if (!(statement instanceof Select select)) {
                throw new QueryRejectedException("Only SELECT statements are allowed, got " + statement.getClass().getSimpleName());
            }
            return new ValidatedQuery(query, select);
        } catch (JSQLParserException e) {
            LOG.debug("SQL parser could not handle query, deferring to the engine: {}", e.getMessage());
            return new ValidatedQuery(query, null);
        }
    }
}
