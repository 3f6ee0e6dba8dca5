package io.tabula.core.sandbox;

import io.tabula.core.dataset.Table;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import net.sf.jsqlparser.expression.Alias;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.schema.Column;
import net.sf.jsqlparser.statement.select.PlainSelect;
import net.sf.jsqlparser.statement.select.SelectItem;

/**
 * Decides whether a tabular result is a read-only view or a transform of the canonical dataset.
 * A transform keeps every original column, has a comparable row count and either adds columns or
 * redefines an original column with an expression.
 */
public final class ResultClassifier {
    private static final double MIN_ROW_RATIO = 0.5;
    private static final double MAX_ROW_RATIO = 1.5;

    public ResultKind classify(Table result, Table original, ValidatedQuery query) {
        if (result.columnCount() == 0) {
            return ResultKind.NONE;
        }
        if (result.rowCount() == 1 && result.columnCount() == 1) {
            return ResultKind.SCALAR;
        }
        Set<String> resultNames = normalizedNames(result.columnNames());
        if (resultNames.size() != result.columnCount()) {
            // duplicate labels cannot become a canonical table
            return ResultKind.TABLE;
        }
        if (!resultNames.containsAll(normalizedNames(original.columnNames()))) {
            return ResultKind.TABLE;
        }
        if (!comparableRowCount(result.rowCount(), original.rowCount())) {
            return ResultKind.TABLE;
        }
        boolean addsColumns = result.columnCount() > original.columnCount();
        if (addsColumns || redefinesOriginalColumn(query, original)) {
            return ResultKind.TABLE_TRANSFORM;
        }
        return ResultKind.TABLE;
    }

    boolean comparableRowCount(int resultRows, int originalRows) {
        if (originalRows == 0) {
            return resultRows == 0;
        }
        return resultRows >= originalRows * MIN_ROW_RATIO && resultRows <= originalRows * MAX_ROW_RATIO;
    }

    private boolean redefinesOriginalColumn(ValidatedQuery query, Table original) {
        if (query == null || !(query.statement() instanceof PlainSelect plain) || plain.getSelectItems() == null) {
            return false;
        }
        Set<String> originalNames = normalizedNames(original.columnNames());
        for (SelectItem<?> item : plain.getSelectItems()) {
            Alias alias = item.getAlias();
            if (alias == null) {
                continue;
            }
            String name = normalize(alias.getName());
            if (!originalNames.contains(name)) {
                continue;
            }
            Expression expression = item.getExpression();
            if (expression instanceof Column column && normalize(column.getColumnName()).equals(name)) {
                continue;
            }
            return true;
        }
        return false;
    }

    private Set<String> normalizedNames(List<String> names) {
        Set<String> normalized = new HashSet<>();
        for (String name : names) {
            normalized.add(normalize(name));
        }
        return normalized;
    }

    private String normalize(String identifier) {
        String value = identifier == null ? "" : identifier.trim();
        if (value.length() >= 2) {
            char first = value.charAt(0);
            char last = value.charAt(value.length() - 1);
            if ((first == '"' && last == '"') || (first == '`' && last == '`') || (first == '[' && last == ']')) {
                value = value.substring(1, value.length() - 1);
            }
        }
        return value.toLowerCase(Locale.ROOT);
    }
}
