package io.tabula.core.sandbox;

import java.util.Objects;
import net.sf.jsqlparser.statement.select.Select;

public record ValidatedQuery(String sql, Select statement) {
    public ValidatedQuery {
        Objects.requireNonNull(sql, "sql must not be null");
    }
}
