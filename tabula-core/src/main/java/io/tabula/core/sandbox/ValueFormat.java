package io.tabula.core.sandbox;

import java.math.BigDecimal;

public final class ValueFormat {

    private ValueFormat() {
    }

    public static String format(Object value) {
        if (value == null) {
            return "NULL";
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return String.valueOf(d);
            }
            return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.stripTrailingZeros().toPlainString();
        }
        if (value instanceof byte[] bytes) {
            return "<blob " + bytes.length + " bytes>";
        }
        return String.valueOf(value);
    }
}
