package com.cascade.variable;

import com.cascade.model.IdentityRef;

import java.math.BigDecimal;
import java.util.Map;

/**
 * String coercion of resolved field values.
 */
public final class Values {

    private Values() {
    }

    /**
     * Text form used for comparisons and written values. Identity composites
     * (typed or raw JSON maps) use their unique name; decimals drop trailing
     * zeros, so a JSON 2.0 reads as "2".
     */
    public static String asString(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof IdentityRef identity) {
            return identity.uniqueName();
        }
        if (value instanceof Map<?, ?> map && map.containsKey("uniqueName")) {
            return String.valueOf(map.get("uniqueName"));
        }
        if (value instanceof Double || value instanceof Float || value instanceof BigDecimal) {
            return decimalString((Number) value);
        }
        return String.valueOf(value);
    }

    /**
     * Plain decimal form without trailing zeros: 2.0 is "2", 2.50 is "2.5".
     */
    private static String decimalString(Number number) {
        if (number instanceof BigDecimal decimal) {
            return decimal.stripTrailingZeros().toPlainString();
        }
        double d = number.doubleValue();
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            return String.valueOf(number);
        }
        return new BigDecimal(number.toString()).stripTrailingZeros().toPlainString();
    }
}
