package com.aperture.query.builder;

import java.util.Locale;

public enum FilterOperator {
    EQ("eq", "="),
    NE("ne", "!="),
    GT("gt", ">"),
    GTE("gte", ">="),
    LT("lt", "<"),
    LTE("lte", "<="),
    CONTAINS("contains", null);

    private final String code;
    private final String symbol;

    FilterOperator(String code, String symbol) {
        this.code = code;
        this.symbol = symbol;
    }

    public String getCode() {
        return code;
    }

    /**
     * SQL comparison symbol; {@code null} for operators that are not a plain comparison.
     */
    public String getSymbol() {
        return symbol;
    }

    public boolean isComparison() {
        return symbol != null;
    }

    /**
     * Accepts the dashboard codes ({@code eq}, {@code gte}, ...) and the enum names.
     */
    public static FilterOperator fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Filter operator must not be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (FilterOperator operator : values()) {
            if (operator.code.equals(normalized) || operator.symbol != null && operator.symbol.equals(normalized)) {
                return operator;
            }
        }
        throw new IllegalArgumentException("Unknown filter operator: " + value);
    }
}
