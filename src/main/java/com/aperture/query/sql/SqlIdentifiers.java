package com.aperture.query.sql;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Identifier normalization shared by the validators: quotes are stripped and names compared
 * case-insensitively.
 */
public final class SqlIdentifiers {

    private static final Pattern SIMPLE_IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private SqlIdentifiers() {
    }

    public static String normalize(String identifier) {
        if (identifier == null) {
            return null;
        }
        String value = identifier.trim();
        if (value.length() >= 2) {
            char first = value.charAt(0);
            char last = value.charAt(value.length() - 1);
            if ((first == '"' && last == '"') || (first == '`' && last == '`')) {
                value = value.substring(1, value.length() - 1);
            }
        }
        return value.toLowerCase(Locale.ROOT);
    }

    /**
     * The parser may read bare {@code true}/{@code false} as column names.
     */
    public static boolean isBooleanLiteral(String normalizedName) {
        return "true".equals(normalizedName) || "false".equals(normalizedName);
    }

    public static boolean isSimpleIdentifier(String value) {
        return value != null && SIMPLE_IDENTIFIER.matcher(value).matches();
    }
}
