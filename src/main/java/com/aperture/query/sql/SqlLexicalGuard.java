package com.aperture.query.sql;

import com.aperture.query.ErrorKind;
import com.aperture.query.QueryValidationException;

/**
 * Character-level checks that run before parsing: comments and statement separators are
 * found outside string literals and quoted identifiers.
 */
final class SqlLexicalGuard {

    private SqlLexicalGuard() {
    }

    /**
     * @return the text with a single trailing statement terminator removed
     * @throws QueryValidationException if the text contains a comment or more than one statement
     */
    static String check(String sql) {
        int length = sql.length();
        char quote = 0;
        for (int i = 0; i < length; i++) {
            char c = sql.charAt(i);
            if (quote != 0) {
                if (c == '\\' && quote == '\'') {
                    i++;
                } else if (c == quote) {
                    if (i + 1 < length && sql.charAt(i + 1) == quote) {
                        i++;
                    } else {
                        quote = 0;
                    }
                }
                continue;
            }
            char next = i + 1 < length ? sql.charAt(i + 1) : 0;
            if (c == '\'' || c == '"' || c == '`') {
                quote = c;
            } else if ((c == '-' && next == '-') || (c == '/' && next == '*') || c == '#') {
                throw new QueryValidationException(ErrorKind.DISALLOWED_STATEMENT, "Comments are not allowed in queries");
            } else if (c == ';') {
                if (!sql.substring(i + 1).isBlank()) {
                    throw new QueryValidationException(ErrorKind.DISALLOWED_STATEMENT, "Only a single statement is allowed");
                }
                return sql.substring(0, i);
            }
        }
        if (quote != 0) {
            throw new QueryValidationException(ErrorKind.SYNTAX_ERROR, "Unterminated quoted literal or identifier");
        }
        return sql;
    }
}
