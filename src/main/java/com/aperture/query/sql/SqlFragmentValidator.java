package com.aperture.query.sql;

import com.aperture.query.ErrorKind;
import com.aperture.query.ParameterSet;
import com.aperture.query.QueryCompilerProperties;
import com.aperture.query.QueryValidationException;
import com.aperture.schema.ColumnSchema;
import com.aperture.schema.TableSchema;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.schema.Column;
import org.springframework.stereotype.Component;

import java.util.IdentityHashMap;
import java.util.Map;

/**
 * {@link FragmentValidator} applying the same table, column and function rules as {@link SqlTranspiler}.
 * Sub-selects are not allowed inside fragments.
 */
@Component
public class SqlFragmentValidator implements FragmentValidator {

    static final String FRAGMENT_PREFIX = "m";

    private final FunctionAllowList functions;

    public SqlFragmentValidator(QueryCompilerProperties properties) {
        this.functions = FunctionAllowList.from(properties);
    }

    @Override
    public String validate(String fragment, TableSchema table, ParameterSet parameters) {
        if (fragment == null || fragment.isBlank()) {
            throw new QueryValidationException(ErrorKind.INVALID_QUERY, "Expression is empty");
        }
        String text = SqlLexicalGuard.check(fragment);
        if (text.length() != fragment.length()) {
            throw new QueryValidationException(ErrorKind.DISALLOWED_STATEMENT, "Statement separators are not allowed in expressions");
        }

        Expression expression;
        try {
            expression = CCJSqlParserUtil.parseExpression(text);
        } catch (JSQLParserException e) {
            throw new QueryValidationException(ErrorKind.SYNTAX_ERROR, "Could not parse expression '" + fragment + "'", e);
        }

        ExpressionWalker.WalkResult walk = ExpressionWalker.walk(expression);
        if (walk.hasPlaceholders()) {
            throw new QueryValidationException(ErrorKind.DISALLOWED_STATEMENT, "Bind placeholders are not allowed in expressions");
        }
        if (!walk.getSubqueries().isEmpty()) {
            throw new QueryValidationException(ErrorKind.DISALLOWED_STATEMENT, "Sub-selects are not allowed in expressions");
        }
        for (String function : walk.getFunctions()) {
            if (!functions.isAllowed(function)) {
                throw new QueryValidationException(ErrorKind.DISALLOWED_FUNCTION, "Function '" + function + "' is not allowed");
            }
        }

        Map<Column, DerivedColumn> derived = new IdentityHashMap<>();
        for (ColumnReference reference : walk.getColumns()) {
            if (!reference.isQualified() && SqlIdentifiers.isBooleanLiteral(SqlIdentifiers.normalize(reference.getColumnName()))) {
                continue;
            }
            if (reference.isQualified()
                && !SqlIdentifiers.normalize(reference.getQualifier()).equals(SqlIdentifiers.normalize(table.getName()))) {
                throw new QueryValidationException(ErrorKind.UNKNOWN_COLUMN, "Unknown column '" + reference + "'");
            }
            ColumnSchema column = table.getColumn(SqlIdentifiers.normalize(reference.getColumnName()))
                .orElseThrow(() -> new QueryValidationException(ErrorKind.UNKNOWN_COLUMN,
                    "Unknown column '" + reference + "' on table " + table.getName()));
            if (column.isDerived()) {
                derived.put(reference.getNode(), new DerivedColumn(table.getName(), column));
            }
        }

        return new ExpressionRewriter(parameters, derived, FRAGMENT_PREFIX).rewrite(expression).toString();
    }
}
