package com.aperture.query.sql;

import com.aperture.schema.ColumnSchema;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.expression.operators.relational.ParenthesedExpressionList;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.schema.Table;

/**
 * A reference to a computed column, bound to the relation it was resolved against.
 */
final class DerivedColumn {

    private final String qualifier;
    private final ColumnSchema column;

    DerivedColumn(String qualifier, ColumnSchema column) {
        this.qualifier = qualifier;
        this.column = column;
    }

    ColumnSchema getColumn() {
        return column;
    }

    /**
     * Fresh AST for the column's expression with every column qualified by the owning relation.
     */
    Expression toExpression() {
        Expression expression;
        try {
            expression = CCJSqlParserUtil.parseExpression(column.getSelectExpression());
        } catch (JSQLParserException e) {
            throw new IllegalStateException("Invalid expression for derived column " + column.getName(), e);
        }
        for (ColumnReference reference : ExpressionWalker.extractColumnReferences(expression)) {
            reference.getNode().setTable(new Table(qualifier));
        }
        ParenthesedExpressionList<Expression> parenthesized = new ParenthesedExpressionList<>();
        parenthesized.add(expression);
        return parenthesized;
    }
}
