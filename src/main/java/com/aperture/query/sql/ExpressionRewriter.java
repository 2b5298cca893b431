package com.aperture.query.sql;

import com.aperture.query.ParameterSet;
import com.aperture.schema.DbType;
import net.sf.jsqlparser.expression.AnalyticExpression;
import net.sf.jsqlparser.expression.BinaryExpression;
import net.sf.jsqlparser.expression.CaseExpression;
import net.sf.jsqlparser.expression.CastExpression;
import net.sf.jsqlparser.expression.DoubleValue;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.expression.Function;
import net.sf.jsqlparser.expression.JdbcNamedParameter;
import net.sf.jsqlparser.expression.LongValue;
import net.sf.jsqlparser.expression.NotExpression;
import net.sf.jsqlparser.expression.SignedExpression;
import net.sf.jsqlparser.expression.StringValue;
import net.sf.jsqlparser.expression.WhenClause;
import net.sf.jsqlparser.expression.WindowDefinition;
import net.sf.jsqlparser.expression.WindowElement;
import net.sf.jsqlparser.expression.WindowOffset;
import net.sf.jsqlparser.expression.operators.relational.Between;
import net.sf.jsqlparser.expression.operators.relational.ExpressionList;
import net.sf.jsqlparser.expression.operators.relational.InExpression;
import net.sf.jsqlparser.expression.operators.relational.IsNullExpression;
import net.sf.jsqlparser.schema.Column;
import net.sf.jsqlparser.statement.select.OrderByElement;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

/**
 * Rewrites one expression tree in place. Literals become named parameters and references to
 * derived columns are replaced by their expression.
 * Nested sub-selects are left alone; they are rewritten when their own SELECT is processed.
 */
final class ExpressionRewriter {

    private final ParameterSet parameters;
    private final Map<Column, DerivedColumn> derivedColumns;
    private final String prefix;

    ExpressionRewriter(ParameterSet parameters, Map<Column, DerivedColumn> derivedColumns, String prefix) {
        this.parameters = parameters;
        this.derivedColumns = derivedColumns;
        this.prefix = prefix;
    }

    boolean isDerived(Column column) {
        return derivedColumns.containsKey(column);
    }

    Expression rewrite(Expression expression) {
        if (expression == null) {
            return null;
        }
        if (expression instanceof Column) {
            DerivedColumn derived = derivedColumns.get(expression);
            return derived != null ? derived.toExpression() : expression;
        }
        Expression bound = bindLiteral(expression);
        if (bound != null) {
            return bound;
        }
        if (expression instanceof BinaryExpression) {
            BinaryExpression binary = (BinaryExpression) expression;
            binary.setLeftExpression(rewrite(binary.getLeftExpression()));
            binary.setRightExpression(rewrite(binary.getRightExpression()));
        } else if (expression instanceof ExpressionList) {
            rewriteList((ExpressionList<?>) expression);
        } else if (expression instanceof Function) {
            rewriteList(((Function) expression).getParameters());
        } else if (expression instanceof AnalyticExpression) {
            rewriteAnalytic((AnalyticExpression) expression);
        } else if (expression instanceof InExpression) {
            InExpression in = (InExpression) expression;
            in.setLeftExpression(rewrite(in.getLeftExpression()));
            in.setRightExpression(rewrite(in.getRightExpression()));
        } else if (expression instanceof Between) {
            Between between = (Between) expression;
            between.setLeftExpression(rewrite(between.getLeftExpression()));
            between.setBetweenExpressionStart(rewrite(between.getBetweenExpressionStart()));
            between.setBetweenExpressionEnd(rewrite(between.getBetweenExpressionEnd()));
        } else if (expression instanceof IsNullExpression) {
            IsNullExpression isNull = (IsNullExpression) expression;
            isNull.setLeftExpression(rewrite(isNull.getLeftExpression()));
        } else if (expression instanceof NotExpression) {
            NotExpression not = (NotExpression) expression;
            not.setExpression(rewrite(not.getExpression()));
        } else if (expression instanceof SignedExpression) {
            SignedExpression signed = (SignedExpression) expression;
            signed.setExpression(rewrite(signed.getExpression()));
        } else if (expression instanceof CastExpression) {
            CastExpression cast = (CastExpression) expression;
            cast.setLeftExpression(rewrite(cast.getLeftExpression()));
        } else if (expression instanceof CaseExpression) {
            CaseExpression caseExpression = (CaseExpression) expression;
            caseExpression.setSwitchExpression(rewrite(caseExpression.getSwitchExpression()));
            if (caseExpression.getWhenClauses() != null) {
                for (WhenClause when : caseExpression.getWhenClauses()) {
                    when.setWhenExpression(rewrite(when.getWhenExpression()));
                    when.setThenExpression(rewrite(when.getThenExpression()));
                }
            }
            caseExpression.setElseExpression(rewrite(caseExpression.getElseExpression()));
        }
        return expression;
    }

    /**
     * Like {@link #rewrite}, but a bare integer stays inline: in GROUP BY, ORDER BY and window
     * frame bounds it is a position or a row count, not a value.
     */
    Expression rewriteKeepingPosition(Expression expression) {
        return expression instanceof LongValue ? expression : rewrite(expression);
    }

    private void rewriteAnalytic(AnalyticExpression analytic) {
        analytic.setExpression(rewrite(analytic.getExpression()));
        analytic.setOffset(rewrite(analytic.getOffset()));
        analytic.setDefaultValue(rewrite(analytic.getDefaultValue()));
        analytic.setFilterExpression(rewrite(analytic.getFilterExpression()));
        rewriteOrderBy(analytic.getFuncOrderBy());
        if (analytic.getKeep() != null) {
            rewriteOrderBy(analytic.getKeep().getOrderByElements());
        }
        WindowDefinition window = analytic.getWindowDefinition();
        if (window != null) {
            rewriteWindow(window.getPartitionExpressionList(), window.getOrderByElements(), window.getWindowElement());
        }
    }

    void rewriteWindow(ExpressionList<?> partitionBy, List<OrderByElement> orderBy, WindowElement frame) {
        rewriteList(partitionBy);
        rewriteOrderBy(orderBy);
        for (WindowOffset offset : ExpressionWalker.frameOffsets(frame)) {
            offset.setExpression(rewriteKeepingPosition(offset.getExpression()));
        }
    }

    void rewriteOrderBy(List<OrderByElement> orderBy) {
        if (orderBy != null) {
            for (OrderByElement element : orderBy) {
                element.setExpression(rewriteKeepingPosition(element.getExpression()));
            }
        }
    }

    @SuppressWarnings("unchecked")
    void rewriteList(ExpressionList<?> list) {
        if (list == null) {
            return;
        }
        ExpressionList<Expression> expressions = (ExpressionList<Expression>) list;
        for (int i = 0; i < expressions.size(); i++) {
            expressions.set(i, rewrite(expressions.get(i)));
        }
    }

    private Expression bindLiteral(Expression expression) {
        if (expression instanceof StringValue) {
            return bind(unescape(((StringValue) expression).getValue()), DbType.STRING);
        }
        if (expression instanceof LongValue) {
            BigInteger value = ((LongValue) expression).getBigIntegerValue();
            return value.bitLength() < 64 ? bind(value.longValue(), DbType.INT64) : null;
        }
        if (expression instanceof DoubleValue) {
            return bind(((DoubleValue) expression).getValue(), DbType.FLOAT64);
        }
        return null;
    }

    private Expression bind(Object value, DbType type) {
        return new JdbcNamedParameter(parameters.next(prefix, value, type));
    }

    static String unescape(String literal) {
        StringBuilder value = new StringBuilder(literal.length());
        for (int i = 0; i < literal.length(); i++) {
            char c = literal.charAt(i);
            if ((c == '\'' || c == '\\') && i + 1 < literal.length()) {
                char next = literal.charAt(i + 1);
                if (c == '\'' && next == '\'') {
                    value.append('\'');
                    i++;
                    continue;
                }
                if (c == '\\') {
                    value.append(unescapeBackslash(next));
                    i++;
                    continue;
                }
            }
            value.append(c);
        }
        return value.toString();
    }

    private static char unescapeBackslash(char c) {
        return switch (c) {
            case 'n' -> '\n';
            case 't' -> '\t';
            case 'r' -> '\r';
            case '0' -> '\0';
            default -> c;
        };
    }
}
