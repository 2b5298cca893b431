package com.aperture.query.sql;

import net.sf.jsqlparser.expression.AnalyticExpression;
import net.sf.jsqlparser.expression.AnyComparisonExpression;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.expression.ExpressionVisitorAdapter;
import net.sf.jsqlparser.expression.Function;
import net.sf.jsqlparser.expression.JdbcNamedParameter;
import net.sf.jsqlparser.expression.JdbcParameter;
import net.sf.jsqlparser.expression.KeepExpression;
import net.sf.jsqlparser.expression.WindowDefinition;
import net.sf.jsqlparser.expression.WindowElement;
import net.sf.jsqlparser.expression.WindowOffset;
import net.sf.jsqlparser.schema.Column;
import net.sf.jsqlparser.statement.select.OrderByElement;
import net.sf.jsqlparser.statement.select.ParenthesedSelect;
import net.sf.jsqlparser.statement.select.Select;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Read-only traversal of a JSqlParser expression tree.
 *
 * <p>Nested sub-selects are reported but not entered: each one is validated as its own
 * SELECT with the enclosing scope available for correlated references.
 */
public final class ExpressionWalker {

    private ExpressionWalker() {
    }

    /**
     * Every column reference in {@code expression}, in encounter order. Columns inside
     * nested sub-selects are not included.
     */
    public static List<ColumnReference> extractColumnReferences(Expression expression) {
        return walk(expression).getColumns();
    }

    public static WalkResult walk(Expression expression) {
        WalkResult result = new WalkResult();
        if (expression != null) {
            expression.accept(new CollectingVisitor(result), null);
        }
        return result;
    }

    /**
     * Walks a named {@code WINDOW} definition: its partition, ordering and frame bounds.
     */
    public static WalkResult walk(WindowDefinition window) {
        WalkResult result = new WalkResult();
        if (window != null) {
            CollectingVisitor visitor = new CollectingVisitor(result);
            for (Expression part : windowParts((List<? extends Expression>) window.getPartitionExpressionList(), window.getOrderByElements(),
                window.getWindowElement())) {
                part.accept(visitor, null);
            }
        }
        return result;
    }

    /**
     * Every expression nested in an {@code OVER (...)} clause, frame offsets included.
     */
    static List<Expression> windowParts(List<? extends Expression> partitionBy, List<OrderByElement> orderBy,
                                        WindowElement frame) {
        List<Expression> parts = new ArrayList<>();
        if (partitionBy != null) {
            parts.addAll(partitionBy);
        }
        addOrderBy(parts, orderBy);
        for (WindowOffset offset : frameOffsets(frame)) {
            if (offset.getExpression() != null) {
                parts.add(offset.getExpression());
            }
        }
        return parts;
    }

    static List<WindowOffset> frameOffsets(WindowElement frame) {
        List<WindowOffset> offsets = new ArrayList<>();
        if (frame == null) {
            return offsets;
        }
        if (frame.getOffset() != null) {
            offsets.add(frame.getOffset());
        }
        if (frame.getRange() != null) {
            if (frame.getRange().getStart() != null) {
                offsets.add(frame.getRange().getStart());
            }
            if (frame.getRange().getEnd() != null) {
                offsets.add(frame.getRange().getEnd());
            }
        }
        return offsets;
    }

    private static void addOrderBy(List<Expression> parts, List<OrderByElement> orderBy) {
        if (orderBy != null) {
            for (OrderByElement element : orderBy) {
                parts.add(element.getExpression());
            }
        }
    }

    /**
     * What a walk found.
     */
    public static class WalkResult {
        private final List<ColumnReference> columns = new ArrayList<>();
        private final List<String> functions = new ArrayList<>();
        private final List<Select> subqueries = new ArrayList<>();
        private boolean placeholders;

        public List<ColumnReference> getColumns() {
            return Collections.unmodifiableList(columns);
        }

        public List<String> getFunctions() {
            return Collections.unmodifiableList(functions);
        }

        public List<Select> getSubqueries() {
            return Collections.unmodifiableList(subqueries);
        }

        public boolean hasPlaceholders() {
            return placeholders;
        }
    }

    private static final class CollectingVisitor extends ExpressionVisitorAdapter<Void> {

        private final WalkResult result;

        private CollectingVisitor(WalkResult result) {
            this.result = result;
        }

        @Override
        public <S> Void visit(Column column, S context) {
            result.columns.add(ColumnReference.of(column));
            return super.visit(column, context);
        }

        @Override
        public <S> Void visit(Function function, S context) {
            result.functions.add(function.getName());
            return super.visit(function, context);
        }

        @Override
        public <S> Void visit(AnalyticExpression expression, S context) {
            result.functions.add(expression.getName());
            List<Expression> parts = new ArrayList<>();
            parts.add(expression.getExpression());
            parts.add(expression.getOffset());
            parts.add(expression.getDefaultValue());
            parts.add(expression.getFilterExpression());
            addOrderBy(parts, expression.getFuncOrderBy());
            KeepExpression keep = expression.getKeep();
            if (keep != null) {
                addOrderBy(parts, keep.getOrderByElements());
            }
            WindowDefinition window = expression.getWindowDefinition();
            if (window != null) {
                parts.addAll(windowParts(window.getPartitionExpressionList(), window.getOrderByElements(),
                    window.getWindowElement()));
            }
            for (Expression part : parts) {
                if (part != null) {
                    part.accept(this, context);
                }
            }
            return null;
        }

        @Override
        public <S> Void visit(ParenthesedSelect select, S context) {
            result.subqueries.add(select);
            return null;
        }

        @Override
        public <S> Void visit(Select select, S context) {
            result.subqueries.add(select);
            return null;
        }

        @Override
        public <S> Void visit(AnyComparisonExpression expression, S context) {
            if (expression.getSelect() != null) {
                result.subqueries.add(expression.getSelect());
            }
            return null;
        }

        @Override
        public <S> Void visit(JdbcParameter parameter, S context) {
            result.placeholders = true;
            return null;
        }

        @Override
        public <S> Void visit(JdbcNamedParameter parameter, S context) {
            result.placeholders = true;
            return null;
        }
    }
}
