package com.aperture.query.sql;

import com.aperture.query.CompilationResult;
import com.aperture.query.CompiledQuery;
import com.aperture.query.ErrorKind;
import com.aperture.query.ParameterSet;
import com.aperture.query.QueryCompilerProperties;
import com.aperture.query.QueryValidationException;
import com.aperture.query.TenantScope;
import com.aperture.schema.ColumnSchema;
import com.aperture.schema.DbType;
import com.aperture.schema.SchemaRegistry;
import com.aperture.schema.TableSchema;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.expression.Alias;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.expression.JdbcNamedParameter;
import net.sf.jsqlparser.expression.LongValue;
import net.sf.jsqlparser.expression.WindowDefinition;
import net.sf.jsqlparser.expression.operators.conditional.AndExpression;
import net.sf.jsqlparser.expression.operators.relational.EqualsTo;
import net.sf.jsqlparser.expression.operators.relational.ExpressionList;
import net.sf.jsqlparser.expression.operators.relational.ParenthesedExpressionList;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.schema.Column;
import net.sf.jsqlparser.schema.Table;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.select.AllColumns;
import net.sf.jsqlparser.statement.select.AllTableColumns;
import net.sf.jsqlparser.statement.select.FromItem;
import net.sf.jsqlparser.statement.select.Join;
import net.sf.jsqlparser.statement.select.LateralSubSelect;
import net.sf.jsqlparser.statement.select.Limit;
import net.sf.jsqlparser.statement.select.Offset;
import net.sf.jsqlparser.statement.select.OrderByElement;
import net.sf.jsqlparser.statement.select.ParenthesedSelect;
import net.sf.jsqlparser.statement.select.PlainSelect;
import net.sf.jsqlparser.statement.select.Select;
import net.sf.jsqlparser.statement.select.SelectItem;
import net.sf.jsqlparser.statement.select.SetOperationList;
import net.sf.jsqlparser.statement.select.WithItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Validates hand-written dashboard SQL and rewrites it into a tenant-scoped, parameterized query.
 *
 * <p>The query is parsed into a JSqlParser AST and processed one SELECT at a time:
 * <ol>
 *   <li>every table is resolved against the {@link SchemaRegistry} (or a visible CTE),</li>
 *   <li>every column reference is resolved against the relations in scope,</li>
 *   <li>every function call is checked against the {@link FunctionAllowList},</li>
 *   <li>literals are replaced by named parameters and derived columns by their expression,</li>
 *   <li>a {@code <table>.project_id = :project_id} predicate is added for every table scan.</li>
 * </ol>
 * The outermost query finally gets a bounded {@code LIMIT :limit}. Any failure yields a
 * rejection; a partially rewritten query is never returned.
 */
@Component
public class SqlTranspiler {

    private static final Logger logger = LoggerFactory.getLogger(SqlTranspiler.class);

    public static final String LIMIT_PARAMETER = "limit";
    public static final String OFFSET_PARAMETER = "offset";
    static final String LITERAL_PREFIX = "p";

    private final SchemaRegistry registry;
    private final QueryCompilerProperties properties;
    private final FunctionAllowList functions;

    public SqlTranspiler(SchemaRegistry registry, QueryCompilerProperties properties) {
        this.registry = registry;
        this.properties = properties;
        this.functions = FunctionAllowList.from(properties);
    }

    /**
     * Compile {@code sqlText} for {@code tenant}. Identical inputs produce identical results.
     */
    public CompilationResult validateAndTranspile(String sqlText, TenantScope tenant) {
        Objects.requireNonNull(tenant, "tenant");
        if (sqlText == null || sqlText.isBlank()) {
            return CompilationResult.rejected(ErrorKind.SYNTAX_ERROR, "Query is empty");
        }
        try {
            Select select = parse(sqlText);
            Compilation compilation = new Compilation(tenant);
            processSelect(select, null, CteScope.EMPTY, compilation);
            if (compilation.tableScans == 0) {
                throw new QueryValidationException(ErrorKind.INVALID_QUERY, "Query must read from at least one table");
            }
            applyLimit(select, compilation);

            CompiledQuery query = new CompiledQuery(select.toString(), compilation.parameters.asMap());
            logger.debug("Compiled query for tenant {}: {}", tenant.getProjectId(), query.getSql());
            return CompilationResult.success(query, compilation.warnings);
        } catch (QueryValidationException e) {
            logger.warn("Rejected query for tenant {}: {} {}", tenant.getProjectId(), e.getKind(), e.getMessage());
            return CompilationResult.rejected(e);
        } catch (RuntimeException e) {
            logger.error("Unexpected failure compiling query for tenant {}", tenant.getProjectId(), e);
            return CompilationResult.rejected(ErrorKind.INVALID_QUERY, "Query could not be compiled");
        }
    }

    private Select parse(String sqlText) {
        String statementText = SqlLexicalGuard.check(sqlText);
        Statement statement;
        try {
            statement = CCJSqlParserUtil.parse(statementText);
        } catch (JSQLParserException e) {
            throw new QueryValidationException(ErrorKind.SYNTAX_ERROR, "Could not parse query: " + parserMessage(e), e);
        }
        if (!(statement instanceof Select)) {
            throw new QueryValidationException(ErrorKind.DISALLOWED_STATEMENT,
                "Only SELECT statements are allowed, got " + statement.getClass().getSimpleName());
        }
        return (Select) statement;
    }

    /**
     * @return the (lower-cased) output column names of {@code select}
     */
    private Set<String> processSelect(Select select, SelectScope outer, CteScope ctes, Compilation compilation) {
        CteScope visible = ctes;
        List<WithItem<?>> withItems = select.getWithItemsList();
        if (withItems != null) {
            for (WithItem<?> item : withItems) {
                if (item.getSelect() == null) {
                    throw new QueryValidationException(ErrorKind.DISALLOWED_STATEMENT, "Only SELECT is allowed inside WITH");
                }
                Set<String> columns = processSelect(item.getSelect(), null, visible, compilation);
                List<SelectItem<?>> declared = item.getWithItemList();
                if (declared != null && !declared.isEmpty()) {
                    columns = new LinkedHashSet<>();
                    for (SelectItem<?> column : declared) {
                        columns.add(SqlIdentifiers.normalize(column.toString()));
                    }
                }
                visible = visible.with(item.getAliasName(), columns);
            }
        }

        if (select instanceof PlainSelect) {
            return processPlainSelect((PlainSelect) select, outer, visible, compilation);
        }
        if (select instanceof SetOperationList) {
            Set<String> columns = null;
            for (Select branch : ((SetOperationList) select).getSelects()) {
                Set<String> branchColumns = processSelect(branch, outer, visible, compilation);
                if (columns == null) {
                    columns = branchColumns;
                }
            }
            validateOutputOrderBy(((SetOperationList) select).getOrderByElements(), columns);
            bindOutputOrderBy(((SetOperationList) select).getOrderByElements(), compilation);
            return columns;
        }
        if (select instanceof ParenthesedSelect && !(select instanceof LateralSubSelect)) {
            ParenthesedSelect parenthesed = (ParenthesedSelect) select;
            Set<String> columns = processSelect(parenthesed.getSelect(), outer, visible, compilation);
            validateOutputOrderBy(parenthesed.getOrderByElements(), columns);
            bindOutputOrderBy(parenthesed.getOrderByElements(), compilation);
            return columns;
        }
        throw new QueryValidationException(ErrorKind.DISALLOWED_STATEMENT,
            "Unsupported query form: " + select.getClass().getSimpleName());
    }

    private Set<String> processPlainSelect(PlainSelect select, SelectScope outer, CteScope ctes, Compilation compilation) {
        if (select.getIntoTables() != null && !select.getIntoTables().isEmpty()) {
            throw new QueryValidationException(ErrorKind.DISALLOWED_STATEMENT, "SELECT INTO is not allowed");
        }

        SelectScope scope = new SelectScope(outer);
        List<TableScan> scans = new ArrayList<>();
        if (select.getFromItem() != null) {
            registerFromItem(select.getFromItem(), null, scope, ctes, compilation, scans);
        }
        if (select.getJoins() != null) {
            for (Join join : select.getJoins()) {
                registerFromItem(join.getRightItem(), join, scope, ctes, compilation, scans);
            }
        }
        for (SelectItem<?> item : select.getSelectItems()) {
            if (item.getAlias() != null) {
                scope.addSelectAlias(item.getAlias().getName());
            }
        }

        for (SelectItem<?> item : select.getSelectItems()) {
            validateSelectItem(item, scope, ctes, compilation);
        }
        if (select.getJoins() != null) {
            for (Join join : select.getJoins()) {
                validateJoin(join, scope, ctes, compilation);
            }
        }
        validateExpression(select.getWhere(), scope, ctes, compilation);
        if (select.getGroupBy() != null && select.getGroupBy().getGroupByExpressionList() != null) {
            for (Object expression : select.getGroupBy().getGroupByExpressionList()) {
                validateExpression((Expression) expression, scope, ctes, compilation);
            }
        }
        validateExpression(select.getHaving(), scope, ctes, compilation);
        if (select.getOrderByElements() != null) {
            for (OrderByElement element : select.getOrderByElements()) {
                validateExpression(element.getExpression(), scope, ctes, compilation);
            }
        }
        if (select.getWindowDefinitions() != null) {
            for (WindowDefinition window : select.getWindowDefinitions()) {
                validateWalk(ExpressionWalker.walk(window), scope, ctes, compilation);
            }
        }
        Set<String> outputColumns = outputColumns(select, scope);

        rewrite(select, compilation);
        expandWildcards(select, scope);
        injectTenantPredicates(select, scans, compilation);
        return outputColumns;
    }

    private void registerFromItem(FromItem item, Join join, SelectScope scope, CteScope ctes,
                                  Compilation compilation, List<TableScan> scans) {
        Relation relation;
        if (item instanceof Table) {
            Table table = (Table) item;
            String name = table.getName();
            if (!Objects.equals(table.getFullyQualifiedName(), name)) {
                throw new QueryValidationException(ErrorKind.UNKNOWN_TABLE,
                    "Unknown table '" + table.getFullyQualifiedName() + "'");
            }
            String qualifier = table.getAlias() != null ? table.getAlias().getName() : name;
            Set<String> cteColumns = ctes.lookup(name);
            if (cteColumns != null) {
                relation = Relation.derived(qualifier, cteColumns);
            } else {
                TableSchema schema = registry.resolveTable(SqlIdentifiers.normalize(name))
                    .orElseThrow(() -> new QueryValidationException(ErrorKind.UNKNOWN_TABLE, "Unknown table '" + name + "'"));
                relation = Relation.base(qualifier, schema);
                scans.add(new TableScan(qualifier, schema, join));
                compilation.tableScans++;
            }
        } else if (item instanceof ParenthesedSelect && !(item instanceof LateralSubSelect)) {
            ParenthesedSelect subSelect = (ParenthesedSelect) item;
            Set<String> columns = processSelect(subSelect, null, ctes, compilation);
            String qualifier = subSelect.getAlias() != null ? subSelect.getAlias().getName() : null;
            relation = Relation.derived(qualifier, columns);
        } else {
            throw new QueryValidationException(ErrorKind.DISALLOWED_STATEMENT,
                "Unsupported FROM item " + item.getClass().getSimpleName()
                    + ": only tables, CTEs and sub-selects can be queried");
        }
        if (!scope.addRelation(relation)) {
            throw new QueryValidationException(ErrorKind.AMBIGUOUS_REFERENCE,
                "Table name or alias '" + relation.getQualifier() + "' is used more than once");
        }
    }

    private void validateSelectItem(SelectItem<?> item, SelectScope scope, CteScope ctes, Compilation compilation) {
        Expression expression = item.getExpression();
        if (expression instanceof AllTableColumns) {
            Table table = ((AllTableColumns) expression).getTable();
            if (scope.findRelation(table.getFullyQualifiedName()) == null) {
                throw new QueryValidationException(ErrorKind.UNKNOWN_TABLE,
                    "Unknown table '" + table.getFullyQualifiedName() + "' in " + expression);
            }
            return;
        }
        if (expression instanceof AllColumns) {
            if (scope.getRelations().isEmpty()) {
                throw new QueryValidationException(ErrorKind.INVALID_QUERY, "SELECT * requires a FROM clause");
            }
            return;
        }
        validateExpression(expression, scope, ctes, compilation);
    }

    private void validateJoin(Join join, SelectScope scope, CteScope ctes, Compilation compilation) {
        Collection<Expression> onExpressions = join.getOnExpressions();
        if (onExpressions != null) {
            for (Expression on : onExpressions) {
                validateExpression(on, scope, ctes, compilation);
            }
        }
        if (join.getUsingColumns() != null) {
            for (Column column : join.getUsingColumns()) {
                String name = SqlIdentifiers.normalize(column.getColumnName());
                if (scope.relationsWithColumn(name).size() < 2) {
                    throw new QueryValidationException(ErrorKind.UNKNOWN_COLUMN,
                        "Column '" + column.getColumnName() + "' in USING must exist on both sides of the join");
                }
            }
        }
    }

    private void validateExpression(Expression expression, SelectScope scope, CteScope ctes, Compilation compilation) {
        if (expression == null) {
            return;
        }
        validateWalk(ExpressionWalker.walk(expression), scope, ctes, compilation);
    }

    private void validateWalk(ExpressionWalker.WalkResult walk, SelectScope scope, CteScope ctes, Compilation compilation) {
        if (walk.hasPlaceholders()) {
            throw new QueryValidationException(ErrorKind.DISALLOWED_STATEMENT, "Bind placeholders are not allowed in queries");
        }
        for (String function : walk.getFunctions()) {
            if (!functions.isAllowed(function)) {
                throw new QueryValidationException(ErrorKind.DISALLOWED_FUNCTION, "Function '" + function + "' is not allowed");
            }
        }
        for (ColumnReference reference : walk.getColumns()) {
            resolveColumn(reference, scope, compilation);
        }
        for (Select subquery : walk.getSubqueries()) {
            processSelect(subquery, scope, ctes, compilation);
        }
    }

    private void resolveColumn(ColumnReference reference, SelectScope scope, Compilation compilation) {
        String name = SqlIdentifiers.normalize(reference.getColumnName());
        if (!reference.isQualified()) {
            if (SqlIdentifiers.isBooleanLiteral(name)) {
                return;
            }
            for (SelectScope current = scope; current != null; current = current.getParent()) {
                List<Relation> matches = current.relationsWithColumn(name);
                if (matches.size() > 1) {
                    throw new QueryValidationException(ErrorKind.AMBIGUOUS_REFERENCE,
                        "Column '" + reference.getColumnName() + "' is ambiguous");
                }
                if (matches.size() == 1) {
                    recordDerived(matches.get(0), name, reference, compilation);
                    return;
                }
                if (current.hasSelectAlias(name)) {
                    return;
                }
            }
            throw new QueryValidationException(ErrorKind.UNKNOWN_COLUMN, "Unknown column '" + reference.getColumnName() + "'");
        }

        for (SelectScope current = scope; current != null; current = current.getParent()) {
            Relation relation = current.findRelation(reference.getQualifier());
            if (relation != null) {
                if (!relation.hasColumn(name)) {
                    break;
                }
                recordDerived(relation, name, reference, compilation);
                return;
            }
        }
        throw new QueryValidationException(ErrorKind.UNKNOWN_COLUMN, "Unknown column '" + reference + "'");
    }

    private void recordDerived(Relation relation, String name, ColumnReference reference, Compilation compilation) {
        if (!relation.isBaseTable()) {
            return;
        }
        ColumnSchema column = relation.getTable().getColumn(name).orElseThrow();
        if (column.isDerived()) {
            compilation.derivedColumns.put(reference.getNode(), new DerivedColumn(relation.getQualifier(), column));
        }
    }

    private void validateOutputOrderBy(List<OrderByElement> orderBy, Set<String> columns) {
        if (orderBy == null) {
            return;
        }
        for (OrderByElement element : orderBy) {
            ExpressionWalker.WalkResult walk = ExpressionWalker.walk(element.getExpression());
            if (walk.hasPlaceholders() || !walk.getSubqueries().isEmpty()) {
                throw new QueryValidationException(ErrorKind.DISALLOWED_STATEMENT,
                    "ORDER BY of a compound query may only reference its output columns");
            }
            for (String function : walk.getFunctions()) {
                if (!functions.isAllowed(function)) {
                    throw new QueryValidationException(ErrorKind.DISALLOWED_FUNCTION, "Function '" + function + "' is not allowed");
                }
            }
            for (ColumnReference reference : walk.getColumns()) {
                if (reference.isQualified() || !columns.contains(SqlIdentifiers.normalize(reference.getColumnName()))) {
                    throw new QueryValidationException(ErrorKind.UNKNOWN_COLUMN, "Unknown column '" + reference + "'");
                }
            }
        }
    }

    private static void bindOutputOrderBy(List<OrderByElement> orderBy, Compilation compilation) {
        new ExpressionRewriter(compilation.parameters, compilation.derivedColumns, LITERAL_PREFIX).rewriteOrderBy(orderBy);
    }

    private Set<String> outputColumns(PlainSelect select, SelectScope scope) {
        Set<String> columns = new LinkedHashSet<>();
        for (SelectItem<?> item : select.getSelectItems()) {
            Expression expression = item.getExpression();
            if (item.getAlias() != null) {
                columns.add(SqlIdentifiers.normalize(item.getAlias().getName()));
            } else if (expression instanceof AllTableColumns) {
                columns.addAll(scope.findRelation(((AllTableColumns) expression).getTable().getFullyQualifiedName()).getColumns());
            } else if (expression instanceof AllColumns) {
                for (Relation relation : scope.getRelations()) {
                    columns.addAll(relation.getColumns());
                }
            } else if (expression instanceof Column) {
                columns.add(SqlIdentifiers.normalize(((Column) expression).getColumnName()));
            } else {
                columns.add(SqlIdentifiers.normalize(expression.toString()));
            }
        }
        return columns;
    }

    @SuppressWarnings("unchecked")
    private void rewrite(PlainSelect select, Compilation compilation) {
        ExpressionRewriter values = new ExpressionRewriter(compilation.parameters, compilation.derivedColumns, LITERAL_PREFIX);

        for (SelectItem<?> item : select.getSelectItems()) {
            Expression expression = item.getExpression();
            if (expression instanceof AllColumns) {
                continue;
            }
            if (item.getAlias() == null && expression instanceof Column && values.isDerived((Column) expression)) {
                item.setAlias(new Alias(((Column) expression).getColumnName(), true));
            }
            ((SelectItem<Expression>) item).setExpression(values.rewrite(expression));
        }
        if (select.getJoins() != null) {
            for (Join join : select.getJoins()) {
                Collection<Expression> onExpressions = join.getOnExpressions();
                if (onExpressions != null && !onExpressions.isEmpty()) {
                    List<Expression> rewritten = new ArrayList<>();
                    for (Expression on : onExpressions) {
                        rewritten.add(values.rewrite(on));
                    }
                    join.setOnExpressions(rewritten);
                }
            }
        }
        select.setWhere(values.rewrite(select.getWhere()));
        select.setHaving(values.rewrite(select.getHaving()));

        if (select.getGroupBy() != null && select.getGroupBy().getGroupByExpressionList() != null) {
            ExpressionList<Expression> groupBy = (ExpressionList<Expression>) select.getGroupBy().getGroupByExpressionList();
            for (int i = 0; i < groupBy.size(); i++) {
                groupBy.set(i, values.rewriteKeepingPosition(groupBy.get(i)));
            }
        }
        values.rewriteOrderBy(select.getOrderByElements());
        if (select.getWindowDefinitions() != null) {
            for (WindowDefinition window : select.getWindowDefinitions()) {
                values.rewriteWindow(window.getPartitionExpressionList(), window.getOrderByElements(), window.getWindowElement());
            }
        }
    }

    /**
     * Replaces {@code *} and {@code t.*} over registry tables by their visible columns, so the
     * hidden tenant column and unlisted physical columns never reach the result set.
     */
    private void expandWildcards(PlainSelect select, SelectScope scope) {
        List<SelectItem<?>> expanded = new ArrayList<>();
        boolean changed = false;
        for (SelectItem<?> item : select.getSelectItems()) {
            Expression expression = item.getExpression();
            if (expression instanceof AllTableColumns) {
                Relation relation = scope.findRelation(((AllTableColumns) expression).getTable().getFullyQualifiedName());
                if (relation.isBaseTable()) {
                    expanded.addAll(columnItems(relation));
                    changed = true;
                    continue;
                }
            } else if (expression instanceof AllColumns && hasBaseTable(scope)) {
                for (Relation relation : scope.getRelations()) {
                    if (relation.isBaseTable()) {
                        expanded.addAll(columnItems(relation));
                    } else if (relation.getQualifier() != null) {
                        expanded.add(new SelectItem<>(new AllTableColumns(new Table(relation.getQualifier()))));
                    } else {
                        throw new QueryValidationException(ErrorKind.INVALID_QUERY,
                            "A sub-select joined with other tables must have an alias");
                    }
                }
                changed = true;
                continue;
            }
            expanded.add(item);
        }
        if (changed) {
            select.setSelectItems(expanded);
        }
    }

    private static boolean hasBaseTable(SelectScope scope) {
        for (Relation relation : scope.getRelations()) {
            if (relation.isBaseTable()) {
                return true;
            }
        }
        return false;
    }

    private static List<SelectItem<?>> columnItems(Relation relation) {
        List<SelectItem<?>> items = new ArrayList<>();
        for (ColumnSchema column : relation.getTable().getColumns()) {
            if (column.isDerived()) {
                SelectItem<Expression> item = new SelectItem<>(new DerivedColumn(relation.getQualifier(), column).toExpression());
                item.setAlias(new Alias(column.getName(), true));
                items.add(item);
            } else {
                items.add(new SelectItem<>(new Column(new Table(relation.getQualifier()), column.getName())));
            }
        }
        return items;
    }

    private void injectTenantPredicates(PlainSelect select, List<TableScan> scans, Compilation compilation) {
        Expression wherePredicate = null;
        for (TableScan scan : scans) {
            Expression predicate = tenantPredicate(scan, compilation);
            Join join = scan.join;
            if (join != null && scopesInOnClause(join)) {
                join.setOnExpressions(Collections.singletonList(conjoin(predicate, combine(join.getOnExpressions()))));
            } else {
                wherePredicate = wherePredicate == null ? predicate : new AndExpression(wherePredicate, predicate);
            }
        }
        if (wherePredicate != null) {
            select.setWhere(conjoin(wherePredicate, select.getWhere()));
        }
    }

    private Expression tenantPredicate(TableScan scan, Compilation compilation) {
        String parameter = properties.getTenantParameter();
        compilation.parameters.add(parameter, compilation.tenant.getProjectId(), scan.table.getTenantColumnType());
        Column tenantColumn = new Column(new Table(scan.qualifier), scan.table.getTenantColumn());
        return new EqualsTo(tenantColumn, new JdbcNamedParameter(parameter));
    }

    // Rows of an outer-joined side must stay null-extended, so only inner and left joins scope in ON.
    private static boolean scopesInOnClause(Join join) {
        return !join.isRight() && !join.isFull() && !join.isCross() && !join.isSimple() && !join.isNatural()
            && join.getOnExpressions() != null && !join.getOnExpressions().isEmpty();
    }

    private static Expression combine(Collection<Expression> expressions) {
        Expression combined = null;
        for (Expression expression : expressions) {
            combined = combined == null ? expression : new AndExpression(combined, expression);
        }
        return combined;
    }

    private static Expression conjoin(Expression tenantPredicate, Expression userCondition) {
        if (userCondition == null) {
            return tenantPredicate;
        }
        ParenthesedExpressionList<Expression> parenthesized = new ParenthesedExpressionList<>();
        parenthesized.add(userCondition);
        return new AndExpression(tenantPredicate, parenthesized);
    }

    private void applyLimit(Select select, Compilation compilation) {
        if (select.getFetch() != null) {
            throw new QueryValidationException(ErrorKind.DISALLOWED_STATEMENT, "FETCH is not supported, use LIMIT");
        }
        long maxLimit = properties.getMaxLimit();
        long effective = maxLimit;
        Limit limit = select.getLimit();
        if (limit == null) {
            limit = new Limit();
            select.setLimit(limit);
        } else {
            Expression rowCount = limit.getRowCount();
            if (rowCount instanceof LongValue) {
                BigInteger requested = ((LongValue) rowCount).getBigIntegerValue();
                if (requested.compareTo(BigInteger.valueOf(maxLimit)) > 0) {
                    compilation.warnings.add("LIMIT " + requested + " exceeds the maximum of " + maxLimit + " rows and was reduced");
                } else {
                    effective = requested.longValue();
                }
            } else if (rowCount != null) {
                compilation.warnings.add("LIMIT " + rowCount + " was replaced by the maximum of " + maxLimit + " rows");
            }
            if (limit.getOffset() != null) {
                limit.setOffset(bindOffset(limit.getOffset(), compilation));
            }
        }
        limit.setRowCount(new JdbcNamedParameter(LIMIT_PARAMETER));
        compilation.parameters.add(LIMIT_PARAMETER, effective, DbType.UINT32);

        Offset offset = select.getOffset();
        if (offset != null && offset.getOffset() != null) {
            offset.setOffset(bindOffset(offset.getOffset(), compilation));
        }
    }

    private static Expression bindOffset(Expression offset, Compilation compilation) {
        if (!(offset instanceof LongValue)) {
            throw new QueryValidationException(ErrorKind.INVALID_QUERY, "OFFSET must be a non-negative integer");
        }
        BigInteger value = ((LongValue) offset).getBigIntegerValue();
        if (value.signum() < 0 || value.bitLength() >= 32) {
            throw new QueryValidationException(ErrorKind.INVALID_QUERY, "OFFSET out of range: " + value);
        }
        compilation.parameters.add(OFFSET_PARAMETER, value.longValue(), DbType.UINT32);
        return new JdbcNamedParameter(OFFSET_PARAMETER);
    }

    private static String parserMessage(JSQLParserException e) {
        Throwable cause = e.getCause() != null ? e.getCause() : e;
        String message = cause.getMessage();
        if (message == null) {
            return "invalid SQL";
        }
        int newline = message.indexOf('\n');
        return newline > 0 ? message.substring(0, newline) : message;
    }

    private static final class TableScan {
        private final String qualifier;
        private final TableSchema table;
        private final Join join;

        private TableScan(String qualifier, TableSchema table, Join join) {
            this.qualifier = qualifier;
            this.table = table;
            this.join = join;
        }
    }

    // Mutable state of one compilation; never shared between calls.
    private static final class Compilation {
        private final TenantScope tenant;
        private final ParameterSet parameters = new ParameterSet();
        private final Map<Column, DerivedColumn> derivedColumns = new IdentityHashMap<>();
        private final List<String> warnings = new ArrayList<>();
        private int tableScans;

        private Compilation(TenantScope tenant) {
            this.tenant = tenant;
        }
    }
}
