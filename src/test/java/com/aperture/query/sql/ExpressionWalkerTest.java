package com.aperture.query.sql;

import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ExpressionWalker")
class ExpressionWalkerTest {

    @Test
    @DisplayName("should list column references with their qualifiers in order")
    void shouldExtractColumnReferences() throws Exception {
        // Given
        Expression expression = CCJSqlParserUtil.parseExpression("s.status = 'error' AND duration > 2 OR name LIKE 'llm%'");

        // When
        List<ColumnReference> references = ExpressionWalker.extractColumnReferences(expression);

        // Then
        assertThat(references).extracting(ColumnReference::getColumnName)
            .containsExactly("status", "duration", "name");
        assertThat(references.get(0).getQualifier()).isEqualTo("s");
        assertThat(references.get(1).isQualified()).isFalse();
    }

    @Test
    @DisplayName("should report function names including nested calls")
    void shouldCollectFunctions() throws Exception {
        Expression expression = CCJSqlParserUtil.parseExpression("round(avg(total_cost), 2)");

        ExpressionWalker.WalkResult walk = ExpressionWalker.walk(expression);

        assertThat(walk.getFunctions().stream().map(String::toLowerCase).collect(Collectors.toList()))
            .containsExactlyInAnyOrder("round", "avg");
        assertThat(walk.getColumns()).extracting(ColumnReference::getColumnName).containsExactly("total_cost");
    }

    @Test
    @DisplayName("should report sub-selects without entering them")
    void shouldNotEnterSubSelects() throws Exception {
        Expression expression = CCJSqlParserUtil.parseExpression(
            "trace_id IN (SELECT id FROM traces WHERE status = 'error')");

        ExpressionWalker.WalkResult walk = ExpressionWalker.walk(expression);

        assertThat(walk.getSubqueries()).hasSize(1);
        assertThat(walk.getColumns()).extracting(ColumnReference::getColumnName).containsExactly("trace_id");
    }

    @Test
    @DisplayName("should look inside the OVER clause of window functions")
    void shouldWalkWindowClauses() throws Exception {
        Expression expression = CCJSqlParserUtil.parseExpression(
            "sum(total_cost) OVER (PARTITION BY model, (SELECT max(id) FROM traces) ORDER BY start_time)");

        ExpressionWalker.WalkResult walk = ExpressionWalker.walk(expression);

        assertThat(walk.getColumns()).extracting(ColumnReference::getColumnName)
            .containsExactlyInAnyOrder("total_cost", "model", "start_time");
        assertThat(walk.getSubqueries()).hasSize(1);
    }

    @Test
    @DisplayName("should flag bind placeholders")
    void shouldFlagPlaceholders() throws Exception {
        assertThat(ExpressionWalker.walk(CCJSqlParserUtil.parseExpression("status = ?")).hasPlaceholders()).isTrue();
        assertThat(ExpressionWalker.walk(CCJSqlParserUtil.parseExpression("status = :tenant")).hasPlaceholders()).isTrue();
        assertThat(ExpressionWalker.walk(CCJSqlParserUtil.parseExpression("status = 'ok'")).hasPlaceholders()).isFalse();
    }

    @Test
    @DisplayName("should return an empty walk for a null expression")
    void shouldHandleNull() {
        assertThat(ExpressionWalker.extractColumnReferences(null)).isEmpty();
    }
}
