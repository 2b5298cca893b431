package com.aperture.query.sql;

import com.aperture.query.CompilationResult;
import com.aperture.query.CompiledQuery;
import com.aperture.query.ErrorKind;
import com.aperture.query.QueryCompilerProperties;
import com.aperture.query.QueryParameter;
import com.aperture.query.TenantScope;
import com.aperture.schema.DbType;
import com.aperture.schema.StaticSchemaRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for SqlTranspiler
 */
@DisplayName("SqlTranspiler")
class SqlTranspilerTest {

    private static final TenantScope TENANT = TenantScope.of("6f1c2a4e-0000-4000-8000-000000000001");

    private SqlTranspiler transpiler;

    @BeforeEach
    void setUp() {
        transpiler = new SqlTranspiler(StaticSchemaRegistry.defaultRegistry(), QueryCompilerProperties.defaults());
    }

    private CompiledQuery compile(String sql) {
        CompilationResult result = transpiler.validateAndTranspile(sql, TENANT);
        assertThat(result.isValid()).as("rejection: %s", result.getRejection()).isTrue();
        return result.getQuery();
    }

    private ErrorKind rejectionKind(String sql) {
        CompilationResult result = transpiler.validateAndTranspile(sql, TENANT);
        assertThat(result.isValid()).as("expected rejection of %s", sql).isFalse();
        assertThat(result.getQuery()).isNull();
        return result.getRejection().getKind();
    }

    @Nested
    @DisplayName("tenant scoping")
    class TenantScoping {

        @Test
        @DisplayName("should add the tenant predicate and parameterize literals")
        void shouldScopeSimpleAggregate() {
            // When
            CompiledQuery query = compile("SELECT status, count(*) AS n FROM spans WHERE status = 'error' GROUP BY status");

            // Then
            assertThat(query.getSql()).contains("spans.project_id = :project_id");
            assertThat(query.getSql()).contains("(status = :p_0)");
            assertThat(query.getSql()).contains("LIMIT :limit");
            assertThat(query.getSql()).doesNotContain("'error'");
            assertThat(query.getParameter("project_id"))
                .isEqualTo(QueryParameter.of(TENANT.getProjectId(), DbType.UUID));
            assertThat(query.getParameter("p_0")).isEqualTo(QueryParameter.of("error", DbType.STRING));
            assertThat(query.getParameter("limit")).isEqualTo(QueryParameter.of(10_000L, DbType.UINT32));
        }

        @Test
        @DisplayName("should never inline the tenant id into the SQL text")
        void shouldNotInlineTenant() {
            CompiledQuery query = compile("SELECT name FROM spans");

            assertThat(query.getSql()).doesNotContain(TENANT.getProjectId());
            assertThat(query.getSql()).contains("WHERE spans.project_id = :project_id");
        }

        @Test
        @DisplayName("should scope every table of a join, inside ON for left joins")
        void shouldScopeLeftJoinInOnClause() {
            CompiledQuery query = compile(
                "SELECT s.name, e.name AS event_name FROM spans s LEFT JOIN events e ON s.span_id = e.span_id");

            assertThat(query.getSql()).contains("ON e.project_id = :project_id AND (s.span_id = e.span_id)");
            assertThat(query.getSql()).contains("WHERE s.project_id = :project_id");
        }

        @Test
        @DisplayName("should scope right joins in WHERE")
        void shouldScopeRightJoinInWhere() {
            CompiledQuery query = compile(
                "SELECT s.name FROM spans s RIGHT JOIN events e ON s.span_id = e.span_id");

            assertThat(query.getSql()).contains("WHERE s.project_id = :project_id AND e.project_id = :project_id");
        }

        @Test
        @DisplayName("should scope tables read inside CTEs and sub-selects")
        void shouldScopeCtesAndSubSelects() {
            CompiledQuery query = compile(
                "WITH errs AS (SELECT trace_id FROM spans WHERE status = 'error') "
                    + "SELECT id FROM traces WHERE id IN (SELECT trace_id FROM errs)");

            assertThat(query.getSql()).contains("spans.project_id = :project_id");
            assertThat(query.getSql()).contains("traces.project_id = :project_id");
        }

        @Test
        @DisplayName("should refuse to expose the tenant column")
        void shouldRejectTenantColumnReference() {
            assertThat(rejectionKind("SELECT project_id FROM spans")).isEqualTo(ErrorKind.UNKNOWN_COLUMN);
            assertThat(rejectionKind("SELECT name FROM spans WHERE project_id = 'other'"))
                .isEqualTo(ErrorKind.UNKNOWN_COLUMN);
        }

        @Test
        @DisplayName("should expand SELECT * to the visible columns only")
        void shouldExpandWildcard() {
            CompiledQuery query = compile("SELECT * FROM tags");

            assertThat(query.getSql()).startsWith("SELECT tags.id, tags.span_id, tags.name, tags.created_at, tags.source FROM tags");
        }
    }

    @Nested
    @DisplayName("rejections")
    class Rejections {

        @Test
        @DisplayName("should reject stacked statements")
        void shouldRejectStackedStatements() {
            assertThat(rejectionKind("SELECT * FROM spans; DROP TABLE spans")).isEqualTo(ErrorKind.DISALLOWED_STATEMENT);
        }

        @Test
        @DisplayName("should reject comments")
        void shouldRejectComments() {
            assertThat(rejectionKind("SELECT name FROM spans -- WHERE status = 'ok'"))
                .isEqualTo(ErrorKind.DISALLOWED_STATEMENT);
            assertThat(rejectionKind("SELECT name /* x */ FROM spans")).isEqualTo(ErrorKind.DISALLOWED_STATEMENT);
        }

        @Test
        @DisplayName("should accept comment markers inside string literals")
        void shouldAcceptMarkersInsideLiterals() {
            CompiledQuery query = compile("SELECT name FROM spans WHERE name = 'a--b;c'");

            assertThat(query.getParameter("p_0").getValue()).isEqualTo("a--b;c");
        }

        @Test
        @DisplayName("should reject statements other than SELECT")
        void shouldRejectWrites() {
            assertThat(rejectionKind("INSERT INTO spans (name) VALUES ('x')")).isEqualTo(ErrorKind.DISALLOWED_STATEMENT);
            assertThat(rejectionKind("DELETE FROM spans WHERE name = 'x'")).isEqualTo(ErrorKind.DISALLOWED_STATEMENT);
        }

        @Test
        @DisplayName("should reject unknown tables")
        void shouldRejectUnknownTables() {
            assertThat(rejectionKind("SELECT name FROM other_tenant_view")).isEqualTo(ErrorKind.UNKNOWN_TABLE);
            assertThat(rejectionKind("SELECT name FROM system.tables")).isEqualTo(ErrorKind.UNKNOWN_TABLE);
            assertThat(rejectionKind("SELECT name FROM spans UNION ALL SELECT name FROM secrets"))
                .isEqualTo(ErrorKind.UNKNOWN_TABLE);
        }

        @Test
        @DisplayName("should reject unknown columns")
        void shouldRejectUnknownColumns() {
            assertThat(rejectionKind("SELECT password FROM spans")).isEqualTo(ErrorKind.UNKNOWN_COLUMN);
            assertThat(rejectionKind("SELECT s.nope FROM spans s")).isEqualTo(ErrorKind.UNKNOWN_COLUMN);
        }

        @Test
        @DisplayName("should reject unqualified columns present on two joined tables")
        void shouldRejectAmbiguousColumns() {
            assertThat(rejectionKind("SELECT name FROM spans JOIN events ON spans.span_id = events.span_id"))
                .isEqualTo(ErrorKind.AMBIGUOUS_REFERENCE);
        }

        @Test
        @DisplayName("should only see the columns a CTE selects")
        void shouldLimitCteColumns() {
            assertThat(rejectionKind("WITH errs AS (SELECT trace_id FROM spans) SELECT status FROM errs"))
                .isEqualTo(ErrorKind.UNKNOWN_COLUMN);
        }

        @Test
        @DisplayName("should reject functions outside the allow list")
        void shouldRejectDisallowedFunctions() {
            assertThat(rejectionKind("SELECT sleep(3) FROM spans")).isEqualTo(ErrorKind.DISALLOWED_FUNCTION);
        }

        @Test
        @DisplayName("should reject bind placeholders in user SQL")
        void shouldRejectPlaceholders() {
            assertThat(rejectionKind("SELECT name FROM spans WHERE status = ?")).isEqualTo(ErrorKind.DISALLOWED_STATEMENT);
        }

        @Test
        @DisplayName("should reject empty and malformed input")
        void shouldRejectMalformedInput() {
            assertThat(rejectionKind("")).isEqualTo(ErrorKind.SYNTAX_ERROR);
            assertThat(rejectionKind("SELEC name FROM spans")).isEqualTo(ErrorKind.SYNTAX_ERROR);
            assertThat(rejectionKind("SELECT name FROM spans WHERE name = 'open")).isEqualTo(ErrorKind.SYNTAX_ERROR);
        }

        @Test
        @DisplayName("should reject queries that read no table")
        void shouldRejectTablelessQueries() {
            assertThat(rejectionKind("SELECT 1")).isEqualTo(ErrorKind.INVALID_QUERY);
        }
    }

    @Nested
    @DisplayName("limits and literals")
    class LimitsAndLiterals {

        @Test
        @DisplayName("should clamp an oversized LIMIT and warn")
        void shouldClampLimit() {
            CompilationResult result = transpiler.validateAndTranspile("SELECT name FROM spans LIMIT 10000000", TENANT);

            assertThat(result.isValid()).isTrue();
            assertThat(result.getQuery().getParameter("limit").getValue()).isEqualTo(10_000L);
            assertThat(result.getWarnings()).hasSize(1);
            assertThat(result.getWarnings().get(0)).contains("10000000");
        }

        @Test
        @DisplayName("should keep a LIMIT within bounds and bind the offset")
        void shouldBindLimitAndOffset() {
            CompilationResult result = transpiler.validateAndTranspile("SELECT name FROM spans LIMIT 50 OFFSET 100", TENANT);

            assertThat(result.getWarnings()).isEmpty();
            assertThat(result.getQuery().getParameter("limit").getValue()).isEqualTo(50L);
            assertThat(result.getQuery().getParameter("offset").getValue()).isEqualTo(100L);
            assertThat(result.getQuery().getSql()).doesNotContain("50").doesNotContain("100");
        }

        @Test
        @DisplayName("should unescape quoted string literals into parameters")
        void shouldUnescapeLiterals() {
            CompiledQuery query = compile("SELECT name FROM spans WHERE name = 'O''Brien'");

            assertThat(query.getParameter("p_0").getValue()).isEqualTo("O'Brien");
            assertThat(query.getSql()).doesNotContain("Brien");
        }

        @Test
        @DisplayName("should substitute derived columns with their expression")
        void shouldSubstituteDerivedColumns() {
            CompiledQuery query = compile("SELECT duration FROM spans WHERE duration > 5");

            assertThat(query.getSql()).contains("toUnixTimestamp64Nano(spans.end_time)");
            assertThat(query.getSql()).contains("AS duration");
            assertThat(query.getParameter("p_0")).isEqualTo(QueryParameter.of(5L, DbType.INT64));
        }

        @Test
        @DisplayName("should compile identical input identically")
        void shouldBeDeterministic() {
            String sql = "SELECT s.name, count(*) AS n FROM spans s LEFT JOIN events e ON s.span_id = e.span_id "
                + "WHERE s.status = 'error' GROUP BY s.name ORDER BY n DESC LIMIT 20";

            CompilationResult first = transpiler.validateAndTranspile(sql, TENANT);
            CompilationResult second = transpiler.validateAndTranspile(sql, TENANT);

            assertThat(first).isEqualTo(second);
        }

        @Test
        @DisplayName("should allow functions added through configuration")
        void shouldHonorExtraFunctions() {
            QueryCompilerProperties properties = new QueryCompilerProperties(100, 24, "project_id",
                Set.of("sleep"), 10, 1);
            SqlTranspiler permissive = new SqlTranspiler(StaticSchemaRegistry.defaultRegistry(), properties);

            CompilationResult result = permissive.validateAndTranspile("SELECT sleep(3) FROM spans", TENANT);

            assertThat(result.isValid()).isTrue();
            assertThat(result.getQuery().getParameter("limit").getValue()).isEqualTo(100L);
        }

        @Test
        @DisplayName("should bind literals in ORDER BY")
        void shouldBindOrderByLiterals() {
            CompiledQuery query = compile("SELECT name FROM spans ORDER BY name = 'x; DROP TABLE y'");

            assertThat(query.getSql()).doesNotContain("DROP").contains("ORDER BY name = :p_0");
            assertThat(query.getParameter("p_0")).isEqualTo(QueryParameter.of("x; DROP TABLE y", DbType.STRING));
        }

        @Test
        @DisplayName("should bind literals in GROUP BY, nested ones included")
        void shouldBindGroupByLiterals() {
            CompiledQuery query = compile(
                "SELECT name FROM spans GROUP BY name, 'secret literal', concat(name, 'suffix')");

            assertThat(query.getSql()).doesNotContain("secret literal").doesNotContain("suffix");
            assertThat(query.getParameters().values()).contains(
                QueryParameter.of("secret literal", DbType.STRING),
                QueryParameter.of("suffix", DbType.STRING));
        }

        @Test
        @DisplayName("should keep positional GROUP BY and ORDER BY references inline")
        void shouldKeepPositions() {
            CompiledQuery query = compile("SELECT name, count(*) AS n FROM spans GROUP BY 1 ORDER BY 2 DESC");

            assertThat(query.getSql()).contains("GROUP BY 1").contains("ORDER BY 2 DESC");
            assertThat(query.getParameters()).containsOnlyKeys("project_id", "limit");
        }
    }

    @Nested
    @DisplayName("window clauses")
    class WindowClauses {

        @Test
        @DisplayName("should scope a sub-select inside OVER")
        void shouldScopeSubSelectInPartition() {
            CompiledQuery query = compile(
                "SELECT name, count(*) OVER (PARTITION BY (SELECT max(top_span_name) FROM traces)) AS c FROM spans");

            assertThat(query.getSql()).contains("traces.project_id = :project_id");
            assertThat(query.getSql()).contains("spans.project_id = :project_id");
        }

        @Test
        @DisplayName("should reject unknown tables and columns inside OVER")
        void shouldRejectUnknownReferences() {
            assertThat(rejectionKind("SELECT count(*) OVER (PARTITION BY secret_col) FROM spans"))
                .isEqualTo(ErrorKind.UNKNOWN_COLUMN);
            assertThat(rejectionKind("SELECT count(*) OVER (ORDER BY project_id) FROM spans"))
                .isEqualTo(ErrorKind.UNKNOWN_COLUMN);
            assertThat(rejectionKind("SELECT count(*) OVER (PARTITION BY (SELECT max(name) FROM secrets)) FROM spans"))
                .isEqualTo(ErrorKind.UNKNOWN_TABLE);
        }

        @Test
        @DisplayName("should bind the default value of an offset window function")
        void shouldBindLagDefault() {
            CompiledQuery query = compile(
                "SELECT lag(name, 1, 'none') OVER (ORDER BY start_time) AS previous FROM spans");

            assertThat(query.getSql()).doesNotContain("'none'");
            assertThat(query.getParameters().values()).contains(QueryParameter.of("none", DbType.STRING));
        }

        @Test
        @DisplayName("should check named WINDOW definitions")
        void shouldValidateNamedWindows() {
            assertThat(rejectionKind("SELECT count(*) OVER w AS c FROM spans WINDOW w AS (PARTITION BY secret_col)"))
                .isEqualTo(ErrorKind.UNKNOWN_COLUMN);
        }
    }
}
