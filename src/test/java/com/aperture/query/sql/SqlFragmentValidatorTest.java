package com.aperture.query.sql;

import com.aperture.query.ErrorKind;
import com.aperture.query.ParameterSet;
import com.aperture.query.QueryCompilerProperties;
import com.aperture.query.QueryParameter;
import com.aperture.query.QueryValidationException;
import com.aperture.schema.DbType;
import com.aperture.schema.StaticSchemaRegistry;
import com.aperture.schema.TableSchema;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SqlFragmentValidator")
class SqlFragmentValidatorTest {

    private SqlFragmentValidator validator;
    private TableSchema spans;
    private ParameterSet parameters;

    @BeforeEach
    void setUp() {
        validator = new SqlFragmentValidator(QueryCompilerProperties.defaults());
        spans = StaticSchemaRegistry.defaultRegistry().resolveTable("spans").orElseThrow();
        parameters = new ParameterSet();
    }

    @Test
    @DisplayName("should accept an aggregate over known columns and bind its literals")
    void shouldAcceptKnownColumns() {
        // When
        String sql = validator.validate("countIf(status = 'error')", spans, parameters);

        // Then
        assertThat(sql).isEqualTo("countIf(status = :m_0)");
        assertThat(parameters.asMap()).containsEntry("m_0", QueryParameter.of("error", DbType.STRING));
    }

    @Test
    @DisplayName("should expand derived columns")
    void shouldExpandDerivedColumns() {
        String sql = validator.validate("avg(duration)", spans, parameters);

        assertThat(sql).contains("toUnixTimestamp64Nano(spans.end_time)");
        assertThat(sql).doesNotContain("avg(duration)");
    }

    @Test
    @DisplayName("should reject columns the table does not expose")
    void shouldRejectUnknownColumns() {
        assertThatThrownBy(() -> validator.validate("sum(project_id)", spans, parameters))
            .isInstanceOf(QueryValidationException.class)
            .extracting(e -> ((QueryValidationException) e).getKind())
            .isEqualTo(ErrorKind.UNKNOWN_COLUMN);
        assertThatThrownBy(() -> validator.validate("max(traces.start_time)", spans, parameters))
            .isInstanceOf(QueryValidationException.class);
    }

    @Test
    @DisplayName("should reject disallowed functions and sub-selects")
    void shouldRejectUnsafeExpressions() {
        assertThatThrownBy(() -> validator.validate("sleep(3)", spans, parameters))
            .isInstanceOf(QueryValidationException.class)
            .extracting(e -> ((QueryValidationException) e).getKind())
            .isEqualTo(ErrorKind.DISALLOWED_FUNCTION);
        assertThatThrownBy(() -> validator.validate("count(*) + (SELECT count(*) FROM traces)", spans, parameters))
            .isInstanceOf(QueryValidationException.class)
            .extracting(e -> ((QueryValidationException) e).getKind())
            .isEqualTo(ErrorKind.DISALLOWED_STATEMENT);
    }

    @Test
    @DisplayName("should check window clauses like the rest of the expression")
    void shouldValidateWindowClauses() {
        assertThatThrownBy(() -> validator.validate(
            "count(*) OVER (PARTITION BY (SELECT max(top_span_name) FROM traces))", spans, parameters))
            .isInstanceOf(QueryValidationException.class)
            .extracting(e -> ((QueryValidationException) e).getKind())
            .isEqualTo(ErrorKind.DISALLOWED_STATEMENT);
        assertThatThrownBy(() -> validator.validate("count(*) OVER (PARTITION BY secret_col)", spans, parameters))
            .isInstanceOf(QueryValidationException.class)
            .extracting(e -> ((QueryValidationException) e).getKind())
            .isEqualTo(ErrorKind.UNKNOWN_COLUMN);
        assertThatThrownBy(() -> validator.validate("count(*) OVER (ORDER BY project_id)", spans, parameters))
            .isInstanceOf(QueryValidationException.class)
            .extracting(e -> ((QueryValidationException) e).getKind())
            .isEqualTo(ErrorKind.UNKNOWN_COLUMN);
    }

    @Test
    @DisplayName("should bind literals inside a window clause")
    void shouldBindWindowLiterals() {
        String sql = validator.validate("count(*) OVER (PARTITION BY concat(status, 'error'))", spans, parameters);

        assertThat(sql).doesNotContain("'error'");
        assertThat(parameters.asMap()).containsEntry("m_0", QueryParameter.of("error", DbType.STRING));
    }

    @Test
    @DisplayName("should reject statement separators and comments")
    void shouldRejectSeparators() {
        assertThatThrownBy(() -> validator.validate("count(*);", spans, parameters))
            .isInstanceOf(QueryValidationException.class);
        assertThatThrownBy(() -> validator.validate("count(*) -- x", spans, parameters))
            .isInstanceOf(QueryValidationException.class);
    }
}
