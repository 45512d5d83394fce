package com.logstuff.query;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for PostgresTranspiler
 */
class PostgresTranspilerTest {

    private LqlCompiler compiler;

    @BeforeEach
    void setUp() {
        compiler = new LqlCompiler(new PostgresTranspiler("doc", "search", "to_number_or_null"));
    }

    @Test
    void testExactMatchAndNumericCoercion() {
        // Given: A text equality combined with a numeric ordering
        String query = "hostname = \"web1\" and level >= 3";

        // When: Compiling to SQL
        SqlPredicate predicate = compiler.compile(query);

        // Then: Text is compared as text, the number through the parse-or-null function
        assertThat(predicate.getSql()).isEqualTo(
            "(coalesce((doc ->> 'hostname') = ?, false)"
                + " AND coalesce(to_number_or_null(doc ->> 'level') >= ?::numeric, false))");
        assertThat(predicate.getParameters()).containsExactly(Scalar.ofText("web1"), Scalar.ofInt(3));
    }

    @Test
    void testBareStringCompilesToFullTextSearchOnly() {
        SqlPredicate predicate = compiler.compile("\"connection refused\"");

        assertThat(predicate.getSql()).isEqualTo("coalesce(search @@ websearch_to_tsquery(?), false)");
        assertThat(predicate.getParameters()).containsExactly(Scalar.ofText("connection refused"));
        assertThat(predicate.getSql()).doesNotContain("->>");
    }

    @Test
    void testNegatedMembership() {
        SqlPredicate predicate = compiler.compile("not (status in (200, 301, 302))");

        assertThat(predicate.getSql()).isEqualTo(
            "(NOT coalesce(to_number_or_null(doc ->> 'status') IN (?::numeric, ?::numeric, ?::numeric), false))");
        assertThat(predicate.toJdbcArguments()).containsExactly(200L, 301L, 302L);
    }

    @Test
    void testEmptyListMatchesNothing() {
        SqlPredicate inEmpty = compiler.compile("anything in ()");
        SqlPredicate eqEmpty = compiler.compile("other.field = ()");

        assertThat(inEmpty.getSql()).isEqualTo("false");
        assertThat(inEmpty.getParameters()).isEmpty();
        assertThat(eqEmpty.getSql()).isEqualTo("false");
    }

    @Test
    void testListEqualityIsMembership() {
        assertThat(compiler.compile("status = (1, 2)").getSql())
            .isEqualTo(compiler.compile("status in (1, 2)").getSql());
    }

    @Test
    void testListWithTextComparesAsText() {
        SqlPredicate predicate = compiler.compile("code in (\"E1\", 2)");

        assertThat(predicate.getSql()).isEqualTo("coalesce((doc ->> 'code') IN (?::text, ?::text), false)");
        assertThat(predicate.getParameters()).containsExactly(Scalar.ofText("E1"), Scalar.ofInt(2));
    }

    @Test
    void testLikePassesPatternThrough() {
        SqlPredicate predicate = compiler.compile("programname like \"ssh%\"");

        assertThat(predicate.getSql()).isEqualTo("coalesce((doc ->> 'programname') LIKE ?, false)");
        assertThat(predicate.getParameters()).containsExactly(Scalar.ofText("ssh%"));
    }

    @Test
    void testFloatEquality() {
        SqlPredicate predicate = compiler.compile("ratio = 0.5");

        assertThat(predicate.getSql()).isEqualTo("coalesce(to_number_or_null(doc ->> 'ratio') = ?::numeric, false)");
        assertThat(predicate.toJdbcArguments()).containsExactly(0.5d);
    }

    @Test
    void testDottedFieldFallsBackToNestedPath() {
        SqlPredicate predicate = compiler.compile("vars.user-name = \"root\"");

        assertThat(predicate.getSql()).isEqualTo(
            "coalesce((coalesce(doc ->> 'vars.user-name', doc #>> '{vars,user-name}')) = ?, false)");
    }

    @Test
    void testDottedFieldWithEmptySegmentUsesFlatKeyOnly() {
        SqlPredicate predicate = compiler.compile("a..b = 1");

        assertThat(predicate.getSql()).isEqualTo("coalesce(to_number_or_null(doc ->> 'a..b') = ?::numeric, false)");
    }

    @Test
    void testBooleanStructureIsParenthesized() {
        SqlPredicate predicate = compiler.compile("\"a\" or \"b\" and not \"c\"");

        assertThat(predicate.getSql()).isEqualTo(
            "(coalesce(search @@ websearch_to_tsquery(?), false) OR "
                + "(coalesce(search @@ websearch_to_tsquery(?), false) AND "
                + "(NOT coalesce(search @@ websearch_to_tsquery(?), false))))");
        assertThat(predicate.getParameters()).extracting(Scalar::asText).containsExactly("a", "b", "c");
    }

    @Test
    void testValuesAreNeverInlined() {
        // Given: A query whose values look like SQL
        String query = "msg = \"'; DROP TABLE logs; --\" or host in (\"x' OR '1'='1\", 7, 2.5) or \"evil'text\"";

        // When: Compiling
        SqlPredicate predicate = compiler.compile(query);

        // Then: No value reaches the SQL text and each scalar has one placeholder
        assertThat(predicate.getSql()).doesNotContain("DROP", "OR '1'", "evil", "2.5");
        assertThat(predicate.getParameters()).hasSize(5);
        assertThat(predicate.getSql().chars().filter(c -> c == '?').count()).isEqualTo(5);
    }

    @Test
    void testParametersFollowTreeOrder() {
        Expression expr = BinaryExpression.and(
            new NotExpression(new ComparisonExpression("a", Operator.IN,
                Value.list(Scalar.ofInt(1), Scalar.ofInt(2)))),
            BinaryExpression.or(
                new FullTextSearchExpression("x"),
                new ComparisonExpression("b", Operator.LT, Value.of(Scalar.ofFloat(3.5)))));

        SqlPredicate predicate = new PostgresTranspiler("doc", "search", "to_number_or_null").transpile(expr);

        assertThat(predicate.getParameters()).containsExactly(
            Scalar.ofInt(1), Scalar.ofInt(2), Scalar.ofText("x"), Scalar.ofFloat(3.5));
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "level like 3",
        "level like (\"a\")",
        "level > \"3\"",
        "level <= (1, 2)",
        "status in 200",
        "status in \"200\""
    })
    void testTypeMismatchesAreRejected(String query) {
        assertThatThrownBy(() -> compiler.compile(query))
            .isInstanceOf(QueryTypeException.class)
            .satisfies(e -> assertThat(((QueryTypeException) e).getErrorCode()).isEqualTo("type_error"));
    }

    @Test
    void testTypeMismatchInsideLargerExpressionIsRejected() {
        assertThatThrownBy(() -> compiler.compile("a = 1 and not (b = 2 or c like 4)"))
            .isInstanceOf(QueryTypeException.class)
            .extracting(e -> ((QueryTypeException) e).getField())
            .isEqualTo("c");
    }

    @Test
    void testProgrammaticFieldNamesAreValidated() {
        Expression expr = new ComparisonExpression("x') OR true --", Operator.EQ, Value.of(Scalar.ofInt(1)));

        assertThatThrownBy(() -> new PostgresTranspiler("doc", "search", "to_number_or_null").transpile(expr))
            .isInstanceOf(QueryTypeException.class);
    }

    @Test
    void testCustomColumnsAndFunction() {
        PostgresTranspiler transpiler = new PostgresTranspiler("body", "fts", "util.try_numeric");

        SqlPredicate predicate = transpiler.transpile(new ComparisonExpression("n", Operator.GT,
            Value.of(Scalar.ofInt(1))));

        assertThat(predicate.getSql()).isEqualTo("coalesce(util.try_numeric(body ->> 'n') > ?::numeric, false)");
    }

    @ParameterizedTest
    @ValueSource(strings = {"Doc", "doc; drop", "", "1doc"})
    void testInvalidColumnNamesAreRejected(String column) {
        assertThatThrownBy(() -> new PostgresTranspiler(column, "search", "to_number_or_null"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testScalarCountMatchesParameterCount() {
        List<String> queries = List.of(
            "a = 1",
            "a in (1, 2, 3) and b = \"x\"",
            "not (a in ()) or \"fts\" and c like \"%\"",
            "((a = 1))");
        for (String query : queries) {
            SqlPredicate predicate = compiler.compile(query);
            long placeholders = predicate.getSql().chars().filter(c -> c == '?').count();
            assertThat(predicate.getParameters()).as(query).hasSize((int) placeholders);
        }
    }
}
