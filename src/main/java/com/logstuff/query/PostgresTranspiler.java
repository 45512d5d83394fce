package com.logstuff.query;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Transpiles LQL expressions to PostgreSQL predicates over the event table.
 *
 * <p>Field values are read from the {@code jsonb} document column as text; numeric comparisons
 * go through a parse-or-null function so that a field holding {@code "3"} compares as 3 and a
 * non-numeric field never matches. Every leaf is wrapped in {@code coalesce(..., false)} so the
 * result is two-valued and {@code not} over a missing field matches.
 *
 * <p>User values are never written into the SQL text: every scalar becomes one {@code ?}
 * placeholder, numbered in left-to-right order of the expression tree.
 */
@Component
public class PostgresTranspiler {

    private static final Pattern COLUMN_NAME = Pattern.compile("[a-z_][a-z0-9_]*");
    private static final Pattern FUNCTION_NAME = Pattern.compile("([a-z_][a-z0-9_]*\\.)?[a-z_][a-z0-9_]*");
    private static final Pattern FIELD_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_.\\-]*");

    private final String documentColumn;
    private final String searchColumn;
    private final String numericFunction;

    public PostgresTranspiler(
            @org.springframework.beans.factory.annotation.Value("${logstuff.query.document-column:doc}") String documentColumn,
            @org.springframework.beans.factory.annotation.Value("${logstuff.query.search-column:search}") String searchColumn,
            @org.springframework.beans.factory.annotation.Value("${logstuff.query.numeric-function:to_number_or_null}") String numericFunction) {
        this.documentColumn = requireName(COLUMN_NAME, documentColumn, "document column");
        this.searchColumn = requireName(COLUMN_NAME, searchColumn, "search column");
        this.numericFunction = requireName(FUNCTION_NAME, numericFunction, "numeric function");
    }

    /**
     * Translate an expression tree into a SQL predicate.
     *
     * @throws QueryTypeException if an operator is used with a value shape it does not accept
     */
    public SqlPredicate transpile(Expression expression) {
        StringBuilder sql = new StringBuilder();
        List<Scalar> parameters = new ArrayList<>();
        appendExpression(expression, sql, parameters);
        return new SqlPredicate(sql.toString(), parameters);
    }

    public String getDocumentColumn() {
        return documentColumn;
    }

    public String getSearchColumn() {
        return searchColumn;
    }

    public String getNumericFunction() {
        return numericFunction;
    }

    private void appendExpression(Expression expr, StringBuilder sql, List<Scalar> parameters) {
        if (expr instanceof BinaryExpression) {
            BinaryExpression binary = (BinaryExpression) expr;
            sql.append('(');
            appendExpression(binary.getLeft(), sql, parameters);
            sql.append(binary.getOperator() == LogicalOperator.AND ? " AND " : " OR ");
            appendExpression(binary.getRight(), sql, parameters);
            sql.append(')');
        } else if (expr instanceof NotExpression) {
            sql.append("(NOT ");
            appendExpression(((NotExpression) expr).getOperand(), sql, parameters);
            sql.append(')');
        } else if (expr instanceof FullTextSearchExpression) {
            sql.append("coalesce(").append(searchColumn).append(" @@ websearch_to_tsquery(?), false)");
            parameters.add(Scalar.ofText(((FullTextSearchExpression) expr).getText()));
        } else if (expr instanceof ComparisonExpression) {
            appendComparison((ComparisonExpression) expr, sql, parameters);
        } else {
            throw new IllegalArgumentException("Unsupported expression: " + expr);
        }
    }

    private void appendComparison(ComparisonExpression comp, StringBuilder sql, List<Scalar> parameters) {
        String field = comp.getField();
        if (!FIELD_NAME.matcher(field).matches()) {
            throw new QueryTypeException("Invalid field name: " + field, field);
        }
        Operator operator = comp.getOperator();
        Value value = comp.getValue();

        switch (operator) {
            case IN -> {
                if (!value.isList()) {
                    throw new QueryTypeException("Operator 'in' requires a list, got " + value, field);
                }
                appendMembership(field, value.getList(), sql, parameters);
            }
            case EQ -> {
                if (value.isList()) {
                    appendMembership(field, value.getList(), sql, parameters);
                } else if (value.getScalar().isNumeric()) {
                    appendNumericComparison(field, "=", value.getScalar(), sql, parameters);
                } else {
                    sql.append("coalesce((").append(textOf(field)).append(") = ?, false)");
                    parameters.add(value.getScalar());
                }
            }
            case LIKE -> {
                if (value.isList() || value.getScalar().isNumeric()) {
                    throw new QueryTypeException("Operator 'like' requires a string pattern, got " + value, field);
                }
                sql.append("coalesce((").append(textOf(field)).append(") LIKE ?, false)");
                parameters.add(value.getScalar());
            }
            default -> {
                if (value.isList() || !value.getScalar().isNumeric()) {
                    throw new QueryTypeException("Operator '" + operator.getSymbol()
                        + "' requires a number, got " + value, field);
                }
                appendNumericComparison(field, operator.getSymbol(), value.getScalar(), sql, parameters);
            }
        }
    }

    private void appendNumericComparison(String field, String symbol, Scalar scalar,
                                         StringBuilder sql, List<Scalar> parameters) {
        sql.append("coalesce(").append(numericOf(field)).append(' ').append(symbol).append(" ?::numeric, false)");
        parameters.add(scalar);
    }

    private void appendMembership(String field, List<Scalar> values, StringBuilder sql, List<Scalar> parameters) {
        if (values.isEmpty()) {
            // Matches nothing regardless of the field
            sql.append("false");
            return;
        }
        boolean numeric = values.stream().allMatch(Scalar::isNumeric);
        String placeholder = numeric ? "?::numeric" : "?::text";

        sql.append("coalesce(");
        sql.append(numeric ? numericOf(field) : "(" + textOf(field) + ")");
        sql.append(" IN (");
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) sql.append(", ");
            sql.append(placeholder);
            parameters.add(values.get(i));
        }
        sql.append("), false)");
    }

    private String numericOf(String field) {
        return numericFunction + "(" + textOf(field) + ")";
    }

    /**
     * SQL reading a field as text. A dotted name is first looked up as a literal top-level key
     * and then as a nested path.
     */
    private String textOf(String field) {
        String flat = documentColumn + " ->> '" + field + "'";
        if (field.indexOf('.') < 0) {
            return flat;
        }
        String[] segments = field.split("\\.", -1);
        for (String segment : segments) {
            if (segment.isEmpty()) {
                return flat;
            }
        }
        return "coalesce(" + flat + ", " + documentColumn + " #>> '{" + String.join(",", segments) + "}')";
    }

    private static String requireName(Pattern pattern, String name, String what) {
        if (name == null || !pattern.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid " + what + " name: " + name);
        }
        return name;
    }
}
