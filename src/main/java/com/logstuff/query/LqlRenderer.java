package com.logstuff.query;

import java.math.BigDecimal;
import java.util.stream.Collectors;

/**
 * Prints an expression tree back to LQL text.
 * Binary and negated expressions are always parenthesized, so parsing the output yields
 * an equal tree.
 */
public final class LqlRenderer {

    private LqlRenderer() {
    }

    public static String render(Expression expr) {
        if (expr instanceof BinaryExpression) {
            BinaryExpression binary = (BinaryExpression) expr;
            return "(" + render(binary.getLeft()) + " " + binary.getOperator().getKeyword()
                + " " + render(binary.getRight()) + ")";
        } else if (expr instanceof NotExpression) {
            return "not (" + render(((NotExpression) expr).getOperand()) + ")";
        } else if (expr instanceof FullTextSearchExpression) {
            return quote(((FullTextSearchExpression) expr).getText());
        } else if (expr instanceof ComparisonExpression) {
            ComparisonExpression comp = (ComparisonExpression) expr;
            return comp.getField() + " " + comp.getOperator().getSymbol() + " " + render(comp.getValue());
        }
        throw new IllegalArgumentException("Unsupported expression: " + expr);
    }

    static String render(Value value) {
        if (value.isList()) {
            return value.getList().stream()
                .map(LqlRenderer::render)
                .collect(Collectors.joining(", ", "(", ")"));
        }
        return render(value.getScalar());
    }

    static String render(Scalar scalar) {
        return switch (scalar.getKind()) {
            case INT -> Long.toString(scalar.asLong());
            case FLOAT -> renderFloat(scalar.asDouble());
            case TEXT -> quote(scalar.asText());
        };
    }

    private static String renderFloat(double value) {
        if (value == 0.0 && Double.doubleToRawLongBits(value) != 0L) {
            return "-0.0";
        }
        String plain = BigDecimal.valueOf(value).toPlainString();
        return plain.indexOf('.') < 0 ? plain + ".0" : plain;
    }

    private static String quote(String text) {
        StringBuilder sb = new StringBuilder(text.length() + 2).append('"');
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\t' -> sb.append("\\t");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }
}
