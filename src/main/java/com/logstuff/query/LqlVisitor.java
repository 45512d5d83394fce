package com.logstuff.query;

import com.logstuff.query.parser.LQLBaseVisitor;
import com.logstuff.query.parser.LQLParser;
import org.antlr.v4.runtime.tree.TerminalNode;

import java.util.ArrayList;
import java.util.List;

/**
 * ANTLR visitor for building the LQL expression tree
 */
public class LqlVisitor extends LQLBaseVisitor<Expression> {

    private final String query;

    public LqlVisitor(String query) {
        this.query = query;
    }

    @Override
    public Expression visitQuery(LQLParser.QueryContext ctx) {
        return extractExpression(ctx.expression());
    }

    private Expression extractExpression(LQLParser.ExpressionContext ctx) {
        if (ctx instanceof LQLParser.OrExpressionContext) {
            LQLParser.OrExpressionContext orCtx = (LQLParser.OrExpressionContext) ctx;
            Expression left = extractExpression(orCtx.expression());
            Expression right = extractConjunction(orCtx.conjunction());
            return BinaryExpression.or(left, right);
        }
        return extractConjunction(((LQLParser.SingleConjunctionContext) ctx).conjunction());
    }

    private Expression extractConjunction(LQLParser.ConjunctionContext ctx) {
        if (ctx instanceof LQLParser.AndExpressionContext) {
            LQLParser.AndExpressionContext andCtx = (LQLParser.AndExpressionContext) ctx;
            Expression left = extractConjunction(andCtx.conjunction());
            Expression right = extractNegation(andCtx.negation());
            return BinaryExpression.and(left, right);
        }
        return extractNegation(((LQLParser.SingleNegationContext) ctx).negation());
    }

    private Expression extractNegation(LQLParser.NegationContext ctx) {
        if (ctx instanceof LQLParser.NotExpressionContext) {
            return new NotExpression(extractPrimary(((LQLParser.NotExpressionContext) ctx).primary()));
        }
        return extractPrimary(((LQLParser.PlainPrimaryContext) ctx).primary());
    }

    private Expression extractPrimary(LQLParser.PrimaryContext ctx) {
        if (ctx instanceof LQLParser.ParenExpressionContext) {
            return extractExpression(((LQLParser.ParenExpressionContext) ctx).expression());
        } else if (ctx instanceof LQLParser.ComparisonExpressionContext) {
            LQLParser.ComparisonExpressionContext compCtx = (LQLParser.ComparisonExpressionContext) ctx;
            String field = compCtx.IDENTIFIER().getText();
            Operator operator = Operator.fromSymbol(compCtx.operator().getText());
            return new ComparisonExpression(field, operator, extractValue(compCtx.value()));
        }
        TerminalNode string = ((LQLParser.FullTextExpressionContext) ctx).STRING();
        return new FullTextSearchExpression(unquote(string.getText()));
    }

    private Value extractValue(LQLParser.ValueContext ctx) {
        if (ctx instanceof LQLParser.ListValueContext) {
            List<Scalar> scalars = new ArrayList<>();
            for (LQLParser.ScalarContext scalarCtx : ((LQLParser.ListValueContext) ctx).scalar()) {
                scalars.add(extractScalar(scalarCtx));
            }
            return Value.list(scalars);
        }
        return Value.of(extractScalar(((LQLParser.ScalarValueContext) ctx).scalar()));
    }

    private Scalar extractScalar(LQLParser.ScalarContext ctx) {
        if (ctx.STRING() != null) {
            return Scalar.ofText(unquote(ctx.STRING().getText()));
        }
        TerminalNode number = ctx.INTEGER() != null ? ctx.INTEGER() : ctx.FLOAT();
        String text = number.getText();
        try {
            if (ctx.INTEGER() != null) {
                return Scalar.ofInt(Long.parseLong(text));
            }
            return Scalar.ofFloat(Double.parseDouble(text));
        } catch (IllegalArgumentException e) {
            // Long overflow, or a float literal beyond double range
            throw new QueryParseException("Numeric literal out of range: " + text, query,
                number.getSymbol().getStartIndex(), e);
        }
    }

    /**
     * Strip the surrounding quotes and resolve escape sequences. The lexer only admits
     * the escapes \t \n \r \" \' and \\.
     */
    static String unquote(String quoted) {
        String body = quoted.substring(1, quoted.length() - 1);
        if (body.indexOf('\\') < 0) {
            return body;
        }
        StringBuilder sb = new StringBuilder(body.length());
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c != '\\') {
                sb.append(c);
                continue;
            }
            char escaped = body.charAt(++i);
            sb.append(switch (escaped) {
                case 't' -> '\t';
                case 'n' -> '\n';
                case 'r' -> '\r';
                default -> escaped;
            });
        }
        return sb.toString();
    }
}
