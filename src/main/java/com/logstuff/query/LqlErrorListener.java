package com.logstuff.query;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.Lexer;
import org.antlr.v4.runtime.LexerNoViableAltException;
import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.Vocabulary;
import org.antlr.v4.runtime.misc.IntervalSet;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns the first lexer or parser error into a {@link QueryParseException}.
 * ANTLR's recovery is never attempted: a query either parses completely or is rejected.
 */
class LqlErrorListener extends BaseErrorListener {

    private final String query;

    LqlErrorListener(String query) {
        this.query = query;
    }

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                            int charPositionInLine, String msg, RecognitionException e) {
        if (recognizer instanceof Lexer) {
            int position = e instanceof LexerNoViableAltException
                ? ((LexerNoViableAltException) e).getStartIndex()
                : offsetOf(line, charPositionInLine);
            throw new QueryParseException(describeCharacter(position), query, position, List.of());
        }

        Token token = (Token) offendingSymbol;
        int position = token.getStartIndex() >= 0 ? token.getStartIndex() : query.length();
        String message = token.getType() == Token.EOF
            ? "Unexpected end of query"
            : "Unexpected token '" + token.getText() + "'";
        throw new QueryParseException(message, query, position, expectedTokens(recognizer, e));
    }

    private List<String> expectedTokens(Recognizer<?, ?> recognizer, RecognitionException e) {
        IntervalSet expected = null;
        if (e != null) {
            expected = e.getExpectedTokens();
        } else if (recognizer instanceof Parser) {
            expected = ((Parser) recognizer).getExpectedTokens();
        }
        if (expected == null) {
            return List.of();
        }

        Vocabulary vocabulary = recognizer.getVocabulary();
        List<String> names = new ArrayList<>();
        for (Integer type : expected.toList()) {
            names.add(vocabulary.getDisplayName(type));
        }
        return names;
    }

    private String describeCharacter(int position) {
        if (position >= query.length()) {
            return "Unexpected end of query";
        }
        char c = query.charAt(position);
        if (c == '"' || c == '\'') {
            return "Unterminated string or invalid escape";
        }
        return "Unexpected character '" + c + "'";
    }

    private int offsetOf(int line, int charPositionInLine) {
        int offset = 0;
        for (int current = 1; current < line && offset < query.length(); offset++) {
            if (query.charAt(offset) == '\n') {
                current++;
            }
        }
        return offset + charPositionInLine;
    }
}
