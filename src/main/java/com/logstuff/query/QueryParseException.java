package com.logstuff.query;

import java.util.List;

/**
 * Exception thrown when an LQL query is malformed.
 * Carries the 0-based character offset of the offending input and the tokens
 * that would have been accepted there (empty for lexical errors).
 */
public class QueryParseException extends InvalidQueryException {

    private final int position;
    private final List<String> expected;

    public QueryParseException(String message, String query, int position, List<String> expected) {
        super(message, query);
        this.position = position;
        this.expected = List.copyOf(expected);
    }

    public QueryParseException(String message, String query, int position, Throwable cause) {
        super(message, query, cause);
        this.position = position;
        this.expected = List.of();
    }

    public int getPosition() {
        return position;
    }

    public List<String> getExpected() {
        return expected;
    }

    @Override
    public String getErrorCode() {
        return "parse_error";
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(super.getMessage());
        sb.append(" at position ").append(position);
        if (!expected.isEmpty()) {
            sb.append(", expected one of ").append(String.join(" ", expected));
        }
        return sb.toString();
    }
}
