package com.logstuff.query;

/**
 * Exception thrown when an operator is combined with a value shape it does not accept,
 * e.g. {@code level like 3} or {@code status in 200}.
 */
public class QueryTypeException extends InvalidQueryException {

    private final String field;

    public QueryTypeException(String message, String field) {
        super(message, null);
        this.field = field;
    }

    public String getField() {
        return field;
    }

    @Override
    public String getErrorCode() {
        return "type_error";
    }
}
