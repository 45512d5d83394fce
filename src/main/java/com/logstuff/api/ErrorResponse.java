package com.logstuff.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Error body of the read API. {@code position} and {@code expected} are set for query parse
 * errors, {@code field} for type errors, {@code retryable} for store failures.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    @JsonProperty("error")
    private final String error;

    @JsonProperty("message")
    private final String message;

    @JsonProperty("position")
    private final Integer position;

    @JsonProperty("expected")
    private final List<String> expected;

    @JsonProperty("field")
    private final String field;

    @JsonProperty("retryable")
    private final Boolean retryable;

    public ErrorResponse(String error, String message, Integer position, List<String> expected,
                         String field, Boolean retryable) {
        this.error = error;
        this.message = message;
        this.position = position;
        this.expected = expected;
        this.field = field;
        this.retryable = retryable;
    }

    public static ErrorResponse of(String error, String message) {
        return new ErrorResponse(error, message, null, null, null, null);
    }

    public String getError() {
        return error;
    }

    public String getMessage() {
        return message;
    }

    public Integer getPosition() {
        return position;
    }

    public List<String> getExpected() {
        return expected;
    }

    public String getField() {
        return field;
    }

    public Boolean getRetryable() {
        return retryable;
    }
}
