package com.logstuff.api;

import com.logstuff.LogstuffApplication;
import com.logstuff.query.InvalidQueryException;
import com.logstuff.query.QueryParseException;
import com.logstuff.query.QueryTypeException;
import com.logstuff.storage.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps read path failures to HTTP responses: invalid queries and parameters to 400, transient
 * store failures to 503 and everything else to 500. Store failures are logged in full; the
 * response only carries their base message since driver detail may quote the statement.
 */
@RestControllerAdvice
@Profile("!" + LogstuffApplication.MODE_INGEST)
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(InvalidQueryException.class)
    public ResponseEntity<ErrorResponse> handleInvalidQuery(InvalidQueryException ex) {
        ErrorResponse body;
        if (ex instanceof QueryParseException) {
            QueryParseException parse = (QueryParseException) ex;
            body = new ErrorResponse(ex.getErrorCode(), ex.getMessage(), parse.getPosition(),
                parse.getExpected(), null, null);
        } else if (ex instanceof QueryTypeException) {
            body = new ErrorResponse(ex.getErrorCode(), ex.getMessage(), null, null,
                ((QueryTypeException) ex).getField(), null);
        } else {
            body = ErrorResponse.of(ex.getErrorCode(), ex.getMessage());
        }
        log.debug("Rejected query {}: {}", ex.getQuery(), ex.getMessage());
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler({
        IllegalArgumentException.class,
        MissingServletRequestParameterException.class,
        MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ErrorResponse> handleBadParameter(Exception ex) {
        log.debug("Rejected request: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(ErrorResponse.of("bad_request", ex.getMessage()));
    }

    @ExceptionHandler(StoreException.class)
    public ResponseEntity<ErrorResponse> handleStore(StoreException ex) {
        if (ex.isRetryable()) {
            log.warn("Search unavailable: {}", ex.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ErrorResponse("unavailable", ex.getBaseMessage(), null, null, null, true));
        }
        log.error("Search failed: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ErrorResponse("store_error", ex.getBaseMessage(), null, null, null, false));
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(RuntimeException ex) {
        log.error("Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(ErrorResponse.of("internal_error", "Internal server error"));
    }
}
