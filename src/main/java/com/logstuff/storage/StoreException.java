package com.logstuff.storage;

/**
 * Failure of the relational store, carrying the SQLSTATE when the driver reported one.
 */
public abstract class StoreException extends RuntimeException {

    private final String sqlState;

    protected StoreException(String message, String sqlState, Throwable cause) {
        super(message, cause);
        this.sqlState = sqlState;
    }

    public String getSqlState() {
        return sqlState;
    }

    public abstract boolean isRetryable();

    /**
     * The message without SQLSTATE and driver detail, which may quote the failed statement.
     */
    public String getBaseMessage() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(super.getMessage());
        if (sqlState != null) {
            sb.append(" [SQLSTATE: ").append(sqlState).append("]");
        }
        if (getCause() != null && getCause().getMessage() != null) {
            sb.append(": ").append(getCause().getMessage());
        }
        return sb.toString();
    }
}
