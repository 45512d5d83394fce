package com.logstuff.storage;

/**
 * Store failure that may succeed on retry (connection reset, timeout, serialization failure).
 */
public class TransientStoreException extends StoreException {

    public TransientStoreException(String message, String sqlState, Throwable cause) {
        super(message, sqlState, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
