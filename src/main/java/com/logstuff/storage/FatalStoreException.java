package com.logstuff.storage;

/**
 * Store failure that retrying cannot fix, such as bad credentials or a schema mismatch.
 * Terminates an ingestion process; fails a single read request.
 */
public class FatalStoreException extends StoreException {

    public FatalStoreException(String message, String sqlState, Throwable cause) {
        super(message, sqlState, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
