package com.logstuff.storage.partition;

/**
 * Exception thrown when the partition configuration cannot produce valid, unambiguous
 * table names. Raised while validating configuration at startup, never per event.
 */
public class PartitionResolutionException extends RuntimeException {

    private final String template;

    public PartitionResolutionException(String message) {
        super(message);
        this.template = null;
    }

    public PartitionResolutionException(String message, String template) {
        super(message);
        this.template = template;
    }

    public String getTemplate() {
        return template;
    }

    @Override
    public String getMessage() {
        if (template == null) {
            return super.getMessage();
        }
        return super.getMessage() + " [Template: " + template + "]";
    }
}
