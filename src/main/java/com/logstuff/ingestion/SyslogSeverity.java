package com.logstuff.ingestion;

/**
 * Syslog severities by numeric code (RFC 5424).
 */
public enum SyslogSeverity {
    EMERGENCY,
    ALERT,
    CRITICAL,
    ERROR,
    WARNING,
    NOTICE,
    INFO,
    DEBUG;

    public String getLabel() {
        return name().toLowerCase();
    }

    /**
     * @throws IllegalArgumentException if the code is not 0-7
     */
    public static SyslogSeverity fromCode(String code) {
        int value = parseCode(code);
        if (value < 0 || value >= values().length) {
            throw new IllegalArgumentException("Invalid syslog severity: " + code);
        }
        return values()[value];
    }

    static int parseCode(String code) {
        try {
            return Integer.parseInt(code.trim());
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
