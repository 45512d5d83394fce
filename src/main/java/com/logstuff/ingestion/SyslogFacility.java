package com.logstuff.ingestion;

/**
 * Syslog facilities by numeric code.
 */
public enum SyslogFacility {
    KERN,
    USER,
    MAIL,
    DAEMON,
    AUTH,
    SYSLOG,
    LPR,
    NEWS,
    UUCP,
    CRON,
    AUTHPRIV,
    FTP,
    NTP,
    SECURITY,
    CONSOLE,
    SOLARISCRON,
    LOCAL0,
    LOCAL1,
    LOCAL2,
    LOCAL3,
    LOCAL4,
    LOCAL5,
    LOCAL6,
    LOCAL7;

    public String getLabel() {
        return name().toLowerCase();
    }

    /**
     * @throws IllegalArgumentException if the code is not 0-23
     */
    public static SyslogFacility fromCode(String code) {
        int value = SyslogSeverity.parseCode(code);
        if (value < 0 || value >= values().length) {
            throw new IllegalArgumentException("Invalid syslog facility: " + code);
        }
        return values()[value];
    }
}
