package com.logstuff.ingestion;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.FileAppender;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

import java.util.Iterator;

/**
 * Reopens Logback file appenders so that a rotated log file is released and recreated.
 */
public final class LogFileReopener {

    private LogFileReopener() {
    }

    /**
     * @return the number of file appenders reopened
     */
    public static int reopenFileAppenders() {
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (!(factory instanceof LoggerContext)) {
            return 0;
        }
        LoggerContext context = (LoggerContext) factory;
        int reopened = 0;
        for (Logger logger : context.getLoggerList()) {
            Iterator<Appender<ILoggingEvent>> appenders = logger.iteratorForAppenders();
            while (appenders.hasNext()) {
                Appender<ILoggingEvent> appender = appenders.next();
                if (appender instanceof FileAppender && appender.isStarted()) {
                    // start() opens the configured file again
                    appender.stop();
                    appender.start();
                    reopened++;
                }
            }
        }
        return reopened;
    }
}
