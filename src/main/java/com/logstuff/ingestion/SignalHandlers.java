package com.logstuff.ingestion;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sun.misc.Signal;
import sun.misc.SignalHandler;

/**
 * Process signals of the ingestion mode: {@code HUP} reopens log files, {@code TERM} and
 * {@code INT} stop the line loop once the event in flight is finished.
 */
public class SignalHandlers {
    private static final Logger logger = LoggerFactory.getLogger(SignalHandlers.class);

    public void install(LineProtocolRunner runner) {
        handle("HUP", signal -> {
            int reopened = LogFileReopener.reopenFileAppenders();
            logger.info("Received SIGHUP, reopened {} log file(s)", reopened);
        });
        handle("TERM", signal -> runner.requestStop(signal.getName()));
        handle("INT", signal -> runner.requestStop(signal.getName()));
    }

    private void handle(String name, SignalHandler handler) {
        try {
            Signal.handle(new Signal(name), handler);
        } catch (IllegalArgumentException e) {
            logger.warn("Cannot handle SIG{} on this platform: {}", name, e.getMessage());
        }
    }
}
