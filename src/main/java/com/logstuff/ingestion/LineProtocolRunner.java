package com.logstuff.ingestion;

import com.logstuff.storage.FatalStoreException;
import com.logstuff.storage.InsertStatementCache;
import com.logstuff.storage.PinnedConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.sql.SQLException;
import java.util.function.IntConsumer;

/**
 * The stdin/stdout protocol of the ingestion mode.
 *
 * <p>Once the database is reachable a single {@code OK} line announces readiness. After that
 * every confirmed input line is answered with exactly one {@code OK}, in input order, and only
 * after the event is durably handled. A fatal store error ends the loop without answering the
 * current line and makes the process exit with status 1.
 */
public class LineProtocolRunner implements CommandLineRunner, ExitCodeGenerator {
    private static final Logger logger = LoggerFactory.getLogger(LineProtocolRunner.class);

    static final String CONFIRMATION = "OK";

    static final int EXIT_FATAL = 1;

    private final EventIngester ingester;
    private final PinnedConnection connection;
    private final InsertStatementCache statementCache;
    private final SignalHandlers signalHandlers;
    private final InputStream in;
    private final PrintStream out;
    private final IntConsumer terminator;

    private final Object lock = new Object();
    private boolean busy;
    private boolean stopRequested;
    private volatile int exitCode;
    private long confirmedLines;

    public LineProtocolRunner(EventIngester ingester,
                              PinnedConnection connection,
                              InsertStatementCache statementCache,
                              SignalHandlers signalHandlers,
                              InputStream in,
                              PrintStream out,
                              IntConsumer terminator) {
        this.ingester = ingester;
        this.connection = connection;
        this.statementCache = statementCache;
        this.signalHandlers = signalHandlers;
        this.in = in;
        this.out = out;
        this.terminator = terminator;
    }

    @Override
    public void run(String... args) {
        if (signalHandlers != null) {
            signalHandlers.install(this);
        }
        try {
            connection.get();
        } catch (SQLException e) {
            logger.error("Cannot connect to the database: {}", e.getMessage(), e);
            exitCode = EXIT_FATAL;
            return;
        }
        logger.info("Connected, waiting for events on stdin");
        if (!confirm()) {
            return;
        }

        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        try {
            String line;
            while ((line = reader.readLine()) != null) {
                synchronized (lock) {
                    if (stopRequested) {
                        break;
                    }
                    busy = true;
                }
                try {
                    if (ingester.process(line).isConfirmed()) {
                        if (!confirm()) {
                            break;
                        }
                        confirmedLines++;
                    }
                } finally {
                    synchronized (lock) {
                        busy = false;
                    }
                }
                synchronized (lock) {
                    if (stopRequested) {
                        break;
                    }
                }
            }
            logger.info("Stopping after {} confirmed line(s)", confirmedLines);
        } catch (FatalStoreException e) {
            logger.error("Fatal store error, the current event is not confirmed: {}", e.getMessage(), e);
            exitCode = EXIT_FATAL;
        } catch (IOException e) {
            logger.error("Failed to read stdin: {}", e.getMessage(), e);
            exitCode = EXIT_FATAL;
        } finally {
            statementCache.invalidateAll();
            connection.close();
        }
    }

    /**
     * Called from a signal handler thread. While idle the process ends right away since the
     * reader cannot be interrupted; otherwise the loop ends after the current event.
     */
    public void requestStop(String signal) {
        boolean idle;
        synchronized (lock) {
            stopRequested = true;
            idle = !busy;
        }
        if (idle) {
            logger.info("Received SIG{} while idle, exiting", signal);
            terminator.accept(0);
        } else {
            logger.info("Received SIG{}, exiting after the current event", signal);
        }
    }

    private boolean confirm() {
        out.print(CONFIRMATION + "\n");
        out.flush();
        if (out.checkError()) {
            logger.error("Cannot write confirmations, stdout is closed");
            exitCode = EXIT_FATAL;
            return false;
        }
        return true;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    public long getConfirmedLines() {
        return confirmedLines;
    }

    public boolean isStopRequested() {
        synchronized (lock) {
            return stopRequested;
        }
    }
}
