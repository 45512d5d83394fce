package com.logstuff;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.env.SimpleCommandLinePropertySource;
import org.springframework.core.env.StandardEnvironment;

/**
 * Main application class for Logstuff.
 *
 * Logstuff stores structured log events in a time-partitioned PostgreSQL table and lets
 * operators search them with LQL, a small boolean query language compiled to SQL.
 *
 * The same executable runs in one of two modes, chosen by {@code logstuff.mode}:
 * - {@code serve} (default): HTTP read API over the event store
 * - {@code ingest}: reads one JSON event per line on stdin, writes it to the right
 *   partition and confirms it with an {@code OK} line on stdout
 *
 * @since 0.1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class LogstuffApplication {

    public static final String MODE_PROPERTY = "logstuff.mode";
    public static final String MODE_SERVE = "serve";
    public static final String MODE_INGEST = "ingest";

    /**
     * Main entry point. In ingest mode the process exits with the code reported by the
     * line protocol runner once stdin is exhausted or a stop signal arrives.
     *
     * @param args command line arguments
     */
    public static void main(String[] args) {
        SpringApplication application = new SpringApplication(LogstuffApplication.class);
        String mode = resolveMode(args);

        if (MODE_INGEST.equals(mode)) {
            application.setAdditionalProfiles(MODE_INGEST);
            application.setWebApplicationType(WebApplicationType.NONE);
            ConfigurableApplicationContext context = application.run(args);
            System.exit(SpringApplication.exit(context));
        } else if (MODE_SERVE.equals(mode)) {
            application.run(args);
        } else {
            throw new IllegalArgumentException("Unknown " + MODE_PROPERTY + ": " + mode
                + " (expected " + MODE_SERVE + " or " + MODE_INGEST + ")");
        }
    }

    /**
     * Mode from the command line, system properties or environment ({@code LOGSTUFF_MODE}),
     * resolved before the application context exists.
     */
    static String resolveMode(String[] args) {
        StandardEnvironment environment = new StandardEnvironment();
        environment.getPropertySources().addFirst(new SimpleCommandLinePropertySource(args));
        return environment.getProperty(MODE_PROPERTY, MODE_SERVE).trim().toLowerCase();
    }
}
