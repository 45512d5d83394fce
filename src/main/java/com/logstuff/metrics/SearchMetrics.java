package com.logstuff.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Metrics collector for the read API.
 * Tracks search latency, rejected queries, store failures by kind and page sizes.
 */
@Component
public class SearchMetrics {

    @Autowired
    private MeterRegistry meterRegistry;

    private Counter searchesExecuted;
    private Counter queriesRejected;
    private Counter transientFailures;
    private Counter fatalFailures;
    private Counter searchesTimedOut;
    private Timer searchLatency;
    private DistributionSummary pageSize;

    public SearchMetrics() {
    }

    SearchMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        init();
    }

    @PostConstruct
    public void init() {
        searchesExecuted = Counter.builder("logstuff.search.executed")
            .description("Total number of searches answered")
            .register(meterRegistry);

        queriesRejected = Counter.builder("logstuff.search.rejected")
            .description("Total number of searches with an invalid query or parameters")
            .register(meterRegistry);

        transientFailures = Counter.builder("logstuff.search.failed")
            .description("Total number of searches failed by the store")
            .tag("kind", "transient")
            .register(meterRegistry);

        fatalFailures = Counter.builder("logstuff.search.failed")
            .description("Total number of searches failed by the store")
            .tag("kind", "fatal")
            .register(meterRegistry);

        searchesTimedOut = Counter.builder("logstuff.search.timedout")
            .description("Total number of searches that exceeded the request timeout")
            .register(meterRegistry);

        searchLatency = Timer.builder("logstuff.search.latency")
            .description("Latency of a complete search request")
            .publishPercentiles(0.5, 0.95, 0.99)
            .minimumExpectedValue(Duration.ofMillis(1))
            .maximumExpectedValue(Duration.ofSeconds(30))
            .register(meterRegistry);

        pageSize = DistributionSummary.builder("logstuff.search.page.size")
            .description("Number of events returned per page")
            .baseUnit("events")
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(meterRegistry);
    }

    public void recordSearch(long durationNanos, int events) {
        searchesExecuted.increment();
        searchLatency.record(durationNanos, TimeUnit.NANOSECONDS);
        pageSize.record(events);
    }

    public void recordRejected() {
        queriesRejected.increment();
    }

    public void recordTransientFailure() {
        transientFailures.increment();
    }

    public void recordFatalFailure() {
        fatalFailures.increment();
    }

    public void recordTimedOut() {
        searchesTimedOut.increment();
    }

    public double getSearchesExecuted() {
        return searchesExecuted.count();
    }

    public double getQueriesRejected() {
        return queriesRejected.count();
    }

    public double getTransientFailures() {
        return transientFailures.count();
    }

    public double getFatalFailures() {
        return fatalFailures.count();
    }
}
