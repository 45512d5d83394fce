package com.logstuff.search;

import com.logstuff.metrics.SearchMetrics;
import com.logstuff.query.InvalidQueryException;
import com.logstuff.query.LqlCompiler;
import com.logstuff.query.SqlPredicate;
import com.logstuff.storage.FatalStoreException;
import com.logstuff.storage.LogEvent;
import com.logstuff.storage.TransientStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeoutException;

/**
 * Answers a search request: compiles the query once, then fetches the page, the total estimate,
 * the top fields and the histogram concurrently on the bounded elastic scheduler.
 *
 * <p>Each statement is retried once after a transient store failure. The whole request is
 * bounded by a timeout reported as a transient failure.
 */
public class EventSearchService {
    private static final Logger log = LoggerFactory.getLogger(EventSearchService.class);

    private final LqlCompiler compiler;
    private final EventSearchExecutor executor;
    private final HistogramAggregator histogramAggregator;
    private final TopFieldsAggregator topFieldsAggregator;
    private final SearchMetrics metrics;
    private final Duration requestTimeout;
    private final Clock clock;

    public EventSearchService(LqlCompiler compiler,
                              EventSearchExecutor executor,
                              HistogramAggregator histogramAggregator,
                              TopFieldsAggregator topFieldsAggregator,
                              SearchMetrics metrics,
                              Duration requestTimeout) {
        this(compiler, executor, histogramAggregator, topFieldsAggregator, metrics, requestTimeout,
            Clock.systemUTC());
    }

    public EventSearchService(LqlCompiler compiler,
                              EventSearchExecutor executor,
                              HistogramAggregator histogramAggregator,
                              TopFieldsAggregator topFieldsAggregator,
                              SearchMetrics metrics,
                              Duration requestTimeout,
                              Clock clock) {
        this.compiler = compiler;
        this.executor = executor;
        this.histogramAggregator = histogramAggregator;
        this.topFieldsAggregator = topFieldsAggregator;
        this.metrics = metrics;
        this.requestTimeout = requestTimeout;
        this.clock = clock;
    }

    public Mono<SearchResult> search(SearchRequest request) {
        return Mono.defer(() -> {
            long start = System.nanoTime();
            TimeRange range = request.getRange();
            HistogramSpec histogram = request.histogramSpec();

            return Mono.fromCallable(() -> compiler.compile(request.getQuery()))
                .flatMap(predicate -> Mono.zip(
                    blocking(() -> executor.fetch(predicate, range, request.getPage())),
                    blocking(() -> executor.estimate(predicate, range)),
                    blocking(() -> topFieldsAggregator.topFields(predicate, range)),
                    blocking(() -> histogramAggregator.histogram(predicate, range, histogram))))
                .map(results -> new SearchResult(
                    results.getT1().withTotalEstimate(results.getT2()),
                    results.getT3(),
                    results.getT4(),
                    histogram))
                .timeout(requestTimeout)
                .onErrorMap(TimeoutException.class, e -> {
                    metrics.recordTimedOut();
                    return new TransientStoreException(
                        "Search did not complete within " + requestTimeout.toMillis() + " ms", null, e);
                })
                .doOnSuccess(result -> {
                    long elapsed = System.nanoTime() - start;
                    metrics.recordSearch(elapsed, result.getPage().getEvents().size());
                    log.debug("Search {} in {} returned {} events in {} ms", request.getQuery(), range,
                        result.getPage().getEvents().size(), elapsed / 1_000_000);
                })
                .doOnError(this::recordFailure);
        });
    }

    /**
     * Events stored after {@code afterId} that match {@code query} and are at most {@code maxAge}
     * old, oldest first. Polling with the highest id returned so far yields each event once.
     */
    public Mono<List<LogEvent>> follow(String query, long afterId, Duration maxAge, int limit) {
        return Mono.defer(() -> {
            if (afterId < 0) {
                throw new IllegalArgumentException("after_id must not be negative: " + afterId);
            }
            if (maxAge.isNegative() || maxAge.isZero()) {
                throw new IllegalArgumentException("max_age must be positive: " + maxAge);
            }
            if (limit < 1 || limit > PageRequest.MAX_LIMIT) {
                throw new IllegalArgumentException("limit must be between 1 and " + PageRequest.MAX_LIMIT + ": " + limit);
            }
            Instant notBefore = clock.instant().minus(maxAge);

            return Mono.fromCallable(() -> compiler.compile(query))
                .flatMap(predicate -> blocking(() -> executor.follow(predicate, afterId, notBefore, limit)))
                .timeout(requestTimeout)
                .onErrorMap(TimeoutException.class, e -> {
                    metrics.recordTimedOut();
                    return new TransientStoreException(
                        "Follow query did not complete within " + requestTimeout.toMillis() + " ms", null, e);
                })
                .doOnSuccess(events -> log.debug("Follow {} after id {} returned {} events",
                    query, afterId, events.size()));
        }).doOnError(this::recordFailure);
    }

    /**
     * Compile only, for callers that validate a query without running it.
     */
    public SqlPredicate compile(String query) {
        return compiler.compile(query);
    }

    private <T> Mono<T> blocking(Callable<T> call) {
        return Mono.fromCallable(call)
            .subscribeOn(Schedulers.boundedElastic())
            .retryWhen(Retry.max(1)
                .filter(TransientStoreException.class::isInstance)
                .doBeforeRetry(signal -> log.warn("Retrying search statement after: {}", signal.failure().getMessage()))
                .onRetryExhaustedThrow((spec, signal) -> signal.failure()));
    }

    private void recordFailure(Throwable error) {
        if (error instanceof InvalidQueryException || error instanceof IllegalArgumentException) {
            metrics.recordRejected();
        } else if (error instanceof TransientStoreException) {
            metrics.recordTransientFailure();
            log.warn("Search failed transiently: {}", error.getMessage());
        } else if (error instanceof FatalStoreException) {
            metrics.recordFatalFailure();
            log.error("Search failed: {}", error.getMessage(), error);
        } else {
            metrics.recordFatalFailure();
            log.error("Unexpected search failure", error);
        }
    }
}
