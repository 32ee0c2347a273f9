package com.phillippitts.holderbot.service.metrics;

import com.phillippitts.holderbot.domain.DecisionPath;
import com.phillippitts.holderbot.domain.SourceKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for decisions, observation sources, region analysis and write-backs.
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class DecisionMetrics {

    private static final String METRIC_PREFIX = "holderbot";

    private final MeterRegistry registry;

    public DecisionMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records one finished decision and its latency.
     *
     * @param path          verified, ensemble or fallback
     * @param durationNanos time spent deciding
     */
    public void recordDecision(DecisionPath path, long durationNanos) {
        String tag = tag(path);
        Timer.builder(METRIC_PREFIX + ".decision.latency")
                .description("Time taken to decide one subject")
                .tag("path", tag)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
        Counter.builder(METRIC_PREFIX + ".decision.count")
                .description("Number of decisions by path")
                .tag("path", tag)
                .register(registry)
                .increment();
    }

    /**
     * Counts an observation contributed by a source.
     */
    public void incrementObservation(SourceKind source) {
        Counter.builder(METRIC_PREFIX + ".observation.count")
                .description("Observations gathered per source kind")
                .tag("source", tag(source))
                .register(registry)
                .increment();
    }

    /**
     * Counts a source that failed while gathering (absorbed, contributed nothing).
     */
    public void incrementSourceFailure(SourceKind source) {
        Counter.builder(METRIC_PREFIX + ".observation.failure")
                .description("Observation sources that failed")
                .tag("source", tag(source))
                .register(registry)
                .increment();
    }

    /**
     * Counts a discarded analysis region.
     *
     * @param reason timeout, oracle_error, unparseable, low_confidence or unexpected_error
     */
    public void incrementRegionFailure(String region, String reason) {
        Counter.builder(METRIC_PREFIX + ".region.failure")
                .description("Analysis regions discarded before voting")
                .tag("region", region)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementWriteBackFailure() {
        Counter.builder(METRIC_PREFIX + ".writeback.failure")
                .description("Decisions that could not be stored")
                .register(registry)
                .increment();
    }

    public void incrementCorrection() {
        Counter.builder(METRIC_PREFIX + ".correction.count")
                .description("Human corrections applied")
                .register(registry)
                .increment();
    }

    private static String tag(Enum<?> e) {
        return e.name().toLowerCase(Locale.ROOT);
    }
}
