package com.soccer.graph.metrics;

import com.soccer.graph.core.model.EntityKind;
import com.soccer.graph.merge.MergeOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code soccer.merge.outcome} - Counter (tags: element, outcome)</li>
 *   <li>{@code soccer.merge.conflict} - Counter (tag: element)</li>
 *   <li>{@code soccer.ingest.skipped} - Counter (tags: source, reason)</li>
 *   <li>{@code soccer.ingest.duration} - Timer (tag: source)</li>
 *   <li>{@code soccer.resolve.fallback} - Counter (tag: kind)</li>
 *   <li>{@code soccer.dedup.merged} - Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Counter dedupCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.dedupCounter = Counter.builder("soccer.dedup.merged")
                .description("Number of teams folded into another by deduplication")
                .register(registry);
    }

    @Override
    public void recordMergeOutcome(String element, MergeOutcome outcome) {
        String key = "outcome:" + element + ":" + outcome.name();
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("soccer.merge.outcome")
                        .description("Nodes and relationships merged, by outcome")
                        .tag("element", element)
                        .tag("outcome", outcome.name())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void incrementConflict(String element) {
        String key = "conflict:" + element;
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("soccer.merge.conflict")
                        .description("Rejected values for immutable fields")
                        .tag("element", element)
                        .register(registry));
        counter.increment();
    }

    @Override
    public void incrementRowSkipped(String source, String reason) {
        String key = "skipped:" + source + ":" + reason;
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("soccer.ingest.skipped")
                        .description("Source rows skipped before or during merge")
                        .tag("source", source)
                        .tag("reason", reason)
                        .register(registry));
        counter.increment();
    }

    @Override
    public void incrementResolutionFallback(EntityKind kind) {
        String key = "fallback:" + kind.name();
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("soccer.resolve.fallback")
                        .description("Names with no alias entry, kept as given")
                        .tag("kind", kind.name())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordIngestionDuration(String source, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(source, k ->
                Timer.builder("soccer.ingest.duration")
                        .description("Duration of one source ingestion")
                        .tag("source", source)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementTeamsDeduplicated() {
        dedupCounter.increment();
    }
}
