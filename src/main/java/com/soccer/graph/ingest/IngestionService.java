package com.soccer.graph.ingest;

import com.soccer.graph.logging.LogContext;
import com.soccer.graph.merge.MergeConflict;
import com.soccer.graph.merge.MergeEngine;
import com.soccer.graph.merge.MergeOutcome;
import com.soccer.graph.merge.RecordMergeResult;
import com.soccer.graph.merge.SkipReason;
import com.soccer.graph.metrics.MetricsService;
import com.soccer.graph.source.AdaptedRecords;
import com.soccer.graph.source.CanonicalRecord;
import com.soccer.graph.source.RecordPhase;
import com.soccer.graph.source.RowIssue;
import com.soccer.graph.source.SourceReadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Feeds adapted records through the merge engine and summarizes each source.
 *
 * <p>{@link #ingestAll(List)} runs sources on a fixed worker pool in two phases: every
 * primary source (matches, players) completes before any correlated source (statistics,
 * venues) starts, so enrichment rows always see the full set of matches.</p>
 */
public class IngestionService implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);
    private static final int PROGRESS_INTERVAL = 100;

    private final MergeEngine engine;
    private final MetricsService metrics;
    private final IngestionOptions options;
    private final ExecutorService executor;

    public IngestionService(MergeEngine engine, MetricsService metrics, IngestionOptions options) {
        this.engine = Objects.requireNonNull(engine, "engine is required");
        this.metrics = Objects.requireNonNull(metrics, "metrics is required");
        this.options = options != null ? options : IngestionOptions.defaults();
        this.executor = Executors.newFixedThreadPool(this.options.getParallelism(), new WorkerThreadFactory());
    }

    public IngestionOptions options() {
        return options;
    }

    public IngestionSummary ingest(AdaptedRecords<?> records) {
        return ingest(records, ProgressCallback.NOOP);
    }

    public IngestionSummary ingest(AdaptedRecords<?> records, ProgressCallback callback) {
        return ingest(LogContext.generateRunId(), records, callback);
    }

    /**
     * Ingests several sources, primary sources first.
     */
    public IngestionReport ingestAll(List<? extends AdaptedRecords<?>> sources) {
        return ingestAll(sources, ProgressCallback.NOOP);
    }

    public IngestionReport ingestAll(List<? extends AdaptedRecords<?>> sources, ProgressCallback callback) {
        String runId = LogContext.generateRunId();
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        IngestionSummary[] summaries = new IngestionSummary[sources.size()];

        for (RecordPhase phase : RecordPhase.values()) {
            List<Integer> indexes = new ArrayList<>();
            List<Future<IngestionSummary>> futures = new ArrayList<>();
            for (int i = 0; i < sources.size(); i++) {
                AdaptedRecords<?> source = sources.get(i);
                if (source.phase() == phase) {
                    indexes.add(i);
                    futures.add(executor.submit(() -> ingest(runId, source, cb)));
                }
            }
            log.info("ingest.phase.started runId={} phase={} sources={}", runId, phase, futures.size());
            for (int j = 0; j < futures.size(); j++) {
                int index = indexes.get(j);
                summaries[index] = await(futures.get(j), sources.get(index).source());
            }
        }

        IngestionReport report = new IngestionReport(runId, List.of(summaries));
        log.info("ingest.run.completed runId={} sources={} processed={} created={} skipped={} conflicts={}",
                runId, sources.size(), report.totalProcessed(), report.totalCreated(),
                report.totalSkipped(), report.totalConflicts());
        return report;
    }

    private IngestionSummary ingest(String runId, AdaptedRecords<?> records, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        String source = records.source();
        long started = System.nanoTime();

        try (LogContext ctx = LogContext.forIngestion(runId, source)) {
            log.info("ingest.starting source={} phase={}", source, records.phase());
            Tally tally = new Tally(source);
            List<RowIssue> issues;
            long filtered;
            try {
                var iterator = records.iterator();
                while (iterator.hasNext()) {
                    CanonicalRecord record = iterator.next();
                    tally.merged++;
                    try {
                        tally.add(engine.merge(record));
                    } catch (RuntimeException e) {
                        tally.failures.add(new IngestionSummary.RecordFailure(record.lineNumber(), e.getMessage()));
                        log.warn("ingest.record.failed source={} line={} error={}",
                                source, record.lineNumber(), e.getMessage());
                    }
                    if (tally.merged % PROGRESS_INTERVAL == 0) {
                        cb.onProgress(source, tally.merged, "Processed " + tally.merged + " records");
                    }
                }
                issues = iterator.issues();
                filtered = iterator.filteredCount();
            } catch (SourceReadException e) {
                Duration duration = Duration.ofNanos(System.nanoTime() - started);
                metrics.recordIngestionDuration(source, duration);
                log.error("ingest.failed source={} error={}", source, e.getMessage());
                return IngestionSummary.failed(source, e.getMessage(), duration);
            }

            for (RowIssue issue : issues) {
                metrics.incrementRowSkipped(source, issue.kind().name());
            }
            Duration duration = Duration.ofNanos(System.nanoTime() - started);
            metrics.recordIngestionDuration(source, duration);
            IngestionSummary summary = tally.toSummary(issues, filtered, duration);
            cb.onProgress(source, tally.merged, "Ingestion completed");
            log.info("ingest.completed source={} processed={} created={} updated={} unchanged={} skipped={} "
                            + "conflicts={} correlationMisses={} durationMs={}",
                    source, summary.processed(), summary.created(), summary.updated(), summary.unchanged(),
                    summary.skipped(), summary.conflicts(), summary.correlationMisses(), duration.toMillis());
            return summary;
        }
    }

    private IngestionSummary await(Future<IngestionSummary> future, String source) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while ingesting " + source, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("ingest.failed source={} error={}", source, cause.getMessage(), cause);
            return IngestionSummary.failed(source, cause.getMessage(), Duration.ZERO);
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Running counts for one source.
     */
    private static final class Tally {
        private final String source;
        private long merged;
        private long created;
        private long updated;
        private long unchanged;
        private long mergeSkipped;
        private long correlationMisses;
        private long ambiguous;
        private final List<MergeConflict> conflicts = new ArrayList<>();
        private final List<IngestionSummary.RecordFailure> failures = new ArrayList<>();

        Tally(String source) {
            this.source = source;
        }

        void add(RecordMergeResult result) {
            if (result.isSkipped()) {
                mergeSkipped++;
                if (result.skipReason() == SkipReason.CORRELATION_MISS) {
                    correlationMisses++;
                } else if (result.skipReason() == SkipReason.CORRELATION_AMBIGUOUS) {
                    ambiguous++;
                }
                return;
            }
            created += result.count(MergeOutcome.CREATED);
            updated += result.count(MergeOutcome.UPDATED);
            unchanged += result.count(MergeOutcome.UNCHANGED);
            conflicts.addAll(result.conflicts());
        }

        IngestionSummary toSummary(List<RowIssue> issues, long filtered, Duration duration) {
            return new IngestionSummary(source, merged + issues.size(), created, updated, unchanged,
                    mergeSkipped + issues.size(), filtered, correlationMisses, ambiguous,
                    issues, conflicts, failures, null, duration);
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "ingest-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
