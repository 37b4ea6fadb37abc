package com.soccer.graph.metrics;

import com.soccer.graph.core.model.EntityKind;
import com.soccer.graph.merge.MergeOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            NoOpMetricsService noOp = new NoOpMetricsService();

            assertDoesNotThrow(() -> {
                noOp.recordMergeOutcome("Team", MergeOutcome.CREATED);
                noOp.incrementConflict("Match");
                noOp.incrementRowSkipped("league-matches", "PARSE");
                noOp.incrementResolutionFallback(EntityKind.TEAM);
                noOp.recordIngestionDuration("league-matches", Duration.ofMillis(10));
                noOp.incrementTeamsDeduplicated();
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Should count merge outcomes per element and outcome")
        void recordMergeOutcome() {
            metrics.recordMergeOutcome("Team", MergeOutcome.CREATED);
            metrics.recordMergeOutcome("Team", MergeOutcome.CREATED);
            metrics.recordMergeOutcome("Team", MergeOutcome.UNCHANGED);
            metrics.recordMergeOutcome("PLAYED_HOME", MergeOutcome.CREATED);

            Counter created = registry.find("soccer.merge.outcome")
                    .tag("element", "Team")
                    .tag("outcome", "CREATED")
                    .counter();
            assertNotNull(created);
            assertEquals(2.0, created.count());
            assertEquals(1.0, registry.find("soccer.merge.outcome")
                    .tag("element", "PLAYED_HOME").counter().count());
        }

        @Test
        @DisplayName("Should count conflicts and skipped rows")
        void incrementConflictAndSkipped() {
            metrics.incrementConflict("Match");
            metrics.incrementRowSkipped("extended-stats", "CORRELATION_MISS");
            metrics.incrementRowSkipped("extended-stats", "CORRELATION_MISS");

            assertEquals(1.0, registry.find("soccer.merge.conflict").tag("element", "Match").counter().count());
            assertEquals(2.0, registry.find("soccer.ingest.skipped")
                    .tag("source", "extended-stats")
                    .tag("reason", "CORRELATION_MISS")
                    .counter().count());
        }

        @Test
        @DisplayName("Should time source ingestion")
        void recordIngestionDuration() {
            metrics.recordIngestionDuration("league-matches", Duration.ofMillis(150));
            metrics.recordIngestionDuration("league-matches", Duration.ofMillis(250));

            Timer timer = registry.find("soccer.ingest.duration").tag("source", "league-matches").timer();
            assertNotNull(timer);
            assertEquals(2, timer.count());
        }

        @Test
        @DisplayName("Should count fallbacks and deduplicated teams")
        void fallbacksAndDedup() {
            metrics.incrementResolutionFallback(EntityKind.STADIUM);
            metrics.incrementTeamsDeduplicated();
            metrics.incrementTeamsDeduplicated();

            assertEquals(1.0, registry.find("soccer.resolve.fallback").tag("kind", "STADIUM").counter().count());
            assertEquals(2.0, registry.find("soccer.dedup.merged").counter().count());
        }
    }
}
