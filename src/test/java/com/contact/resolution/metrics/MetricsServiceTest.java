package com.contact.resolution.metrics;

import com.contact.resolution.attribution.AttributionModel;
import com.contact.resolution.core.model.MatchConfidence;
import com.contact.resolution.core.model.SourcePlatform;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

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
                noOp.recordResolutionDuration(MatchConfidence.EXACT, Duration.ofMillis(5));
                noOp.incrementContactCreated(SourcePlatform.CLOSE);
                noOp.incrementContactMerged(SourcePlatform.CALENDLY);
                noOp.incrementMergeConflict();
                noOp.incrementAmbiguousMatch();
                noOp.incrementIngestFailed();
                noOp.recordSimilarityScore(0.8);
                noOp.recordBatchSize(10);
                noOp.incrementChainsBuilt(AttributionModel.MULTI_TOUCH);
                noOp.recordCacheHit();
                noOp.recordCacheMiss();
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Should record resolution duration per confidence")
        void recordResolutionDuration() {
            metrics.recordResolutionDuration(MatchConfidence.EXACT, Duration.ofMillis(10));
            metrics.recordResolutionDuration(MatchConfidence.EXACT, Duration.ofMillis(30));
            metrics.recordResolutionDuration(MatchConfidence.NONE, Duration.ofMillis(5));

            Timer exact = registry.find("contact.resolution.duration").tag("confidence", "EXACT").timer();

            assertNotNull(exact);
            assertEquals(2, exact.count());
            assertEquals(40, exact.totalTime(TimeUnit.MILLISECONDS), 0.5);
        }

        @Test
        @DisplayName("Should count creations and merges per source")
        void contactCounters() {
            metrics.incrementContactCreated(SourcePlatform.TYPEFORM);
            metrics.incrementContactCreated(SourcePlatform.TYPEFORM);
            metrics.incrementContactMerged(SourcePlatform.CALENDLY);

            Counter created = registry.find("contact.created").tag("source", "typeform").counter();
            Counter merged = registry.find("contact.merged").tag("source", "calendly").counter();

            assertEquals(2.0, created.count());
            assertEquals(1.0, merged.count());
        }

        @Test
        @DisplayName("Should count conflicts, ambiguity and failures")
        void outcomeCounters() {
            metrics.incrementMergeConflict();
            metrics.incrementAmbiguousMatch();
            metrics.incrementAmbiguousMatch();
            metrics.incrementIngestFailed();

            assertEquals(1.0, registry.find("contact.merge.conflict").counter().count());
            assertEquals(2.0, registry.find("contact.match.ambiguous").counter().count());
            assertEquals(1.0, registry.find("contact.ingest.failed").counter().count());
        }

        @Test
        @DisplayName("Should record score and batch size distributions")
        void summaries() {
            metrics.recordSimilarityScore(0.9);
            metrics.recordSimilarityScore(0.5);
            metrics.recordBatchSize(25);

            DistributionSummary scores = registry.find("contact.similarity.score").summary();
            assertEquals(2, scores.count());
            assertEquals(0.7, scores.mean(), 0.0001);
            assertEquals(25.0, registry.find("contact.batch.size").summary().totalAmount());
        }

        @Test
        @DisplayName("Should count chains per model and cache access")
        void attributionCounters() {
            metrics.incrementChainsBuilt(AttributionModel.LAST_TOUCH);
            metrics.recordCacheHit();
            metrics.recordCacheMiss();
            metrics.recordCacheMiss();

            assertEquals(1.0, registry.find("attribution.chains.built").tag("model", "last-touch").counter().count());
            assertEquals(1.0, registry.find("attribution.cache.hit").counter().count());
            assertEquals(2.0, registry.find("attribution.cache.miss").counter().count());
        }
    }
}
