package com.contact.resolution.metrics;

import com.contact.resolution.attribution.AttributionModel;
import com.contact.resolution.core.model.MatchConfidence;
import com.contact.resolution.core.model.SourcePlatform;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
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
 *   <li>{@code contact.resolution.duration}: Timer (tag: confidence)</li>
 *   <li>{@code contact.created}, {@code contact.merged}: Counter (tag: source)</li>
 *   <li>{@code contact.merge.conflict}, {@code contact.match.ambiguous}, {@code contact.ingest.failed}: Counter</li>
 *   <li>{@code contact.similarity.score}, {@code contact.batch.size}: DistributionSummary</li>
 *   <li>{@code attribution.chains.built}: Counter (tag: model)</li>
 *   <li>{@code attribution.cache.hit}, {@code attribution.cache.miss}: Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary similarityScoreSummary;
    private final DistributionSummary batchSizeSummary;
    private final Counter conflictCounter;
    private final Counter ambiguousCounter;
    private final Counter failedCounter;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.similarityScoreSummary = DistributionSummary.builder("contact.similarity.score")
                .description("Name similarity of fuzzy matches")
                .register(registry);
        this.batchSizeSummary = DistributionSummary.builder("contact.batch.size")
                .description("Number of items per bulk operation")
                .register(registry);
        this.conflictCounter = Counter.builder("contact.merge.conflict")
                .description("Merges that kept the existing email over a different incoming one")
                .register(registry);
        this.ambiguousCounter = Counter.builder("contact.match.ambiguous")
                .description("Records that matched several existing contacts")
                .register(registry);
        this.failedCounter = Counter.builder("contact.ingest.failed")
                .description("Records rejected or failed during ingestion")
                .register(registry);
        this.cacheHitCounter = Counter.builder("attribution.cache.hit")
                .description("Number of attribution cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("attribution.cache.miss")
                .description("Number of attribution cache misses")
                .register(registry);
    }

    @Override
    public void recordResolutionDuration(MatchConfidence confidence, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(confidence.name(), k ->
                Timer.builder("contact.resolution.duration")
                        .description("Duration of identity resolution")
                        .tag("confidence", confidence.name())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementContactCreated(SourcePlatform source) {
        counter("contact.created", "source", source.tag(), "New contacts created").increment();
    }

    @Override
    public void incrementContactMerged(SourcePlatform source) {
        counter("contact.merged", "source", source.tag(), "Records merged into existing contacts").increment();
    }

    @Override
    public void incrementMergeConflict() {
        conflictCounter.increment();
    }

    @Override
    public void incrementAmbiguousMatch() {
        ambiguousCounter.increment();
    }

    @Override
    public void incrementIngestFailed() {
        failedCounter.increment();
    }

    @Override
    public void recordSimilarityScore(double score) {
        similarityScoreSummary.record(score);
    }

    @Override
    public void recordBatchSize(int size) {
        batchSizeSummary.record(size);
    }

    @Override
    public void incrementChainsBuilt(AttributionModel model) {
        counter("attribution.chains.built", "model", model.tag(), "Attribution chains built").increment();
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }

    private Counter counter(String name, String tagKey, String tagValue, String description) {
        return counterCache.computeIfAbsent(name + ":" + tagValue, k ->
                Counter.builder(name)
                        .description(description)
                        .tag(tagKey, tagValue)
                        .register(registry));
    }
}
