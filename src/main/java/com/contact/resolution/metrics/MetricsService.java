package com.contact.resolution.metrics;

import com.contact.resolution.attribution.AttributionModel;
import com.contact.resolution.core.model.MatchConfidence;
import com.contact.resolution.core.model.SourcePlatform;

import java.time.Duration;

/**
 * Records ingestion and attribution metrics.
 * The default {@link NoOpMetricsService} does nothing, so the engine runs without a
 * meter registry.
 */
public interface MetricsService {

    void recordResolutionDuration(MatchConfidence confidence, Duration duration);

    void incrementContactCreated(SourcePlatform source);

    void incrementContactMerged(SourcePlatform source);

    void incrementMergeConflict();

    void incrementAmbiguousMatch();

    void incrementIngestFailed();

    void recordSimilarityScore(double score);

    void recordBatchSize(int size);

    void incrementChainsBuilt(AttributionModel model);

    void recordCacheHit();

    void recordCacheMiss();
}
