package com.contact.resolution.metrics;

import com.contact.resolution.attribution.AttributionModel;
import com.contact.resolution.core.model.MatchConfidence;
import com.contact.resolution.core.model.SourcePlatform;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordResolutionDuration(MatchConfidence confidence, Duration duration) {
    }

    @Override
    public void incrementContactCreated(SourcePlatform source) {
    }

    @Override
    public void incrementContactMerged(SourcePlatform source) {
    }

    @Override
    public void incrementMergeConflict() {
    }

    @Override
    public void incrementAmbiguousMatch() {
    }

    @Override
    public void incrementIngestFailed() {
    }

    @Override
    public void recordSimilarityScore(double score) {
    }

    @Override
    public void recordBatchSize(int size) {
    }

    @Override
    public void incrementChainsBuilt(AttributionModel model) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}
