package com.contact.resolution.bulk;

/**
 * Options for batch processing.
 *
 * @param maxConcurrency the number of items processed in parallel
 */
public record BatchOptions(int maxConcurrency) {

    public static final int DEFAULT_MAX_CONCURRENCY = 4;

    public BatchOptions {
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be at least 1");
        }
    }

    public static BatchOptions defaults() {
        return new BatchOptions(DEFAULT_MAX_CONCURRENCY);
    }

    public static BatchOptions sequential() {
        return new BatchOptions(1);
    }
}
