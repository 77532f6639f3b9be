package com.contact.resolution.similarity;

/**
 * Graded comparison of two field values.
 * Implementations return a score between 0.0 (no similarity) and 1.0 (identical),
 * are total over their inputs and never throw. An absent value on either side scores 0.0.
 */
public interface SimilarityAlgorithm {

    /**
     * Computes the similarity between two values.
     *
     * @param s1 first value, may be null
     * @param s2 second value, may be null
     * @return similarity score between 0.0 and 1.0
     */
    double compute(String s1, String s2);

    /**
     * Returns the name of this algorithm.
     */
    String getName();
}
