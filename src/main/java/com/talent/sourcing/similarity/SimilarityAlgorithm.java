package com.talent.sourcing.similarity;

/**
 * Computes a similarity score between 0.0 (no similarity) and 1.0 (identical).
 */
public interface SimilarityAlgorithm {

    double compute(String s1, String s2);

    String getName();
}
