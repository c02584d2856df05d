package com.talent.sourcing.resolver;

import java.util.Optional;

/**
 * One tier of the resolution fold. A step either produces a match or defers to
 * the next tier; exceptions are treated as a deferral by the resolver.
 */
public interface ResolutionStep {

    ResolutionTier tier();

    Optional<TierMatch> attempt(ResolutionRequest request, double confidenceThreshold);
}
