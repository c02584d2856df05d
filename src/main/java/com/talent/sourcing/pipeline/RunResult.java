package com.talent.sourcing.pipeline;

/**
 * Outcome of {@link StageOrchestrator#runToCompletion}.
 */
public record RunResult(DiscoveryResult discovery, PreviewResult preview, CollectionResult collection,
                        EvaluationResult evaluation) {
}
