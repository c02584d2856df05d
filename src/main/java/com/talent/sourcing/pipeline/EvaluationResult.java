package com.talent.sourcing.pipeline;

import java.util.List;

/**
 * Outcome of the evaluation stage: candidates ranked by weighted score, highest first.
 */
public record EvaluationResult(String sessionId, List<ScoredCandidate> ranked, List<ItemFailure> failures) {

    public EvaluationResult {
        ranked = List.copyOf(ranked);
        failures = List.copyOf(failures);
    }

    public String summary() {
        int total = ranked.size() + failures.size();
        return ranked.size() + " of " + total + " evaluated, " + failures.size() + " failed";
    }
}
