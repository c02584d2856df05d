package com.talent.sourcing.provider;

import java.util.Map;

/**
 * Score returned by a {@link ScoringCollaborator}.
 *
 * @param overallScore   overall fit, 0 to 10
 * @param criterionScores per-requirement scores keyed by requirement name, 0 to 10
 * @param rationale      free-text explanation
 */
public record CandidateScore(double overallScore, Map<String, Double> criterionScores, String rationale) {

    public CandidateScore {
        if (overallScore < 0.0 || overallScore > 10.0) {
            throw new IllegalArgumentException("overallScore must be between 0 and 10, got " + overallScore);
        }
        criterionScores = criterionScores != null ? Map.copyOf(criterionScores) : Map.of();
        rationale = rationale != null ? rationale : "";
    }
}
