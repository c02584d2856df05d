package com.talent.sourcing.rest.dto;

import com.talent.sourcing.pipeline.EvaluationResult;
import com.talent.sourcing.pipeline.ItemFailure;
import com.talent.sourcing.pipeline.ScoredCandidate;

import java.util.List;
import java.util.Map;

/**
 * Response DTO for an evaluation: candidates ranked by weighted score, highest first.
 */
public record EvaluationResponse(
        String sessionId,
        List<Ranked> ranked,
        List<ItemFailure> failures,
        String summary
) {
    public record Ranked(String candidateId, double weightedScore, double overallScore,
                         Map<String, Double> criterionScores, String rationale) {

        static Ranked from(ScoredCandidate candidate) {
            return new Ranked(candidate.record().id(), candidate.weightedScore(), candidate.score().overallScore(),
                    candidate.score().criterionScores(), candidate.score().rationale());
        }
    }

    public static EvaluationResponse from(EvaluationResult result) {
        return new EvaluationResponse(result.sessionId(),
                result.ranked().stream().map(Ranked::from).toList(),
                result.failures(), result.summary());
    }
}
