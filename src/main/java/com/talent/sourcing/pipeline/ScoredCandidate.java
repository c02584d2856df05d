package com.talent.sourcing.pipeline;

import com.talent.sourcing.provider.CandidateScore;

/**
 * A candidate with its collaborator score and the weighted score, 0 to 10, used for ranking.
 */
public record ScoredCandidate(CandidateRecord record, CandidateScore score, double weightedScore) {
}
