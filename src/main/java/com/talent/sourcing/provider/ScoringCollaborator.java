package com.talent.sourcing.provider;

import com.talent.sourcing.pipeline.CandidateRecord;
import com.talent.sourcing.pipeline.Requirements;

/**
 * External collaborator that scores one candidate against the requirements.
 */
public interface ScoringCollaborator {

    CandidateScore score(CandidateRecord record, Requirements requirements);
}
