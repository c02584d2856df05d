package com.talent.sourcing.pipeline;

import com.talent.sourcing.SourcingException;
import com.talent.sourcing.session.PipelineStage;

import java.util.Set;

/**
 * An operation was requested for a session that is not in a stage that allows it.
 */
public class StageConflictException extends SourcingException {

    private final String sessionId;
    private final PipelineStage actual;

    public StageConflictException(String sessionId, PipelineStage actual, Set<PipelineStage> expected) {
        super("Session " + sessionId + " is in stage " + actual + ", expected one of " + expected);
        this.sessionId = sessionId;
        this.actual = actual;
    }

    public String getSessionId() {
        return sessionId;
    }

    public PipelineStage getActual() {
        return actual;
    }
}
