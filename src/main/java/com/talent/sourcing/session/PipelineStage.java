package com.talent.sourcing.session;

/**
 * Stages of a sourcing run, in order.
 * Transitions only move forward, except that {@link #FAILED} is reachable from
 * any stage and {@link #COLLECTION} may be re-entered for further pages.
 */
public enum PipelineStage {
    DISCOVERY,
    PREVIEW,
    COLLECTION,
    EVALUATION,
    COMPLETED,
    FAILED;

    public boolean canTransitionTo(PipelineStage next) {
        if (next == FAILED) {
            return true;
        }
        if (this == FAILED || this == COMPLETED) {
            return false;
        }
        if (this == COLLECTION && next == COLLECTION) {
            return true;
        }
        return next.ordinal() > ordinal();
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Parses a stored stage name.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static PipelineStage fromName(String name) {
        return valueOf(name);
    }
}
