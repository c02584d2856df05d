package com.talent.sourcing.tracing;

/**
 * Outcome counts attached to a stage span once the stage has produced its result.
 */
public enum StageCounter {
    ENTITIES_RESOLVED("sourcing.entities.resolved"),
    ENTITIES_UNRESOLVED("sourcing.entities.unresolved"),
    IDS_FOUND("sourcing.ids.found"),
    IDS_ADDED("sourcing.ids.added"),
    PROCESSED("sourcing.items.processed"),
    FAILED("sourcing.items.failed"),
    CREDITS("sourcing.credits.spent"),
    RANKED("sourcing.candidates.ranked");

    private final String attributeKey;

    StageCounter(String attributeKey) {
        this.attributeKey = attributeKey;
    }

    public String attributeKey() {
        return attributeKey;
    }
}
