package com.talent.sourcing.pipeline;

import java.util.Objects;

/**
 * One page of candidate ids to collect.
 *
 * @param sessionId   the run
 * @param startIndex  first candidate id index, zero-based
 * @param count       page size; a page running past the end is truncated
 * @param bypassCache skip cache reads for this page
 */
public record CollectRequest(String sessionId, int startIndex, int count, boolean bypassCache) {

    public CollectRequest {
        Objects.requireNonNull(sessionId, "sessionId is required");
    }

    public static CollectRequest of(String sessionId, int startIndex, int count) {
        return new CollectRequest(sessionId, startIndex, count, false);
    }
}
