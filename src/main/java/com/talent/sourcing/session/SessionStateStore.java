package com.talent.sourcing.session;

import java.time.Instant;
import java.util.List;

/**
 * Durable, merge-not-replace store for {@link SessionState}.
 * Every mutation of one session is serialized; mutations never drop fields
 * written by an earlier update.
 */
public interface SessionStateStore {

    /**
     * Creates a new session in {@link PipelineStage#DISCOVERY}.
     *
     * @throws IllegalStateException if the session already exists
     */
    SessionState create(String sessionId);

    /**
     * Reads a session and records the access.
     *
     * @throws SessionNotFoundException        if the session does not exist
     * @throws SessionStateCorruptionException if the stored state is invalid
     */
    SessionState read(String sessionId);

    /**
     * Applies a patch to the stored state and returns the result.
     */
    SessionState mergeUpdate(String sessionId, SessionPatch patch);

    /**
     * Appends ids not already present, in first-seen order, up to the configured cap.
     *
     * @return number of ids actually added
     */
    int appendCandidateIds(String sessionId, List<String> ids);

    /**
     * Moves the pagination offset forward by {@code n}.
     *
     * @throws IllegalArgumentException if {@code n} is negative
     * @throws IllegalStateException    if the new offset would exceed the candidate count
     */
    SessionState advanceOffset(String sessionId, int n);

    /**
     * Moves the pagination offset to {@code max(offset, target)}.
     *
     * @throws IllegalStateException if {@code target} exceeds the candidate count
     */
    SessionState advanceOffsetTo(String sessionId, int target);

    /**
     * Active sessions, most recently accessed first.
     */
    List<SessionSummary> listActive(int limit);

    /**
     * Marks a session inactive. Its state stays readable until purged.
     *
     * @return false if the session was already inactive
     */
    boolean deactivate(String sessionId);

    SessionSummary stats(String sessionId);

    /**
     * Deletes sessions last accessed before {@code cutoff}.
     *
     * @return number of sessions deleted
     */
    int purgeInactiveBefore(Instant cutoff);
}
