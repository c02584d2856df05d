package com.talent.sourcing.retention;

/**
 * Result of a retention sweep.
 *
 * @param sessionsDeleted     number of sessions deleted
 * @param cacheEntriesDeleted number of cached payloads deleted
 */
public record RetentionResult(long sessionsDeleted, long cacheEntriesDeleted) {

    public long totalDeleted() {
        return sessionsDeleted + cacheEntriesDeleted;
    }

    public static RetentionResult empty() {
        return new RetentionResult(0, 0);
    }
}
