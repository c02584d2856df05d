package com.talent.sourcing.retention;

import com.talent.sourcing.session.SessionStateStore;
import com.talent.sourcing.store.CacheStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;

/**
 * Deletes sessions and cached payloads that have outlived the retention policy.
 */
public class RetentionService {
    private static final Logger log = LoggerFactory.getLogger(RetentionService.class);

    private final SessionStateStore sessionStore;
    private final CacheStore cacheStore;
    private final Clock clock;

    public RetentionService(SessionStateStore sessionStore, CacheStore cacheStore) {
        this(sessionStore, cacheStore, Clock.systemUTC());
    }

    public RetentionService(SessionStateStore sessionStore, CacheStore cacheStore, Clock clock) {
        this.sessionStore = sessionStore;
        this.cacheStore = cacheStore;
        this.clock = clock;
    }

    public RetentionResult applyRetention(RetentionPolicy policy) {
        log.info("retention.starting policy={}", policy);
        Instant now = clock.instant();

        long sessions = sessionStore.purgeInactiveBefore(now.minus(policy.sessionRetention()));
        long entries = cacheStore.deleteFetchedBefore(now.minus(policy.cacheEntryRetention()));

        RetentionResult result = new RetentionResult(sessions, entries);
        log.info("retention.completed sessionsDeleted={} cacheEntriesDeleted={}", sessions, entries);
        return result;
    }
}
