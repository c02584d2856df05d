package com.talent.sourcing.session;

import com.talent.sourcing.lock.DistributedLock;
import com.talent.sourcing.lock.LocalDistributedLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Session store held in a {@link ConcurrentHashMap}. Suitable for tests and
 * single-JVM deployments.
 */
public class InMemorySessionStateStore extends AbstractSessionStateStore {
    private static final Logger log = LoggerFactory.getLogger(InMemorySessionStateStore.class);

    private final ConcurrentMap<String, SessionState> sessions = new ConcurrentHashMap<>();

    public InMemorySessionStateStore() {
        this(new LocalDistributedLock(), Clock.systemUTC(), DEFAULT_CANDIDATE_ID_CAP);
    }

    public InMemorySessionStateStore(DistributedLock lock, Clock clock, int candidateIdCap) {
        super(lock, clock, candidateIdCap);
    }

    @Override
    protected Optional<SessionState> load(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    @Override
    protected void save(SessionState state) {
        sessions.put(state.sessionId(), state);
    }

    @Override
    public List<SessionSummary> listActive(int limit) {
        return sessions.values().stream()
                .filter(SessionState::active)
                .sorted(Comparator.comparing(SessionState::lastAccessedAt).reversed())
                .limit(limit)
                .map(SessionSummary::of)
                .toList();
    }

    @Override
    public int purgeInactiveBefore(Instant cutoff) {
        int purged = 0;
        for (SessionState state : sessions.values()) {
            if (state.lastAccessedAt().isBefore(cutoff)
                    && sessions.remove(state.sessionId(), state)) {
                lock.forget(state.sessionId());
                purged++;
            }
        }
        log.info("session.purged cutoff={} count={}", cutoff, purged);
        return purged;
    }
}
