package com.talent.sourcing.session;

import com.talent.sourcing.lock.DistributedLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Update logic shared by the session store implementations. Subclasses supply
 * load and save; every mutation runs under the per-session lock.
 */
public abstract class AbstractSessionStateStore implements SessionStateStore {
    private static final Logger log = LoggerFactory.getLogger(AbstractSessionStateStore.class);

    public static final int DEFAULT_CANDIDATE_ID_CAP = 1000;

    protected final DistributedLock lock;
    protected final Clock clock;
    private final int candidateIdCap;

    protected AbstractSessionStateStore(DistributedLock lock, Clock clock, int candidateIdCap) {
        this.lock = Objects.requireNonNull(lock, "lock is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        if (candidateIdCap <= 0) {
            throw new IllegalArgumentException("candidateIdCap must be > 0");
        }
        this.candidateIdCap = candidateIdCap;
    }

    protected abstract Optional<SessionState> load(String sessionId);

    protected abstract void save(SessionState state);

    public int getCandidateIdCap() {
        return candidateIdCap;
    }

    @Override
    public SessionState create(String sessionId) {
        Objects.requireNonNull(sessionId, "sessionId is required");
        return lock.withLock(sessionId, () -> {
            if (load(sessionId).isPresent()) {
                throw new IllegalStateException("Session already exists: " + sessionId);
            }
            SessionState state = SessionState.initial(sessionId, clock.instant());
            save(state);
            log.info("session.created sessionId={}", sessionId);
            return state;
        });
    }

    @Override
    public SessionState read(String sessionId) {
        return lock.withLock(sessionId, () -> {
            SessionState state = require(sessionId).accessed(clock.instant());
            save(state);
            return state;
        });
    }

    @Override
    public SessionState mergeUpdate(String sessionId, SessionPatch patch) {
        Objects.requireNonNull(patch, "patch is required");
        return lock.withLock(sessionId, () -> {
            SessionState current = require(sessionId);
            SessionState next = patch.applyTo(current).written(clock.instant());
            save(next);
            if (next.stage() != current.stage()) {
                log.info("session.stage.changed sessionId={} from={} to={}", sessionId, current.stage(), next.stage());
            }
            return next;
        });
    }

    @Override
    public int appendCandidateIds(String sessionId, List<String> ids) {
        Objects.requireNonNull(ids, "ids is required");
        return lock.withLock(sessionId, () -> {
            SessionState current = require(sessionId);
            Set<String> merged = new LinkedHashSet<>(current.candidateIds());
            int before = merged.size();
            for (String id : ids) {
                if (merged.size() >= candidateIdCap) {
                    break;
                }
                if (id != null && !id.isBlank()) {
                    merged.add(id);
                }
            }
            int added = merged.size() - before;
            save(current.withCandidateIds(List.copyOf(merged)).written(clock.instant()));
            log.debug("session.ids.appended sessionId={} offered={} added={} total={}",
                    sessionId, ids.size(), added, merged.size());
            return added;
        });
    }

    @Override
    public SessionState advanceOffset(String sessionId, int n) {
        if (n < 0) {
            throw new IllegalArgumentException("n must be >= 0, got " + n);
        }
        return lock.withLock(sessionId, () -> {
            SessionState current = require(sessionId);
            return moveOffset(current, current.paginationOffset() + n);
        });
    }

    @Override
    public SessionState advanceOffsetTo(String sessionId, int target) {
        return lock.withLock(sessionId, () -> {
            SessionState current = require(sessionId);
            return moveOffset(current, Math.max(current.paginationOffset(), target));
        });
    }

    @Override
    public boolean deactivate(String sessionId) {
        return lock.withLock(sessionId, () -> {
            SessionState current = require(sessionId);
            if (!current.active()) {
                return false;
            }
            save(current.withActive(false).written(clock.instant()));
            log.info("session.deactivated sessionId={}", sessionId);
            return true;
        });
    }

    @Override
    public SessionSummary stats(String sessionId) {
        return SessionSummary.of(read(sessionId));
    }

    private SessionState moveOffset(SessionState current, int newOffset) {
        if (newOffset > current.candidateIds().size()) {
            throw new IllegalStateException("Offset " + newOffset + " would exceed candidate count "
                    + current.candidateIds().size() + " for session " + current.sessionId());
        }
        if (newOffset == current.paginationOffset()) {
            return current;
        }
        SessionState next = current.withPaginationOffset(newOffset).written(clock.instant());
        save(next);
        log.debug("session.offset.advanced sessionId={} from={} to={}",
                current.sessionId(), current.paginationOffset(), newOffset);
        return next;
    }

    /**
     * Loads a session and checks its invariants.
     */
    protected SessionState require(String sessionId) {
        SessionState state = load(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
        String violation = state.invariantViolation();
        if (violation != null) {
            throw new SessionStateCorruptionException("Session " + sessionId + " is corrupt: " + violation);
        }
        return state;
    }
}
