package com.talent.sourcing.review;

import com.talent.sourcing.resolver.ResolvedEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory {@link ManualResolutionQueue}. Suitable for tests and single-JVM deployments.
 */
public class InMemoryManualResolutionQueue implements ManualResolutionQueue {
    private static final Logger log = LoggerFactory.getLogger(InMemoryManualResolutionQueue.class);

    private final ConcurrentMap<String, ManualResolutionItem> items = new ConcurrentHashMap<>();

    @Override
    public ManualResolutionItem submit(ResolvedEntity entity, String sessionId) {
        Objects.requireNonNull(entity, "entity is required");
        if (entity.isResolved()) {
            throw new IllegalArgumentException("Entity is already resolved: " + entity.queryName());
        }
        ManualResolutionItem item = ManualResolutionItem.builder()
                .sessionId(sessionId)
                .queryName(entity.queryName())
                .website(entity.website())
                .build();
        items.put(item.getId(), item);
        log.debug("review.submitted itemId={} name='{}' sessionId={}", item.getId(), entity.queryName(), sessionId);
        return item;
    }

    @Override
    public Page<ManualResolutionItem> getPending(PageRequest page) {
        List<ManualResolutionItem> pending = items.values().stream()
                .filter(ManualResolutionItem::isPending)
                .sorted(Comparator.comparing(ManualResolutionItem::getSubmittedAt))
                .toList();
        int total = pending.size();
        int from = Math.min(page.offset(), total);
        int to = Math.min(page.offset() + page.limit(), total);
        return new Page<>(pending.subList(from, to), total, page.pageNumber(), page.limit());
    }

    @Override
    public Optional<ManualResolutionItem> get(String itemId) {
        return Optional.ofNullable(items.get(itemId));
    }

    @Override
    public void resolve(String itemId, String canonicalId, String reviewerId) {
        Objects.requireNonNull(canonicalId, "canonicalId is required");
        ManualResolutionItem item = existing(itemId);
        synchronized (item) {
            requirePending(item);
            item.markResolved(canonicalId, reviewerId);
        }
        log.info("review.resolved itemId={} canonicalId={} reviewer={}", itemId, canonicalId, reviewerId);
    }

    @Override
    public void dismiss(String itemId, String reviewerId, String notes) {
        ManualResolutionItem item = existing(itemId);
        synchronized (item) {
            requirePending(item);
            item.markDismissed(reviewerId, notes);
        }
        log.info("review.dismissed itemId={} reviewer={}", itemId, reviewerId);
    }

    @Override
    public long countPending() {
        return items.values().stream().filter(ManualResolutionItem::isPending).count();
    }

    private ManualResolutionItem existing(String itemId) {
        ManualResolutionItem item = items.get(itemId);
        if (item == null) {
            throw new IllegalArgumentException("Manual resolution item not found: " + itemId);
        }
        return item;
    }

    private static void requirePending(ManualResolutionItem item) {
        if (!item.isPending()) {
            throw new IllegalStateException("Manual resolution item is not pending: " + item.getId());
        }
    }
}
