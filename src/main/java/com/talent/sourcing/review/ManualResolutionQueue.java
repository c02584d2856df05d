package com.talent.sourcing.review;

import com.talent.sourcing.resolver.ResolvedEntity;

import java.util.Optional;

/**
 * Queue of organizations that could not be resolved automatically.
 */
public interface ManualResolutionQueue {

    /**
     * Queues an unresolved entity.
     *
     * @param entity    the unresolved entity
     * @param sessionId the session that discovered it, may be {@code null}
     * @return the queued item
     * @throws IllegalArgumentException if the entity is already resolved
     */
    ManualResolutionItem submit(ResolvedEntity entity, String sessionId);

    /**
     * Pending items, oldest first.
     */
    Page<ManualResolutionItem> getPending(PageRequest page);

    Optional<ManualResolutionItem> get(String itemId);

    /**
     * Records the canonical id a reviewer chose for the item.
     *
     * @throws IllegalArgumentException if the item does not exist
     * @throws IllegalStateException    if the item is not pending
     */
    void resolve(String itemId, String canonicalId, String reviewerId);

    /**
     * Closes the item without a match.
     *
     * @throws IllegalArgumentException if the item does not exist
     * @throws IllegalStateException    if the item is not pending
     */
    void dismiss(String itemId, String reviewerId, String notes);

    long countPending();
}
