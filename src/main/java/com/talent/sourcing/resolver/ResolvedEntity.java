package com.talent.sourcing.resolver;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Objects;

/**
 * Outcome of resolving one organization. Unresolved entities are kept, never dropped:
 * they carry no canonical id, zero confidence and {@link ResolutionMethod#UNRESOLVED}.
 *
 * @param queryName   the name as supplied by the caller
 * @param website     the website as supplied by the caller, may be {@code null}
 * @param canonicalId the provider's organization id, {@code null} when unresolved
 * @param matchedName the provider's name for the match, {@code null} when unresolved
 * @param confidence  match confidence in [0, 1]
 * @param tier        the tier that matched, {@code null} when unresolved
 * @param method      how the entity was resolved
 */
public record ResolvedEntity(String queryName, String website, String canonicalId, String matchedName,
                             double confidence, ResolutionTier tier, ResolutionMethod method) {

    public ResolvedEntity {
        Objects.requireNonNull(queryName, "queryName is required");
        Objects.requireNonNull(method, "method is required");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be in [0, 1], got " + confidence);
        }
        if (canonicalId != null && confidence == 0.0) {
            throw new IllegalArgumentException("a resolved entity must have confidence > 0");
        }
        if (canonicalId == null && (confidence != 0.0 || method != ResolutionMethod.UNRESOLVED)) {
            throw new IllegalArgumentException("an unresolved entity must have confidence 0 and method UNRESOLVED");
        }
    }

    public static ResolvedEntity resolved(ResolutionRequest request, TierMatch match) {
        return new ResolvedEntity(request.name(), request.website(), match.match().id(),
                match.match().name(), match.confidence(), match.tier(), match.tier().method());
    }

    public static ResolvedEntity unresolved(ResolutionRequest request) {
        return new ResolvedEntity(request.name(), request.website(), null, null,
                0.0, null, ResolutionMethod.UNRESOLVED);
    }

    @JsonIgnore
    public boolean isResolved() {
        return canonicalId != null;
    }

    public boolean needsManualResolution() {
        return canonicalId == null;
    }

    /**
     * Tier number 1-3, or 0 when unresolved.
     */
    public int tierNumber() {
        return tier != null ? tier.number() : 0;
    }
}
