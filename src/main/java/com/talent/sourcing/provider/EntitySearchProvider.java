package com.talent.sourcing.provider;

import java.util.List;
import java.util.Optional;

/**
 * External organization lookup used by the entity resolver.
 * Implementations throw {@link ExternalFetchException} on transport failure;
 * "not found" is an empty result, never an exception.
 */
public interface EntitySearchProvider {

    /**
     * Exact lookup by normalized domain (e.g. {@code acme.com}).
     */
    Optional<OrganizationMatch> findByWebsite(String domain);

    /**
     * Name search, best matches first.
     */
    List<OrganizationMatch> searchByName(String name, int limit);
}
