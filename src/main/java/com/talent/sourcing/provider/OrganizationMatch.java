package com.talent.sourcing.provider;

import java.util.Objects;

/**
 * An organization returned by an {@link EntitySearchProvider}.
 *
 * @param id      the provider's canonical organization id
 * @param name    the organization's display name
 * @param website the organization's website, may be {@code null}
 * @param score   the provider's own relevance score, 0 when not supplied
 */
public record OrganizationMatch(String id, String name, String website, double score) {

    public OrganizationMatch {
        Objects.requireNonNull(id, "id is required");
        if (name == null) {
            name = "";
        }
    }

    public static OrganizationMatch of(String id, String name) {
        return new OrganizationMatch(id, name, null, 0.0);
    }
}
