package com.talent.sourcing.resolver;

/**
 * An organization to resolve.
 *
 * @param name    the organization name as supplied by the caller
 * @param website optional website, used for the exact-key tier
 */
public record ResolutionRequest(String name, String website) {

    public ResolutionRequest {
        name = name != null ? name.trim() : "";
        if (website != null && website.isBlank()) {
            website = null;
        }
    }

    public static ResolutionRequest of(String name) {
        return new ResolutionRequest(name, null);
    }

    public static ResolutionRequest of(String name, String website) {
        return new ResolutionRequest(name, website);
    }
}
