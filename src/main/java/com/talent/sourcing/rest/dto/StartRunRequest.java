package com.talent.sourcing.rest.dto;

import com.talent.sourcing.pipeline.RunRequest;

import java.util.List;

/**
 * Request DTO for starting a sourcing run.
 */
public record StartRunRequest(
        String sessionId,
        List<Seed> seeds,
        boolean bypassCache
) {
    public record Seed(String name, String website) {
    }

    public StartRunRequest {
        if (seeds == null || seeds.isEmpty()) {
            throw new IllegalArgumentException("seeds are required");
        }
    }

    public RunRequest toRunRequest() {
        RunRequest.Builder builder = RunRequest.builder()
                .sessionId(sessionId)
                .bypassCache(bypassCache);
        seeds.forEach(seed -> builder.seed(seed.name(), seed.website()));
        return builder.build();
    }
}
