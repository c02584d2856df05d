package com.talent.sourcing.lock;

/**
 * Configuration for lock implementations.
 *
 * @param timeoutMs maximum time to wait for lock acquisition
 */
public record LockConfig(long timeoutMs) {

    public LockConfig {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be > 0");
        }
    }

    /**
     * Default configuration: 5s timeout.
     */
    public static LockConfig defaults() {
        return new LockConfig(5000);
    }
}
