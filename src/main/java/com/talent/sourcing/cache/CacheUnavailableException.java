package com.talent.sourcing.cache;

import com.talent.sourcing.SourcingException;

/**
 * Raised by a persistent store when it cannot be reached. The cache tier
 * degrades it to a miss; the session store lets it abort the run.
 */
public class CacheUnavailableException extends SourcingException {

    public CacheUnavailableException(String message) {
        super(message);
    }

    public CacheUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
