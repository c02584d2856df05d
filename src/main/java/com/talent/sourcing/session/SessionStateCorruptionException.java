package com.talent.sourcing.session;

import com.talent.sourcing.SourcingException;

/**
 * Stored session state is unreadable or violates its invariants. Fatal for the run.
 */
public class SessionStateCorruptionException extends SourcingException {

    public SessionStateCorruptionException(String message) {
        super(message);
    }

    public SessionStateCorruptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
