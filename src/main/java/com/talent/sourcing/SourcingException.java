package com.talent.sourcing;

/**
 * Base class for the typed failures raised by the sourcing pipeline.
 * All pipeline failures are unchecked.
 */
public class SourcingException extends RuntimeException {

    public SourcingException(String message) {
        super(message);
    }

    public SourcingException(String message, Throwable cause) {
        super(message, cause);
    }
}
