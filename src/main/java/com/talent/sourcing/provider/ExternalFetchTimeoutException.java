package com.talent.sourcing.provider;

/**
 * An external provider call exceeded its timeout.
 */
public class ExternalFetchTimeoutException extends ExternalFetchException {

    public ExternalFetchTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
