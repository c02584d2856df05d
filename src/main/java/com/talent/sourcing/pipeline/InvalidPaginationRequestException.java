package com.talent.sourcing.pipeline;

import com.talent.sourcing.SourcingException;

/**
 * A collection page that starts outside the session's candidate ids, or has a non-positive size.
 */
public class InvalidPaginationRequestException extends SourcingException {

    private final int startIndex;
    private final int count;
    private final int available;

    public InvalidPaginationRequestException(int startIndex, int count, int available) {
        super("Invalid page start=" + startIndex + " count=" + count + " for " + available + " candidate ids");
        this.startIndex = startIndex;
        this.count = count;
        this.available = available;
    }

    public int getStartIndex() {
        return startIndex;
    }

    public int getCount() {
        return count;
    }

    public int getAvailable() {
        return available;
    }
}
