package com.fintech.signals.domain;

/**
 * Asks the buffer sink for its most recent entries.
 *
 * @param n maximum number of entries, newest first
 */
public record BufferDataRequest(int n) {

    public BufferDataRequest {
        if (n < 0) {
            throw new IllegalArgumentException("Entry count must not be negative, got " + n);
        }
    }
}
