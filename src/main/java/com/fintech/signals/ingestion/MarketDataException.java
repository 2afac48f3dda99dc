package com.fintech.signals.ingestion;

/**
 * Quote data could not be retrieved or was malformed.
 */
public class MarketDataException extends RuntimeException {

    public MarketDataException(String message) {
        super(message);
    }

    public MarketDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
