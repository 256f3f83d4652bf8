package io.scanrelay.error;

/**
 * Base type for domain errors callers are expected to handle.
 */
public class ScanRelayException extends RuntimeException {
    public ScanRelayException(String message) {
        super(message);
    }

    public ScanRelayException(String message, Throwable cause) {
        super(message, cause);
    }
}
