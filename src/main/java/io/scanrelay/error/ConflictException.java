package io.scanrelay.error;

/**
 * Raised when a write lost an optimistic version check to a concurrent writer.
 */
public class ConflictException extends ScanRelayException {
    private final long expectedVersion;

    public ConflictException(String resourceId, long expectedVersion) {
        super("Concurrent update on " + resourceId + " (expected version " + expectedVersion + ")");
        this.expectedVersion = expectedVersion;
    }

    public long expectedVersion() {
        return expectedVersion;
    }
}
