package io.scanrelay.error;

public class InvalidTransitionException extends ScanRelayException {
    private final String from;
    private final String to;

    public InvalidTransitionException(String resourceId, String from, String to) {
        super("Illegal transition for " + resourceId + ": " + from + " -> " + to);
        this.from = from;
        this.to = to;
    }

    public String from() {
        return from;
    }

    public String to() {
        return to;
    }
}
