package io.github.drompincen.clawgate.runtime.permission;

/**
 * The human dismissed a confirmation without deciding (ESC), or the pending request
 * was withdrawn. Distinct from a denial so callers can stop the whole batch.
 */
public class ConfirmationCancelledException extends RuntimeException {

    private final String requestId;

    public ConfirmationCancelledException(String requestId, String message) {
        super(message);
        this.requestId = requestId;
    }

    public String getRequestId() {
        return requestId;
    }
}
