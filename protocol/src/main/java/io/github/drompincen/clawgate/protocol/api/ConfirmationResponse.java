package io.github.drompincen.clawgate.protocol.api;

/**
 * What the human answered for the item currently shown. Cancelling (ESC) is not a
 * response: it rejects the caller instead of producing a decision.
 */
public record ConfirmationResponse(
        Choice choice,
        String message
) {
    public enum Choice {
        ALLOW_ONCE,
        ALLOW_ALWAYS,
        DENY,
        REDIRECT
    }

    public ConfirmationResponse {
        if (choice == null) {
            throw new IllegalArgumentException("choice is required");
        }
        if (choice == Choice.REDIRECT && (message == null || message.isBlank())) {
            throw new IllegalArgumentException("redirect requires instructions for the model");
        }
    }

    public static ConfirmationResponse allowOnce() {
        return new ConfirmationResponse(Choice.ALLOW_ONCE, null);
    }

    public static ConfirmationResponse allowAlways() {
        return new ConfirmationResponse(Choice.ALLOW_ALWAYS, null);
    }

    public static ConfirmationResponse deny(String reason) {
        return new ConfirmationResponse(Choice.DENY, reason);
    }

    public static ConfirmationResponse redirect(String instructions) {
        return new ConfirmationResponse(Choice.REDIRECT, instructions);
    }

    public boolean allows() {
        return choice == Choice.ALLOW_ONCE || choice == Choice.ALLOW_ALWAYS;
    }
}
