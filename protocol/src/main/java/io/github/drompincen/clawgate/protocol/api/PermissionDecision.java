package io.github.drompincen.clawgate.protocol.api;

/**
 * Final answer for one tool invocation. A denial always carries a human readable
 * message: it is what the model is told, or the user's redirect instructions.
 */
public record PermissionDecision(
        Behavior behavior,
        String message
) {
    public enum Behavior {
        ALLOW,
        DENY
    }

    public PermissionDecision {
        if (behavior == null) {
            throw new IllegalArgumentException("behavior is required");
        }
        if (behavior == Behavior.DENY && (message == null || message.isBlank())) {
            throw new IllegalArgumentException("a deny decision requires a message");
        }
    }

    public static PermissionDecision allow() {
        return new PermissionDecision(Behavior.ALLOW, null);
    }

    public static PermissionDecision deny(String message) {
        return new PermissionDecision(Behavior.DENY, message);
    }

    public boolean allowed() {
        return behavior == Behavior.ALLOW;
    }
}
