package io.github.drompincen.clawgate.runtime.tools;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * @param error failure text, or for {@link Status#DENIED} the reason reported back to the model
 */
public record ToolResult(
        Status status,
        JsonNode output,
        String error
) {
    public enum Status {
        SUCCESS,
        FAILED,
        DENIED
    }

    public static ToolResult success(JsonNode output) {
        return new ToolResult(Status.SUCCESS, output, null);
    }

    public static ToolResult failure(String error) {
        return new ToolResult(Status.FAILED, null, error);
    }

    public static ToolResult denied(String reason) {
        return new ToolResult(Status.DENIED, null, reason);
    }

    public boolean success() {
        return status == Status.SUCCESS;
    }
}
