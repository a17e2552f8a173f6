package io.github.drompincen.clawgate.runtime.agent;

import io.github.drompincen.clawgate.runtime.tools.ToolResult;

/**
 * @param cancelled the human cancelled a confirmation for this call (or the batch was halted);
 *                  {@code result} then carries the reason
 */
public record ToolCallOutcome(
        ToolCall call,
        ToolResult result,
        boolean cancelled
) {
    public static ToolCallOutcome completed(ToolCall call, ToolResult result) {
        return new ToolCallOutcome(call, result, false);
    }

    public static ToolCallOutcome cancelled(ToolCall call, String reason) {
        return new ToolCallOutcome(call, ToolResult.failure(reason), true);
    }
}
