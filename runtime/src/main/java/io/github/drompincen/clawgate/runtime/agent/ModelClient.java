package io.github.drompincen.clawgate.runtime.agent;

import io.github.drompincen.clawgate.runtime.tools.ToolContext;

import java.util.List;

/**
 * The model side of a response cycle. Given the outcomes of the previous round (empty on the
 * first call), returns the next tool calls; an empty list ends the cycle.
 */
@FunctionalInterface
public interface ModelClient {

    List<ToolCall> nextToolCalls(ToolContext ctx, List<ToolCallOutcome> previousOutcomes);
}
