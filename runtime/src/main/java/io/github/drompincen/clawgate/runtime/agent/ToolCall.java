package io.github.drompincen.clawgate.runtime.agent;

import com.fasterxml.jackson.databind.JsonNode;

/** One tool invocation requested by the model. */
public record ToolCall(
        String id,
        String toolName,
        JsonNode input
) {}
