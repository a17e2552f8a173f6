package io.github.drompincen.clawgate.runtime.tools;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.clawgate.protocol.api.ToolRiskProfile;

import java.util.Set;

public interface Tool {

    String name();

    String description();

    JsonNode inputSchema();

    Set<ToolRiskProfile> riskProfiles();

    ToolResult execute(ToolContext ctx, JsonNode input, ToolStream stream);
}
