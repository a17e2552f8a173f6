package io.github.drompincen.clawgate.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.clawgate.protocol.api.ToolRiskProfile;
import io.github.drompincen.clawgate.runtime.tools.GatedTool;
import io.github.drompincen.clawgate.runtime.tools.ToolContext;
import io.github.drompincen.clawgate.runtime.tools.ToolResult;
import io.github.drompincen.clawgate.runtime.tools.ToolStream;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.Set;

/** Read-only, so the permission check always passes; it still goes through the gateway. */
public class ReadFileTool extends GatedTool {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override public String name() { return "Read"; }
    @Override public String description() { return "Read the contents of a file"; }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        props.putObject("file_path").put("type", "string").put("description", "File path to read");
        schema.putArray("required").add("file_path");
        return schema;
    }

    @Override public Set<ToolRiskProfile> riskProfiles() { return Set.of(ToolRiskProfile.READ_ONLY); }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input, ToolStream stream) {
        Optional<String> filePath = ToolInputs.nonBlank(input, "file_path");
        if (filePath.isEmpty()) {
            return ToolResult.failure("file_path is required");
        }
        Optional<Path> resolved = ToolInputs.path(ctx, filePath.get());
        if (resolved.isEmpty() || !Files.isRegularFile(resolved.get())) {
            return ToolResult.failure("File not found: " + filePath.get());
        }

        Optional<ToolResult> refusal = checkPermission(ctx, input);
        if (refusal.isPresent()) return refusal.get();

        try {
            return ToolResult.success(MAPPER.valueToTree(Files.readString(resolved.get())));
        } catch (IOException e) {
            return ToolResult.failure("Failed to read file: " + e.getMessage());
        }
    }
}
