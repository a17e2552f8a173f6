package io.github.drompincen.clawgate.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.clawgate.protocol.api.RestrictedTools;
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

public class WriteFileTool extends GatedTool {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override public String name() { return RestrictedTools.WRITE; }
    @Override public String description() { return "Write content to a file (creates or overwrites)"; }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        props.putObject("file_path").put("type", "string").put("description", "File path to write");
        props.putObject("content").put("type", "string").put("description", "Content to write");
        schema.putArray("required").add("file_path").add("content");
        return schema;
    }

    @Override public Set<ToolRiskProfile> riskProfiles() { return Set.of(ToolRiskProfile.WRITE_FILES); }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input, ToolStream stream) {
        Optional<String> filePath = ToolInputs.nonBlank(input, "file_path");
        Optional<String> content = ToolInputs.text(input, "content");
        if (filePath.isEmpty() || content.isEmpty()) {
            return ToolResult.failure("file_path and content are required");
        }
        Optional<Path> resolved = ToolInputs.path(ctx, filePath.get());
        if (resolved.isEmpty()) {
            return ToolResult.failure("Invalid file path: " + filePath.get());
        }
        if (Files.isDirectory(resolved.get())) {
            return ToolResult.failure(filePath.get() + " is a directory");
        }
        boolean overwrite = Files.exists(resolved.get());

        Optional<ToolResult> refusal = checkPermission(ctx, input);
        if (refusal.isPresent()) return refusal.get();

        try {
            Path parent = resolved.get().getParent();
            if (parent != null) Files.createDirectories(parent);
            Files.writeString(resolved.get(), content.get());
        } catch (IOException e) {
            return ToolResult.failure("Failed to write file: " + e.getMessage());
        }
        return ToolResult.success(MAPPER.valueToTree((overwrite ? "Overwrote " : "Created ")
                + filePath.get() + " (" + content.get().length() + " chars)"));
    }
}
