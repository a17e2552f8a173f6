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

/**
 * Replaces {@code old_string} with {@code new_string}. The replacement is computed (and the
 * match checked for uniqueness) before permission is asked, so a doomed edit never prompts.
 */
public class EditFileTool extends GatedTool {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override public String name() { return RestrictedTools.EDIT; }
    @Override public String description() { return "Replace text in an existing file"; }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        props.putObject("file_path").put("type", "string").put("description", "File to edit");
        props.putObject("old_string").put("type", "string").put("description", "Text to replace");
        props.putObject("new_string").put("type", "string").put("description", "Replacement text");
        props.putObject("replace_all").put("type", "boolean").put("description", "Replace every occurrence");
        schema.putArray("required").add("file_path").add("old_string").add("new_string");
        return schema;
    }

    @Override public Set<ToolRiskProfile> riskProfiles() { return Set.of(ToolRiskProfile.WRITE_FILES); }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input, ToolStream stream) {
        Optional<String> filePath = ToolInputs.nonBlank(input, "file_path");
        Optional<String> oldString = ToolInputs.text(input, "old_string");
        Optional<String> newString = ToolInputs.text(input, "new_string");
        if (filePath.isEmpty() || oldString.isEmpty() || newString.isEmpty()) {
            return ToolResult.failure("file_path, old_string and new_string are required");
        }
        if (oldString.get().isEmpty()) {
            return ToolResult.failure("old_string must not be empty");
        }
        if (oldString.get().equals(newString.get())) {
            return ToolResult.failure("old_string and new_string are identical");
        }
        boolean replaceAll = input.path("replace_all").asBoolean(false);

        Optional<Path> resolved = ToolInputs.path(ctx, filePath.get());
        if (resolved.isEmpty() || !Files.isRegularFile(resolved.get())) {
            return ToolResult.failure("File not found: " + filePath.get());
        }

        String original;
        try {
            original = Files.readString(resolved.get());
        } catch (IOException e) {
            return ToolResult.failure("Failed to read file: " + e.getMessage());
        }
        int occurrences = countOccurrences(original, oldString.get());
        if (occurrences == 0) {
            return ToolResult.failure("old_string not found in " + filePath.get());
        }
        if (occurrences > 1 && !replaceAll) {
            return ToolResult.failure("old_string occurs " + occurrences
                    + " times in " + filePath.get() + "; set replace_all or add context");
        }
        String updated = replaceAll
                ? original.replace(oldString.get(), newString.get())
                : replaceFirst(original, oldString.get(), newString.get());

        Optional<ToolResult> refusal = checkPermission(ctx, input);
        if (refusal.isPresent()) return refusal.get();

        try {
            Files.writeString(resolved.get(), updated);
        } catch (IOException e) {
            return ToolResult.failure("Failed to write file: " + e.getMessage());
        }
        return ToolResult.success(MAPPER.valueToTree("Replaced " + (replaceAll ? occurrences : 1)
                + " occurrence(s) in " + filePath.get()));
    }

    static int countOccurrences(String text, String needle) {
        int count = 0;
        int from = 0;
        int at;
        while ((at = text.indexOf(needle, from)) >= 0) {
            count++;
            from = at + needle.length();
        }
        return count;
    }

    private static String replaceFirst(String text, String needle, String replacement) {
        int at = text.indexOf(needle);
        return text.substring(0, at) + replacement + text.substring(at + needle.length());
    }
}
