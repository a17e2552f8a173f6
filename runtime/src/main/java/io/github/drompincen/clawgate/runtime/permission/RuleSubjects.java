package io.github.drompincen.clawgate.runtime.permission;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.clawgate.protocol.api.RestrictedTools;

import java.util.Optional;
import java.util.Set;

/**
 * Picks the string a rule pattern is matched against for a given tool input.
 */
public final class RuleSubjects {

    private static final Set<String> PATH_TOOLS = Set.of(
            RestrictedTools.WRITE, RestrictedTools.EDIT, RestrictedTools.MULTI_EDIT,
            RestrictedTools.DELETE, "Read", "LS");
    private static final String[] PATH_FIELDS = {"file_path", "target_file", "path"};

    private RuleSubjects() {
    }

    public static Optional<String> subjectOf(String toolName, JsonNode toolInput) {
        if (toolInput == null || !toolInput.isObject()) return Optional.empty();
        if (RestrictedTools.BASH.equals(toolName)) {
            return text(toolInput, "command");
        }
        if (PATH_TOOLS.contains(toolName)) {
            for (String field : PATH_FIELDS) {
                Optional<String> value = text(toolInput, field);
                if (value.isPresent()) return value;
            }
        }
        return Optional.empty();
    }

    private static Optional<String> text(JsonNode input, String field) {
        JsonNode node = input.get(field);
        if (node == null || !node.isTextual() || node.asText().isBlank()) return Optional.empty();
        return Optional.of(node.asText());
    }
}
