package io.github.drompincen.clawgate.tools;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.clawgate.runtime.tools.ToolContext;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Optional;

/** Input validation shared by the built-in tools. */
final class ToolInputs {

    private ToolInputs() {
    }

    static Optional<String> text(JsonNode input, String field) {
        if (input == null) return Optional.empty();
        JsonNode node = input.get(field);
        if (node == null || !node.isTextual()) return Optional.empty();
        return Optional.of(node.asText());
    }

    static Optional<String> nonBlank(JsonNode input, String field) {
        return text(input, field).filter(value -> !value.isBlank());
    }

    /** Relative paths are resolved against the call's working directory. */
    static Optional<Path> path(ToolContext ctx, String raw) {
        try {
            Path path = Path.of(raw.trim());
            return Optional.of(path.isAbsolute() ? path.normalize() : ctx.workingDirectory().resolve(path).normalize());
        } catch (InvalidPathException e) {
            return Optional.empty();
        }
    }
}
