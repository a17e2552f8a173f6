package io.github.drompincen.clawgate.runtime.tools;

import io.github.drompincen.clawgate.protocol.api.PermissionMode;

import java.nio.file.Path;
import java.util.Map;

/**
 * @param permissionMode the call site's mode override, or null to use the configured mode
 */
public record ToolContext(
        String sessionId,
        Path workingDirectory,
        Map<String, String> environment,
        PermissionMode permissionMode
) {
    public ToolContext(String sessionId, Path workingDirectory, Map<String, String> environment) {
        this(sessionId, workingDirectory, environment, null);
    }

    public ToolContext withPermissionMode(PermissionMode mode) {
        return new ToolContext(sessionId, workingDirectory, environment, mode);
    }
}
