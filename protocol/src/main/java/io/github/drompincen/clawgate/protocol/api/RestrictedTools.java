package io.github.drompincen.clawgate.protocol.api;

import java.util.Set;

/**
 * Tool names that are ever eligible for confirmation. Anything else is auto-allowed.
 */
public final class RestrictedTools {

    public static final String BASH = "Bash";
    public static final String WRITE = "Write";
    public static final String EDIT = "Edit";
    public static final String MULTI_EDIT = "MultiEdit";
    public static final String DELETE = "Delete";

    public static final Set<String> NAMES = Set.of(BASH, WRITE, EDIT, MULTI_EDIT, DELETE);

    /** Tools auto-accepted by {@link PermissionMode#ACCEPT_EDITS} inside the safe zone. */
    public static final Set<String> FILE_EDIT_TOOLS = Set.of(WRITE, EDIT, MULTI_EDIT, DELETE);

    private RestrictedTools() {
    }

    public static boolean isRestricted(String toolName) {
        return toolName != null && NAMES.contains(toolName);
    }

    public static boolean isFileEditTool(String toolName) {
        return toolName != null && FILE_EDIT_TOOLS.contains(toolName);
    }
}
