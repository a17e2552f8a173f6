package io.github.drompincen.clawgate.protocol.api;

/**
 * A trust or deny rule in its parsed form. The textual form is {@code ToolName(pattern)},
 * e.g. {@code Bash(git commit *)}.
 *
 * @param scope where the rule is stored; {@code null} for temporary rules, which are never persisted
 */
public record PermissionRule(
        String toolName,
        String pattern,
        RuleKind kind,
        RuleScope scope
) {
    public static final String WILDCARD = "*";

    public PermissionRule {
        if (toolName == null || toolName.isBlank()) {
            throw new IllegalArgumentException("toolName is required");
        }
        if (pattern == null || pattern.isEmpty()) {
            throw new IllegalArgumentException("pattern is required");
        }
        if (kind == null) {
            kind = kindOf(pattern);
        }
        if (kind == RuleKind.EXACT && pattern.contains(WILDCARD)) {
            throw new IllegalArgumentException("exact rule cannot contain a wildcard: " + pattern);
        }
    }

    public static PermissionRule exact(String toolName, String pattern) {
        return new PermissionRule(toolName, pattern, RuleKind.EXACT, null);
    }

    public static PermissionRule glob(String toolName, String pattern) {
        return new PermissionRule(toolName, pattern, RuleKind.GLOB, null);
    }

    /** Exact when the pattern has no {@code *}, glob otherwise. */
    public static PermissionRule of(String toolName, String pattern) {
        return new PermissionRule(toolName, pattern, kindOf(pattern), null);
    }

    public static RuleKind kindOf(String pattern) {
        return pattern.contains(WILDCARD) ? RuleKind.GLOB : RuleKind.EXACT;
    }

    public PermissionRule withScope(RuleScope newScope) {
        return new PermissionRule(toolName, pattern, kind, newScope);
    }

    public boolean isTemporary() {
        return scope == null;
    }

    /** True for a bare tool rule such as {@code Bash} or {@code Bash(*)}. */
    public boolean matchesAnyInput() {
        return WILDCARD.equals(pattern);
    }

    public String toRuleString() {
        return toolName + "(" + pattern + ")";
    }

    /** Scope-insensitive identity used for de-duplication. */
    public boolean sameRuleAs(PermissionRule other) {
        return other != null && toolName.equals(other.toolName) && pattern.equals(other.pattern);
    }
}
