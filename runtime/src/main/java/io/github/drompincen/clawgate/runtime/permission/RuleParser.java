package io.github.drompincen.clawgate.runtime.permission;

import io.github.drompincen.clawgate.protocol.api.PermissionRule;
import io.github.drompincen.clawgate.protocol.api.RuleScope;

import java.util.regex.Pattern;

/**
 * Parses the textual rule form used in settings files and command front matter:
 * {@code Bash(git commit *)}, a bare {@code Write} (any input), or the legacy
 * prefix form {@code Bash(npm install:*)}.
 */
public final class RuleParser {

    private static final Pattern TOOL_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_.-]*");
    private static final String LEGACY_PREFIX_SUFFIX = ":*";

    private RuleParser() {
    }

    public static PermissionRule parse(String text) {
        return parse(text, null);
    }

    public static PermissionRule parse(String text, RuleScope scope) {
        if (text == null || text.isBlank()) {
            throw new RuleSyntaxException(String.valueOf(text), "empty rule");
        }
        String rule = text.trim();
        int open = rule.indexOf('(');
        if (open < 0) {
            if (rule.indexOf(')') >= 0) {
                throw new RuleSyntaxException(text, "unbalanced parentheses");
            }
            return PermissionRule.glob(toolName(text, rule), PermissionRule.WILDCARD).withScope(scope);
        }
        if (!rule.endsWith(")")) {
            throw new RuleSyntaxException(text, "missing closing parenthesis");
        }

        String tool = toolName(text, rule.substring(0, open).trim());
        String pattern = rule.substring(open + 1, rule.length() - 1).trim();
        if (pattern.isEmpty()) {
            throw new RuleSyntaxException(text, "empty pattern");
        }
        if (pattern.endsWith(LEGACY_PREFIX_SUFFIX)) {
            String prefix = pattern.substring(0, pattern.length() - LEGACY_PREFIX_SUFFIX.length()).trim();
            pattern = prefix.isEmpty() ? PermissionRule.WILDCARD : prefix + " *";
        }
        return PermissionRule.of(tool, pattern).withScope(scope);
    }

    private static String toolName(String text, String candidate) {
        if (!TOOL_NAME.matcher(candidate).matches()) {
            throw new RuleSyntaxException(text, "invalid tool name '" + candidate + "'");
        }
        return candidate;
    }
}
