package io.github.drompincen.clawgate.runtime.config;

import io.github.drompincen.clawgate.protocol.api.PermissionRule;

import java.nio.file.Path;
import java.util.List;

/**
 * Union of the rule lists of every scope.
 *
 * @param additionalDirectories extra roots treated like the working directory by {@code acceptEdits}
 */
public record RuleSet(
        List<PermissionRule> allow,
        List<PermissionRule> deny,
        List<Path> additionalDirectories
) {
    public static final RuleSet EMPTY = new RuleSet(List.of(), List.of(), List.of());

    public RuleSet {
        allow = allow == null ? List.of() : List.copyOf(allow);
        deny = deny == null ? List.of() : List.copyOf(deny);
        additionalDirectories = additionalDirectories == null ? List.of() : List.copyOf(additionalDirectories);
    }
}
