package io.github.drompincen.clawgate.runtime.config;

import io.github.drompincen.clawgate.protocol.api.RuleScope;

import java.nio.file.Path;
import java.util.List;

/**
 * Locations of the three settings files for one working directory.
 */
public record ConfigurationPaths(Path userHome, Path workdir) {

    public static final String DIRECTORY = ".clawgate";

    public Path forScope(RuleScope scope) {
        Path base = scope == RuleScope.USER ? userHome : workdir;
        return base.resolve(DIRECTORY).resolve(scope.fileName());
    }

    /** Lowest precedence first. */
    public List<Path> all() {
        return List.of(forScope(RuleScope.USER), forScope(RuleScope.PROJECT), forScope(RuleScope.LOCAL));
    }
}
