package io.github.drompincen.clawgate.runtime.config;

import io.github.drompincen.clawgate.protocol.api.RuleScope;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;

/**
 * Process-level settings bound from {@code clawgate.*}. Every field has a default so the
 * engine also runs with an empty environment.
 */
@ConfigurationProperties("clawgate")
public record ClawGateProperties(
        String workdir,
        String userHome,
        Permissions permissions
) {
    public static final long DEFAULT_RELOAD_INTERVAL_MS = 2000;

    public ClawGateProperties {
        if (workdir == null || workdir.isBlank()) {
            workdir = System.getProperty("user.dir");
        }
        if (userHome == null || userHome.isBlank()) {
            userHome = System.getProperty("user.home");
        }
        if (permissions == null) {
            permissions = new Permissions(false, null, 0);
        }
    }

    public static ClawGateProperties of(Path workdir, Path userHome) {
        return new ClawGateProperties(workdir.toString(), userHome.toString(), null);
    }

    public Path workdirPath() {
        return Path.of(workdir).toAbsolutePath().normalize();
    }

    public Path userHomePath() {
        return Path.of(userHome).toAbsolutePath().normalize();
    }

    public ClawGateProperties withPermissions(Permissions newPermissions) {
        return new ClawGateProperties(workdir, userHome, newPermissions);
    }

    /**
     * @param dangerouslySkipPermissions the CLI override; forces bypass for the whole process
     * @param persistScope               where "always allow" rules are written
     */
    public record Permissions(
            boolean dangerouslySkipPermissions,
            RuleScope persistScope,
            long reloadIntervalMs
    ) {
        public Permissions {
            if (persistScope == null) {
                persistScope = RuleScope.LOCAL;
            }
            if (reloadIntervalMs <= 0) {
                reloadIntervalMs = DEFAULT_RELOAD_INTERVAL_MS;
            }
        }
    }
}
