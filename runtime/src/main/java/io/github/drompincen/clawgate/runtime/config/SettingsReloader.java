package io.github.drompincen.clawgate.runtime.config;

import io.github.drompincen.clawgate.runtime.permission.PermissionManager;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;

/**
 * Polls the settings files and pushes changed rules and mode into the {@link PermissionManager},
 * so edits take effect without a restart.
 */
@Component
public class SettingsReloader {

    private static final Logger log = LoggerFactory.getLogger(SettingsReloader.class);

    private final PermissionConfigurationResolver resolver;
    private final PermissionManager permissionManager;
    private final Path workdir;
    private volatile List<String> lastFingerprint = List.of();

    public SettingsReloader(PermissionConfigurationResolver resolver,
                            PermissionManager permissionManager,
                            ClawGateProperties properties) {
        this.resolver = resolver;
        this.permissionManager = permissionManager;
        this.workdir = properties.workdirPath();
    }

    @PostConstruct
    public void init() {
        lastFingerprint = fingerprint();
    }

    @Scheduled(fixedDelayString = "${clawgate.permissions.reload-interval-ms:2000}")
    public void poll() {
        checkForChanges();
    }

    /** @return true if anything changed on disk since the last check */
    public boolean checkForChanges() {
        List<String> current = fingerprint();
        if (current.equals(lastFingerprint)) return false;
        lastFingerprint = current;
        log.debug("Settings changed on disk: {}", current);
        reload();
        return true;
    }

    public void reload() {
        try {
            permissionManager.updateRules(resolver.resolveRuleSets(workdir));
            permissionManager.updateConfiguredDefaultMode(resolver.resolveConfiguredMode(workdir).orElse(null));
            log.info("Reloaded permission settings for {}", workdir);
        } catch (RuntimeException e) {
            log.warn("Reloading permission settings failed; keeping the previous rules: {}", e.getMessage());
        }
    }

    List<String> fingerprint() {
        List<String> result = new ArrayList<>();
        for (Path file : resolver.configurationPaths(workdir).all()) {
            if (!Files.exists(file)) {
                result.add(file + ":absent");
                continue;
            }
            try {
                BasicFileAttributes attrs = Files.readAttributes(file, BasicFileAttributes.class);
                result.add(file + ":" + attrs.lastModifiedTime().toMillis() + ":" + attrs.size());
            } catch (IOException e) {
                result.add(file + ":unreadable");
            }
        }
        return result;
    }
}
