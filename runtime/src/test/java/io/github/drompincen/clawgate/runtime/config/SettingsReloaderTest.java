package io.github.drompincen.clawgate.runtime.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.clawgate.protocol.api.PermissionMode;
import io.github.drompincen.clawgate.protocol.api.PermissionRule;
import io.github.drompincen.clawgate.protocol.api.RuleScope;
import io.github.drompincen.clawgate.runtime.permission.ConfirmationQueue;
import io.github.drompincen.clawgate.runtime.permission.PermissionCallback;
import io.github.drompincen.clawgate.runtime.permission.PermissionManager;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class SettingsReloaderTest {

    @TempDir
    Path tempDir;

    private PermissionConfigurationResolver resolver;
    private PermissionManager manager;
    private ConfirmationQueue queue;
    private SettingsReloader reloader;
    private Path localSettings;

    @BeforeEach
    void setUp() throws IOException {
        Path workdir = Files.createDirectories(tempDir.resolve("project"));
        Path home = Files.createDirectories(tempDir.resolve("home"));
        ClawGateProperties properties = ClawGateProperties.of(workdir, home);
        resolver = new PermissionConfigurationResolver(properties, new ObjectMapper());
        queue = new ConfirmationQueue();
        manager = new PermissionManager(properties, resolver, queue, PermissionCallback.NONE);
        manager.loadConfiguration();
        reloader = new SettingsReloader(resolver, manager, properties);
        reloader.init();
        localSettings = resolver.configurationPaths(workdir).forScope(RuleScope.LOCAL);
        Files.createDirectories(localSettings.getParent());
    }

    @AfterEach
    void tearDown() {
        queue.shutdown();
    }

    @Test
    void nothingChangedMeansNoReload() {
        assertThat(reloader.checkForChanges()).isFalse();
    }

    @Test
    void editedRulesAndModeTakeEffect() throws IOException {
        Files.writeString(localSettings,
                "{\"permissions\": {\"defaultMode\": \"acceptEdits\", \"allow\": [\"Bash(make *)\"]}}");

        assertThat(reloader.checkForChanges()).isTrue();
        assertThat(manager.allowRules()).extracting(PermissionRule::toRuleString).containsExactly("Bash(make *)");
        assertThat(manager.effectiveMode(null)).isEqualTo(PermissionMode.ACCEPT_EDITS);
        assertThat(reloader.checkForChanges()).isFalse();

        Files.writeString(localSettings, "{\"permissions\": {\"deny\": [\"Bash(make deploy)\", \"Delete\"]}}");

        assertThat(reloader.checkForChanges()).isTrue();
        assertThat(manager.allowRules()).isEmpty();
        assertThat(manager.denyRules()).hasSize(2);
        assertThat(manager.effectiveMode(null)).isEqualTo(PermissionMode.DEFAULT);
    }

    @Test
    void deletedFileDropsItsRules() throws IOException {
        Files.writeString(localSettings, "{\"permissions\": {\"allow\": [\"Bash(make *)\"]}}");
        reloader.checkForChanges();

        Files.delete(localSettings);

        assertThat(reloader.checkForChanges()).isTrue();
        assertThat(manager.allowRules()).isEmpty();
    }

    @Test
    void fingerprintCoversEveryScope() {
        assertThat(reloader.fingerprint()).hasSize(3).allSatisfy(entry -> assertThat(entry).endsWith(":absent"));
    }
}
