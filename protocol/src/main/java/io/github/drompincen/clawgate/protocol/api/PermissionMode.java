package io.github.drompincen.clawgate.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

public enum PermissionMode {
    DEFAULT("default"),
    BYPASS_PERMISSIONS("bypassPermissions"),
    ACCEPT_EDITS("acceptEdits");

    private final String configValue;

    PermissionMode(String configValue) {
        this.configValue = configValue;
    }

    /** The spelling used in settings files, e.g. {@code bypassPermissions}. */
    @JsonValue
    public String configValue() {
        return configValue;
    }

    public static Optional<PermissionMode> fromConfigValue(String value) {
        if (value == null) return Optional.empty();
        for (PermissionMode mode : values()) {
            if (mode.configValue.equals(value.trim())) {
                return Optional.of(mode);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static PermissionMode fromJson(String value) {
        return fromConfigValue(value)
                .orElseThrow(() -> new IllegalArgumentException("Unknown permission mode: " + value));
    }
}
