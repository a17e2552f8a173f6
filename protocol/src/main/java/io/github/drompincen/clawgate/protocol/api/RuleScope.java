package io.github.drompincen.clawgate.protocol.api;

/**
 * Configuration tier a persisted rule lives in. Higher precedence wins for scalar
 * settings such as the default mode; rule lists from all scopes are unioned.
 */
public enum RuleScope {
    USER(0, "settings.json"),
    PROJECT(1, "settings.json"),
    LOCAL(2, "settings.local.json");

    private final int precedence;
    private final String fileName;

    RuleScope(int precedence, String fileName) {
        this.precedence = precedence;
        this.fileName = fileName;
    }

    public int precedence() {
        return precedence;
    }

    public String fileName() {
        return fileName;
    }
}
