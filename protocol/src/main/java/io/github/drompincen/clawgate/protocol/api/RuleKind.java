package io.github.drompincen.clawgate.protocol.api;

public enum RuleKind {
    EXACT,
    GLOB
}
