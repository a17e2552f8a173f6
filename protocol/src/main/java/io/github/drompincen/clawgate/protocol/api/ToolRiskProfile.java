package io.github.drompincen.clawgate.protocol.api;

public enum ToolRiskProfile {
    READ_ONLY,
    WRITE_FILES,
    EXEC_SHELL
}
