package io.github.drompincen.clawgate.protocol.api;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PermissionDecisionTest {

    @Test
    void allowHasNoMessage() {
        PermissionDecision decision = PermissionDecision.allow();

        assertThat(decision.allowed()).isTrue();
        assertThat(decision.message()).isNull();
    }

    @Test
    void denyKeepsMessage() {
        PermissionDecision decision = PermissionDecision.deny("blocked by policy");

        assertThat(decision.allowed()).isFalse();
        assertThat(decision.behavior()).isEqualTo(PermissionDecision.Behavior.DENY);
        assertThat(decision.message()).isEqualTo("blocked by policy");
    }

    @Test
    void denyWithoutMessageIsRejected() {
        assertThatThrownBy(() -> PermissionDecision.deny(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PermissionDecision.deny("  ")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void behaviorIsRequired() {
        assertThatThrownBy(() -> new PermissionDecision(null, "x")).isInstanceOf(IllegalArgumentException.class);
    }
}
