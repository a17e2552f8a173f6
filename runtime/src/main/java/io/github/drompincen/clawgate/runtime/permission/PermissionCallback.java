package io.github.drompincen.clawgate.runtime.permission;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.clawgate.protocol.api.PermissionDecision;

import java.util.concurrent.CompletableFuture;

/**
 * Authorization hook supplied by an embedding application. Consulted after the rule
 * checks and before the permission mode. Completing with {@code null} abstains and
 * lets the mode and the human decide; failing completes the check with a denial.
 */
@FunctionalInterface
public interface PermissionCallback {

    PermissionCallback NONE = (toolName, toolInput) -> CompletableFuture.completedFuture(null);

    CompletableFuture<PermissionDecision> authorize(String toolName, JsonNode toolInput);
}
