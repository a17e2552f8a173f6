package io.github.drompincen.clawgate.runtime.tools;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.clawgate.protocol.api.PermissionDecision;
import io.github.drompincen.clawgate.runtime.permission.ConfirmationCancelledException;
import io.github.drompincen.clawgate.runtime.permission.PermissionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * The permission call site used by tools: runs after input validation and any preview,
 * right before the side effect, and blocks the tool's thread until a decision exists.
 */
@Component
public class ToolExecutionGateway {

    private static final Logger log = LoggerFactory.getLogger(ToolExecutionGateway.class);

    private final PermissionManager permissionManager;

    public ToolExecutionGateway(PermissionManager permissionManager) {
        this.permissionManager = permissionManager;
    }

    /**
     * @throws ConfirmationCancelledException if the human cancelled, or the waiting thread was
     *                                        interrupted (the pending confirmation is withdrawn)
     */
    public PermissionDecision authorize(ToolContext ctx, String toolName, JsonNode input) {
        CompletableFuture<PermissionDecision> pending = ctx == null
                ? permissionManager.checkPermission(toolName, input, null, null)
                : permissionManager.checkPermission(toolName, input, ctx.permissionMode(), ctx.workingDirectory());
        try {
            PermissionDecision decision = pending.get();
            if (decision == null) {
                return PermissionDecision.deny("No permission decision was produced for " + toolName + ".");
            }
            log.debug("{} authorization: {}", toolName, decision.behavior());
            return decision;
        } catch (InterruptedException e) {
            pending.cancel(true);
            Thread.currentThread().interrupt();
            throw new ConfirmationCancelledException(null,
                    "Interrupted while waiting for permission to use " + toolName);
        } catch (CancellationException e) {
            throw new ConfirmationCancelledException(null, "Permission request for " + toolName + " was withdrawn");
        } catch (ExecutionException e) {
            Throwable cause = unwrap(e.getCause());
            if (cause instanceof ConfirmationCancelledException cancelled) {
                throw cancelled;
            }
            if (cause instanceof CancellationException) {
                throw new ConfirmationCancelledException(null, "Permission request for " + toolName + " was withdrawn");
            }
            log.error("Permission check for {} failed", toolName, cause);
            return PermissionDecision.deny("Permission check for " + toolName + " failed: " + cause.getMessage());
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
