package io.github.drompincen.clawgate.runtime.tools;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.clawgate.protocol.api.PermissionDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Base class for tools whose side effects need permission. Subclasses validate input and
 * compute any preview, then call {@link #checkPermission} and stop if it returns a result.
 */
public abstract class GatedTool implements Tool {

    private static final Logger log = LoggerFactory.getLogger(GatedTool.class);

    private ToolExecutionGateway toolExecutionGateway;

    public void setToolExecutionGateway(ToolExecutionGateway toolExecutionGateway) {
        this.toolExecutionGateway = toolExecutionGateway;
    }

    /** Empty when the call may proceed, otherwise the DENIED result to return as-is. */
    protected Optional<ToolResult> checkPermission(ToolContext ctx, JsonNode input) {
        if (toolExecutionGateway == null) {
            log.warn("{} invoked without a permission gateway; refusing", name());
            return Optional.of(ToolResult.denied("No permission gateway is configured; " + name() + " cannot run."));
        }
        PermissionDecision decision = toolExecutionGateway.authorize(ctx, name(), input);
        if (decision.allowed()) return Optional.empty();
        return Optional.of(ToolResult.denied(decision.message()));
    }
}
