package io.github.drompincen.clawgate.runtime.agent;

import io.github.drompincen.clawgate.protocol.api.PermissionRule;
import io.github.drompincen.clawgate.runtime.permission.TemporaryRuleController;
import io.github.drompincen.clawgate.runtime.tools.ToolContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Drives one top-level response cycle: ask the model for tool calls, run them, feed the
 * outcomes back, until the model stops asking. Pre-authorized rules live exactly as long as
 * the cycle. A cancelled confirmation ends the cycle without another model round trip;
 * a denial is just an outcome the model gets to see.
 */
public class AgentCycleRunner {

    private static final Logger log = LoggerFactory.getLogger(AgentCycleRunner.class);

    public static final int MAX_DEPTH = 50;

    public enum Status {
        COMPLETED,
        CANCELLED,
        MAX_DEPTH_REACHED
    }

    public record CycleResult(Status status, int rounds, List<ToolCallOutcome> outcomes) {
        public CycleResult {
            outcomes = List.copyOf(outcomes);
        }
    }

    private final TemporaryRuleController temporaryRuleController;
    private final ToolCallBatchExecutor batchExecutor;
    private final ModelClient modelClient;

    public AgentCycleRunner(TemporaryRuleController temporaryRuleController,
                            ToolCallBatchExecutor batchExecutor,
                            ModelClient modelClient) {
        this.temporaryRuleController = temporaryRuleController;
        this.batchExecutor = batchExecutor;
        this.modelClient = modelClient;
    }

    public CycleResult run(ToolContext ctx, Collection<PermissionRule> preAuthorizedRules) {
        List<ToolCallOutcome> all = new ArrayList<>();
        CycleResult result = step(ctx, preAuthorizedRules, List.of(), 0, all);
        log.info("Response cycle for session {} ended {} after {} round(s)",
                ctx.sessionId(), result.status(), result.rounds());
        return result;
    }

    private CycleResult step(ToolContext ctx, Collection<PermissionRule> rules,
                             List<ToolCallOutcome> previous, int depth, List<ToolCallOutcome> all) {
        return temporaryRuleController.withTemporaryRules(depth, rules, () -> {
            if (depth >= MAX_DEPTH) {
                log.warn("Response cycle for session {} reached the maximum depth of {}", ctx.sessionId(), MAX_DEPTH);
                return new CycleResult(Status.MAX_DEPTH_REACHED, depth, all);
            }
            List<ToolCall> calls = modelClient.nextToolCalls(ctx, previous);
            if (calls == null || calls.isEmpty()) {
                return new CycleResult(Status.COMPLETED, depth, all);
            }

            BatchResult batch = batchExecutor.execute(ctx, calls);
            all.addAll(batch.outcomes());
            if (batch.cancelled()) {
                return new CycleResult(Status.CANCELLED, depth + 1, all);
            }
            return step(ctx, rules, batch.outcomes(), depth + 1, all);
        });
    }
}
