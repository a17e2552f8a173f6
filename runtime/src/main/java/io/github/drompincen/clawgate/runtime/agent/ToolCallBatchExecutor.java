package io.github.drompincen.clawgate.runtime.agent;

import io.github.drompincen.clawgate.runtime.permission.ConfirmationCancelledException;
import io.github.drompincen.clawgate.runtime.tools.Tool;
import io.github.drompincen.clawgate.runtime.tools.ToolContext;
import io.github.drompincen.clawgate.runtime.tools.ToolRegistry;
import io.github.drompincen.clawgate.runtime.tools.ToolResult;
import io.github.drompincen.clawgate.runtime.tools.ToolStream;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs the tool calls of one model turn concurrently, so several confirmations can be
 * pending at once while the queue still shows them one by one. When the human cancels any
 * confirmation, the calls of the batch still in flight are interrupted, which withdraws
 * their pending confirmations.
 */
@Component
public class ToolCallBatchExecutor {

    private static final Logger log = LoggerFactory.getLogger(ToolCallBatchExecutor.class);

    private final ToolRegistry toolRegistry;
    private final ExecutorService executor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "tool-call");
        t.setDaemon(true);
        return t;
    });

    public ToolCallBatchExecutor(ToolRegistry toolRegistry) {
        this.toolRegistry = toolRegistry;
    }

    public BatchResult execute(ToolContext ctx, List<ToolCall> calls) {
        return execute(ctx, calls, ToolStream.NOOP);
    }

    public BatchResult execute(ToolContext ctx, List<ToolCall> calls, ToolStream stream) {
        CompletionService<ToolCallOutcome> completion = new ExecutorCompletionService<>(executor);
        List<Future<ToolCallOutcome>> running = new ArrayList<>();
        for (ToolCall call : calls) {
            running.add(completion.submit(() -> executeOne(ctx, call, stream)));
        }

        // handled in completion order so a cancel anywhere in the batch is seen at once
        ToolCallOutcome[] outcomes = new ToolCallOutcome[calls.size()];
        boolean halted = false;
        for (int n = 0; n < calls.size(); n++) {
            Future<ToolCallOutcome> future;
            try {
                future = completion.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.info("Interrupted while running a batch of {} tool call(s); halting it", calls.size());
                running.forEach(f -> f.cancel(true));
                break;
            }
            int i = running.indexOf(future);
            ToolCall call = calls.get(i);
            ToolCallOutcome outcome = await(call, future);
            outcomes[i] = outcome;
            if (outcome.cancelled() && !halted) {
                halted = true;
                log.info("Tool call {} ({}) cancelled; halting the rest of the batch", call.id(), call.toolName());
                running.forEach(f -> f.cancel(true));
            }
        }
        for (int i = 0; i < outcomes.length; i++) {
            if (outcomes[i] == null) outcomes[i] = await(calls.get(i), running.get(i));
        }
        return new BatchResult(List.of(outcomes));
    }

    private ToolCallOutcome executeOne(ToolContext ctx, ToolCall call, ToolStream stream) {
        Optional<Tool> tool = toolRegistry.get(call.toolName());
        if (tool.isEmpty()) {
            log.warn("Model requested unknown tool {}", call.toolName());
            return ToolCallOutcome.completed(call, ToolResult.failure("Unknown tool: " + call.toolName()));
        }
        try {
            return ToolCallOutcome.completed(call, tool.get().execute(ctx, call.input(), stream));
        } catch (ConfirmationCancelledException e) {
            return ToolCallOutcome.cancelled(call, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Tool {} failed", call.toolName(), e);
            return ToolCallOutcome.completed(call, ToolResult.failure(call.toolName() + " failed: " + e.getMessage()));
        }
    }

    private ToolCallOutcome await(ToolCall call, Future<ToolCallOutcome> future) {
        try {
            return future.get();
        } catch (CancellationException e) {
            return ToolCallOutcome.cancelled(call, "Halted because another tool call in the batch was cancelled");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return ToolCallOutcome.cancelled(call, "Interrupted while waiting for " + call.toolName());
        } catch (ExecutionException e) {
            log.error("Tool call {} failed unexpectedly", call.id(), e.getCause());
            return ToolCallOutcome.completed(call, ToolResult.failure(String.valueOf(e.getCause())));
        }
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }
}
