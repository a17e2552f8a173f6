package io.github.drompincen.clawgate.runtime.agent;

import java.util.List;

/** Outcomes in the order the calls were requested. */
public record BatchResult(List<ToolCallOutcome> outcomes) {

    public BatchResult {
        outcomes = List.copyOf(outcomes);
    }

    public boolean cancelled() {
        return outcomes.stream().anyMatch(ToolCallOutcome::cancelled);
    }
}
