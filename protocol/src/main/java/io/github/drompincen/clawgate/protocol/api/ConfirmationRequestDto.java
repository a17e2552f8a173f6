package io.github.drompincen.clawgate.protocol.api;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.List;

/**
 * The pending decision a consumer surface shows to the human.
 *
 * @param suggestedRules            rule strings persisted when the human picks "always allow"
 * @param persistentOptionAvailable false when no reusable rule can be offered for this input
 */
public record ConfirmationRequestDto(
        String requestId,
        String toolName,
        JsonNode toolInput,
        List<String> suggestedRules,
        boolean persistentOptionAvailable,
        Instant createdAt
) {
    public ConfirmationRequestDto {
        suggestedRules = suggestedRules == null ? List.of() : List.copyOf(suggestedRules);
    }
}
