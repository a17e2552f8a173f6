package io.github.drompincen.clawgate.runtime.tools;

import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ToolResultTest {

    @Test
    void successCreatesSuccessfulResult() {
        ToolResult result = ToolResult.success(new TextNode("output data"));

        assertThat(result.success()).isTrue();
        assertThat(result.status()).isEqualTo(ToolResult.Status.SUCCESS);
        assertThat(result.output().asText()).isEqualTo("output data");
        assertThat(result.error()).isNull();
    }

    @Test
    void failureCreatesFailedResult() {
        ToolResult result = ToolResult.failure("something went wrong");

        assertThat(result.success()).isFalse();
        assertThat(result.status()).isEqualTo(ToolResult.Status.FAILED);
        assertThat(result.error()).isEqualTo("something went wrong");
        assertThat(result.output()).isNull();
    }

    @Test
    void deniedCarriesReasonForTheModel() {
        ToolResult result = ToolResult.denied("The user denied permission to use Bash.");

        assertThat(result.success()).isFalse();
        assertThat(result.status()).isEqualTo(ToolResult.Status.DENIED);
        assertThat(result.error()).isEqualTo("The user denied permission to use Bash.");
    }
}
