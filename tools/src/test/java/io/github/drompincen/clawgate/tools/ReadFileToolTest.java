package io.github.drompincen.clawgate.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.clawgate.protocol.api.PermissionDecision;
import io.github.drompincen.clawgate.protocol.api.ToolRiskProfile;
import io.github.drompincen.clawgate.runtime.tools.ToolContext;
import io.github.drompincen.clawgate.runtime.tools.ToolExecutionGateway;
import io.github.drompincen.clawgate.runtime.tools.ToolResult;
import io.github.drompincen.clawgate.runtime.tools.ToolStream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class ReadFileToolTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void readsFileThroughGateway(@TempDir Path tempDir) throws IOException {
        Files.writeString(tempDir.resolve("notes.md"), "hello");
        ToolExecutionGateway gateway = mock(ToolExecutionGateway.class);
        when(gateway.authorize(any(), eq("Read"), any())).thenReturn(PermissionDecision.allow());
        ReadFileTool tool = new ReadFileTool();
        tool.setToolExecutionGateway(gateway);

        ToolResult result = tool.execute(new ToolContext("s1", tempDir, Map.of()),
                mapper.createObjectNode().put("file_path", "notes.md"), ToolStream.NOOP);

        assertThat(tool.riskProfiles()).containsExactly(ToolRiskProfile.READ_ONLY);
        assertThat(result.success()).isTrue();
        assertThat(result.output().asText()).isEqualTo("hello");
        verify(gateway).authorize(any(), eq("Read"), any());
    }

    @Test
    void missingFileFails(@TempDir Path tempDir) {
        ReadFileTool tool = new ReadFileTool();

        ToolResult result = tool.execute(new ToolContext("s1", tempDir, Map.of()),
                mapper.createObjectNode().put("file_path", "nope.txt"), ToolStream.NOOP);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).startsWith("File not found");
    }
}
