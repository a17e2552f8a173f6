package io.github.drompincen.clawgate.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.clawgate.protocol.api.RestrictedTools;
import io.github.drompincen.clawgate.protocol.api.ToolRiskProfile;
import io.github.drompincen.clawgate.runtime.tools.GatedTool;
import io.github.drompincen.clawgate.runtime.tools.ToolContext;
import io.github.drompincen.clawgate.runtime.tools.ToolResult;
import io.github.drompincen.clawgate.runtime.tools.ToolStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

public class BashTool extends GatedTool {

    private static final Logger log = LoggerFactory.getLogger(BashTool.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final int DEFAULT_TIMEOUT_SECONDS = 120;

    @Override public String name() { return RestrictedTools.BASH; }
    @Override public String description() { return "Execute a shell command in the working directory"; }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        props.putObject("command").put("type", "string").put("description", "Shell command to execute");
        props.putObject("timeout_seconds").put("type", "integer")
                .put("description", "Timeout in seconds (default " + DEFAULT_TIMEOUT_SECONDS + ")");
        schema.putArray("required").add("command");
        return schema;
    }

    @Override public Set<ToolRiskProfile> riskProfiles() { return Set.of(ToolRiskProfile.EXEC_SHELL); }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input, ToolStream stream) {
        Optional<String> command = ToolInputs.nonBlank(input, "command");
        if (command.isEmpty()) {
            return ToolResult.failure("command is required");
        }
        int timeout = input.has("timeout_seconds") ? input.get("timeout_seconds").asInt(DEFAULT_TIMEOUT_SECONDS)
                : DEFAULT_TIMEOUT_SECONDS;
        if (timeout <= 0) {
            return ToolResult.failure("timeout_seconds must be positive");
        }

        Optional<ToolResult> refusal = checkPermission(ctx, input);
        if (refusal.isPresent()) return refusal.get();

        return run(ctx, command.get(), timeout, stream);
    }

    private ToolResult run(ToolContext ctx, String command, int timeout, ToolStream stream) {
        Process process;
        try {
            ProcessBuilder pb = new ProcessBuilder("sh", "-c", command)
                    .directory(ctx.workingDirectory().toFile())
                    .redirectErrorStream(false);
            if (ctx.environment() != null) pb.environment().putAll(ctx.environment());
            process = pb.start();
        } catch (IOException e) {
            return ToolResult.failure("Failed to start command: " + e.getMessage());
        }

        StringBuffer stdout = new StringBuffer();
        StringBuffer stderr = new StringBuffer();
        Thread stdoutThread = pump(process.getInputStream(), stdout, stream::stdoutDelta, "bash-stdout");
        Thread stderrThread = pump(process.getErrorStream(), stderr, stream::stderrDelta, "bash-stderr");

        try {
            boolean finished = process.waitFor(timeout, TimeUnit.SECONDS);
            if (!finished) {
                process.destroyForcibly();
                return ToolResult.failure("Command timed out after " + timeout + " seconds");
            }
            stdoutThread.join(1000);
            stderrThread.join(1000);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            return ToolResult.failure("Command interrupted");
        }

        return ToolResult.success(MAPPER.valueToTree(Map.of(
                "exitCode", process.exitValue(),
                "stdout", stdout.toString(),
                "stderr", stderr.toString())));
    }

    private static Thread pump(InputStream in, StringBuffer sink, Consumer<String> delta, String name) {
        Thread t = new Thread(() -> {
            try (var reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    sink.append(line).append("\n");
                    delta.accept(line + "\n");
                }
            } catch (IOException e) {
                log.debug("Stopped reading {}: {}", name, e.getMessage());
            }
        }, name);
        t.setDaemon(true);
        t.start();
        return t;
    }
}
