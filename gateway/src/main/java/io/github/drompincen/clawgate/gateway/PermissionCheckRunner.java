package io.github.drompincen.clawgate.gateway;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.clawgate.protocol.api.PermissionDecision;
import io.github.drompincen.clawgate.protocol.api.RestrictedTools;
import io.github.drompincen.clawgate.runtime.permission.ConfirmationCancelledException;
import io.github.drompincen.clawgate.runtime.permission.PermissionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * {@code check <Tool> <subject...>}: evaluates one request against the current settings and
 * prints {@code ALLOW}, {@code DENY: <message>} or {@code CANCELLED}.
 */
@Component
public class PermissionCheckRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(PermissionCheckRunner.class);

    private final PermissionManager permissionManager;
    private final ObjectMapper objectMapper;
    private final PrintStream out;

    @Autowired
    public PermissionCheckRunner(PermissionManager permissionManager, ObjectMapper objectMapper) {
        this(permissionManager, objectMapper, System.out);
    }

    PermissionCheckRunner(PermissionManager permissionManager, ObjectMapper objectMapper, PrintStream out) {
        this.permissionManager = permissionManager;
        this.objectMapper = objectMapper;
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        List<String> words = args.getNonOptionArgs();
        if (words.isEmpty() || !"check".equals(words.get(0))) return;
        if (words.size() < 2) {
            out.println("usage: check <Tool> <command or path>");
            return;
        }
        String toolName = words.get(1);
        String subject = String.join(" ", words.subList(2, words.size()));
        out.println(check(toolName, subject));
    }

    String check(String toolName, String subject) throws InterruptedException {
        ObjectNode input = objectMapper.createObjectNode();
        if (!subject.isEmpty()) {
            input.put(RestrictedTools.BASH.equals(toolName) ? "command" : "file_path", subject);
        }
        try {
            PermissionDecision decision = permissionManager.checkPermission(toolName, input).get();
            return decision.allowed() ? "ALLOW" : "DENY: " + decision.message();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() instanceof CompletionException && e.getCause().getCause() != null
                    ? e.getCause().getCause() : e.getCause();
            if (cause instanceof ConfirmationCancelledException) return "CANCELLED";
            log.error("Permission check for {} failed", toolName, cause);
            return "ERROR: " + cause.getMessage();
        }
    }
}
