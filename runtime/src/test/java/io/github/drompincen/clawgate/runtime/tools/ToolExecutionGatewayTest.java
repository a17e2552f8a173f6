package io.github.drompincen.clawgate.runtime.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.clawgate.protocol.api.PermissionDecision;
import io.github.drompincen.clawgate.protocol.api.PermissionMode;
import io.github.drompincen.clawgate.runtime.permission.ConfirmationCancelledException;
import io.github.drompincen.clawgate.runtime.permission.PermissionManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ToolExecutionGatewayTest {

    @Mock
    private PermissionManager permissionManager;

    private ToolExecutionGateway gateway;
    private final ObjectNode input = new ObjectMapper().createObjectNode().put("command", "make");
    private final ToolContext ctx = new ToolContext("s1", Path.of("."), Map.of());

    @BeforeEach
    void setUp() {
        gateway = new ToolExecutionGateway(permissionManager);
    }

    @Test
    void passesDecisionThrough() {
        when(permissionManager.checkPermission(eq("Bash"), eq(input), any(), any()))
                .thenReturn(CompletableFuture.completedFuture(PermissionDecision.deny("no")));

        PermissionDecision decision = gateway.authorize(ctx, "Bash", input);

        assertThat(decision.allowed()).isFalse();
        assertThat(decision.message()).isEqualTo("no");
    }

    @Test
    void forwardsCallSiteModeAndWorkingDirectory() {
        when(permissionManager.checkPermission("Bash", input, PermissionMode.ACCEPT_EDITS, Path.of(".")))
                .thenReturn(CompletableFuture.completedFuture(PermissionDecision.allow()));

        assertThat(gateway.authorize(ctx.withPermissionMode(PermissionMode.ACCEPT_EDITS), "Bash", input).allowed())
                .isTrue();
    }

    @Test
    void missingDecisionIsADenial() {
        when(permissionManager.checkPermission(eq("Bash"), eq(input), any(), any()))
                .thenReturn(CompletableFuture.completedFuture(null));

        assertThat(gateway.authorize(ctx, "Bash", input).allowed()).isFalse();
    }

    @Test
    void cancellationPropagatesAsCancelledException() {
        when(permissionManager.checkPermission(eq("Bash"), eq(input), any(), any()))
                .thenReturn(CompletableFuture.failedFuture(new ConfirmationCancelledException("r1", "cancelled")));

        assertThatThrownBy(() -> gateway.authorize(ctx, "Bash", input))
                .isInstanceOf(ConfirmationCancelledException.class)
                .hasMessage("cancelled");
    }

    @Test
    void unexpectedFailureDeniesInsteadOfThrowing() {
        when(permissionManager.checkPermission(eq("Bash"), eq(input), any(), any()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("boom")));

        PermissionDecision decision = gateway.authorize(ctx, "Bash", input);

        assertThat(decision.allowed()).isFalse();
        assertThat(decision.message()).contains("boom");
    }

    @Test
    void interruptWithdrawsPendingRequest() throws Exception {
        CompletableFuture<PermissionDecision> pending = new CompletableFuture<>();
        when(permissionManager.checkPermission(eq("Bash"), eq(input), any(), any())).thenReturn(pending);
        AtomicReference<Throwable> thrown = new AtomicReference<>();
        CountDownLatch done = new CountDownLatch(1);

        Thread worker = new Thread(() -> {
            try {
                gateway.authorize(ctx, "Bash", input);
            } catch (Throwable t) {
                thrown.set(t);
            } finally {
                done.countDown();
            }
        });
        worker.start();
        verify(permissionManager, timeout(5000)).checkPermission(eq("Bash"), eq(input), any(), any());
        worker.interrupt();

        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(thrown.get()).isInstanceOf(ConfirmationCancelledException.class);
        assertThat(pending).isCancelled();
    }
}
