package io.github.drompincen.clawgate.runtime.permission;

import io.github.drompincen.clawgate.protocol.api.ConfirmationRequestDto;
import io.github.drompincen.clawgate.protocol.api.ConfirmationResponse;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Presents pending human decisions one at a time, in arrival order.
 *
 * <p>The queue is {@link State#IDLE} with nothing pending, or {@link State#SHOWING} exactly
 * one item while the rest wait in a FIFO backlog. Answering or cancelling the shown item
 * settles its caller's future and moves on to the next item. Listeners are notified on a
 * single notifier thread, so they observe state changes in the order they happened.
 */
@Component
public class ConfirmationQueue {

    private static final Logger log = LoggerFactory.getLogger(ConfirmationQueue.class);

    public enum State {
        IDLE,
        SHOWING
    }

    private record Pending(ConfirmationRequestDto request, CompletableFuture<ConfirmationResponse> future) {}

    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<Pending> backlog = new ArrayDeque<>();
    private final List<ConfirmationListener> listeners = new CopyOnWriteArrayList<>();
    private final ExecutorService notifier = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "confirmation-notifier");
        t.setDaemon(true);
        return t;
    });

    private Pending current;
    private boolean closed;

    /**
     * Adds a request and returns the future the human's answer completes. The future fails
     * with {@link ConfirmationCancelledException} when the item is cancelled; cancelling the
     * future itself withdraws the item.
     */
    public CompletableFuture<ConfirmationResponse> enqueue(ConfirmationRequestDto request) {
        Objects.requireNonNull(request, "request");
        CompletableFuture<ConfirmationResponse> future = new CompletableFuture<>();
        Pending item = new Pending(request, future);

        lock.lock();
        try {
            if (closed) {
                future.completeExceptionally(new ConfirmationCancelledException(
                        request.requestId(), "Confirmation queue is shut down"));
                return future;
            }
            if (listeners.isEmpty()) {
                log.warn("No confirmation consumer attached; {} request {} stays pending until one answers",
                        request.toolName(), request.requestId());
            }
            if (current == null) {
                show(item);
            } else {
                backlog.addLast(item);
                log.debug("Queued confirmation {} for {} behind {} other(s)",
                        request.requestId(), request.toolName(), backlog.size());
            }
        } finally {
            lock.unlock();
        }

        future.whenComplete((response, error) -> withdraw(item));
        return future;
    }

    /** Answers the shown item. Returns false if {@code requestId} is not the one being shown. */
    public boolean respond(String requestId, ConfirmationResponse response) {
        Objects.requireNonNull(response, "response");
        Pending answered = takeCurrent(requestId);
        if (answered == null) return false;

        log.info("Confirmation {} for {} answered: {}", requestId, answered.request().toolName(), response.choice());
        answered.future().complete(response);
        return true;
    }

    /**
     * Rejects the shown item without a decision. The backlog is kept and presentation
     * continues with the next item.
     */
    public boolean cancel(String requestId) {
        Pending cancelled = takeCurrent(requestId);
        if (cancelled == null) return false;

        log.info("Confirmation {} for {} cancelled", requestId, cancelled.request().toolName());
        cancelled.future().completeExceptionally(new ConfirmationCancelledException(requestId,
                "The user cancelled the " + cancelled.request().toolName() + " request"));
        return true;
    }

    public boolean cancelCurrent() {
        return current().map(request -> cancel(request.requestId())).orElse(false);
    }

    public Optional<ConfirmationRequestDto> current() {
        lock.lock();
        try {
            return Optional.ofNullable(current).map(Pending::request);
        } finally {
            lock.unlock();
        }
    }

    public State state() {
        lock.lock();
        try {
            return current == null ? State.IDLE : State.SHOWING;
        } finally {
            lock.unlock();
        }
    }

    /** Shown item plus backlog. */
    public int pendingCount() {
        lock.lock();
        try {
            return backlog.size() + (current == null ? 0 : 1);
        } finally {
            lock.unlock();
        }
    }

    /** Ordinary input is accepted only while nothing is shown. */
    public boolean isInputEnabled() {
        return state() == State.IDLE;
    }

    /** Registers a consumer; if an item is already shown, the new listener is told about it. */
    public void addListener(ConfirmationListener listener) {
        lock.lock();
        try {
            listeners.add(listener);
            if (current != null) {
                ConfirmationRequestDto shown = current.request();
                submit(() -> deliver(listener, l -> l.onShowing(shown)));
            }
        } finally {
            lock.unlock();
        }
    }

    public void removeListener(ConfirmationListener listener) {
        listeners.remove(listener);
    }

    /** Rejects everything still pending so no caller waits on a closed engine. */
    @PreDestroy
    public void shutdown() {
        List<Pending> abandoned = new ArrayList<>();
        lock.lock();
        try {
            closed = true;
            if (current != null) abandoned.add(current);
            abandoned.addAll(backlog);
            backlog.clear();
            current = null;
        } finally {
            lock.unlock();
        }
        if (!abandoned.isEmpty()) {
            log.info("Shutting down with {} pending confirmation(s)", abandoned.size());
        }
        for (Pending item : abandoned) {
            item.future().completeExceptionally(new ConfirmationCancelledException(
                    item.request().requestId(), "Confirmation queue is shut down"));
        }
        notifier.shutdown();
    }

    private Pending takeCurrent(String requestId) {
        lock.lock();
        try {
            if (current == null || !current.request().requestId().equals(requestId)) {
                log.warn("Ignoring answer for {}: it is not the confirmation being shown", requestId);
                return null;
            }
            Pending taken = current;
            advance();
            return taken;
        } finally {
            lock.unlock();
        }
    }

    private void withdraw(Pending item) {
        lock.lock();
        try {
            if (current == item) {
                log.debug("Confirmation {} withdrawn by its caller", item.request().requestId());
                advance();
            } else if (backlog.remove(item)) {
                log.debug("Queued confirmation {} withdrawn by its caller", item.request().requestId());
            }
        } finally {
            lock.unlock();
        }
    }

    // lock held
    private void advance() {
        Pending next = backlog.pollFirst();
        if (next != null) {
            show(next);
        } else {
            current = null;
            notifyListeners(ConfirmationListener::onIdle);
        }
    }

    // lock held
    private void show(Pending item) {
        current = item;
        ConfirmationRequestDto request = item.request();
        log.info("Showing confirmation {} for {}", request.requestId(), request.toolName());
        notifyListeners(l -> l.onShowing(request));
    }

    // lock held, so notifications are submitted in state-change order
    private void notifyListeners(Consumer<ConfirmationListener> action) {
        List<ConfirmationListener> snapshot = List.copyOf(listeners);
        if (snapshot.isEmpty()) return;
        submit(() -> snapshot.forEach(l -> deliver(l, action)));
    }

    private void submit(Runnable task) {
        if (closed) return;
        notifier.execute(task);
    }

    private void deliver(ConfirmationListener listener, Consumer<ConfirmationListener> action) {
        try {
            action.accept(listener);
        } catch (RuntimeException e) {
            log.error("Confirmation listener {} failed", listener.getClass().getSimpleName(), e);
        }
    }
}
