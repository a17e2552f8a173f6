package io.github.drompincen.clawgate.runtime.permission;

import io.github.drompincen.clawgate.protocol.api.ConfirmationRequestDto;

/**
 * Consumer surface for the confirmation queue. Callbacks arrive on the queue's
 * notifier thread, in the order the queue changed state.
 */
public interface ConfirmationListener {

    void onShowing(ConfirmationRequestDto request);

    /** Nothing pending any more; ordinary input can be re-enabled. */
    default void onIdle() {
    }
}
