package com.example.downloadgateway.model;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cancellation signal shared between the waiting caller and the transfer that
 * serves it. Client disconnects, caller deadlines and shutdown all cancel through
 * the same token; the first reason recorded wins.
 */
public class CancellationToken {

    private final AtomicReference<CancellationReason> reason = new AtomicReference<>();

    /**
     * @return true if this call cancelled the token, false if it was already cancelled
     */
    public boolean cancel(CancellationReason cause) {
        return reason.compareAndSet(null, cause);
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    public Optional<CancellationReason> getReason() {
        return Optional.ofNullable(reason.get());
    }
}
