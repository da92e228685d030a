package com.example.downloadgateway.model;

import com.example.downloadgateway.service.TransferSink;
import lombok.Getter;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One admitted download, from enqueue until its completion signal fires.
 */
@Getter
public class PendingRequest {

    public enum State {
        QUEUED,
        STARTED,
        ABANDONED
    }

    private final String id = UUID.randomUUID().toString();
    private final String fileName; // raw and untrusted
    private final TransferSink sink;
    private final CancellationToken cancellationToken;
    private final Instant enqueuedAt = Instant.now();
    private final CompletableFuture<TransferOutcome> completion = new CompletableFuture<>();
    private final AtomicReference<State> state = new AtomicReference<>(State.QUEUED);

    public PendingRequest(String fileName, TransferSink sink, CancellationToken cancellationToken) {
        this.fileName = fileName;
        this.sink = sink;
        this.cancellationToken = cancellationToken;
    }

    /**
     * Claims the request for a transfer. Only the winner of this call may touch the sink.
     */
    public boolean markStarted() {
        return state.compareAndSet(State.QUEUED, State.STARTED);
    }

    /**
     * Gives up on a request that has not been picked up by a worker yet.
     */
    public boolean abandon() {
        return state.compareAndSet(State.QUEUED, State.ABANDONED);
    }

    /**
     * Writes the completion signal. Only the first call has any effect.
     */
    public boolean complete(TransferOutcome outcome) {
        return completion.complete(outcome);
    }

    public boolean isDone() {
        return completion.isDone();
    }

    public State getState() {
        return state.get();
    }
}
