package com.example.downloadgateway.worker;

import com.example.downloadgateway.model.PendingRequest;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;

/**
 * Fixed-capacity FIFO of requests waiting for a worker.
 * Producers are never blocked: a full (or closed) queue rejects immediately.
 */
public class AdmissionQueue {

    private final BlockingQueue<PendingRequest> buffer;
    private final int capacity;
    private boolean closed;

    public AdmissionQueue(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.buffer = new ArrayBlockingQueue<>(capacity);
    }

    public synchronized boolean tryEnqueue(PendingRequest request) {
        if (closed) {
            return false;
        }
        return buffer.offer(request);
    }

    /**
     * Blocks until a request is available.
     */
    public PendingRequest dequeue() throws InterruptedException {
        return buffer.take();
    }

    public boolean remove(PendingRequest request) {
        return buffer.remove(request);
    }

    /**
     * Approximate number of waiting requests.
     */
    public int depth() {
        return buffer.size();
    }

    public int capacity() {
        return capacity;
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    /**
     * Stops admitting requests and hands back everything still waiting.
     */
    public synchronized List<PendingRequest> close() {
        closed = true;
        List<PendingRequest> drained = new ArrayList<>(buffer.size());
        buffer.drainTo(drained);
        return drained;
    }
}
