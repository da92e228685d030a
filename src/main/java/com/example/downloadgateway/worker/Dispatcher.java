package com.example.downloadgateway.worker;

import com.example.downloadgateway.exception.DownloadErrorCode;
import com.example.downloadgateway.exception.DownloadException;
import com.example.downloadgateway.model.CancellationReason;
import com.example.downloadgateway.model.PendingRequest;
import com.example.downloadgateway.model.TransferOutcome;
import com.example.downloadgateway.service.PathResolver;
import com.example.downloadgateway.service.TransferEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Moves requests from the {@link AdmissionQueue} onto a fixed set of worker slots.
 * <p>
 * The dispatch thread only waits for a free slot, never for a transfer to finish, so
 * at most {@code workers} transfers run at once. Every dispatched request gets its
 * completion signal written, whatever happens inside the transfer.
 */
@Slf4j
public class Dispatcher {

    private final AdmissionQueue admissionQueue;
    private final PathResolver pathResolver;
    private final TransferEngine transferEngine;
    private final int workers;
    private final Duration pacingDelay;
    private final Duration shutdownGrace;

    private final Semaphore slots;
    private final ExecutorService workerPool;
    private final Set<PendingRequest> inFlight = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private Thread dispatchThread;

    public Dispatcher(AdmissionQueue admissionQueue, PathResolver pathResolver, TransferEngine transferEngine,
            int workers, Duration pacingDelay, Duration shutdownGrace) {
        if (workers <= 0) {
            throw new IllegalArgumentException("workers must be positive: " + workers);
        }
        this.admissionQueue = admissionQueue;
        this.pathResolver = pathResolver;
        this.transferEngine = transferEngine;
        this.workers = workers;
        this.pacingDelay = pacingDelay;
        this.shutdownGrace = shutdownGrace;
        this.slots = new Semaphore(workers);
        this.workerPool = Executors.newFixedThreadPool(workers, new CustomizableThreadFactory("download-worker-"));
    }

    public synchronized void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        dispatchThread = new Thread(this::dispatchLoop, "download-dispatcher");
        dispatchThread.setDaemon(true);
        dispatchThread.start();
        log.info("Dispatcher started with {} worker slots, queue capacity {}", workers, admissionQueue.capacity());
    }

    private void dispatchLoop() {
        while (running.get()) {
            PendingRequest request;
            try {
                request = admissionQueue.dequeue();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }

            try {
                slots.acquire();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                request.getCancellationToken().cancel(CancellationReason.SHUTDOWN);
                request.complete(TransferOutcome.cancelled(0));
                break;
            }

            try {
                workerPool.execute(() -> runTransfer(request));
            } catch (RejectedExecutionException e) {
                slots.release();
                request.getCancellationToken().cancel(CancellationReason.SHUTDOWN);
                request.complete(TransferOutcome.cancelled(0));
            }
        }
        log.info("Dispatcher stopped");
    }

    private void runTransfer(PendingRequest request) {
        TransferOutcome outcome = null;
        inFlight.add(request);
        try {
            if (!request.markStarted() || request.getCancellationToken().isCancelled()) {
                outcome = TransferOutcome.cancelled(0);
                return;
            }
            pace();

            Path path = pathResolver.resolve(request.getFileName());
            outcome = transferEngine.transfer(path, request.getSink(), request.getCancellationToken());
            if (outcome.status() == TransferOutcome.Status.FAILED) {
                respondWithError(request, outcome.errorCode(), outcome.message());
            }
        } catch (DownloadException e) {
            log.info("Rejected download of {}: {}", request.getFileName(), e.getMessage());
            outcome = TransferOutcome.failed(e.getCode(), e.getMessage(), 0);
            respondWithError(request, e.getCode(), e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            request.getCancellationToken().cancel(CancellationReason.SHUTDOWN);
            outcome = TransferOutcome.cancelled(0);
        } catch (Throwable t) {
            log.error("Unexpected failure in download handler for {}", request.getFileName(), t);
            outcome = TransferOutcome.failed(DownloadErrorCode.IO_ERROR, "Internal server error", 0);
            respondWithError(request, DownloadErrorCode.IO_ERROR, DownloadErrorCode.IO_ERROR.getDefaultMessage());
        } finally {
            request.complete(outcome != null
                    ? outcome
                    : TransferOutcome.failed(DownloadErrorCode.IO_ERROR, "Internal server error", 0));
            inFlight.remove(request);
            slots.release();
        }
    }

    private void pace() throws InterruptedException {
        if (!pacingDelay.isZero() && !pacingDelay.isNegative()) {
            Thread.sleep(pacingDelay.toMillis());
        }
    }

    private static void respondWithError(PendingRequest request, DownloadErrorCode code, String message) {
        try {
            if (!request.getSink().isCommitted()) {
                request.getSink().sendError(code.getStatus(), message);
            }
        } catch (RuntimeException e) {
            log.warn("Failed to send {} response for {}: {}", code, request.getFileName(), e.getMessage());
        }
    }

    public int activeTransfers() {
        return inFlight.size();
    }

    public int workers() {
        return workers;
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Stops admitting work, cancels everything still queued, lets in-flight transfers
     * finish within the shutdown grace period and cancels whatever is left after it.
     */
    public void shutdown() {
        if (!running.compareAndSet(true, false)) {
            workerPool.shutdownNow();
            return;
        }
        log.info("Shutting down dispatcher, {} transfers in flight", inFlight.size());

        for (PendingRequest queued : admissionQueue.close()) {
            queued.getCancellationToken().cancel(CancellationReason.SHUTDOWN);
            queued.abandon();
            queued.complete(TransferOutcome.cancelled(0));
        }
        synchronized (this) {
            if (dispatchThread != null) {
                dispatchThread.interrupt();
            }
        }

        workerPool.shutdown();
        try {
            if (!workerPool.awaitTermination(shutdownGrace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("{} transfers still running after {}, cancelling them", inFlight.size(), shutdownGrace);
                inFlight.forEach(request -> request.getCancellationToken().cancel(CancellationReason.SHUTDOWN));
                if (!workerPool.awaitTermination(shutdownGrace.toMillis(), TimeUnit.MILLISECONDS)) {
                    workerPool.shutdownNow();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workerPool.shutdownNow();
        }
    }
}
