package com.example.downloadgateway.service;

import com.example.downloadgateway.exception.DownloadErrorCode;
import com.example.downloadgateway.model.CancellationReason;
import com.example.downloadgateway.model.CancellationToken;
import com.example.downloadgateway.model.PendingRequest;
import com.example.downloadgateway.model.TransferOutcome;
import com.example.downloadgateway.worker.AdmissionQueue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;

/**
 * Caller-facing entry point: admits a download through the {@link AdmissionQueue} and
 * completes the returned future when its transfer finishes or the request deadline passes.
 * No thread waits while the request is queued or transferring; the deadline runs on the
 * {@link TaskScheduler}.
 * <p>
 * Once a transfer has started, the response belongs to the transfer; the gate only
 * writes an error body when nothing has been committed yet.
 */
@Slf4j
public class RequestGate {

    /** Non-standard status used when the receiver disconnected; nothing is sent for it. */
    public static final HttpStatusCode CLIENT_CLOSED_REQUEST = HttpStatusCode.valueOf(499);

    private final AdmissionQueue admissionQueue;
    private final TaskScheduler scheduler;
    private final Duration requestTimeout;
    private final Duration cancellationGrace;

    public RequestGate(AdmissionQueue admissionQueue, TaskScheduler scheduler, Duration requestTimeout,
            Duration cancellationGrace) {
        this.admissionQueue = admissionQueue;
        this.scheduler = scheduler;
        this.requestTimeout = requestTimeout;
        this.cancellationGrace = cancellationGrace;
    }

    /**
     * Longest time {@link #handle} can take to complete its future.
     */
    public Duration getMaxResponseTime() {
        return requestTimeout.plus(cancellationGrace.multipliedBy(2));
    }

    public CompletableFuture<HttpStatusCode> handle(String requestedName, TransferSink sink,
            CancellationToken cancellationToken) {
        PendingRequest request = new PendingRequest(requestedName, sink, cancellationToken);

        if (!admissionQueue.tryEnqueue(request)) {
            DownloadErrorCode code = admissionQueue.isClosed()
                    ? DownloadErrorCode.SHUTTING_DOWN
                    : DownloadErrorCode.QUEUE_FULL;
            log.debug("Rejected download request for {}: {}", requestedName, code);
            sink.sendError(code.getStatus(), code.getDefaultMessage());
            return CompletableFuture.completedFuture(code.getStatus());
        }

        log.info("Starting download request {} for {}", request.getId(), requestedName);

        CompletableFuture<HttpStatusCode> response = new CompletableFuture<>();
        ScheduledFuture<?> deadline = scheduler.schedule(() -> onDeadline(request, response),
                Instant.now().plus(requestTimeout));

        request.getCompletion().whenComplete((outcome, error) -> {
            deadline.cancel(false);
            try {
                response.complete(finish(request, outcome));
            } catch (RuntimeException e) {
                log.error("Failed to finish download request {} for {}", request.getId(), requestedName, e);
                response.complete(HttpStatus.INTERNAL_SERVER_ERROR);
            }
        });
        return response;
    }

    private void onDeadline(PendingRequest request, CompletableFuture<HttpStatusCode> response) {
        if (request.isDone()) {
            return;
        }
        request.getCancellationToken().cancel(CancellationReason.DEADLINE_EXCEEDED);
        log.warn("Request timeout for {} after {}", request.getFileName(), requestTimeout);

        if (request.abandon()) {
            admissionQueue.remove(request);
            request.complete(TransferOutcome.cancelled(0));
            return;
        }

        // the worker owns the sink until it observes the cancellation or the grace period ends
        scheduler.schedule(() -> {
            if (request.isDone()) {
                return;
            }
            log.warn("Transfer {} of {} did not stop within {}, releasing the response", request.getId(),
                    request.getFileName(), cancellationGrace);
            request.getSink().release(DownloadErrorCode.TIMEOUT.getStatus(),
                    DownloadErrorCode.TIMEOUT.getDefaultMessage());
            response.complete(DownloadErrorCode.TIMEOUT.getStatus());
        }, Instant.now().plus(cancellationGrace));
    }

    private HttpStatusCode finish(PendingRequest request, TransferOutcome outcome) {
        return switch (outcome.status()) {
            case COMPLETED -> HttpStatus.OK;
            case FAILED -> {
                respondIfUncommitted(request.getSink(), outcome.errorCode());
                yield outcome.errorCode().getStatus();
            }
            case ABORTED -> CLIENT_CLOSED_REQUEST;
            case CANCELLED -> onCancelled(request);
        };
    }

    private HttpStatusCode onCancelled(PendingRequest request) {
        CancellationReason reason = request.getCancellationToken().getReason()
                .orElse(CancellationReason.SHUTDOWN);
        log.info("Download request {} for {} cancelled: {}", request.getId(), request.getFileName(), reason);

        return switch (reason) {
            case CLIENT_DISCONNECTED -> CLIENT_CLOSED_REQUEST;
            case DEADLINE_EXCEEDED -> {
                respondIfUncommitted(request.getSink(), DownloadErrorCode.TIMEOUT);
                yield DownloadErrorCode.TIMEOUT.getStatus();
            }
            case SHUTDOWN -> {
                respondIfUncommitted(request.getSink(), DownloadErrorCode.SHUTTING_DOWN);
                yield DownloadErrorCode.SHUTTING_DOWN.getStatus();
            }
        };
    }

    private static void respondIfUncommitted(TransferSink sink, DownloadErrorCode code) {
        if (!sink.isCommitted()) {
            sink.sendError(code.getStatus(), code.getDefaultMessage());
        }
    }
}
