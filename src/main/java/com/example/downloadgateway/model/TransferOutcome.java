package com.example.downloadgateway.model;

import com.example.downloadgateway.exception.DownloadErrorCode;

/**
 * Final result of one transfer attempt, written once to the request's completion signal.
 */
public record TransferOutcome(
        Status status,
        long bytesWritten,
        DownloadErrorCode errorCode, // only set for FAILED
        String message) {

    public enum Status {
        COMPLETED,
        CANCELLED,
        ABORTED,
        FAILED
    }

    public static TransferOutcome completed(long bytesWritten) {
        return new TransferOutcome(Status.COMPLETED, bytesWritten, null, null);
    }

    public static TransferOutcome cancelled(long bytesWritten) {
        return new TransferOutcome(Status.CANCELLED, bytesWritten, null, null);
    }

    public static TransferOutcome aborted(long bytesWritten) {
        return new TransferOutcome(Status.ABORTED, bytesWritten, null, null);
    }

    public static TransferOutcome failed(DownloadErrorCode errorCode, String message, long bytesWritten) {
        return new TransferOutcome(Status.FAILED, bytesWritten, errorCode, message);
    }

    public boolean isCompleted() {
        return status == Status.COMPLETED;
    }
}
