package com.example.downloadgateway.service;

import org.springframework.http.HttpStatusCode;

import java.io.IOException;

/**
 * Destination of a download. Headers are committed by {@link #writeHeaders} before
 * the first body byte is written.
 */
public interface TransferSink {

    /**
     * Sets the attachment headers for a body of exactly {@code contentLength} bytes and
     * commits them.
     */
    void writeHeaders(String fileName, long contentLength) throws IOException;

    void write(byte[] buffer, int offset, int length) throws IOException;

    default boolean supportsFlush() {
        return true;
    }

    void flush() throws IOException;

    boolean isCommitted();

    /**
     * Writes an error response. Has no effect once headers are committed or the sink
     * has been released.
     */
    void sendError(HttpStatusCode status, String message);

    /**
     * Hands the response back to the caller. If nothing is committed and {@code status}
     * is not null, the error is written first. Afterwards every header, body or error
     * write from the transfer side fails.
     */
    void release(HttpStatusCode status, String message);
}
