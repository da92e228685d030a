package com.example.downloadgateway.controller;

import com.example.downloadgateway.model.ErrorResponse;
import com.example.downloadgateway.service.TransferSink;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.ServletOutputStream;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;

import java.io.IOException;

/**
 * {@link TransferSink} over a servlet response.
 * <p>
 * Header and error writes are serialized with {@link #release}; body writes only check
 * the released flag, so a write already blocked on the socket is not waited for.
 */
@Slf4j
public class ServletTransferSink implements TransferSink {

    private final HttpServletResponse response;
    private final ObjectMapper objectMapper;
    private volatile ServletOutputStream body;
    private volatile boolean released;

    public ServletTransferSink(HttpServletResponse response, ObjectMapper objectMapper) {
        this.response = response;
        this.objectMapper = objectMapper;
    }

    @Override
    public synchronized void writeHeaders(String fileName, long contentLength) throws IOException {
        checkNotReleased();
        response.setStatus(HttpStatus.OK.value());
        response.setHeader(HttpHeaders.CONTENT_DISPOSITION,
                ContentDisposition.attachment().filename(fileName).build().toString());
        response.setContentType(MediaType.APPLICATION_OCTET_STREAM_VALUE);
        response.setContentLengthLong(contentLength);
        response.setHeader(HttpHeaders.ACCEPT_RANGES, "bytes");
        response.setHeader(HttpHeaders.CACHE_CONTROL, "no-cache");
        body = response.getOutputStream();
        response.flushBuffer();
    }

    @Override
    public void write(byte[] buffer, int offset, int length) throws IOException {
        checkNotReleased();
        if (body == null) {
            throw new IllegalStateException("Headers must be written before the body");
        }
        body.write(buffer, offset, length);
    }

    @Override
    public void flush() throws IOException {
        checkNotReleased();
        if (body != null) {
            body.flush();
        }
    }

    @Override
    public boolean isCommitted() {
        return response.isCommitted();
    }

    @Override
    public synchronized void sendError(HttpStatusCode status, String message) {
        if (released) {
            log.debug("Response already released, dropping {} error: {}", status.value(), message);
            return;
        }
        writeError(status, message);
    }

    @Override
    public synchronized void release(HttpStatusCode status, String message) {
        if (released) {
            return;
        }
        if (status != null) {
            writeError(status, message);
        }
        released = true;
    }

    private void checkNotReleased() throws IOException {
        if (released) {
            throw new IOException("Response has been released");
        }
    }

    private void writeError(HttpStatusCode status, String message) {
        if (response.isCommitted()) {
            log.debug("Response already committed, dropping {} error: {}", status.value(), message);
            return;
        }
        HttpStatus resolved = HttpStatus.resolve(status.value());
        ErrorResponse error = new ErrorResponse(status.value(),
                resolved != null ? resolved.getReasonPhrase() : "Error", message);
        try {
            response.resetBuffer();
            response.setStatus(status.value());
            response.setContentType(MediaType.APPLICATION_JSON_VALUE);
            response.getOutputStream().write(objectMapper.writeValueAsBytes(error));
            response.flushBuffer();
        } catch (IOException e) {
            log.info("Could not deliver {} error response: {}", status.value(), e.getMessage());
        }
    }
}
