package com.example.downloadgateway.controller;

import com.example.downloadgateway.exception.DownloadErrorCode;
import com.example.downloadgateway.model.CancellationReason;
import com.example.downloadgateway.model.CancellationToken;
import com.example.downloadgateway.service.RequestGate;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.context.request.async.DeferredResult;

/**
 * Downloads run asynchronously: the request thread returns to Tomcat as soon as the
 * request is queued or rejected, and the transfer writes to the response from a worker.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class DownloadController {

    private final RequestGate requestGate;
    private final ObjectMapper objectMapper;

    @GetMapping("/download")
    public DeferredResult<Void> download(
            @RequestParam(value = "file", required = false) String file,
            HttpServletResponse response) {

        DeferredResult<Void> result = new DeferredResult<>(requestGate.getMaxResponseTime().toMillis());
        ServletTransferSink sink = new ServletTransferSink(response, objectMapper);
        CancellationToken token = new CancellationToken();

        result.onError(e -> {
            log.info("Connection for {} failed: {}", file, e.toString());
            token.cancel(CancellationReason.CLIENT_DISCONNECTED);
            sink.release(null, null);
        });
        result.onTimeout(() -> {
            log.warn("Download of {} outlived its async timeout", file);
            token.cancel(CancellationReason.DEADLINE_EXCEEDED);
            sink.release(DownloadErrorCode.TIMEOUT.getStatus(), DownloadErrorCode.TIMEOUT.getDefaultMessage());
            result.setResult(null);
        });

        requestGate.handle(file, sink, token).whenComplete((status, e) -> {
            log.debug("Download request for {} finished with {}", file, status != null ? status.value() : e);
            result.setResult(null);
        });
        return result;
    }
}
