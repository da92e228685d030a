package com.example.downloadgateway.model;

import lombok.Getter;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

/**
 * In-progress state of a single streaming transfer. Owned by the engine invocation
 * that created it and never shared between threads.
 */
@Getter
public class TransferContext {

    private final Path resolvedPath;
    private final String fileName;
    private final long totalSize;
    private final Instant startedAt;
    private long bytesWritten;

    public TransferContext(Path resolvedPath, long totalSize) {
        this.resolvedPath = resolvedPath;
        this.fileName = resolvedPath.getFileName().toString();
        this.totalSize = totalSize;
        this.startedAt = Instant.now();
    }

    public void addBytesWritten(int count) {
        bytesWritten += count;
    }

    public long getRemaining() {
        return totalSize - bytesWritten;
    }

    public Duration getElapsed() {
        return Duration.between(startedAt, Instant.now());
    }
}
