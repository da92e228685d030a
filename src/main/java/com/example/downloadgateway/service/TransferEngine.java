package com.example.downloadgateway.service;

import com.example.downloadgateway.exception.DownloadErrorCode;
import com.example.downloadgateway.exception.DownloadException;
import com.example.downloadgateway.model.CancellationReason;
import com.example.downloadgateway.model.CancellationToken;
import com.example.downloadgateway.model.TransferContext;
import com.example.downloadgateway.model.TransferOutcome;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Streams a file to a {@link TransferSink} in fixed-size chunks.
 * <p>
 * Headers are committed before the first body byte. The cancellation token is
 * checked before every read, so a cancelled transfer stops within one chunk.
 * Write failures mean the receiver went away and end the transfer as
 * {@link TransferOutcome.Status#ABORTED}; read failures are reported as
 * {@code IO_ERROR} and never retried.
 */
@Slf4j
public class TransferEngine {

    public static final int DEFAULT_CHUNK_SIZE = 32 * 1024;

    private final int chunkSize;

    public TransferEngine() {
        this(DEFAULT_CHUNK_SIZE);
    }

    public TransferEngine(int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
        }
        this.chunkSize = chunkSize;
    }

    public TransferOutcome transfer(Path resolvedPath, TransferSink sink, CancellationToken cancellationToken) {
        try {
            return doTransfer(resolvedPath, sink, cancellationToken);
        } catch (DownloadException e) {
            log.warn("Download of {} failed: {}", resolvedPath.getFileName(), e.getMessage());
            return TransferOutcome.failed(e.getCode(), e.getMessage(), 0);
        } catch (RuntimeException e) {
            log.error("Unexpected failure during download of {}", resolvedPath.getFileName(), e);
            return TransferOutcome.failed(DownloadErrorCode.IO_ERROR, "Internal server error", 0);
        }
    }

    private TransferOutcome doTransfer(Path path, TransferSink sink, CancellationToken token) {
        if (token.isCancelled()) {
            return TransferOutcome.cancelled(0);
        }

        SeekableByteChannel channel = open(path);
        try {
            TransferContext context = new TransferContext(path, sizeOf(channel, path));

            try {
                sink.writeHeaders(context.getFileName(), context.getTotalSize());
            } catch (IOException e) {
                token.cancel(CancellationReason.CLIENT_DISCONNECTED);
                log.info("Client went away before headers for {} were sent: {}", context.getFileName(), e.getMessage());
                return TransferOutcome.aborted(0);
            }

            return stream(context, channel, sink, token);
        } finally {
            close(channel, path);
        }
    }

    private TransferOutcome stream(TransferContext context, SeekableByteChannel channel, TransferSink sink,
            CancellationToken token) {
        ByteBuffer buffer = ByteBuffer.allocate(chunkSize);

        while (context.getRemaining() > 0) {
            if (token.isCancelled()) {
                log.info("Download of {} cancelled ({}) after {} of {} bytes", context.getFileName(),
                        token.getReason().orElse(null), context.getBytesWritten(), context.getTotalSize());
                return TransferOutcome.cancelled(context.getBytesWritten());
            }

            buffer.clear();
            buffer.limit((int) Math.min(chunkSize, context.getRemaining()));
            int read;
            try {
                read = channel.read(buffer);
            } catch (IOException e) {
                log.error("Read error during download of {}", context.getFileName(), e);
                return TransferOutcome.failed(DownloadErrorCode.IO_ERROR, "Read error", context.getBytesWritten());
            }

            if (read < 0) {
                log.error("{} shrank during download: expected {} bytes, read {}", context.getFileName(),
                        context.getTotalSize(), context.getBytesWritten());
                return TransferOutcome.failed(DownloadErrorCode.IO_ERROR, "File truncated during transfer",
                        context.getBytesWritten());
            }

            try {
                sink.write(buffer.array(), 0, read);
                context.addBytesWritten(read);
                if (sink.supportsFlush()) {
                    sink.flush();
                }
            } catch (IOException e) {
                token.cancel(CancellationReason.CLIENT_DISCONNECTED);
                log.info("Write error during download of {} after {} bytes: {}", context.getFileName(),
                        context.getBytesWritten(), e.getMessage());
                return TransferOutcome.aborted(context.getBytesWritten());
            }
        }

        log.info("Completed download of {} ({} bytes) in {} ms", context.getFileName(), context.getBytesWritten(),
                context.getElapsed().toMillis());
        return TransferOutcome.completed(context.getBytesWritten());
    }

    private static SeekableByteChannel open(Path path) {
        if (Files.isDirectory(path)) {
            throw new DownloadException(DownloadErrorCode.NOT_FOUND, "Not a file: " + path.getFileName());
        }
        try {
            return Files.newByteChannel(path);
        } catch (NoSuchFileException e) {
            throw new DownloadException(DownloadErrorCode.NOT_FOUND, "File not found: " + path.getFileName(), e);
        } catch (IOException e) {
            log.error("Failed to open {}", path, e);
            throw new DownloadException(DownloadErrorCode.IO_ERROR, "Failed to open " + path.getFileName(), e);
        }
    }

    private static void close(SeekableByteChannel channel, Path path) {
        try {
            channel.close();
        } catch (IOException e) {
            // outcome is already decided
            log.warn("Failed to close {}: {}", path.getFileName(), e.getMessage());
        }
    }

    private static long sizeOf(SeekableByteChannel channel, Path path) {
        try {
            return channel.size();
        } catch (IOException e) {
            log.error("Failed to stat {}", path, e);
            throw new DownloadException(DownloadErrorCode.IO_ERROR, "Failed to stat " + path.getFileName(), e);
        }
    }
}
