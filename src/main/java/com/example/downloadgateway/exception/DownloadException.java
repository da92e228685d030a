package com.example.downloadgateway.exception;

import lombok.Getter;

@Getter
public class DownloadException extends RuntimeException {

    private final DownloadErrorCode code;

    public DownloadException(DownloadErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public DownloadException(DownloadErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }
}
