package com.example.downloadgateway.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * Failure taxonomy of a download request and the HTTP status each one maps to.
 */
@Getter
@RequiredArgsConstructor
public enum DownloadErrorCode {

    INVALID_INPUT(HttpStatus.BAD_REQUEST, "File name is required"),
    PATH_ESCAPE(HttpStatus.BAD_REQUEST, "Invalid file path"),
    NOT_FOUND(HttpStatus.NOT_FOUND, "File not found"),
    IO_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error"),
    QUEUE_FULL(HttpStatus.SERVICE_UNAVAILABLE, "Server busy, please try again later"),
    TIMEOUT(HttpStatus.REQUEST_TIMEOUT, "Request timeout"),
    SHUTTING_DOWN(HttpStatus.SERVICE_UNAVAILABLE, "Server is shutting down");

    private final HttpStatus status;
    private final String defaultMessage;
}
