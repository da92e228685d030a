package com.example.downloadgateway.model;

public record ErrorResponse(
        int status,
        String error,
        String message) {
}
