package com.example.downloadgateway.model;

public enum CancellationReason {
    CLIENT_DISCONNECTED,
    DEADLINE_EXCEEDED,
    SHUTDOWN
}
