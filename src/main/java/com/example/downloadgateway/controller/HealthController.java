package com.example.downloadgateway.controller;

import com.example.downloadgateway.model.HealthStatus;
import com.example.downloadgateway.worker.AdmissionQueue;
import com.example.downloadgateway.worker.Dispatcher;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class HealthController {

    private final AdmissionQueue admissionQueue;
    private final Dispatcher dispatcher;

    @GetMapping("/health")
    public HealthStatus health() {
        return new HealthStatus(
                dispatcher.isRunning() ? "ok" : "stopping",
                dispatcher.workers(),
                admissionQueue.depth(),
                admissionQueue.capacity(),
                dispatcher.activeTransfers());
    }
}
