package com.example.downloadgateway.config;

import com.example.downloadgateway.service.PathResolver;
import com.example.downloadgateway.service.RequestGate;
import com.example.downloadgateway.service.TransferEngine;
import com.example.downloadgateway.worker.AdmissionQueue;
import com.example.downloadgateway.worker.Dispatcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

@Configuration
@Slf4j
public class DownloadConfig {

    @Value("${app.download.root-dir:files}")
    private String rootDir;

    @Value("${app.download.queue-capacity:1000}")
    private int queueCapacity;

    @Value("${app.download.workers:100}")
    private int workers;

    @Value("${app.download.chunk-size:32768}")
    private int chunkSize;

    @Value("${app.download.request-timeout:20m}")
    private Duration requestTimeout;

    @Value("${app.download.cancellation-grace:10s}")
    private Duration cancellationGrace;

    @Value("${app.download.pacing-delay:10ms}")
    private Duration pacingDelay;

    @Value("${app.download.shutdown-grace:30s}")
    private Duration shutdownGrace;

    @Bean
    public PathResolver pathResolver() {
        Path root = Path.of(rootDir);
        createRootIfNotExists(root);
        return new PathResolver(root);
    }

    @Bean
    public TransferEngine transferEngine() {
        return new TransferEngine(chunkSize);
    }

    @Bean
    public AdmissionQueue admissionQueue() {
        return new AdmissionQueue(queueCapacity);
    }

    @Bean(initMethod = "start", destroyMethod = "shutdown")
    public Dispatcher dispatcher(AdmissionQueue admissionQueue, PathResolver pathResolver,
            TransferEngine transferEngine) {
        return new Dispatcher(admissionQueue, pathResolver, transferEngine, workers, pacingDelay, shutdownGrace);
    }

    @Bean
    public RequestGate requestGate(AdmissionQueue admissionQueue, TaskScheduler taskScheduler) {
        return new RequestGate(admissionQueue, taskScheduler, requestTimeout, cancellationGrace);
    }

    // The service cannot run without its root, so failures here abort startup.
    private static void createRootIfNotExists(Path dir) {
        if (Files.isDirectory(dir)) {
            log.info("Serving downloads from {}", dir.toAbsolutePath());
            return;
        }
        try {
            Files.createDirectories(dir);
            log.info("Created download directory {}", dir.toAbsolutePath());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create download directory " + dir, e);
        }
    }
}
