package com.example.downloadgateway.worker;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class QueueDepthReporter {

    private final AdmissionQueue admissionQueue;
    private final Dispatcher dispatcher;

    /**
     * Logs the backlog while there is one; silent when the queue is empty.
     */
    @Scheduled(fixedRateString = "${app.download.report-interval-ms:30000}")
    public void reportQueueDepth() {
        int depth = admissionQueue.depth();
        if (depth > 0) {
            log.info("Download queue depth {}/{}, {} of {} workers busy", depth, admissionQueue.capacity(),
                    dispatcher.activeTransfers(), dispatcher.workers());
        }
    }
}
