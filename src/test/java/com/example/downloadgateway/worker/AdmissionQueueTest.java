package com.example.downloadgateway.worker;

import com.example.downloadgateway.model.CancellationToken;
import com.example.downloadgateway.model.PendingRequest;
import com.example.downloadgateway.service.RecordingSink;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.ArrayList;

import static org.junit.jupiter.api.Assertions.*;

class AdmissionQueueTest {

    private static PendingRequest request(String name) {
        return new PendingRequest(name, new RecordingSink(), new CancellationToken());
    }

    @Test
    void rejectsImmediatelyWhenFull() {
        AdmissionQueue queue = new AdmissionQueue(2);

        assertTrue(queue.tryEnqueue(request("a")));
        assertTrue(queue.tryEnqueue(request("b")));
        assertFalse(queue.tryEnqueue(request("c")));
        assertEquals(2, queue.depth());
    }

    @Test
    void acceptsAgainOnceASlotFrees() throws InterruptedException {
        AdmissionQueue queue = new AdmissionQueue(1);
        queue.tryEnqueue(request("a"));
        assertFalse(queue.tryEnqueue(request("b")));

        queue.dequeue();

        assertTrue(queue.tryEnqueue(request("b")));
    }

    @Test
    void dequeuesInFifoOrder() throws InterruptedException {
        AdmissionQueue queue = new AdmissionQueue(3);
        queue.tryEnqueue(request("first"));
        queue.tryEnqueue(request("second"));
        queue.tryEnqueue(request("third"));

        assertEquals("first", queue.dequeue().getFileName());
        assertEquals("second", queue.dequeue().getFileName());
        assertEquals("third", queue.dequeue().getFileName());
        assertEquals(0, queue.depth());
    }

    @Test
    void removeFreesCapacity() {
        AdmissionQueue queue = new AdmissionQueue(1);
        PendingRequest waiting = request("a");
        queue.tryEnqueue(waiting);

        assertTrue(queue.remove(waiting));
        assertFalse(queue.remove(waiting));
        assertTrue(queue.tryEnqueue(request("b")));
    }

    @Test
    void closeDrainsAndRefusesFurtherRequests() {
        AdmissionQueue queue = new AdmissionQueue(5);
        queue.tryEnqueue(request("a"));
        queue.tryEnqueue(request("b"));

        List<PendingRequest> drained = queue.close();

        assertEquals(2, drained.size());
        assertTrue(queue.isClosed());
        assertEquals(0, queue.depth());
        assertFalse(queue.tryEnqueue(request("c")));
    }

    @Test
    void concurrentBurstAdmitsExactlyCapacity() throws Exception {
        int capacity = 10;
        int producers = 25;
        AdmissionQueue queue = new AdmissionQueue(capacity);
        ExecutorService pool = Executors.newFixedThreadPool(producers);
        CountDownLatch go = new CountDownLatch(1);
        AtomicInteger accepted = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();

        try {
            for (int i = 0; i < producers; i++) {
                String name = "file-" + i;
                futures.add(pool.submit(() -> {
                    go.await();
                    if (queue.tryEnqueue(request(name))) {
                        accepted.incrementAndGet();
                    }
                    return null;
                }));
            }
            go.countDown();
            for (Future<?> future : futures) {
                future.get(5, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(capacity, accepted.get());
        assertEquals(capacity, queue.depth());
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new AdmissionQueue(0));
    }
}
