package com.sretoolbox.worker;

import com.sretoolbox.queue.Delivery;
import com.sretoolbox.queue.TaskQueue;
import com.sretoolbox.worker.engine.ExecutionEngine;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@code concurrency} consumer threads, each running dequeue, execute, ack until the queue is closed.
 * A descriptor is acked whatever the outcome; redelivery only happens when a worker dies holding the lease.
 */
@Slf4j
public class WorkerPool {
    private static final long DEQUEUE_ERROR_PAUSE_MS = 1000;

    private final TaskQueue queue;
    private final ExecutionEngine engine;
    private final int concurrency;
    private final AtomicInteger inFlight = new AtomicInteger();
    private ExecutorService executor;

    public WorkerPool(TaskQueue queue, ExecutionEngine engine, int concurrency) {
        this.queue = queue;
        this.engine = engine;
        this.concurrency = concurrency;
    }

    public synchronized void start() {
        if (executor != null) {
            throw new IllegalStateException("worker pool already started");
        }
        AtomicInteger n = new AtomicInteger();
        executor = Executors.newFixedThreadPool(concurrency, r -> {
            Thread t = new Thread(r, "job-worker-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        for (int i = 0; i < concurrency; i++) {
            executor.submit(this::consume);
        }
    }

    public int inFlight() {
        return inFlight.get();
    }

    void consume() {
        while (!Thread.currentThread().isInterrupted()) {
            Optional<Delivery> next;
            try {
                next = queue.dequeue();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (RuntimeException e) {
                log.warn("Dequeue failed: {}", e.getMessage());
                if (!pause()) {
                    return;
                }
                continue;
            }
            if (next.isEmpty()) {
                return;
            }
            Delivery delivery = next.get();
            inFlight.incrementAndGet();
            try {
                engine.execute(delivery.getDescriptor());
            } catch (RuntimeException | Error e) {
                // the consumer outlives any single job
                log.error("Unexpected failure executing job {}", delivery.getJobId(), e);
            } finally {
                inFlight.decrementAndGet();
                ack(delivery);
            }
        }
    }

    private void ack(Delivery delivery) {
        try {
            queue.ack(delivery);
        } catch (RuntimeException e) {
            log.warn("Ack failed for job {}, it will be redelivered after the lease: {}", delivery.getJobId(),
                    e.getMessage());
        }
    }

    private static boolean pause() {
        try {
            Thread.sleep(DEQUEUE_ERROR_PAUSE_MS);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Stops taking new jobs and waits up to {@code grace} for in-flight ones.
     *
     * @return true if every consumer finished within the grace period
     */
    public boolean stop(Duration grace) throws InterruptedException {
        queue.close();
        ExecutorService ex;
        synchronized (this) {
            ex = executor;
        }
        if (ex == null) {
            return true;
        }
        ex.shutdown();
        if (ex.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
            return true;
        }
        log.warn("{} job(s) still running after {}s, interrupting", inFlight.get(), grace.toSeconds());
        ex.shutdownNow();
        return false;
    }
}
