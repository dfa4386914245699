package org.netpreserve.hubfinder.telemetry;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.hubfinder.util.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

/**
 * Delivers events to sinks from a single daemon thread. Emitting never blocks: when the queue is full the event is
 * dropped and counted.
 */
public class Telemetry implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Telemetry.class);
    public static final int DEFAULT_CAPACITY = 10_000;
    private final List<TelemetrySink> sinks = new CopyOnWriteArrayList<>();
    private final BlockingQueue<TelemetryEvent> queue;
    private final Thread dispatcher;
    private final Object deliveryLock = new Object();
    private long accepted;
    private long delivered;
    private long dropped;
    private volatile boolean closed;

    public Telemetry() {
        this(DEFAULT_CAPACITY);
    }

    public Telemetry(int capacity) {
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.dispatcher = new NamedThreadFactory("telemetry").newThread(this::dispatchLoop);
        dispatcher.start();
    }

    public void subscribe(TelemetrySink sink) {
        sinks.add(sink);
    }

    public void emit(EventType type, @Nullable String domain, Map<String, Object> attributes) {
        emit(new TelemetryEvent(type, Instant.now(), domain, attributes));
    }

    public void emit(TelemetryEvent event) {
        synchronized (deliveryLock) {
            if (closed || !queue.offer(event)) {
                dropped++;
                return;
            }
            accepted++;
        }
    }

    public long dropped() {
        synchronized (deliveryLock) {
            return dropped;
        }
    }

    /**
     * Waits until every event accepted so far has been delivered.
     *
     * @return false if the timeout elapsed first
     */
    public boolean flush(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (deliveryLock) {
            long target = accepted;
            while (delivered < target) {
                long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                if (remainingMs <= 0) return false;
                deliveryLock.wait(remainingMs);
            }
            return true;
        }
    }

    private void dispatchLoop() {
        while (true) {
            TelemetryEvent event;
            try {
                event = queue.take();
            } catch (InterruptedException e) {
                return;
            }
            for (TelemetrySink sink : sinks) {
                try {
                    sink.accept(event);
                } catch (RuntimeException e) {
                    log.warn("Telemetry sink {} failed on {}", sink.getClass().getSimpleName(),
                            event.type().label(), e);
                }
            }
            synchronized (deliveryLock) {
                delivered++;
                deliveryLock.notifyAll();
            }
        }
    }

    @Override
    public void close() {
        try {
            flush(Duration.ofSeconds(5));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        closed = true;
        dispatcher.interrupt();
    }
}
