package com.example.disksight.progress;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Hands progress events to a background delivery thread so that a slow host
 * (a UI event bus, a socket) never stalls the traversal.
 */
public final class QueuedProgressSink implements ProgressSink, AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(QueuedProgressSink.class);
    private static final ProgressEvent POISON = new ProgressEvent(null, null, "poison");

    static final int DEFAULT_CAPACITY = 10_000;

    private final BlockingQueue<ProgressEvent> queue;
    private final ProgressSink host;
    private final Thread worker;
    private final AtomicLong dropped = new AtomicLong();
    private volatile boolean closed;

    public QueuedProgressSink(ProgressSink host) {
        this(host, DEFAULT_CAPACITY);
    }

    /**
     * @param capacity events held while the host is slower than the traversal; further
     *                 events are dropped until the delivery thread catches up
     */
    public QueuedProgressSink(ProgressSink host, int capacity) {
        this.host = host;
        this.queue = new LinkedBlockingQueue<>(capacity);
        this.worker = new Thread(this::run, "progress-delivery");
        this.worker.setDaemon(true);
        this.worker.start();
    }

    @Override
    public void notify(Path currentDirectory, Path currentEntry, String status) {
        if (closed) {
            LOGGER.warn("Dropping progress event {} for {} because the sink is closed.", status, currentEntry);
            return;
        }
        if (!queue.offer(new ProgressEvent(currentDirectory, currentEntry, status))
                && dropped.getAndIncrement() == 0) {
            LOGGER.warn("Progress queue is full; dropping events until the host catches up.");
        }
    }

    public long droppedCount() {
        return dropped.get();
    }

    /**
     * Stops accepting events and waits until everything already queued has been delivered.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            queue.put(POISON);
            worker.join();
            if (dropped.get() > 0) {
                LOGGER.warn("Dropped {} progress events because the host fell behind.", dropped.get());
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Interrupted while waiting for progress delivery to stop.", ex);
        }
    }

    private void run() {
        try {
            while (true) {
                ProgressEvent event = queue.take();
                if (event == POISON) {
                    return;
                }
                deliver(event);
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Progress delivery interrupted; exiting.", ex);
        }
    }

    private void deliver(ProgressEvent event) {
        try {
            host.notify(event.currentDirectory(), event.currentEntry(), event.status());
        } catch (RuntimeException ex) {
            LOGGER.warn("Failed to deliver progress event {} for {}", event.status(), event.currentEntry(), ex);
        }
    }
}
