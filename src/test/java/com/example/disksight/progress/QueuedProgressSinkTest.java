package com.example.disksight.progress;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QueuedProgressSinkTest {
    @Test
    void deliversQueuedEventsInOrderBeforeClosing() {
        List<String> delivered = new CopyOnWriteArrayList<>();
        QueuedProgressSink sink = new QueuedProgressSink((directory, entry, status) -> delivered.add(status + ":" + entry));

        Path dir = Path.of("root");
        for (int i = 0; i < 50; i++) {
            sink.notify(dir, dir.resolve("f" + i), ProgressStatus.PROCESSING);
        }
        sink.close();

        assertEquals(50, delivered.size());
        assertEquals("processing:" + dir.resolve("f0"), delivered.get(0));
        assertEquals("processing:" + dir.resolve("f49"), delivered.get(49));
    }

    @Test
    void hostFailureDoesNotStopDelivery() {
        List<String> delivered = new CopyOnWriteArrayList<>();
        QueuedProgressSink sink = new QueuedProgressSink((directory, entry, status) -> {
            if (status.equals("boom")) {
                throw new IllegalStateException("host closed");
            }
            delivered.add(status);
        });

        Path dir = Path.of("root");
        sink.notify(dir, dir, "boom");
        sink.notify(dir, dir, ProgressStatus.COMPLETED);
        sink.close();

        assertEquals(List.of(ProgressStatus.COMPLETED), delivered);
    }

    @Test
    void fullQueueDropsInsteadOfBlocking() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        List<String> delivered = new CopyOnWriteArrayList<>();
        QueuedProgressSink sink = new QueuedProgressSink((directory, entry, status) -> {
            try {
                release.await();
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
            delivered.add(status);
        }, 4);

        Path dir = Path.of("root");
        for (int i = 0; i < 100; i++) {
            sink.notify(dir, dir.resolve("f" + i), ProgressStatus.PROCESSING_FILE);
        }
        release.countDown();
        sink.close();

        assertTrue(sink.droppedCount() > 0);
        assertEquals(100, delivered.size() + sink.droppedCount());
    }

    @Test
    void eventsAfterCloseAreDropped() {
        List<String> delivered = new CopyOnWriteArrayList<>();
        QueuedProgressSink sink = new QueuedProgressSink((directory, entry, status) -> delivered.add(status));
        sink.close();

        sink.notify(Path.of("root"), Path.of("root"), ProgressStatus.PROCESSING);
        sink.close();

        assertEquals(List.of(), delivered);
    }
}
