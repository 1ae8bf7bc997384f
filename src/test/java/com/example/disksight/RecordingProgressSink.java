package com.example.disksight;

import com.example.disksight.progress.ProgressEvent;
import com.example.disksight.progress.ProgressSink;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.stream.Collectors;

final class RecordingProgressSink implements ProgressSink {
    private final ConcurrentLinkedQueue<ProgressEvent> events = new ConcurrentLinkedQueue<>();

    @Override
    public void notify(Path currentDirectory, Path currentEntry, String status) {
        events.add(new ProgressEvent(currentDirectory, currentEntry, status));
    }

    List<ProgressEvent> events() {
        return List.copyOf(events);
    }

    List<String> statuses() {
        return events.stream().map(ProgressEvent::status).collect(Collectors.toList());
    }

    List<String> statusesFor(Path entry) {
        return events.stream()
                .filter(event -> entry.equals(event.currentEntry()))
                .map(ProgressEvent::status)
                .collect(Collectors.toList());
    }
}
