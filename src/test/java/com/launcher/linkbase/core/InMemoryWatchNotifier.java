package com.launcher.linkbase.core;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.launcher.linkbase.watch.FileChangeEvent;
import com.launcher.linkbase.watch.FileChangeHandler;
import com.launcher.linkbase.watch.FileChangeType;
import com.launcher.linkbase.watch.WatchNotifier;

/**
 * Deterministic notifier for tests: replays the files declared with
 * {@link #existing} when a watch is installed and delivers whatever the test
 * fires, on the test thread.
 */
class InMemoryWatchNotifier implements WatchNotifier {

    private final Map<Path, List<String>> existingFiles = new HashMap<>();
    private final Map<Path, FileChangeHandler> handlers = new LinkedHashMap<>();
    private final List<Path> watchOrder = new ArrayList<>();
    private boolean closed;

    InMemoryWatchNotifier existing(Path dir, String... subPaths) {
        existingFiles.computeIfAbsent(dir, d -> new ArrayList<>()).addAll(List.of(subPaths));
        return this;
    }

    @Override
    public void watch(Path directory, boolean recursive, FileChangeHandler handler) {
        if (closed) {
            throw new IllegalStateException("closed");
        }
        handlers.put(directory, handler);
        watchOrder.add(directory);
        for (String sub : existingFiles.getOrDefault(directory, List.of())) {
            handler.onChange(FileChangeEvent.of(directory, sub, FileChangeType.ADDED));
        }
    }

    /**
     * Deliver an event to the handler installed for {@code dir}, or to the
     * first handler when nothing watches {@code dir}.
     */
    void fire(FileChangeType type, Path dir, String subPath) {
        FileChangeHandler handler = handlers.get(dir);
        if (handler == null) {
            handler = handlers.values().iterator().next();
        }
        handler.onChange(FileChangeEvent.of(dir, subPath, type));
    }

    List<Path> getWatchOrder() {
        return watchOrder;
    }

    boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        closed = true;
    }
}
