package com.launcher.linkbase.watch;

import static java.nio.file.StandardWatchEventKinds.ENTRY_CREATE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_DELETE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_MODIFY;
import static java.nio.file.StandardWatchEventKinds.OVERFLOW;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystem;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import lombok.AllArgsConstructor;

/**
 * {@link WatchNotifier} on top of a {@link WatchService}.
 *
 * Existing files are replayed on the caller's thread when a watch is
 * installed; later changes are delivered from a single daemon thread.
 */
public class DirectoryWatcher implements WatchNotifier {
    private static final Logger log = LoggerFactory.getLogger(DirectoryWatcher.class);

    private static final long POLL_INTERVAL_MS = 250;

    private final WatchService service;
    private final Map<WatchKey, Registration> registrations = new ConcurrentHashMap<>();

    private volatile boolean running = true;
    private Thread thread;

    @AllArgsConstructor
    private static final class Registration {
        final Path base;
        final Path dir;
        final boolean recursive;
        final FileChangeHandler handler;
    }

    public DirectoryWatcher() {
        this(FileSystems.getDefault());
    }

    public DirectoryWatcher(FileSystem fileSystem) {
        try {
            this.service = fileSystem.newWatchService();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create watch service", e);
        }
    }

    @Override
    public synchronized void watch(Path directory, boolean recursive, FileChangeHandler handler) throws IOException {
        if (!running) {
            throw new IllegalStateException("Watcher is closed");
        }
        if (!Files.isDirectory(directory)) {
            log.debug("Not watching missing directory {}", directory);
            return;
        }

        // Register before replaying so nothing created in between is lost.
        // Files caught by both are reported as added twice.
        registerTree(directory, directory, recursive, handler);
        replay(directory, directory, recursive, handler);

        log.info("Watching {}{}", directory, recursive ? " (recursive)" : "");
        startThread();
    }

    @Override
    public void close() {
        running = false;
        try {
            service.close();
        } catch (IOException e) {
            log.warn("Failed to close watch service", e);
        }
        registrations.clear();
    }

    private void registerTree(Path base, Path dir, boolean recursive, FileChangeHandler handler) throws IOException {
        List<Path> dirs;
        if (recursive) {
            try (Stream<Path> stream = walk(dir, Integer.MAX_VALUE)) {
                dirs = stream.filter(Files::isDirectory).collect(Collectors.toList());
            } catch (UncheckedIOException e) {
                throw e.getCause();
            }
        } else {
            dirs = List.of(dir);
        }
        for (Path d : dirs) {
            WatchKey key = d.register(service, ENTRY_CREATE, ENTRY_MODIFY, ENTRY_DELETE);
            registrations.put(key, new Registration(base, d, recursive, handler));
        }
    }

    private void replay(Path base, Path dir, boolean recursive, FileChangeHandler handler) throws IOException {
        List<Path> files;
        try (Stream<Path> stream = walk(dir, recursive ? Integer.MAX_VALUE : 1)) {
            files = stream.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
        for (Path file : files) {
            deliver(handler, FileChangeEvent.of(base, subPath(base, file), FileChangeType.ADDED));
        }
    }

    /**
     * Lists a directory tree. Entries that fail while the stream is consumed
     * surface as {@link UncheckedIOException}, which callers unwrap.
     */
    protected Stream<Path> walk(Path dir, int maxDepth) throws IOException {
        return Files.walk(dir, maxDepth);
    }

    private synchronized void startThread() {
        if (thread != null) {
            return;
        }
        thread = new Thread(this::pollLoop, "linkbase-watch");
        thread.setDaemon(true);
        thread.start();
    }

    private void pollLoop() {
        while (running) {
            WatchKey key;
            try {
                key = service.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (ClosedWatchServiceException e) {
                break;
            }
            if (key == null) {
                continue;
            }

            Registration reg = registrations.get(key);
            if (reg == null) {
                key.cancel();
                continue;
            }

            for (WatchEvent<?> event : key.pollEvents()) {
                if (!running) {
                    return;
                }
                try {
                    handleEvent(reg, event);
                } catch (RuntimeException e) {
                    log.error("Failed to process {} in {}", event.kind(), reg.dir, e);
                }
            }

            if (!key.reset()) {
                registrations.remove(key);
                if (reg.dir.equals(reg.base)) {
                    log.warn("Watched directory {} was removed", reg.base);
                    deliver(reg.handler, FileChangeEvent.of(reg.base, "", FileChangeType.SELF_REMOVED));
                }
            }
        }
        log.debug("Watch thread stopped");
    }

    private void handleEvent(Registration reg, WatchEvent<?> event) {
        WatchEvent.Kind<?> kind = event.kind();
        if (kind == OVERFLOW) {
            log.warn("Change events lost for {}", reg.dir);
            return;
        }

        Path child = reg.dir.resolve((Path) event.context());
        String sub = subPath(reg.base, child);

        if (kind == ENTRY_CREATE) {
            if (Files.isDirectory(child)) {
                if (reg.recursive) {
                    try {
                        registerTree(reg.base, child, true, reg.handler);
                        replay(reg.base, child, true, reg.handler);
                    } catch (IOException e) {
                        log.warn("Cannot watch new directory {}", child, e);
                    }
                }
                return;
            }
            deliver(reg.handler, FileChangeEvent.of(reg.base, sub, FileChangeType.ADDED));
        } else if (kind == ENTRY_MODIFY) {
            if (Files.isDirectory(child)) {
                return;
            }
            deliver(reg.handler, FileChangeEvent.of(reg.base, sub, FileChangeType.MODIFIED));
        } else if (kind == ENTRY_DELETE) {
            deliver(reg.handler, FileChangeEvent.of(reg.base, sub, FileChangeType.REMOVED));
        }
    }

    private void deliver(FileChangeHandler handler, FileChangeEvent event) {
        try {
            handler.onChange(event);
        } catch (RuntimeException e) {
            log.error("Change handler failed for {} {}", event.getType(), event.getFullPath(), e);
        }
    }

    static String subPath(Path base, Path file) {
        Path relative = base.relativize(file);
        StringBuilder sb = new StringBuilder();
        for (Path part : relative) {
            if (sb.length() > 0) sb.append('/');
            sb.append(part);
        }
        return sb.toString();
    }
}
