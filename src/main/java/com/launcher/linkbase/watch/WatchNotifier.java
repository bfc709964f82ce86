package com.launcher.linkbase.watch;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Watches directories and reports changes to a handler.
 *
 * <p>Installing a watch replays every file already present in the directory
 * as an {@link FileChangeType#ADDED} event, synchronously, before
 * {@link #watch} returns. Callers rely on this to populate their state from
 * the initial contents in registration order. The same file may be reported
 * as added more than once around installation time.
 */
public interface WatchNotifier extends AutoCloseable {

    /**
     * Start watching a directory. A directory that does not exist is ignored.
     *
     * @param recursive also watch (and replay) subdirectories
     * @throws IOException if the directory exists but cannot be watched
     */
    void watch(Path directory, boolean recursive, FileChangeHandler handler) throws IOException;

    /**
     * Stop delivering events. Does not wait for an event currently being handled.
     */
    @Override
    void close();
}
