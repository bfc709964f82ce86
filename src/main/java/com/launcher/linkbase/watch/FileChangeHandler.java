package com.launcher.linkbase.watch;

/**
 * Receives change notifications. Events are delivered one at a time.
 */
@FunctionalInterface
public interface FileChangeHandler {

    void onChange(FileChangeEvent event);
}
