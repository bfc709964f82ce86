package com.launcher.linkbase.watch;

import java.nio.file.Path;

import lombok.NonNull;
import lombok.Value;

/**
 * One change notification for a watched directory.
 */
@Value
public class FileChangeEvent {

    /** The directory the watch was installed on. */
    @NonNull
    Path basePath;

    /** Path relative to {@link #basePath}, {@code /}-separated. Empty for {@link FileChangeType#SELF_REMOVED}. */
    @NonNull
    String subPath;

    @NonNull
    Path fullPath;

    @NonNull
    FileChangeType type;

    public static FileChangeEvent of(Path basePath, String subPath, FileChangeType type) {
        Path fullPath = subPath.isEmpty() ? basePath : basePath.resolve(subPath);
        return new FileChangeEvent(basePath, subPath, fullPath, type);
    }
}
