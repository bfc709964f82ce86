package com.launcher.linkbase.watch;

/**
 * Kinds of change reported for a watched directory.
 */
public enum FileChangeType {
    /**
     * A file appeared. Also used to replay files already present when a watch is installed.
     */
    ADDED,

    /**
     * A file's contents changed.
     */
    MODIFIED,

    /**
     * A file disappeared.
     */
    REMOVED,

    /**
     * The watched directory itself disappeared.
     */
    SELF_REMOVED
}
