package com.launcher.linkbase.index;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Priorities of watched directories. Directories are numbered from 0 in the
 * order they are registered; a lower number takes precedence. Numbers are
 * never reassigned or reused.
 */
public class PathPriorityRegistry {

    private final Map<Path, Integer> priorities = new LinkedHashMap<>();
    private int nextPriority = 0;

    public boolean isRegistered(Path path) {
        return priorities.containsKey(path);
    }

    /**
     * Assign the next priority to a directory.
     *
     * @throws IllegalArgumentException if the directory is already registered
     */
    public int register(Path path) {
        if (priorities.containsKey(path)) {
            throw new IllegalArgumentException("Already registered: " + path);
        }
        int priority = nextPriority++;
        priorities.put(path, priority);
        return priority;
    }

    public OptionalInt priorityOf(Path path) {
        Integer priority = priorities.get(path);
        return (priority == null) ? OptionalInt.empty() : OptionalInt.of(priority);
    }

    /** Registered directories in priority order. */
    public Map<Path, Integer> asMap() {
        return Collections.unmodifiableMap(priorities);
    }

    public int size() {
        return priorities.size();
    }
}
