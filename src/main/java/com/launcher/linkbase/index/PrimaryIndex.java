package com.launcher.linkbase.index;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Desktop file id to the entries found for it, ordered by ascending priority.
 *
 * Entry lists are stored by value: {@link #put} keeps an immutable copy and
 * {@link #get} hands that copy out, so callers build a new list for every
 * change. An id never maps to an empty list.
 */
public class PrimaryIndex {

    private final Map<String, List<LinkBaseEntry>> entriesById = new HashMap<>();

    /**
     * Entries for an id, empty when the id is unknown.
     */
    public List<LinkBaseEntry> get(String id) {
        return entriesById.getOrDefault(id, List.of());
    }

    /**
     * Replace the entries for an id. An empty list removes the id.
     *
     * @throws IllegalArgumentException if priorities are not strictly ascending
     */
    public void put(String id, List<LinkBaseEntry> entries) {
        if (entries.isEmpty()) {
            entriesById.remove(id);
            return;
        }
        for (int i = 1; i < entries.size(); i++) {
            if (entries.get(i - 1).getPriority() >= entries.get(i).getPriority()) {
                throw new IllegalArgumentException("Entries for " + id + " are not in ascending priority order");
            }
        }
        entriesById.put(id, List.copyOf(entries));
    }

    public boolean contains(String id) {
        return entriesById.containsKey(id);
    }

    public Set<String> ids() {
        return Collections.unmodifiableSet(entriesById.keySet());
    }

    public int size() {
        return entriesById.size();
    }

    /**
     * Remove every id and return all entries that were stored, so their
     * references can be released once each.
     */
    public List<LinkBaseEntry> drain() {
        List<LinkBaseEntry> all = new ArrayList<>();
        for (List<LinkBaseEntry> entries : entriesById.values()) {
            all.addAll(entries);
        }
        entriesById.clear();
        return all;
    }

    /**
     * Position of the entry whose link was read from {@code sourcePath}, or -1.
     */
    public static int indexOfSource(List<LinkBaseEntry> entries, Path sourcePath) {
        for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i).getLink().getSourcePath().equals(sourcePath)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Position of the first entry with a priority number {@code >= priority},
     * or the list size when there is none.
     */
    public static int insertionPoint(List<LinkBaseEntry> entries, int priority) {
        for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i).getPriority() >= priority) {
                return i;
            }
        }
        return entries.size();
    }
}
