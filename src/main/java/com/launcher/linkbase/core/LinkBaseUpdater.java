package com.launcher.linkbase.core;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.launcher.linkbase.index.CategoryIndex;
import com.launcher.linkbase.index.LinkBaseEntry;
import com.launcher.linkbase.index.PathPriorityRegistry;
import com.launcher.linkbase.index.PrimaryIndex;
import com.launcher.linkbase.link.Link;
import com.launcher.linkbase.link.LinkIds;
import com.launcher.linkbase.link.LinkParseException;
import com.launcher.linkbase.link.LinkParser;
import com.launcher.linkbase.locale.LocaleSelector;
import com.launcher.linkbase.watch.FileChangeEvent;
import com.launcher.linkbase.watch.FileChangeHandler;

/**
 * Applies directory change notifications to the primary and category indexes.
 *
 * Not thread safe: the owning {@link LinkBase} feeds it one event at a time.
 */
class LinkBaseUpdater implements FileChangeHandler {
    private static final Logger log = LoggerFactory.getLogger(LinkBaseUpdater.class);

    private final LinkBase owner;
    private final PrimaryIndex primaryIndex;
    private final CategoryIndex categoryIndex;
    private final PathPriorityRegistry priorities;
    private final LinkParser parser;
    private final LocaleSelector locale;
    private final int environments;

    private LinkBaseUpdateListener listener;

    LinkBaseUpdater(LinkBase owner, PrimaryIndex primaryIndex, CategoryIndex categoryIndex,
                    PathPriorityRegistry priorities, LinkParser parser, LocaleSelector locale, int environments) {
        this.owner = owner;
        this.primaryIndex = Objects.requireNonNull(primaryIndex, "primaryIndex");
        this.categoryIndex = Objects.requireNonNull(categoryIndex, "categoryIndex");
        this.priorities = Objects.requireNonNull(priorities, "priorities");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.locale = Objects.requireNonNull(locale, "locale");
        this.environments = environments;
    }

    void setListener(LinkBaseUpdateListener listener) {
        this.listener = listener;
    }

    @Override
    public void onChange(FileChangeEvent event) {
        if (!LinkIds.isDesktopFile(event.getSubPath())) {
            return;
        }

        String id = LinkIds.fromDesktopFile(event.getSubPath());
        List<LinkBaseEntry> entries = new ArrayList<>(primaryIndex.get(id));

        switch (event.getType()) {
            case SELF_REMOVED -> log.warn("Ignoring removal of {}", event.getFullPath());
            case REMOVED -> {
                if (removeEntry(entries, event.getFullPath())) {
                    primaryIndex.put(id, entries);
                }
            }
            case MODIFIED -> {
                if (removeEntry(entries, event.getFullPath())) {
                    primaryIndex.put(id, entries);
                }
                int priority = requirePriority(event.getBasePath());
                int at = PrimaryIndex.insertionPoint(entries, priority);
                if (isTaken(entries, at, priority)) {
                    log.debug("{} shadowed by another file with id {} at priority {}", event.getFullPath(), id, priority);
                    return;
                }
                addEntry(id, entries, at, priority, event.getFullPath());
            }
            case ADDED -> {
                int priority = requirePriority(event.getBasePath());
                int at = PrimaryIndex.insertionPoint(entries, priority);
                if (isTaken(entries, at, priority)) {
                    log.debug("{} already indexed as {} at priority {}", event.getFullPath(), id, priority);
                    return;
                }
                addEntry(id, entries, at, priority, event.getFullPath());
            }
        }
    }

    /**
     * Remove the entry read from {@code fullPath}, if any. Files that failed to
     * parse or were not displayed never got an entry.
     */
    private boolean removeEntry(List<LinkBaseEntry> entries, Path fullPath) {
        int index = PrimaryIndex.indexOfSource(entries, fullPath);
        if (index < 0) {
            return false;
        }

        Link link = entries.get(index).getLink();
        notifyListener(LinkBaseUpdateKind.REMOVED, link);

        if (link.isApplication()) {
            for (String category : link.getCategories()) {
                categoryIndex.remove(category, link);
            }
        }

        entries.remove(index);
        link.release();
        log.debug("Removed {}", fullPath);
        return true;
    }

    private void addEntry(String id, List<LinkBaseEntry> entries, int at, int priority, Path fullPath) {
        Link link;
        try {
            link = parser.parse(fullPath, locale);
        } catch (LinkParseException e) {
            log.debug("Skipping {}: {}", fullPath, e.getMessage());
            return;
        } catch (RuntimeException e) {
            log.warn("Skipping {}: parser failed unexpectedly", fullPath, e);
            return;
        }

        if (!link.isDisplayed(environments)) {
            log.debug("Skipping {}: not displayed in this environment", fullPath);
            link.release();
            return;
        }

        notifyListener(LinkBaseUpdateKind.ADDED, link);

        entries.add(at, new LinkBaseEntry(priority, link));
        primaryIndex.put(id, entries);

        if (link.isApplication()) {
            for (String category : link.getCategories()) {
                categoryIndex.add(category, link);
            }
        }
        log.debug("Added {} as {} at priority {}", fullPath, id, priority);
    }

    private int requirePriority(Path basePath) {
        return priorities.priorityOf(basePath)
                .orElseThrow(() -> new IllegalStateException("No priority registered for " + basePath));
    }

    private static boolean isTaken(List<LinkBaseEntry> entries, int at, int priority) {
        return at < entries.size() && entries.get(at).getPriority() == priority;
    }

    private void notifyListener(LinkBaseUpdateKind kind, Link link) {
        LinkBaseUpdateListener current = listener;
        if (current == null) {
            return;
        }
        try {
            current.onUpdate(owner, kind, link);
        } catch (RuntimeException e) {
            log.error("Update listener failed on {} {}", kind, link.getSourcePath(), e);
        }
    }
}
