package com.launcher.linkbase.core;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.launcher.linkbase.config.LinkBaseConfig;
import com.launcher.linkbase.index.CategoryIndex;
import com.launcher.linkbase.index.LinkBaseEntry;
import com.launcher.linkbase.index.PathPriorityRegistry;
import com.launcher.linkbase.index.PrimaryIndex;
import com.launcher.linkbase.link.DesktopEntryParser;
import com.launcher.linkbase.link.Link;
import com.launcher.linkbase.link.LinkParser;
import com.launcher.linkbase.locale.LocaleSelector;
import com.launcher.linkbase.paths.DataPaths;
import com.launcher.linkbase.watch.DirectoryWatcher;
import com.launcher.linkbase.watch.FileChangeEvent;
import com.launcher.linkbase.watch.WatchNotifier;

import lombok.Builder;
import lombok.NonNull;

/**
 * Live index of the launchers found in the {@code applications} directory of
 * every data directory.
 *
 * <p>Each data directory gets a priority in search order. Files with the same
 * desktop file id in several directories are all kept, ordered by priority,
 * and the first one wins {@link #lookup}. Application links are also indexed
 * by category. Both indexes follow the filesystem through a {@link WatchNotifier}.
 *
 * <p>A link base is reference counted: it starts with one reference, and the
 * last {@link #release()} releases every indexed link and stops watching.
 * Change processing and queries are serialized on one lock.
 */
public final class LinkBase implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(LinkBase.class);

    static final String APPLICATIONS_DIR = "applications";

    private final Object lock = new Object();

    private final LocaleSelector locale;
    private final int environments;
    private final WatchNotifier notifier;

    private final PrimaryIndex primaryIndex = new PrimaryIndex();
    private final CategoryIndex categoryIndex = new CategoryIndex();
    private final PathPriorityRegistry priorities = new PathPriorityRegistry();
    private final LinkBaseUpdater updater;

    private DataPaths paths;
    private int references = 1;

    private LinkBase(DataPaths paths, LocaleSelector locale, int environments,
                     LinkParser parser, WatchNotifier notifier) {
        this.paths = paths;
        this.locale = locale;
        this.environments = environments;
        this.notifier = notifier;
        this.updater = new LinkBaseUpdater(this, primaryIndex, categoryIndex, priorities,
                parser, locale, environments);
    }

    /**
     * Create a link base watching {@code <dir>/applications} for every data
     * directory, with the default desktop entry parser and directory watcher.
     * Files already present are indexed before this returns.
     *
     * @param locale       locale specifier used to pick localized names, e.g. {@code de_DE.UTF-8}
     * @param environments mask of {@link com.launcher.linkbase.link.LinkEnvironment} flags
     */
    public static LinkBase create(DataPaths paths, String locale, int environments) {
        return builder()
                .paths(paths)
                .locale(locale)
                .environments(environments)
                .create();
    }

    public static LinkBase fromConfig(LinkBaseConfig config, Map<String, String> env) {
        return create(config.dataPaths(env), config.getLocale(), config.environmentMask());
    }

    /**
     * Builder entry point; {@code parser} and {@code notifier} default to
     * {@link DesktopEntryParser} and {@link DirectoryWatcher}. The link base
     * takes ownership of the notifier and closes it on the last release.
     */
    @Builder(builderMethodName = "builder", buildMethodName = "create")
    private static LinkBase newLinkBase(@NonNull DataPaths paths, String locale, int environments,
                                        LinkParser parser, WatchNotifier notifier) {
        LinkBase linkBase = new LinkBase(
                paths,
                LocaleSelector.parse(locale),
                environments,
                (parser != null) ? parser : new DesktopEntryParser(),
                (notifier != null) ? notifier : new DirectoryWatcher());

        linkBase.rescanPaths();

        log.info("Link base ready: {} ids from {} directories (locale '{}', environments {})",
                linkBase.size(), linkBase.priorities.size(), linkBase.locale, environments);
        return linkBase;
    }

    /**
     * Watch the {@code applications} directory of every data directory not
     * seen before, giving each the next priority. The priority is registered
     * before the watch is installed because installing it reports the
     * existing files right away.
     */
    public void rescanPaths() {
        synchronized (lock) {
            ensureAlive();
            for (Path dataDir : paths.dataDirs()) {
                Path watched = dataDir.resolve(APPLICATIONS_DIR);
                if (priorities.isRegistered(watched)) {
                    continue;
                }

                int priority = priorities.register(watched);
                log.debug("Registered {} with priority {}", watched, priority);

                try {
                    notifier.watch(watched, false, this::dispatch);
                } catch (IOException e) {
                    log.warn("Cannot watch {}, skipping it", watched, e);
                }
            }
        }
    }

    private void dispatch(FileChangeEvent event) {
        synchronized (lock) {
            if (references < 1) {
                return;
            }
            updater.onChange(event);
        }
    }

    public void retain() {
        synchronized (lock) {
            ensureAlive();
            references++;
        }
    }

    /**
     * Drop one reference. The last one stops watching and releases every
     * indexed link exactly once; the handle is unusable afterwards.
     */
    public void release() {
        synchronized (lock) {
            ensureAlive();
            if (--references > 0) {
                return;
            }

            notifier.close();

            List<LinkBaseEntry> entries = primaryIndex.drain();
            for (LinkBaseEntry entry : entries) {
                entry.getLink().release();
            }
            categoryIndex.clear();
            paths = null;
            updater.setListener(null);

            log.debug("Link base released ({} links)", entries.size());
        }
    }

    @Override
    public void close() {
        release();
    }

    /**
     * Replace the update listener; {@code null} removes it.
     */
    public void setUpdateListener(LinkBaseUpdateListener listener) {
        synchronized (lock) {
            ensureAlive();
            updater.setListener(listener);
        }
    }

    /**
     * Application links declaring a category, empty for an unknown category.
     */
    public List<Link> lookupCategory(String category) {
        synchronized (lock) {
            ensureAlive();
            return categoryIndex.lookup(category);
        }
    }

    /**
     * The link that wins for a desktop file id, i.e. the one from the
     * directory with the lowest priority number.
     */
    public Optional<Link> lookup(String id) {
        synchronized (lock) {
            ensureAlive();
            List<LinkBaseEntry> entries = primaryIndex.get(id);
            return entries.isEmpty() ? Optional.empty() : Optional.of(entries.get(0).getLink());
        }
    }

    /**
     * Every entry for a desktop file id in ascending priority order, empty when unknown.
     */
    public List<LinkBaseEntry> entries(String id) {
        synchronized (lock) {
            ensureAlive();
            return primaryIndex.get(id);
        }
    }

    public Set<String> ids() {
        synchronized (lock) {
            ensureAlive();
            return new TreeSet<>(primaryIndex.ids());
        }
    }

    public Set<String> categories() {
        synchronized (lock) {
            ensureAlive();
            return categoryIndex.categories();
        }
    }

    public int size() {
        synchronized (lock) {
            ensureAlive();
            return primaryIndex.size();
        }
    }

    public OptionalInt priorityOf(Path watchedDir) {
        synchronized (lock) {
            ensureAlive();
            return priorities.priorityOf(watchedDir);
        }
    }

    public LocaleSelector getLocale() {
        return locale;
    }

    public int getEnvironments() {
        return environments;
    }

    public boolean isReleased() {
        synchronized (lock) {
            return references < 1;
        }
    }

    private void ensureAlive() {
        if (references < 1) {
            throw new IllegalStateException("Link base has been released");
        }
    }
}
