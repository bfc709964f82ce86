package com.launcher.linkbase.link;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import lombok.Builder;
import lombok.Getter;

/**
 * A parsed launcher description.
 *
 * Links are shared between owners and reference counted: a freshly parsed
 * link holds one reference, every additional owner calls {@link #retain()}
 * and every owner calls {@link #release()} once when done. Identity is the
 * object itself; two links parsed from the same file are distinct.
 */
@Getter
public class Link {

    private final Path sourcePath;
    private final LinkType type;

    private final String name;
    private final String genericName;
    private final String comment;
    private final String icon;

    /** Application only. */
    private final String exec;
    private final String workingDirectory;
    private final boolean terminal;
    private final boolean startupNotify;
    private final Set<String> categories;
    private final List<String> mimeTypes;
    private final List<String> keywords;

    /** Link only. */
    private final String url;

    private final boolean noDisplay;
    private final String tryExec;
    private final boolean tryExecSatisfied;
    private final int onlyShowIn;
    private final int notShowIn;

    @Getter(lombok.AccessLevel.NONE)
    private final AtomicInteger references = new AtomicInteger(1);

    @Builder
    private Link(Path sourcePath, LinkType type, String name, String genericName, String comment, String icon,
                 String exec, String workingDirectory, boolean terminal, boolean startupNotify,
                 Set<String> categories, List<String> mimeTypes, List<String> keywords, String url,
                 boolean noDisplay, String tryExec, Boolean tryExecSatisfied, int onlyShowIn, int notShowIn) {
        this.sourcePath = Objects.requireNonNull(sourcePath, "sourcePath");
        this.type = Objects.requireNonNull(type, "type");
        this.name = name;
        this.genericName = genericName;
        this.comment = comment;
        this.icon = icon;
        this.exec = exec;
        this.workingDirectory = workingDirectory;
        this.terminal = terminal;
        this.startupNotify = startupNotify;
        this.categories = (type == LinkType.APPLICATION && categories != null)
                ? Collections.unmodifiableSet(new LinkedHashSet<>(categories))
                : Set.of();
        this.mimeTypes = (mimeTypes != null) ? List.copyOf(mimeTypes) : List.of();
        this.keywords = (keywords != null) ? List.copyOf(keywords) : List.of();
        this.url = url;
        this.noDisplay = noDisplay;
        this.tryExec = tryExec;
        this.tryExecSatisfied = (tryExecSatisfied == null) || tryExecSatisfied;
        this.onlyShowIn = onlyShowIn;
        this.notShowIn = notShowIn;
    }

    public boolean isApplication() {
        return type == LinkType.APPLICATION;
    }

    /**
     * Whether the link should be shown when the given environments are active.
     * {@code OnlyShowIn} must match at least one active environment when set,
     * and {@code NotShowIn} must match none.
     */
    public boolean isDisplayed(int environments) {
        return !noDisplay
                && tryExecSatisfied
                && (onlyShowIn == 0 || (onlyShowIn & environments) != 0)
                && (notShowIn & environments) == 0;
    }

    public Link retain() {
        int previous = references.getAndUpdate(n -> n > 0 ? n + 1 : n);
        if (previous <= 0) {
            throw new IllegalStateException("Link already released: " + sourcePath);
        }
        return this;
    }

    /**
     * Drop one reference.
     *
     * @return true when this was the last reference
     */
    public boolean release() {
        int previous = references.getAndUpdate(n -> n > 0 ? n - 1 : n);
        if (previous <= 0) {
            throw new IllegalStateException("Link already released: " + sourcePath);
        }
        return previous == 1;
    }

    public int getReferenceCount() {
        return references.get();
    }

    public boolean isReleased() {
        return references.get() == 0;
    }

    @Override
    public String toString() {
        return "Link[" + type.getDesktopName() + " " + name + " <" + sourcePath + ">]";
    }
}
