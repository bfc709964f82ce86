package com.launcher.linkbase.paths;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import lombok.NonNull;
import lombok.ToString;

/**
 * Data directories following the XDG Base Directory layout:
 * {@code $XDG_DATA_HOME} first, then every entry of {@code $XDG_DATA_DIRS}.
 */
@ToString
public class XdgDataPaths implements DataPaths {

    static final String DEFAULT_DATA_DIRS = "/usr/local/share:/usr/share";

    private final List<Path> dataDirs;

    private XdgDataPaths(List<Path> dataDirs) {
        this.dataDirs = List.copyOf(dataDirs);
    }

    /**
     * Explicit directory list, kept in the given order with duplicates removed.
     */
    public static XdgDataPaths of(@NonNull List<Path> dirs) {
        Set<Path> unique = new LinkedHashSet<>();
        for (Path dir : dirs) {
            unique.add(Objects.requireNonNull(dir, "dir").normalize());
        }
        return new XdgDataPaths(new ArrayList<>(unique));
    }

    public static XdgDataPaths fromEnvironment(@NonNull Map<String, String> env) {
        List<Path> dirs = new ArrayList<>();

        String dataHome = env.get("XDG_DATA_HOME");
        if (dataHome != null && !dataHome.isBlank()) {
            dirs.add(Path.of(dataHome));
        } else {
            String home = env.getOrDefault("HOME", System.getProperty("user.home"));
            dirs.add(Path.of(home, ".local", "share"));
        }

        String dataDirs = env.get("XDG_DATA_DIRS");
        if (dataDirs == null || dataDirs.isBlank()) {
            dataDirs = DEFAULT_DATA_DIRS;
        }
        for (String entry : dataDirs.split(":")) {
            if (!entry.isBlank()) {
                dirs.add(Path.of(entry.trim()));
            }
        }

        return of(dirs);
    }

    @Override
    public List<Path> dataDirs() {
        return dataDirs;
    }
}
