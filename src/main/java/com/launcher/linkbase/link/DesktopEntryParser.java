package com.launcher.linkbase.link;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.launcher.linkbase.locale.LocaleSelector;

/**
 * Parses freedesktop {@code .desktop} files into {@link Link}s.
 *
 * Only the {@code [Desktop Entry]} group is read. Localized strings are picked
 * with {@link LocaleSelector#candidateKeys()} before falling back to the plain key.
 */
public class DesktopEntryParser implements LinkParser {
    private static final Logger log = LoggerFactory.getLogger(DesktopEntryParser.class);

    static final String DESKTOP_ENTRY_GROUP = "Desktop Entry";

    private final DesktopEntryReader reader;
    private final Predicate<String> executableLookup;

    public DesktopEntryParser() {
        this(new DesktopEntryReader(), pathLookup(System.getenv("PATH")));
    }

    /**
     * @param executableLookup decides whether a {@code TryExec} program is installed
     */
    public DesktopEntryParser(DesktopEntryReader reader, Predicate<String> executableLookup) {
        this.reader = Objects.requireNonNull(reader, "reader");
        this.executableLookup = Objects.requireNonNull(executableLookup, "executableLookup");
    }

    @Override
    public Link parse(Path file, LocaleSelector locale) throws LinkParseException {
        Map<String, Map<String, String>> groups = reader.read(file);

        Map<String, String> entry = groups.get(DESKTOP_ENTRY_GROUP);
        if (entry == null) {
            throw new LinkParseException(file, "missing [" + DESKTOP_ENTRY_GROUP + "] group");
        }

        String rawType = entry.get("Type");
        if (rawType == null) {
            throw new LinkParseException(file, "missing Type");
        }
        LinkType type = LinkType.fromDesktopName(rawType)
                .orElseThrow(() -> new LinkParseException(file, "unknown Type '" + rawType + "'"));

        if (booleanValue(entry, "Hidden")) {
            throw new LinkParseException(file, "entry is hidden (deleted)");
        }

        String name = localized(entry, "Name", locale);
        if (name == null || name.isBlank()) {
            throw new LinkParseException(file, "missing Name");
        }

        Link.LinkBuilder builder = Link.builder()
                .sourcePath(file)
                .type(type)
                .name(name)
                .genericName(localized(entry, "GenericName", locale))
                .comment(localized(entry, "Comment", locale))
                .icon(string(entry, "Icon"))
                .noDisplay(booleanValue(entry, "NoDisplay"))
                .onlyShowIn(LinkEnvironment.maskOfDesktopNames(list(entry, "OnlyShowIn")))
                .notShowIn(LinkEnvironment.maskOfDesktopNames(list(entry, "NotShowIn")));

        String tryExec = string(entry, "TryExec");
        if (tryExec != null && !tryExec.isBlank()) {
            boolean found = executableLookup.test(tryExec);
            if (!found) {
                log.debug("{}: TryExec program {} not found", file, tryExec);
            }
            builder.tryExec(tryExec).tryExecSatisfied(found);
        }

        switch (type) {
            case APPLICATION -> {
                String exec = string(entry, "Exec");
                if (exec == null || exec.isBlank()) {
                    throw new LinkParseException(file, "Application without Exec");
                }
                builder.exec(exec)
                        .workingDirectory(string(entry, "Path"))
                        .terminal(booleanValue(entry, "Terminal"))
                        .startupNotify(booleanValue(entry, "StartupNotify"))
                        .categories(new LinkedHashSet<>(list(entry, "Categories")))
                        .mimeTypes(list(entry, "MimeType"))
                        .keywords(localizedList(entry, "Keywords", locale));
            }
            case LINK -> {
                String url = string(entry, "URL");
                if (url == null || url.isBlank()) {
                    throw new LinkParseException(file, "Link without URL");
                }
                builder.url(url);
            }
            case DIRECTORY -> {
                // nothing beyond the common keys
            }
        }

        return builder.build();
    }

    /**
     * Default {@code TryExec} check: absolute paths must be executable files,
     * bare names are searched for in the given {@code PATH}. A value that is
     * not a valid path counts as not installed.
     */
    public static Predicate<String> pathLookup(String searchPath) {
        return program -> {
            try {
                Path candidate = Path.of(program);
                if (candidate.isAbsolute()) {
                    return Files.isExecutable(candidate) && !Files.isDirectory(candidate);
                }
                if (searchPath == null || searchPath.isBlank()) {
                    return false;
                }
                for (String dir : searchPath.split(File.pathSeparator)) {
                    if (dir.isBlank()) continue;
                    Path resolved = Path.of(dir).resolve(program);
                    if (Files.isExecutable(resolved) && !Files.isDirectory(resolved)) {
                        return true;
                    }
                }
                return false;
            } catch (InvalidPathException e) {
                log.debug("TryExec program '{}' is not a valid path: {}", program, e.getMessage());
                return false;
            }
        };
    }

    private static String string(Map<String, String> entry, String key) {
        return DesktopEntryReader.unescape(entry.get(key));
    }

    private static boolean booleanValue(Map<String, String> entry, String key) {
        String value = entry.get(key);
        return value != null && value.trim().equals("true");
    }

    private static List<String> list(Map<String, String> entry, String key) {
        return DesktopEntryReader.splitList(entry.get(key));
    }

    private static String localized(Map<String, String> entry, String key, LocaleSelector locale) {
        return DesktopEntryReader.unescape(rawLocalized(entry, key, locale));
    }

    private static List<String> localizedList(Map<String, String> entry, String key, LocaleSelector locale) {
        return DesktopEntryReader.splitList(rawLocalized(entry, key, locale));
    }

    private static String rawLocalized(Map<String, String> entry, String key, LocaleSelector locale) {
        for (String suffix : locale.candidateKeys()) {
            String value = entry.get(key + "[" + suffix + "]");
            if (value != null) {
                return value;
            }
        }
        return entry.get(key);
    }
}
