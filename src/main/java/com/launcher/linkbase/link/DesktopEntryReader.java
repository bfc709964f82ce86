package com.launcher.linkbase.link;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reader for the key-file format used by desktop entries.
 *
 * Format:
 * - Groups: [Desktop Entry]
 * - Entries: Key=Value, Key[locale]=Value
 * - Comments: # comment
 */
public class DesktopEntryReader {
    private static final Logger log = LoggerFactory.getLogger(DesktopEntryReader.class);

    private static final Pattern GROUP_PATTERN = Pattern.compile("^\\[([^\\[\\]]+)]$");

    private static final Pattern ENTRY_PATTERN = Pattern.compile(
            "^([A-Za-z0-9-]+(?:\\[[^\\]]+])?)\\s*=\\s*(.*)$"
    );

    /**
     * Read all groups of a file, keyed by group name. Keys keep their locale
     * suffix, values are raw (not unescaped).
     */
    public Map<String, Map<String, String>> read(Path file) throws LinkParseException {
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new LinkParseException(file, "cannot read file", e);
        }
        return read(file, lines);
    }

    public Map<String, Map<String, String>> read(Path file, List<String> lines) throws LinkParseException {
        Map<String, Map<String, String>> groups = new LinkedHashMap<>();
        Map<String, String> current = null;

        int lineNum = 0;
        for (String line : lines) {
            lineNum++;

            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }

            Matcher group = GROUP_PATTERN.matcher(trimmed);
            if (group.matches()) {
                String name = group.group(1);
                if (groups.containsKey(name)) {
                    throw new LinkParseException(file, "line " + lineNum + ": duplicate group [" + name + "]");
                }
                current = new LinkedHashMap<>();
                groups.put(name, current);
                continue;
            }

            Matcher entry = ENTRY_PATTERN.matcher(trimmed);
            if (!entry.matches()) {
                throw new LinkParseException(file, "line " + lineNum + ": invalid entry: " + trimmed);
            }
            if (current == null) {
                throw new LinkParseException(file, "line " + lineNum + ": entry outside of any group");
            }

            String key = entry.group(1);
            if (current.containsKey(key)) {
                log.debug("{} line {}: duplicate key {} ignored", file, lineNum, key);
                continue;
            }
            current.put(key, entry.group(2));
        }

        return groups;
    }

    /**
     * Decode the {@code \s \n \t \r \\} escapes of a string value.
     */
    public static String unescape(String raw) {
        if (raw == null || raw.indexOf('\\') < 0) {
            return raw;
        }
        StringBuilder sb = new StringBuilder(raw.length());
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c != '\\' || i + 1 == raw.length()) {
                sb.append(c);
                continue;
            }
            char next = raw.charAt(++i);
            switch (next) {
                case 's' -> sb.append(' ');
                case 'n' -> sb.append('\n');
                case 't' -> sb.append('\t');
                case 'r' -> sb.append('\r');
                case '\\' -> sb.append('\\');
                default -> sb.append('\\').append(next);
            }
        }
        return sb.toString();
    }

    /**
     * Split a list value on unescaped {@code ;} and unescape each item.
     * The trailing empty item after a final separator is dropped.
     */
    public static List<String> splitList(String raw) {
        List<String> items = new ArrayList<>();
        if (raw == null || raw.isEmpty()) {
            return items;
        }
        StringBuilder item = new StringBuilder();
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c == '\\' && i + 1 < raw.length() && raw.charAt(i + 1) == ';') {
                item.append(';');
                i++;
            } else if (c == '\\' && i + 1 < raw.length()) {
                item.append(c).append(raw.charAt(++i));
            } else if (c == ';') {
                items.add(unescape(item.toString()));
                item.setLength(0);
            } else {
                item.append(c);
            }
        }
        if (item.length() > 0) {
            items.add(unescape(item.toString()));
        }
        return items;
    }
}
