package com.launcher.linkbase.link;

import lombok.experimental.UtilityClass;

/**
 * Desktop file ids: the path of a {@code .desktop} file relative to its
 * {@code applications} directory, with {@code /} replaced by {@code -}.
 * The same relative path under two data directories gives the same id.
 */
@UtilityClass
public class LinkIds {

    public final String DESKTOP_SUFFIX = ".desktop";

    public boolean isDesktopFile(String subPath) {
        return subPath != null && subPath.endsWith(DESKTOP_SUFFIX);
    }

    public String fromDesktopFile(String subPath) {
        return subPath.replace('/', '-');
    }
}
