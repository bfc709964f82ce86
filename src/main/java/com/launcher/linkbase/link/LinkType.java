package com.launcher.linkbase.link;

import java.util.Optional;

/**
 * Desktop entry {@code Type} values.
 */
public enum LinkType {
    /**
     * A program to launch ({@code Exec} required).
     */
    APPLICATION("Application"),

    /**
     * A URL to open ({@code URL} required).
     */
    LINK("Link"),

    /**
     * Metadata for a menu directory.
     */
    DIRECTORY("Directory");

    private final String desktopName;

    LinkType(String desktopName) {
        this.desktopName = desktopName;
    }

    public String getDesktopName() {
        return desktopName;
    }

    public static Optional<LinkType> fromDesktopName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        for (LinkType type : values()) {
            if (type.desktopName.equals(trimmed)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
