package com.launcher.linkbase.link;

import java.util.Collection;
import java.util.Optional;

/**
 * Desktop environments a link can be restricted to with {@code OnlyShowIn} / {@code NotShowIn}.
 * Each value is one bit of an environment mask.
 */
public enum LinkEnvironment {
    OPENBOX(1 << 0, "Openbox"),
    GNOME(1 << 1, "GNOME"),
    KDE(1 << 2, "KDE"),
    LXDE(1 << 3, "LXDE"),
    ROX(1 << 4, "ROX"),
    XFCE(1 << 5, "XFCE"),
    OLD(1 << 6, "Old");

    private final int flag;
    private final String desktopName;

    LinkEnvironment(int flag, String desktopName) {
        this.flag = flag;
        this.desktopName = desktopName;
    }

    public int getFlag() {
        return flag;
    }

    public String getDesktopName() {
        return desktopName;
    }

    public static Optional<LinkEnvironment> fromDesktopName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        for (LinkEnvironment env : values()) {
            if (env.desktopName.equals(name.trim())) {
                return Optional.of(env);
            }
        }
        return Optional.empty();
    }

    public static int mask(Collection<LinkEnvironment> environments) {
        int mask = 0;
        for (LinkEnvironment env : environments) {
            mask |= env.flag;
        }
        return mask;
    }

    /**
     * Mask for a list of desktop names as found in {@code OnlyShowIn}. Unknown names are ignored.
     */
    public static int maskOfDesktopNames(Collection<String> names) {
        int mask = 0;
        for (String name : names) {
            mask |= fromDesktopName(name).map(LinkEnvironment::getFlag).orElse(0);
        }
        return mask;
    }
}
