package com.launcher.linkbase.core;

/**
 * What happened to a link reported to a {@link LinkBaseUpdateListener}.
 */
public enum LinkBaseUpdateKind {
    ADDED,
    REMOVED
}
