package com.launcher.linkbase.core;

import com.launcher.linkbase.link.Link;

/**
 * Told about every link entering or leaving a {@link LinkBase}.
 *
 * Called while the link base is processing a change, before the link is
 * inserted (for {@link LinkBaseUpdateKind#ADDED}) or released (for
 * {@link LinkBaseUpdateKind#REMOVED}). A listener that wants to keep a link
 * must {@link Link#retain()} it.
 */
@FunctionalInterface
public interface LinkBaseUpdateListener {

    void onUpdate(LinkBase linkBase, LinkBaseUpdateKind kind, Link link);
}
