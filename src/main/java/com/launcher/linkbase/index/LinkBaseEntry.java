package com.launcher.linkbase.index;

import com.launcher.linkbase.link.Link;

import lombok.NonNull;
import lombok.Value;

/**
 * One indexed link and the priority of the directory it was found in.
 * The entry owns one reference to its link.
 */
@Value
public class LinkBaseEntry {
    int priority;

    @NonNull
    Link link;
}
