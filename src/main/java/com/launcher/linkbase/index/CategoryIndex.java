package com.launcher.linkbase.index;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import com.launcher.linkbase.link.Link;

/**
 * Category tag to the application links declaring it.
 *
 * Links are held for lookup only: the index never retains or releases them,
 * the {@link PrimaryIndex} entries own them. A tag with no links is removed.
 */
public class CategoryIndex {

    private final Map<String, Set<Link>> linksByCategory = new HashMap<>();

    public void add(String category, Link link) {
        linksByCategory.computeIfAbsent(category, c -> new LinkedHashSet<>()).add(link);
    }

    /**
     * @return false if the link was not indexed under the category
     */
    public boolean remove(String category, Link link) {
        Set<Link> links = linksByCategory.get(category);
        if (links == null || !links.remove(link)) {
            return false;
        }
        if (links.isEmpty()) {
            linksByCategory.remove(category);
        }
        return true;
    }

    /**
     * Snapshot of the links under a category, in the order they were added.
     */
    public List<Link> lookup(String category) {
        Set<Link> links = linksByCategory.get(category);
        return (links == null) ? List.of() : List.copyOf(links);
    }

    public boolean contains(String category, Link link) {
        Set<Link> links = linksByCategory.get(category);
        return links != null && links.contains(link);
    }

    public Set<String> categories() {
        return new TreeSet<>(linksByCategory.keySet());
    }

    /** Forget every link without touching its references. */
    public void clear() {
        linksByCategory.clear();
    }
}
