package com.q2galaxy.tooltree.order;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Fixed ordering of child tags for one nesting context. Every child tag met in that context must be listed;
 * {@link #rank(String)} fails with {@link UnknownSectionException} otherwise.
 */
public final class TagPriority {

    private final String context;
    private final List<String> tags;
    private final Map<String, Integer> ranks;

    public TagPriority(String context, List<String> tags) {
        this.context = context;
        this.tags = List.copyOf(tags);
        Map<String, Integer> r = new HashMap<>();
        for (int i = 0; i < this.tags.size(); i++) {
            if (r.putIfAbsent(this.tags.get(i), i) != null) {
                throw new IllegalArgumentException("Duplicate tag in priority list for " + context + ": " + this.tags.get(i));
            }
        }
        this.ranks = Map.copyOf(r);
    }

    /** Name of the element whose children this list orders (e.g. "tool"). */
    public String getContext() {
        return context;
    }

    /**
     * Position of {@code tag} in this list.
     *
     * @throws UnknownSectionException if the tag is not listed
     */
    public int rank(String tag) {
        Integer r = ranks.get(tag);
        if (r == null) {
            throw new UnknownSectionException(context, tag, tags);
        }
        return r;
    }
}
