package com.q2galaxy.tooltree.order;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Attribute order used on every element: the names in {@link #NAMES} first, in list order, then every other
 * name alphabetically.
 */
public final class AttributePriority {

    public static final List<String> NAMES = List.of(
            "name",
            "argument",
            "type",
            "format",
            "min",
            "truevalue",
            "max",
            "falsevalue",
            "value",
            "checked",
            "optional",
            "label",
            "help"
    );

    private static final Map<String, Integer> RANKS;

    static {
        Map<String, Integer> r = new HashMap<>();
        for (int i = 0; i < NAMES.size(); i++) {
            r.put(NAMES.get(i), i);
        }
        RANKS = Map.copyOf(r);
    }

    /** Prioritized names by rank, the rest by natural string order after them. */
    public static final Comparator<String> ORDER = (a, b) -> {
        Integer ra = RANKS.get(a);
        Integer rb = RANKS.get(b);
        if (ra != null && rb != null) return Integer.compare(ra, rb);
        if (ra != null) return -1;
        if (rb != null) return 1;
        return a.compareTo(b);
    };

    private AttributePriority() {
    }

    /** Returns a new insertion-ordered map with the entries of {@code attributes} in canonical order. */
    public static Map<String, String> sort(Map<String, String> attributes) {
        List<String> names = new ArrayList<>(attributes.keySet());
        names.sort(ORDER);
        Map<String, String> sorted = new LinkedHashMap<>();
        for (String name : names) {
            sorted.put(name, attributes.get(name));
        }
        return sorted;
    }
}
