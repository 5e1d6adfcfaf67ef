package com.q2galaxy.escape;

import java.util.ArrayList;
import java.util.List;

/**
 * Placeholders for UI-bound fields (conditional selectors, control parameters). These are generated only;
 * {@link GalaxyEscape#decode(String)} leaves them as plain text.
 */
public final class GalaxyUiVar {

    public static final String CONTROL_PREFIX = "__q2galaxy__::control::";

    private static final String SEPARATOR = "__";
    private static final String NAMESPACE = "q2galaxy";
    private static final String GUI = "GUI";

    private GalaxyUiVar() {
    }

    /** {@code __q2galaxy__::control::<value>} */
    public static String control(String value) {
        return CONTROL_PREFIX + value;
    }

    /**
     * Underscore-joined path {@code __q2galaxy__GUI__<tag>__<name>__}; a null tag or name is left out.
     */
    public static String path(String tag, String name) {
        List<String> elements = new ArrayList<>(List.of("", NAMESPACE, GUI));
        if (tag != null) elements.add(tag);
        if (name != null) elements.add(name);
        elements.add("");
        return String.join(SEPARATOR, elements);
    }

    /** Control token when {@code value} is non-null, otherwise the path form. */
    public static String uiVar(String value, String tag, String name) {
        if (value != null) {
            return control(value);
        }
        return path(tag, name);
    }
}
