package com.q2galaxy.tooltree.order;

import java.util.List;

/**
 * A child tag is not in the priority list of its context. Fatal: the priority list is the schema boundary, so an
 * unlisted tag means the tree builder and the list have drifted apart.
 */
public final class UnknownSectionException extends IllegalStateException {

    private final String context;
    private final String tag;

    public UnknownSectionException(String context, String tag, List<String> allowed) {
        super("Unknown child <" + tag + "> of <" + context + ">; expected one of " + allowed);
        this.context = context;
        this.tag = tag;
    }

    public String getContext() {
        return context;
    }

    public String getTag() {
        return tag;
    }
}
