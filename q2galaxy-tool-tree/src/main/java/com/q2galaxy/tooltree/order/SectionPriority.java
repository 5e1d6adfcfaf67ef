package com.q2galaxy.tooltree.order;

import java.util.List;

/**
 * Order of the top-level sections of a Galaxy tool ({@code <tool>} children), as the Galaxy tool linter expects them.
 */
public final class SectionPriority {

    public static final String ROOT_TAG = "tool";

    public static final List<String> SECTIONS = List.of(
            "description",
            "macros",
            "edam_topics",
            "edam_operations",
            "parallelism",
            "requirements",
            "code",
            "stdio",
            "version_command",
            "command",
            "environment_variables",
            "configfiles",
            "inputs",
            "request_param_translation",
            "outputs",
            "tests",
            "help",
            "citations"
    );

    public static final TagPriority TOOL = new TagPriority(ROOT_TAG, SECTIONS);

    private SectionPriority() {
    }
}
