package com.q2galaxy.config;

import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Configuration for tool generation, loaded from environment variables.
 * <p>
 * Provenance: Q2GALAXY_VERSION (generator version), Q2GALAXY_TARGET_VERSION (QIIME 2 version the tools are
 * generated for). Tool root attributes: Q2GALAXY_PROFILE, Q2GALAXY_LICENSE. Output: Q2GALAXY_OUTPUT_DIR,
 * Q2GALAXY_INDENT (spaces per nesting level).
 */
public final class GalaxyConfig {

    private static final String ENV_VERSION = "Q2GALAXY_VERSION";
    private static final String ENV_TARGET_VERSION = "Q2GALAXY_TARGET_VERSION";
    private static final String ENV_PROFILE = "Q2GALAXY_PROFILE";
    private static final String ENV_LICENSE = "Q2GALAXY_LICENSE";
    private static final String ENV_OUTPUT_DIR = "Q2GALAXY_OUTPUT_DIR";
    private static final String ENV_INDENT = "Q2GALAXY_INDENT";

    public static final String GENERATOR_NAME = "q2galaxy";
    public static final String TARGET_NAME = "qiime2";

    private static final String DEFAULT_VERSION = "0.0.0-dev";
    private static final String DEFAULT_TARGET_VERSION = "unknown";
    /** Galaxy tool profile the generated XML is written against. */
    private static final String DEFAULT_PROFILE = "20.09";
    private static final String DEFAULT_LICENSE = "BSD-3-Clause";
    private static final String DEFAULT_OUTPUT_DIR = "tools";
    private static final int DEFAULT_INDENT = 4;

    private final String generatorName;
    private final String generatorVersion;
    private final String targetName;
    private final String targetVersion;
    private final String profile;
    private final String license;
    private final String outputDir;
    private final int indent;

    private GalaxyConfig(Builder b) {
        this.generatorName = b.generatorName;
        this.generatorVersion = b.generatorVersion;
        this.targetName = b.targetName;
        this.targetVersion = b.targetVersion;
        this.profile = b.profile;
        this.license = b.license;
        this.outputDir = b.outputDir;
        this.indent = b.indent;
    }

    /** Name of the generating system in the provenance comment. Default {@value #GENERATOR_NAME}. */
    public String getGeneratorName() {
        return generatorName;
    }

    /** Generator version (Q2GALAXY_VERSION). Default {@value #DEFAULT_VERSION}. */
    public String getGeneratorVersion() {
        return generatorVersion;
    }

    /** Name of the system the tools wrap. Default {@value #TARGET_NAME}. */
    public String getTargetName() {
        return targetName;
    }

    /** Target system version (Q2GALAXY_TARGET_VERSION). Default {@value #DEFAULT_TARGET_VERSION}. */
    public String getTargetVersion() {
        return targetVersion;
    }

    /** Value of the root {@code profile} attribute. Default {@value #DEFAULT_PROFILE}. */
    public String getProfile() {
        return profile;
    }

    /** Value of the root {@code license} attribute (SPDX id). Default {@value #DEFAULT_LICENSE}. */
    public String getLicense() {
        return license;
    }

    /** Directory generated tool files are written to. Default {@value #DEFAULT_OUTPUT_DIR}. */
    public String getOutputDir() {
        return outputDir;
    }

    /** Spaces per nesting level in the XML output. Default {@value #DEFAULT_INDENT}. */
    public int getIndent() {
        return indent;
    }

    public static GalaxyConfig fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    /** Same as {@link #fromEnvironment()} with the given lookup (e.g. a map in tests). */
    public static GalaxyConfig fromEnvironment(Function<String, String> env) {
        return builder()
                .generatorVersion(getEnv(env, ENV_VERSION, DEFAULT_VERSION))
                .targetVersion(getEnv(env, ENV_TARGET_VERSION, DEFAULT_TARGET_VERSION))
                .profile(getEnv(env, ENV_PROFILE, DEFAULT_PROFILE))
                .license(getEnv(env, ENV_LICENSE, DEFAULT_LICENSE))
                .outputDir(getEnv(env, ENV_OUTPUT_DIR, DEFAULT_OUTPUT_DIR))
                .indent(parseNonNegativeInt(env.apply(ENV_INDENT), DEFAULT_INDENT))
                .build();
    }

    public static GalaxyConfig fromMap(Map<String, String> values) {
        return fromEnvironment(values::get);
    }

    public static Builder builder() {
        return new Builder();
    }

    private static int parseNonNegativeInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            return parsed >= 0 ? parsed : defaultValue;
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static String getEnv(Function<String, String> env, String key, String defaultValue) {
        String v = env.apply(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    public static final class Builder {
        private String generatorName = GENERATOR_NAME;
        private String generatorVersion = DEFAULT_VERSION;
        private String targetName = TARGET_NAME;
        private String targetVersion = DEFAULT_TARGET_VERSION;
        private String profile = DEFAULT_PROFILE;
        private String license = DEFAULT_LICENSE;
        private String outputDir = DEFAULT_OUTPUT_DIR;
        private int indent = DEFAULT_INDENT;

        public Builder generatorName(String generatorName) {
            this.generatorName = Objects.requireNonNull(generatorName, "generatorName");
            return this;
        }

        public Builder generatorVersion(String generatorVersion) {
            this.generatorVersion = generatorVersion != null ? generatorVersion : DEFAULT_VERSION;
            return this;
        }

        public Builder targetName(String targetName) {
            this.targetName = Objects.requireNonNull(targetName, "targetName");
            return this;
        }

        public Builder targetVersion(String targetVersion) {
            this.targetVersion = targetVersion != null ? targetVersion : DEFAULT_TARGET_VERSION;
            return this;
        }

        public Builder profile(String profile) {
            this.profile = profile != null ? profile : DEFAULT_PROFILE;
            return this;
        }

        public Builder license(String license) {
            this.license = license != null ? license : DEFAULT_LICENSE;
            return this;
        }

        public Builder outputDir(String outputDir) {
            this.outputDir = outputDir != null ? outputDir : DEFAULT_OUTPUT_DIR;
            return this;
        }

        public Builder indent(int indent) {
            if (indent < 0) {
                throw new IllegalArgumentException("indent must be >= 0: " + indent);
            }
            this.indent = indent;
            return this;
        }

        public GalaxyConfig build() {
            return new GalaxyConfig(this);
        }
    }
}
