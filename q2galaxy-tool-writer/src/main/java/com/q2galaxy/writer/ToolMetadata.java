package com.q2galaxy.writer;

import com.q2galaxy.config.GalaxyConfig;

import java.util.Objects;

/**
 * Fixed values stamped onto a generated tool: root {@code profile}/{@code license} attributes and the
 * generator/target versions named in the provenance comment.
 */
public record ToolMetadata(
        String generatorName,
        String generatorVersion,
        String targetName,
        String targetVersion,
        String profile,
        String license) {

    public ToolMetadata {
        Objects.requireNonNull(generatorName, "generatorName");
        Objects.requireNonNull(generatorVersion, "generatorVersion");
        Objects.requireNonNull(targetName, "targetName");
        Objects.requireNonNull(targetVersion, "targetVersion");
        Objects.requireNonNull(profile, "profile");
        Objects.requireNonNull(license, "license");
    }

    /** q2galaxy/qiime2 metadata with the given versions and the default profile and license. */
    public static ToolMetadata of(String generatorVersion, String targetVersion) {
        return fromConfig(GalaxyConfig.builder()
                .generatorVersion(generatorVersion)
                .targetVersion(targetVersion)
                .build());
    }

    public static ToolMetadata fromConfig(GalaxyConfig config) {
        return new ToolMetadata(
                config.getGeneratorName(),
                config.getGeneratorVersion(),
                config.getTargetName(),
                config.getTargetVersion(),
                config.getProfile(),
                config.getLicense());
    }

    /** Body of the provenance comment placed before the root element. */
    public String provenanceComment() {
        return "\nThis tool was automatically generated by:\n"
                + "    " + generatorName + " (version: " + generatorVersion + ")\n"
                + "for:\n"
                + "    " + targetName + " (version: " + targetVersion + ")\n";
    }
}
