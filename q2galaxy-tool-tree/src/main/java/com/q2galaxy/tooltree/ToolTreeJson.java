package com.q2galaxy.tooltree;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * JSON form of a tool tree, for tree builders that hand over a description instead of objects.
 * JSON excludes null values when serializing; attribute order in the JSON object is kept.
 */
public final class ToolTreeJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private ToolTreeJson() {
    }

    /**
     * Deserializes a tool tree from a JSON string.
     *
     * @throws UncheckedIOException on parse failure
     */
    public static ToolNode fromJson(String json) {
        try {
            return MAPPER.readValue(json, ToolNode.class);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Serializes a tool tree to pretty-printed JSON.
     *
     * @throws UncheckedIOException on serialization failure
     */
    public static String toJson(ToolNode root) {
        try {
            return MAPPER.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }
}
