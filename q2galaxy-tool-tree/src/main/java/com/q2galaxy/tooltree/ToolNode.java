package com.q2galaxy.tooltree;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.q2galaxy.escape.GalaxyEscape;
import com.q2galaxy.escape.GalaxyValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Element of a Galaxy tool description: tag, string attributes, child elements and optional inline text.
 * Immutable. Attribute iteration order is the order given at construction; callers should not rely on it
 * until the tree has been through {@link com.q2galaxy.tooltree.order.CanonicalOrder}.
 * <p>
 * {@link #equals(Object)} is order-sensitive for both attributes and children so that two canonical trees
 * compare equal only when they serialize identically. Use {@link #sameContent(ToolNode)} to compare ignoring order.
 */
public final class ToolNode {

    private final String tag;
    private final Map<String, String> attributes;
    private final List<ToolNode> children;
    private final String text;

    @JsonCreator
    public ToolNode(
            @JsonProperty("tag") String tag,
            @JsonProperty("attributes") Map<String, String> attributes,
            @JsonProperty("children") List<ToolNode> children,
            @JsonProperty("text") String text) {
        if (tag == null || tag.isBlank()) {
            throw new IllegalArgumentException("tag must be non-blank");
        }
        this.tag = tag;
        this.attributes = attributes != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(attributes))
                : Map.of();
        this.children = children != null ? List.copyOf(children) : List.of();
        this.text = text;
    }

    /** Shorthand for a leaf element: tag, optional text and attributes in the given order. */
    public static ToolNode of(String tag, String text, Map<String, String> attributes) {
        return new ToolNode(tag, attributes, null, text);
    }

    public static Builder builder(String tag) {
        return new Builder(tag);
    }

    @JsonProperty("tag")
    public String getTag() {
        return tag;
    }

    /** Unmodifiable attributes in iteration order. */
    @JsonProperty("attributes")
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public Map<String, String> getAttributes() {
        return attributes;
    }

    /** Attribute value or null. */
    public String getAttribute(String name) {
        return attributes.get(name);
    }

    @JsonProperty("children")
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public List<ToolNode> getChildren() {
        return children;
    }

    /** Inline text, may be null. */
    @JsonProperty("text")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public String getText() {
        return text;
    }

    /** Same node with the given children (attributes, text and tag kept). */
    public ToolNode withChildren(List<ToolNode> newChildren) {
        return new ToolNode(tag, attributes, newChildren, text);
    }

    /** Same node with the given attributes (children, text and tag kept). */
    public ToolNode withAttributes(Map<String, String> newAttributes) {
        return new ToolNode(tag, newAttributes, children, text);
    }

    /**
     * Same node with {@code name} set to {@code value}: replaces an existing attribute in place, otherwise appends it.
     */
    public ToolNode withAttribute(String name, String value) {
        Map<String, String> copy = new LinkedHashMap<>(attributes);
        copy.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
        return withAttributes(copy);
    }

    /**
     * Compares tag, text, attribute content and children recursively, ignoring attribute order and child order.
     */
    public boolean sameContent(ToolNode other) {
        if (other == null) return false;
        if (!tag.equals(other.tag) || !Objects.equals(text, other.text) || !attributes.equals(other.attributes)) {
            return false;
        }
        if (children.size() != other.children.size()) return false;
        List<ToolNode> remaining = new ArrayList<>(other.children);
        for (ToolNode child : children) {
            boolean matched = false;
            for (int i = 0; i < remaining.size(); i++) {
                if (child.sameContent(remaining.get(i))) {
                    remaining.remove(i);
                    matched = true;
                    break;
                }
            }
            if (!matched) return false;
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ToolNode that = (ToolNode) o;
        return tag.equals(that.tag)
                && Objects.equals(text, that.text)
                && List.copyOf(attributes.entrySet()).equals(List.copyOf(that.attributes.entrySet()))
                && children.equals(that.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tag, attributes, children, text);
    }

    @Override
    public String toString() {
        return "ToolNode{tag='" + tag + "', attributes=" + attributes + ", children=" + children.size()
                + (text != null ? ", text='" + text + "'" : "") + "}";
    }

    public static final class Builder {
        private final String tag;
        private final Map<String, String> attributes = new LinkedHashMap<>();
        private final List<ToolNode> children = new ArrayList<>();
        private String text;

        private Builder(String tag) {
            this.tag = tag;
        }

        public Builder attribute(String name, String value) {
            attributes.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
            return this;
        }

        /** Sets an attribute to the escaped form of {@code value} (see {@link GalaxyEscape#encode(GalaxyValue)}). */
        public Builder attribute(String name, GalaxyValue value) {
            return attribute(name, GalaxyEscape.encode(value));
        }

        public Builder attributes(Map<String, String> values) {
            values.forEach(this::attribute);
            return this;
        }

        public Builder child(ToolNode child) {
            children.add(Objects.requireNonNull(child, "child"));
            return this;
        }

        public Builder children(List<ToolNode> nodes) {
            nodes.forEach(this::child);
            return this;
        }

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public ToolNode build() {
            return new ToolNode(tag, attributes, children, text);
        }
    }
}
