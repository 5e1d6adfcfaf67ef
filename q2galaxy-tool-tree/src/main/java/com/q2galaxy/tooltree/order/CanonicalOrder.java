package com.q2galaxy.tooltree.order;

import com.q2galaxy.tooltree.ToolNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Produces the canonical form of a tool tree.
 * <ul>
 *   <li>Attributes of every element are ordered by {@link AttributePriority}.</li>
 *   <li>Direct children of the root are ordered by the root {@link TagPriority} (stable sort); an unlisted tag
 *       fails with {@link UnknownSectionException}.</li>
 *   <li>Deeper children keep their input order unless a {@link TagPriority} is registered for the parent's tag
 *       with {@link #withNestedOrder(TagPriority)}.</li>
 * </ul>
 * Tag and text are carried over unchanged. The result is a new tree; applying it twice gives an equal tree.
 */
public final class CanonicalOrder {

    private static final Logger log = LoggerFactory.getLogger(CanonicalOrder.class);

    /** Galaxy tool ordering: {@link SectionPriority#TOOL} at the root, input order below it. */
    public static final CanonicalOrder TOOL = new CanonicalOrder(SectionPriority.TOOL, Map.of());

    private final TagPriority rootOrder;
    private final Map<String, TagPriority> nestedOrders;

    private CanonicalOrder(TagPriority rootOrder, Map<String, TagPriority> nestedOrders) {
        this.rootOrder = Objects.requireNonNull(rootOrder, "rootOrder");
        this.nestedOrders = Map.copyOf(nestedOrders);
    }

    /**
     * Returns an ordering that additionally sorts the children of every non-root element tagged
     * {@link TagPriority#getContext()} with {@code order}.
     */
    public CanonicalOrder withNestedOrder(TagPriority order) {
        Map<String, TagPriority> copy = new HashMap<>(nestedOrders);
        copy.put(order.getContext(), order);
        return new CanonicalOrder(rootOrder, copy);
    }

    /** Canonicalizes with {@link #TOOL}. */
    public static ToolNode canonicalize(ToolNode root) {
        return TOOL.apply(root);
    }

    /**
     * Canonical copy of {@code root}.
     *
     * @throws UnknownSectionException if a child of the root (or of a nested-ordered element) is not listed
     */
    public ToolNode apply(ToolNode root) {
        Objects.requireNonNull(root, "root");
        ToolNode sorted = sortAttributes(root);
        List<ToolNode> sections = sortByTag(sorted.getChildren(), rootOrder);
        log.debug("Canonicalized <{}> with {} top-level sections", root.getTag(), sections.size());
        return sorted.withChildren(sections);
    }

    private ToolNode sortAttributes(ToolNode node) {
        List<ToolNode> children = new ArrayList<>(node.getChildren().size());
        for (ToolNode child : node.getChildren()) {
            ToolNode c = sortAttributes(child);
            TagPriority nested = nestedOrders.get(c.getTag());
            if (nested != null) {
                c = c.withChildren(sortByTag(c.getChildren(), nested));
            }
            children.add(c);
        }
        return new ToolNode(node.getTag(), AttributePriority.sort(node.getAttributes()), children, node.getText());
    }

    private static List<ToolNode> sortByTag(List<ToolNode> children, TagPriority order) {
        // rank every tag up front so an unknown tag fails even for a single child
        for (ToolNode child : children) {
            order.rank(child.getTag());
        }
        List<ToolNode> sorted = new ArrayList<>(children);
        sorted.sort(Comparator.comparingInt(c -> order.rank(c.getTag())));
        return sorted;
    }
}
