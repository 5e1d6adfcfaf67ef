package com.q2galaxy.tooltree.order;

import com.q2galaxy.tooltree.ToolNode;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CanonicalOrderTest {

    private static List<String> attributeNames(ToolNode node) {
        return new ArrayList<>(node.getAttributes().keySet());
    }

    private static List<String> childTags(ToolNode node) {
        return node.getChildren().stream().map(ToolNode::getTag).toList();
    }

    private static ToolNode sampleTool() {
        ToolNode param = ToolNode.builder("param")
                .attribute("optional", "true")
                .attribute("label", "Count")
                .attribute("zeta", "z")
                .attribute("type", "integer")
                .attribute("name", "count")
                .attribute("alpha", "a")
                .build();
        return ToolNode.builder("tool")
                .attribute("version", "2021.4.0")
                .attribute("name", "qiime2 demo")
                .attribute("id", "qiime2__demo__action")
                .child(ToolNode.builder("outputs").child(ToolNode.of("data", null, Map.of("name", "out"))).build())
                .child(ToolNode.builder("help").text("Help text").build())
                .child(ToolNode.builder("inputs").child(param).build())
                .child(ToolNode.builder("command").text("q2galaxy run demo action inputs.json").build())
                .child(ToolNode.builder("description").text("Do a thing").build())
                .child(ToolNode.builder("requirements").build())
                .build();
    }

    @Test
    void attributes_priorityListFirstThenAlphabetical() {
        Map<String, String> attrs = new LinkedHashMap<>();
        attrs.put("help", "h");
        attrs.put("name", "n");
        attrs.put("zzz", "z");
        attrs.put("argument", "a");
        ToolNode node = ToolNode.of("param", null, attrs);

        ToolNode result = CanonicalOrder.canonicalize(node);

        assertEquals(List.of("name", "argument", "help", "zzz"), attributeNames(result));
    }

    @Test
    void attributes_sortedAtEveryDepth() {
        ToolNode result = CanonicalOrder.canonicalize(sampleTool());

        assertEquals(List.of("name", "id", "version"), attributeNames(result));
        ToolNode inputs = result.getChildren().get(childTags(result).indexOf("inputs"));
        assertEquals(List.of("name", "type", "optional", "label", "alpha", "zeta"),
                attributeNames(inputs.getChildren().get(0)));
    }

    @Test
    void rootChildren_orderedBySectionPriority() {
        ToolNode root = ToolNode.builder("tool")
                .child(ToolNode.builder("outputs").build())
                .child(ToolNode.builder("description").build())
                .child(ToolNode.builder("code").build())
                .build();

        assertEquals(List.of("description", "code", "outputs"), childTags(CanonicalOrder.canonicalize(root)));
    }

    @Test
    void rootChildren_fullSample() {
        ToolNode result = CanonicalOrder.canonicalize(sampleTool());

        assertEquals(List.of("description", "requirements", "command", "inputs", "outputs", "help"), childTags(result));
    }

    @Test
    void rootChildren_sameTagKeepsInputOrder() {
        ToolNode root = ToolNode.builder("tool")
                .child(ToolNode.builder("help").text("first").build())
                .child(ToolNode.builder("description").build())
                .child(ToolNode.builder("help").text("second").build())
                .build();

        ToolNode result = CanonicalOrder.canonicalize(root);

        assertEquals("first", result.getChildren().get(1).getText());
        assertEquals("second", result.getChildren().get(2).getText());
    }

    @Test
    void unknownRootTag_failsFast() {
        ToolNode root = ToolNode.builder("tool")
                .child(ToolNode.builder("description").build())
                .child(ToolNode.builder("foobar").build())
                .build();

        UnknownSectionException e = assertThrows(UnknownSectionException.class, () -> CanonicalOrder.canonicalize(root));
        assertEquals("foobar", e.getTag());
        assertEquals("tool", e.getContext());
    }

    @Test
    void unknownRootTag_failsEvenWhenAlone() {
        ToolNode root = ToolNode.builder("tool").child(ToolNode.builder("foobar").build()).build();

        assertThrows(UnknownSectionException.class, () -> CanonicalOrder.canonicalize(root));
    }

    @Test
    void nestedChildren_keepInputOrderAndUnknownTagsAreAllowed() {
        ToolNode inputs = ToolNode.builder("inputs")
                .child(ToolNode.of("param", null, Map.of("name", "b")))
                .child(ToolNode.of("section", null, Map.of("name", "a")))
                .child(ToolNode.of("anything", null, Map.of()))
                .build();
        ToolNode root = ToolNode.builder("tool").child(inputs).build();

        ToolNode result = CanonicalOrder.canonicalize(root);

        assertEquals(List.of("param", "section", "anything"), childTags(result.getChildren().get(0)));
    }

    @Test
    void nestedOrder_appliesToRegisteredContext() {
        CanonicalOrder order = CanonicalOrder.TOOL
                .withNestedOrder(new TagPriority("tests", List.of("test")))
                .withNestedOrder(new TagPriority("test", List.of("param", "output")));
        ToolNode test = ToolNode.builder("test")
                .child(ToolNode.of("output", null, Map.of("name", "o")))
                .child(ToolNode.of("param", null, Map.of("name", "p")))
                .build();
        ToolNode root = ToolNode.builder("tool").child(ToolNode.builder("tests").child(test).build()).build();

        ToolNode result = order.apply(root);

        assertEquals(List.of("param", "output"), childTags(result.getChildren().get(0).getChildren().get(0)));
    }

    @Test
    void nestedOrder_unknownTagFails() {
        CanonicalOrder order = CanonicalOrder.TOOL.withNestedOrder(new TagPriority("tests", List.of("test")));
        ToolNode root = ToolNode.builder("tool")
                .child(ToolNode.builder("tests").child(ToolNode.builder("assert").build()).build())
                .build();

        UnknownSectionException e = assertThrows(UnknownSectionException.class, () -> order.apply(root));
        assertEquals("tests", e.getContext());
    }

    @Test
    void canonicalize_isIdempotent() {
        ToolNode once = CanonicalOrder.canonicalize(sampleTool());
        ToolNode twice = CanonicalOrder.canonicalize(once);

        assertEquals(once, twice);
        assertEquals(attributeNames(once), attributeNames(twice));
    }

    @Test
    void canonicalize_keepsContentAndInputTreeUnchanged() {
        ToolNode input = sampleTool();
        ToolNode result = CanonicalOrder.canonicalize(input);

        assertTrue(result.sameContent(input));
        assertEquals("version", attributeNames(input).get(0));
        assertEquals("outputs", input.getChildren().get(0).getTag());
    }

    @Test
    void tagPriority_rejectsDuplicates() {
        assertThrows(IllegalArgumentException.class, () -> new TagPriority("x", List.of("a", "b", "a")));
    }

    @Test
    void sectionPriority_ranksFollowListPosition() {
        assertEquals(0, SectionPriority.TOOL.rank("description"));
        assertEquals(SectionPriority.SECTIONS.size() - 1, SectionPriority.TOOL.rank("citations"));
        assertTrue(SectionPriority.TOOL.rank("inputs") < SectionPriority.TOOL.rank("outputs"));
    }
}
