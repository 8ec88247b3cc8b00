package org.graphdelta.dotEditor.commands;

import org.graphdelta.dotEditor.Fixtures;
import org.graphdelta.dotEditor.backend.ToDot;
import org.graphdelta.dotEditor.chunks.Chunk;
import org.graphdelta.dotEditor.chunks.ChunkExtractor;
import org.graphdelta.dotEditor.chunks.ChunkKind;
import org.graphdelta.dotEditor.chunks.Chunks;
import org.graphdelta.dotEditor.chunks.LineRange;
import org.graphdelta.dotEditor.errors.CommandException;
import org.graphdelta.dotEditor.errors.CommandException.ErrorCode;
import org.graphdelta.dotEditor.errors.ParseError;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;
import java.util.Map;

public class CommandApplierTests {
    static List<Chunk> example() {
        return ChunkExtractor.parseToChunks(Fixtures.EXAMPLE);
    }

    static List<Chunk> kitchenSink() {
        return ChunkExtractor.parseToChunks(Fixtures.kitchenSink());
    }

    /** Apply a command which must fail, and check that the chunks are unchanged. */
    static void assertFails(List<Chunk> chunks, DotCommand command, ErrorCode code) {
        List<Chunk> before = Chunks.copy(chunks);
        CommandException ex = Assert.assertThrows(CommandException.class,
                () -> CommandApplier.apply(chunks, command));
        Assert.assertEquals(code, ex.code);
        Assert.assertEquals(before, chunks);
    }

    @Test
    public void testHtmlLabel() {
        List<Chunk> chunks = example();
        CommandApplier.apply(chunks, new DotCommand.CreateNode("HTMLNode",
                "shape=plaintext label=<<table><tr><td>HTML</td></tr></table>>"));
        String dot = ToDot.chunksToCompleteDot(chunks, "Example");
        Assert.assertTrue(dot, dot.contains(
                "    HTMLNode [shape=plaintext, label=<<table><tr><td>HTML</td></tr></table>>];\n"));
    }

    @Test
    public void testCreateNodeAfterLastNode() {
        List<Chunk> chunks = kitchenSink();
        CommandApplier.apply(chunks, new DotCommand.CreateNode("Extra", null));
        int end = Chunks.indexOf(chunks, ChunkKind.NODE, "End");
        Chunk extra = chunks.get(end + 1);
        Assert.assertTrue(extra.is(ChunkKind.NODE, "Extra"));
        Assert.assertEquals(new LineRange(10, 10), extra.getRange());
        Assert.assertTrue(extra.getAttrs().isEmpty());
    }

    @Test
    public void testCreateThenDelete() {
        List<Chunk> chunks = example();
        List<Chunk> before = Chunks.copy(chunks);
        CommandApplier.apply(chunks, new DotCommand.CreateNode("C", "label=\"Node C\""));
        Assert.assertEquals(4, chunks.size());
        CommandApplier.apply(chunks, new DotCommand.DeleteNode("C"));
        Assert.assertEquals(before, chunks);
    }

    @Test
    public void testCreateInsideParent() {
        List<Chunk> chunks = kitchenSink();
        CommandApplier.apply(chunks, new DotCommand.CreateNode(
                "Cache", "label=\"Redis cache\" shape=cylinder", "cluster_backend"));
        String dot = ToDot.chunksToCompleteDot(chunks, "KitchenSink");
        Assert.assertTrue(dot, dot.contains(
                "        API -> DB;\n" +
                "        Cache [label=\"Redis cache\", shape=cylinder];\n" +
                "    }\n"));
    }

    @Test
    public void testCreateInEmptySubgraph() {
        List<Chunk> chunks = example();
        CommandApplier.apply(chunks, new DotCommand.CreateSubgraph("cluster_x", null, "label=X"));
        Chunk subgraph = Chunks.find(chunks, ChunkKind.SUBGRAPH, "cluster_x");
        Assert.assertNotNull(subgraph);
        Assert.assertEquals(new LineRange(2, 12), subgraph.getRange());

        CommandApplier.apply(chunks, new DotCommand.CreateNode("C", null, "cluster_x"));
        CommandApplier.apply(chunks, new DotCommand.CreateEdge("C", "A", null, "cluster_x"));
        Assert.assertEquals("digraph G {\n" +
                "    A [label=\"Node A\"];\n" +
                "    B [label=\"Node B\"];\n" +
                "    A -> B [label=edge];\n" +
                "    subgraph cluster_x {\n" +
                "        graph [label=X];\n" +
                "        C;\n" +
                "        C -> A;\n" +
                "    }\n" +
                "}\n", ToDot.chunksToCompleteDot(chunks));

        CommandApplier.apply(chunks, new DotCommand.DeleteSubgraph("cluster_x"));
        Assert.assertEquals(example(), chunks);
    }

    @Test
    public void testSuccessiveInsertsKeepOrder() {
        List<Chunk> chunks = kitchenSink();
        CommandApplier.apply(chunks, new DotCommand.CreateNode("C1", null, "cluster_backend"));
        CommandApplier.apply(chunks, new DotCommand.CreateNode("C2", null, "cluster_backend"));
        CommandApplier.apply(chunks, new DotCommand.CreateEdge("C1", "C2", null, "cluster_backend"));
        int c1 = Chunks.indexOf(chunks, ChunkKind.NODE, "C1");
        Assert.assertTrue(chunks.get(c1 + 1).is(ChunkKind.NODE, "C2"));
        Assert.assertTrue(chunks.get(c1 + 2).isEdge("C1", "C2"));
        String dot = ToDot.chunksToCompleteDot(chunks, "KitchenSink");
        Assert.assertTrue(dot, dot.contains(
                "        API -> DB;\n" +
                "        C1;\n" +
                "        C2;\n" +
                "        C1 -> C2;\n" +
                "    }\n"));
    }

    @Test
    public void testParentWithoutPosition() {
        List<Chunk> chunks = example();
        chunks.add(Chunk.subgraph("cluster_grp", Map.of("label", "Group"), LineRange.SYNTHETIC));
        assertFails(chunks, new DotCommand.CreateNode("C", null, "cluster_grp"), ErrorCode.INVALID_COMMAND);
        assertFails(chunks, new DotCommand.CreateEdge("A", "C", null, "cluster_grp"), ErrorCode.INVALID_COMMAND);
        assertFails(chunks, new DotCommand.CreateSubgraph("cluster_in", "cluster_grp"), ErrorCode.INVALID_COMMAND);
        // Without a parent the node is still accepted
        CommandApplier.apply(chunks, new DotCommand.CreateNode("C", null));
        Assert.assertTrue(Chunks.isTopLevel(chunks, Chunks.find(chunks, ChunkKind.NODE, "C")));
    }

    @Test
    public void testNestedSubgraph() {
        List<Chunk> chunks = kitchenSink();
        CommandApplier.apply(chunks, new DotCommand.CreateSubgraph("cluster_inner", "cluster_backend"));
        int parent = Chunks.indexOf(chunks, ChunkKind.SUBGRAPH, "cluster_backend");
        Chunk inner = chunks.get(parent + 1);
        Assert.assertTrue(inner.is(ChunkKind.SUBGRAPH, "cluster_inner"));
        Assert.assertEquals(new LineRange(25, 28), inner.getRange());
        Assert.assertFalse(Chunks.isTopLevel(chunks, inner));
    }

    @Test
    public void testUpdateIsRightBiased() {
        List<Chunk> chunks = example();
        CommandApplier.apply(chunks, new DotCommand.CreateNode("X", "a=1 b=2"));
        CommandApplier.apply(chunks, new DotCommand.UpdateNode("X", "b=3 c=4"));
        Chunk x = Chunks.find(chunks, ChunkKind.NODE, "X");
        Assert.assertNotNull(x);
        Assert.assertEquals(List.of("a", "b", "c"), List.copyOf(x.getAttrs().keySet()));
        Assert.assertEquals(List.of("1", "3", "4"), List.copyOf(x.getAttrs().values()));
    }

    @Test
    public void testNodeErrors() {
        List<Chunk> chunks = example();
        assertFails(chunks, new DotCommand.CreateNode("A", null), ErrorCode.NODE_ALREADY_EXISTS);
        assertFails(chunks, new DotCommand.UpdateNode("Z", "color=red"), ErrorCode.NODE_NOT_FOUND);
        assertFails(chunks, new DotCommand.DeleteNode("Z"), ErrorCode.NODE_NOT_FOUND);
        assertFails(chunks, new DotCommand.CreateNode("Z", null, "cluster_none"),
                ErrorCode.PARENT_SUBGRAPH_NOT_FOUND);
        Assert.assertThrows(ParseError.class,
                () -> CommandApplier.apply(chunks, new DotCommand.CreateNode("Z", "label=")));
        Assert.assertNull(Chunks.find(chunks, ChunkKind.NODE, "Z"));
    }

    @Test
    public void testDeleteNodeCascade() {
        List<Chunk> chunks = example();
        CommandApplier.apply(chunks, new DotCommand.DeleteNode("A"));
        Assert.assertNotNull(Chunks.findEdge(chunks, "A", "B"));

        chunks = example();
        CommandApplier.apply(chunks, new DotCommand.DeleteNode("B", true));
        Assert.assertNull(Chunks.findEdge(chunks, "A", "B"));
        Assert.assertEquals(1, chunks.size());
    }

    @Test
    public void testEdges() {
        List<Chunk> chunks = example();
        CommandApplier.apply(chunks, new DotCommand.CreateEdge("B", "A", "color=red"));
        assertFails(chunks, new DotCommand.CreateEdge("B", "A", null), ErrorCode.EDGE_ALREADY_EXISTS);

        CommandApplier.apply(chunks, new DotCommand.UpdateEdge("A", "B", "color=blue"));
        Chunk ab = Chunks.findEdge(chunks, "A", "B");
        Assert.assertNotNull(ab);
        Assert.assertEquals("edge", ab.getAttrs().get("label"));
        Assert.assertEquals("blue", ab.getAttrs().get("color"));

        // Updating a missing edge creates it at the end
        CommandApplier.apply(chunks, new DotCommand.UpdateEdge("A", "C", "style=dotted"));
        Chunk last = chunks.get(chunks.size() - 1);
        Assert.assertTrue(last.isEdge("A", "C"));
        Assert.assertEquals("dotted", last.getAttrs().get("style"));

        CommandApplier.apply(chunks, new DotCommand.DeleteEdge("B", "A"));
        Assert.assertNull(Chunks.findEdge(chunks, "B", "A"));
        assertFails(chunks, new DotCommand.DeleteEdge("B", "A"), ErrorCode.EDGE_NOT_FOUND);
    }

    @Test
    public void testDeleteSubgraph() {
        List<Chunk> chunks = kitchenSink();
        CommandApplier.apply(chunks, new DotCommand.DeleteSubgraph("cluster_frontend"));
        Assert.assertEquals(16, chunks.size());
        for (String gone: new String[] { "UI", "Router", "Button", "Slider" })
            Assert.assertNull(Chunks.find(chunks, ChunkKind.NODE, gone));
        Assert.assertNull(Chunks.find(chunks, ChunkKind.SUBGRAPH, "cluster_widgets"));
        Assert.assertNotNull(Chunks.find(chunks, ChunkKind.SUBGRAPH, "cluster_backend"));
        Assert.assertNotNull(Chunks.find(chunks, ChunkKind.NODE, "Start"));
        // Edges outside the subgraph are kept even when they mention deleted nodes
        Assert.assertNotNull(Chunks.findEdge(chunks, "Start", "UI"));
        assertFails(chunks, new DotCommand.DeleteSubgraph("cluster_frontend"), ErrorCode.SUBGRAPH_NOT_FOUND);
    }

    @Test
    public void testSubgraphErrors() {
        List<Chunk> chunks = kitchenSink();
        assertFails(chunks, new DotCommand.CreateSubgraph("cluster_backend", null),
                ErrorCode.SUBGRAPH_ALREADY_EXISTS);
        assertFails(chunks, new DotCommand.CreateSubgraph("cluster_new", "cluster_none"),
                ErrorCode.PARENT_SUBGRAPH_NOT_FOUND);
    }

    @Test
    public void testGraphAttributes() {
        List<Chunk> chunks = kitchenSink();
        CommandApplier.apply(chunks, new DotCommand.SetGraphAttr("rankdir", "TB"));
        Assert.assertEquals("TB", chunks.get(0).getExtra());
        Assert.assertEquals(25, chunks.size());

        // The cluster labels are not top-level, so a new assignment is added
        CommandApplier.apply(chunks, new DotCommand.SetGraphAttr("label", "Top"));
        Assert.assertEquals(26, chunks.size());
        Assert.assertTrue(chunks.get(0).is(ChunkKind.ID_EQ, "label"));
        Assert.assertEquals(new LineRange(1, 1), chunks.get(0).getRange());

        CommandApplier.apply(chunks, new DotCommand.DeleteAttr("rankdir"));
        Assert.assertEquals(-1, Chunks.indexOf(chunks, ChunkKind.ID_EQ, "rankdir"));
        assertFails(chunks, new DotCommand.DeleteAttr("rankdir"), ErrorCode.ATTRIBUTE_NOT_FOUND);
    }

    @Test
    public void testDefaults() {
        List<Chunk> chunks = kitchenSink();
        CommandApplier.apply(chunks, new DotCommand.SetNodeDefault("color=red style=rounded"));
        Chunk node = Chunks.find(chunks, ChunkKind.ATTR_STMT, "node");
        Assert.assertNotNull(node);
        Assert.assertEquals("box", node.getAttrs().get("shape"));
        Assert.assertEquals("rounded", node.getAttrs().get("style"));
        Assert.assertEquals("red", node.getAttrs().get("color"));

        chunks = example();
        CommandApplier.apply(chunks, new DotCommand.SetEdgeDefault("arrowhead=none"));
        Assert.assertTrue(chunks.get(0).is(ChunkKind.ATTR_STMT, "edge"));
        Assert.assertTrue(ToDot.chunksToCompleteDot(chunks).startsWith("digraph G {\n    edge [arrowhead=none];\n"));
    }
}
