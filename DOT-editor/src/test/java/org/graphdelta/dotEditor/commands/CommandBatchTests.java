package org.graphdelta.dotEditor.commands;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.graphdelta.dotEditor.Fixtures;
import org.graphdelta.dotEditor.chunks.Chunk;
import org.graphdelta.dotEditor.chunks.ChunkExtractor;
import org.graphdelta.dotEditor.chunks.ChunkKind;
import org.graphdelta.dotEditor.chunks.Chunks;
import org.graphdelta.dotEditor.errors.CommandException;
import org.graphdelta.dotEditor.errors.EditorMessages;
import org.graphdelta.util.Utilities;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;

public class CommandBatchTests {
    static final ObjectMapper MAPPER = Utilities.deterministicObjectMapper();

    static List<DotCommand> commands() {
        return List.of(
                new DotCommand.CreateNode("C", "label=\"Node C\""),
                new DotCommand.CreateNode("A", null),
                new DotCommand.CreateEdge("C", "A", null));
    }

    @Test
    public void testApplyAllSkipsFailures() {
        List<Chunk> chunks = ChunkExtractor.parseToChunks(Fixtures.EXAMPLE);
        EditorMessages messages = new EditorMessages();
        int applied = new CommandBatch(messages).applyAll(chunks, commands());
        Assert.assertEquals(2, applied);
        Assert.assertEquals(1, messages.errorCount());
        Assert.assertEquals(1, messages.exitCode);
        Assert.assertEquals("Node already exists", messages.getMessage(0).errorType);
        Assert.assertNotNull(Chunks.find(chunks, ChunkKind.NODE, "C"));
        Assert.assertNotNull(Chunks.findEdge(chunks, "C", "A"));
    }

    @Test
    public void testApplyAtomically() {
        List<Chunk> chunks = ChunkExtractor.parseToChunks(Fixtures.EXAMPLE);
        List<Chunk> before = Chunks.copy(chunks);
        EditorMessages messages = new EditorMessages();
        CommandBatch batch = new CommandBatch(messages);
        Assert.assertEquals(0, batch.applyAtomically(chunks, commands()));
        Assert.assertEquals(before, chunks);
        Assert.assertTrue(messages.hasErrors());

        messages.clear();
        List<DotCommand> good = List.of(commands().get(0), commands().get(2));
        Assert.assertEquals(2, batch.applyAtomically(chunks, good));
        Assert.assertFalse(messages.hasErrors());
        Assert.assertEquals(5, chunks.size());
    }

    @Test
    public void testJson() throws Exception {
        String text = "[{\"action\":\"create_node\",\"id\":\"A\",\"attrs\":\"label=\\\"x\\\"\",\"parent\":\"cluster_a\"}," +
                "{\"action\":\"delete_node\",\"id\":\"B\",\"cascade\":true}," +
                "{\"action\":\"update_edge\",\"from\":\"A\",\"to\":\"B\"}," +
                "{\"action\":\"create_subgraph\"}," +
                "{\"action\":\"set_graph_attr\",\"key\":\"rankdir\",\"value\":\"LR\"}]";
        JsonNode json = MAPPER.readTree(text);
        List<DotCommand> commands = DotCommand.listFromJson(json);
        Assert.assertEquals(5, commands.size());

        DotCommand.CreateNode create = (DotCommand.CreateNode) commands.get(0);
        Assert.assertEquals("A", create.id);
        Assert.assertEquals("label=\"x\"", create.attrs);
        Assert.assertEquals("cluster_a", create.parent);
        Assert.assertTrue(((DotCommand.DeleteNode) commands.get(1)).cascade);
        Assert.assertNull(((DotCommand.UpdateEdge) commands.get(2)).attrs);
        Assert.assertNull(((DotCommand.CreateSubgraph) commands.get(3)).id);

        Assert.assertEquals(json, DotCommand.listToJson(commands));
        Assert.assertEquals(new DotCommand.SetGraphAttr("rankdir", "LR"), commands.get(4));
    }

    @Test
    public void testSingleObject() throws Exception {
        List<DotCommand> commands = DotCommand.listFromJson(
                MAPPER.readTree("{\"action\":\"delete_attr\",\"key\":\"rankdir\"}"));
        Assert.assertEquals(List.of(new DotCommand.DeleteAttr("rankdir")), commands);
        Assert.assertEquals("{\"action\":\"delete_node\",\"id\":\"A\"}",
                new DotCommand.DeleteNode("A").toJson().toString());
    }

    @Test
    public void testJsonErrors() throws Exception {
        CommandException ex = Assert.assertThrows(CommandException.class,
                () -> DotCommand.fromJson(MAPPER.readTree("{\"action\":\"rename_node\",\"id\":\"A\"}")));
        Assert.assertEquals(CommandException.ErrorCode.INVALID_COMMAND, ex.code);
        ex = Assert.assertThrows(CommandException.class,
                () -> DotCommand.fromJson(MAPPER.readTree("{\"action\":\"create_edge\",\"from\":\"A\"}")));
        Assert.assertEquals(CommandException.ErrorCode.MISSING_PARAMETER, ex.code);
        ex = Assert.assertThrows(CommandException.class,
                () -> DotCommand.fromJson(MAPPER.readTree("\"create_node\"")));
        Assert.assertEquals(CommandException.ErrorCode.INVALID_COMMAND, ex.code);
    }

    @Test
    public void testFixture() throws Exception {
        List<Chunk> chunks = ChunkExtractor.parseToChunks(Fixtures.kitchenSink());
        List<DotCommand> commands = DotCommand.listFromJson(MAPPER.readTree(Fixtures.read("commands.json")));
        EditorMessages messages = new EditorMessages();
        Assert.assertEquals(commands.size(), new CommandBatch(messages).applyAtomically(chunks, commands));
        Assert.assertTrue(messages.isEmpty());
        Chunk db = Chunks.find(chunks, ChunkKind.NODE, "DB");
        Assert.assertNotNull(db);
        Assert.assertEquals("red", db.getAttrs().get("color"));
        Assert.assertNotNull(Chunks.findEdge(chunks, "API", "Cache"));
        Assert.assertNull(Chunks.findEdge(chunks, "Button", "End"));
        Chunk splines = Chunks.find(chunks, ChunkKind.ID_EQ, "splines");
        Assert.assertNotNull(splines);
        Assert.assertEquals("ortho", splines.getExtra());
    }
}
