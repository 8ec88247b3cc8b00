package org.graphdelta.dotEditor;

import com.fasterxml.jackson.databind.JsonNode;
import org.graphdelta.dotEditor.backend.ToDot;
import org.graphdelta.dotEditor.commands.CommandApplier;
import org.graphdelta.dotEditor.errors.EditorMessages;
import org.graphdelta.dotEditor.errors.ParseError;
import org.graphdelta.util.Logger;
import org.graphdelta.util.Utilities;
import org.junit.Assert;
import org.junit.Test;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

public class EditorMainTests {
    static File createFile(String contents, String extension) throws IOException {
        File file = File.createTempFile("editor", extension);
        file.deleteOnExit();
        Files.writeString(file.toPath(), contents, StandardCharsets.UTF_8);
        return file;
    }

    static File outputFile() throws IOException {
        return createFile("", ".out");
    }

    static String read(File file) throws IOException {
        return Utilities.readFile(file.toPath());
    }

    @Test
    public void testRewrite() throws IOException {
        File input = createFile(Fixtures.EXAMPLE, ".dot");
        File output = outputFile();
        EditorMessages messages = EditorMain.execute("-o", output.getPath(), input.getPath());
        Assert.assertEquals(0, messages.exitCode);
        Assert.assertEquals("digraph Example {\n" +
                "    A [label=\"Node A\"];\n" +
                "    B [label=\"Node B\"];\n" +
                "    A -> B [label=edge];\n" +
                "}\n", read(output));
    }

    @Test
    public void testGraphName() throws IOException {
        File input = createFile("digraph { a }", ".dot");
        File output = outputFile();
        EditorMain.execute("-o", output.getPath(), input.getPath());
        Assert.assertTrue(read(output).startsWith("digraph G {\n"));
        EditorMain.execute("--name", "Renamed", "-o", output.getPath(), input.getPath());
        Assert.assertTrue(read(output).startsWith("digraph Renamed {\n"));
    }

    @Test
    public void testCommands() throws IOException {
        File input = createFile(Fixtures.kitchenSink(), ".dot");
        File commands = createFile(Fixtures.read("commands.json"), ".json");
        File output = outputFile();
        EditorMessages messages = EditorMain.execute("--atomic", "--commands", commands.getPath(),
                "-o", output.getPath(), input.getPath());
        Assert.assertEquals(0, messages.exitCode);
        String dot = read(output);
        Assert.assertTrue(dot, dot.contains("        Cache [label=\"Redis cache\", shape=cylinder];\n"));
        Assert.assertTrue(dot, dot.contains("    splines = ortho;\n"));
        Assert.assertTrue(dot, dot.contains("    API -> Cache;\n"));
        Assert.assertFalse(dot, dot.contains("Button -> End"));
    }

    @Test
    public void testFailingCommands() throws IOException {
        File input = createFile(Fixtures.EXAMPLE, ".dot");
        File commands = createFile("[{\"action\": \"create_node\", \"id\": \"C\"}," +
                "{\"action\": \"create_node\", \"id\": \"A\"}]", ".json");
        File output = outputFile();

        EditorMessages messages = EditorMain.execute("--commands", commands.getPath(),
                "-o", output.getPath(), input.getPath());
        Assert.assertEquals(1, messages.exitCode);
        Assert.assertEquals(1, messages.errorCount());
        Assert.assertTrue(read(output).contains("    C;\n"));

        messages = EditorMain.execute("--atomic", "--commands", commands.getPath(),
                "-o", output.getPath(), input.getPath());
        Assert.assertEquals(1, messages.exitCode);
        Assert.assertFalse(read(output).contains("    C;\n"));
    }

    @Test
    public void testMalformedCommands() throws IOException {
        File input = createFile(Fixtures.EXAMPLE, ".dot");
        File commands = createFile("[{\"action\": ", ".json");
        EditorMessages messages = EditorMain.execute("--commands", commands.getPath(), input.getPath());
        Assert.assertEquals(1, messages.exitCode);
        Assert.assertEquals("Malformed JSON", messages.getMessage(0).errorType);
    }

    @Test
    public void testDsl() throws IOException {
        File input = createFile(Fixtures.kitchenSink(), ".dot");
        File script = createFile(Fixtures.read("edits.dsl"), ".dsl");
        File output = outputFile();
        EditorMessages messages = EditorMain.execute("--dsl", script.getPath(),
                "-o", output.getPath(), input.getPath());
        Assert.assertEquals(0, messages.exitCode);
        String dot = read(output);
        Assert.assertTrue(dot, dot.contains("        Gateway [color=blue];\n"));
        Assert.assertTrue(dot, dot.contains("    { rank=same; \"API\"; \"Cache\"; }\n"));
    }

    @Test
    public void testDslErrors() throws IOException {
        File input = createFile(Fixtures.EXAMPLE, ".dot");
        File script = createFile("node: C\nnode D\n", ".dsl");
        EditorMessages messages = EditorMain.execute("--dsl", script.getPath(), input.getPath());
        Assert.assertEquals(1, messages.exitCode);
        Assert.assertEquals(ParseError.KIND, messages.getMessage(0).errorType);
        String text = messages.toString();
        Assert.assertTrue(text, text.startsWith(script.getPath() + ":2:6: error: Parse error"));
        Assert.assertTrue(text, text.contains("node D"));
    }

    @Test
    public void testQueryTool() throws IOException {
        File input = createFile(Fixtures.kitchenSink(), ".dot");
        File call = createFile("{\"name\": \"find_nodes\", \"parameters\": {\"ids\": [\"UI\", \"Nope\"]}}", ".json");
        File output = outputFile();
        EditorMessages messages = EditorMain.execute("--tool", call.getPath(), "-o", output.getPath(), input.getPath());
        Assert.assertEquals(0, messages.exitCode);
        JsonNode answer = Utilities.deterministicObjectMapper().readTree(read(output));
        Assert.assertEquals("UI", answer.get("found").get(0).asText());
        Assert.assertEquals("Nope", answer.get("missing").get(0).asText());
    }

    @Test
    public void testEditingTool() throws IOException {
        File input = createFile(Fixtures.EXAMPLE, ".dot");
        File call = createFile("```json\n{\"name\": \"update_node\", \"parameters\": {\"id\": \"A\", \"color\": \"red\"}}\n```",
                ".json");
        File output = outputFile();
        EditorMessages messages = EditorMain.execute("--tool", call.getPath(), "-o", output.getPath(), input.getPath());
        Assert.assertEquals(0, messages.exitCode);
        Assert.assertTrue(read(output).contains("    A [label=\"Node A\", color=red];\n"));

        call = createFile("{\"name\": \"explode\", \"parameters\": {}}", ".json");
        messages = EditorMain.execute("--tool", call.getPath(), "-o", output.getPath(), input.getPath());
        Assert.assertEquals(1, messages.exitCode);
        Assert.assertEquals("Unknown tool", messages.getMessage(0).errorType);
    }

    @Test
    public void testChunks() throws IOException {
        File input = createFile(Fixtures.EXAMPLE, ".dot");
        File output = outputFile();
        EditorMain.execute("--chunks", "-o", output.getPath(), input.getPath());
        JsonNode chunks = Utilities.deterministicObjectMapper().readTree(read(output));
        Assert.assertEquals(3, chunks.size());
        Assert.assertEquals("edge", chunks.get(2).get("kind").asText());
        Assert.assertEquals("B", chunks.get(2).get("extra").asText());
    }

    @Test
    public void testToolsAndPrompt() throws IOException {
        File output = outputFile();
        EditorMessages messages = EditorMain.execute("--tools", "-o", output.getPath());
        Assert.assertEquals(0, messages.exitCode);
        JsonNode tools = Utilities.deterministicObjectMapper().readTree(read(output));
        Assert.assertEquals(13, tools.size());
        EditorMain.execute("--prompt", "-o", output.getPath());
        Assert.assertTrue(read(output).startsWith("You are a graph modification assistant."));
    }

    @Test
    public void testCommandSchema() throws IOException {
        File output = outputFile();
        EditorMessages messages = EditorMain.execute("--schema", "-o", output.getPath());
        Assert.assertEquals(0, messages.exitCode);
        JsonNode schema = Utilities.deterministicObjectMapper().readTree(read(output));
        Assert.assertEquals("DotCommand", schema.get("title").asText());
        Assert.assertEquals(12, schema.get("oneOf").size());
        EditorMain.execute("--command-examples", "-o", output.getPath());
        Assert.assertTrue(read(output).startsWith("# DOT Command Examples"));
        EditorMain.execute("--command-prompt", "-o", output.getPath());
        Assert.assertTrue(read(output).startsWith("# DOT Graph Manipulation Commands"));
    }

    @Test
    public void testInputErrors() throws IOException {
        File input = createFile("digraph G {\n  a -> ;\n}\n", ".dot");
        EditorMessages messages = EditorMain.execute(input.getPath());
        Assert.assertEquals(1, messages.exitCode);
        EditorMessages.Message message = messages.getMessage(0);
        Assert.assertEquals(ParseError.KIND, message.errorType);
        Assert.assertEquals(2, message.range.start.line);

        messages = EditorMain.execute("/nonexistent/graph.dot");
        Assert.assertEquals(1, messages.exitCode);
        Assert.assertEquals("Error reading file", messages.getMessage(0).errorType);

        messages = EditorMain.execute("--je", input.getPath());
        JsonNode json = Utilities.deterministicObjectMapper().readTree(messages.toString());
        Assert.assertEquals(2, json.get(0).get("start_line_number").asInt());
    }

    @Test
    public void testUndirectedInputWarning() throws IOException {
        File input = createFile("strict graph G {\n  a -- b\n}\n", ".dot");
        File output = outputFile();
        EditorMessages messages = EditorMain.execute("-o", output.getPath(), input.getPath());
        Assert.assertEquals(0, messages.exitCode);
        Assert.assertEquals(1, messages.warningCount());
        Assert.assertEquals(DotDocument.CONVERTED, messages.getMessage(0).errorType);
        Assert.assertTrue(messages.toString().contains("warning: " + DotDocument.CONVERTED));
        Assert.assertEquals("digraph G {\n    a -> b;\n}\n", read(output));

        messages = EditorMain.execute("-q", "-o", output.getPath(), input.getPath());
        Assert.assertEquals(1, messages.warningCount());
        Assert.assertEquals("", messages.toString());
    }

    @Test
    public void testBadOptions() {
        Assert.assertEquals(1, EditorMain.execute("--no-such-option").exitCode);
        Assert.assertEquals(1, EditorMain.execute("-TToDot=high").exitCode);
        Assert.assertEquals(1, EditorMain.execute("-TNoSuchClass=1").exitCode);
    }

    // Test the -T command-line parameter
    @Test
    public void testLogging() throws IOException {
        StringBuilder builder = new StringBuilder();
        Appendable save = Logger.INSTANCE.setDebugStream(builder);
        File input = createFile(Fixtures.kitchenSink(), ".dot");
        File commands = createFile("{\"action\": \"delete_node\", \"id\": \"End\"}", ".json");
        try {
            EditorMain.execute("-TToDot=2", "-TCommandApplier=1", "--commands", commands.getPath(),
                    "-o", outputFile().getPath(), input.getPath());
        } finally {
            Logger.INSTANCE.setDebugStream(save);
            Logger.INSTANCE.setLoggingLevel(ToDot.class, 0);
            Logger.INSTANCE.setLoggingLevel(CommandApplier.class, 0);
        }
        String log = builder.toString();
        Assert.assertTrue(log, log.contains("Closing subgraph cluster_widgets (17,21)"));
        Assert.assertTrue(log, log.contains("Applying {\"action\":\"delete_node\",\"id\":\"End\"}"));
    }
}
