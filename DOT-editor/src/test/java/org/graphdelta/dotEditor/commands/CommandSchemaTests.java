package org.graphdelta.dotEditor.commands;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.graphdelta.dotEditor.errors.CommandException;
import org.graphdelta.util.Utilities;
import org.junit.Assert;
import org.junit.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

public class CommandSchemaTests {
    static final List<String> ACTIONS = List.of(
            DotCommand.CreateNode.ACTION, DotCommand.UpdateNode.ACTION, DotCommand.DeleteNode.ACTION,
            DotCommand.CreateEdge.ACTION, DotCommand.UpdateEdge.ACTION, DotCommand.DeleteEdge.ACTION,
            DotCommand.CreateSubgraph.ACTION, DotCommand.DeleteSubgraph.ACTION,
            DotCommand.SetGraphAttr.ACTION, DotCommand.SetNodeDefault.ACTION,
            DotCommand.SetEdgeDefault.ACTION, DotCommand.DeleteAttr.ACTION);

    @Test
    public void testEveryActionInSchema() {
        ObjectNode schema = CommandSchema.getSchema();
        Assert.assertEquals("http://json-schema.org/draft-07/schema#", schema.get("$schema").asText());
        Set<String> actions = new HashSet<>();
        for (JsonNode variant: schema.get("oneOf")) {
            Assert.assertEquals("object", variant.get("type").asText());
            Assert.assertTrue(variant.has("description"));
            JsonNode values = variant.get("properties").get("action").get("enum");
            Assert.assertEquals(1, values.size());
            Assert.assertTrue(values.get(0).asText(), actions.add(values.get(0).asText()));
        }
        Assert.assertEquals(new HashSet<>(ACTIONS), actions);
    }

    // The schema requires exactly what the decoder insists on.
    @Test
    public void testRequiredPropertiesMatchDecoder() {
        for (CommandSchema.Variant variant: CommandSchema.getVariants()) {
            ObjectNode schema = variant.toJson();
            JsonNode required = schema.get("required");
            ObjectNode command = Utilities.deterministicObjectMapper().createObjectNode();
            for (JsonNode name: required)
                command.put(name.asText(), name.asText().equals("action") ? variant.action() : "x");
            Assert.assertEquals(variant.action(), DotCommand.fromJson(command).getAction());

            for (JsonNode name: required) {
                if (name.asText().equals("action"))
                    continue;
                ObjectNode missing = command.deepCopy();
                missing.remove(name.asText());
                CommandException ex = Assert.assertThrows(CommandException.class,
                        () -> DotCommand.fromJson(missing));
                Assert.assertEquals(variant.action(), CommandException.ErrorCode.MISSING_PARAMETER, ex.code);
            }
        }
    }

    @Test
    public void testExamples() {
        Set<String> covered = new HashSet<>();
        for (CommandSchema.Example example: CommandSchema.getExamples()) {
            DotCommand command = example.command();
            Assert.assertEquals(example.description(), command, DotCommand.fromJson(command.toJson()));
            covered.add(command.getAction());
        }
        Assert.assertEquals(new HashSet<>(ACTIONS), covered);
    }

    @Test
    public void testMarkdown() {
        String examples = CommandSchema.examplesMarkdown();
        Assert.assertTrue(examples.startsWith("# DOT Command Examples\n"));
        Assert.assertTrue(examples.contains("## Create a nested subgraph\n\n```json\n"));

        String prompt = CommandSchema.llmPrompt();
        Assert.assertTrue(prompt.contains(CommandSchema.getSchema().toPrettyString()));
        for (String action: ACTIONS) {
            Assert.assertTrue(action, prompt.contains("- `" + action + "`: "));
            Assert.assertTrue(action, examples.contains("\"" + action + "\""));
        }
        Assert.assertTrue(prompt.contains("  - `id`: Node identifier (required)\n"));
        Assert.assertTrue(prompt.contains("  - `cascade`: Also remove the edges of the node (optional)\n"));
        Assert.assertTrue(prompt.endsWith("\n```\n"));
    }
}
