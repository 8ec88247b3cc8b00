package org.graphdelta.dotEditor.commands;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.graphdelta.util.JsonSchema;
import org.graphdelta.util.Utilities;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Describes the JSON form of {@link DotCommand} to a language model:
 * a JSON schema with one alternative per action, worked examples,
 * and a prompt combining both.
 */
public final class CommandSchema {
    private CommandSchema() {}

    static final String ATTRS = "Graphviz attributes such as label=\"...\" shape=box color=red";

    /** One alternative of the schema. */
    public record Variant(String action, String description, JsonSchema parameters) {
        ObjectNode toJson() {
            ObjectNode result = this.parameters.build();
            result.put("description", this.description);
            return result;
        }
    }

    /** A command together with what it does. */
    public record Example(String description, DotCommand command) {}

    static JsonSchema action(ObjectMapper mapper, String action) {
        return new JsonSchema(mapper)
                .property("action", "string", "The command", true, action);
    }

    /** The alternatives, in the order of the prompt.  Required properties
     * are the ones {@link DotCommand#fromJson} insists on. */
    public static List<Variant> getVariants() {
        ObjectMapper mapper = Utilities.deterministicObjectMapper();
        List<Variant> result = new ArrayList<>();
        result.add(new Variant(DotCommand.CreateNode.ACTION,
                "Create a new node with optional attributes and parent subgraph",
                action(mapper, DotCommand.CreateNode.ACTION)
                        .required("id", "Node identifier")
                        .optional("attrs", ATTRS)
                        .optional("parent", "Parent subgraph to nest this node inside")));
        result.add(new Variant(DotCommand.UpdateNode.ACTION,
                "Merge attributes into an existing node",
                action(mapper, DotCommand.UpdateNode.ACTION)
                        .required("id", "Node identifier")
                        .optional("attrs", "New " + ATTRS)));
        result.add(new Variant(DotCommand.DeleteNode.ACTION,
                "Remove a node from the graph",
                action(mapper, DotCommand.DeleteNode.ACTION)
                        .required("id", "Node identifier")
                        .property("cascade", "boolean", "Also remove the edges of the node", false)));
        result.add(new Variant(DotCommand.CreateEdge.ACTION,
                "Create an edge between two nodes with optional attributes and parent subgraph",
                action(mapper, DotCommand.CreateEdge.ACTION)
                        .required("from", "Source node id, can include a port like NodeA:p1")
                        .required("to", "Target node id, can include a port like NodeB:p2")
                        .optional("attrs", ATTRS)
                        .optional("parent", "Parent subgraph to nest this edge inside")));
        result.add(new Variant(DotCommand.UpdateEdge.ACTION,
                "Merge attributes into an edge, creating the edge if it does not exist",
                action(mapper, DotCommand.UpdateEdge.ACTION)
                        .required("from", "Source node id")
                        .required("to", "Target node id")
                        .optional("attrs", "New " + ATTRS)));
        result.add(new Variant(DotCommand.DeleteEdge.ACTION,
                "Remove an edge from the graph",
                action(mapper, DotCommand.DeleteEdge.ACTION)
                        .required("from", "Source node id")
                        .required("to", "Target node id")));
        result.add(new Variant(DotCommand.CreateSubgraph.ACTION,
                "Create a new subgraph or cluster, optionally nested in another one",
                action(mapper, DotCommand.CreateSubgraph.ACTION)
                        .optional("id", "Subgraph identifier; use the cluster_ prefix for visible clusters")
                        .optional("parent", "Parent subgraph for nesting")
                        .optional("attrs", ATTRS)));
        result.add(new Variant(DotCommand.DeleteSubgraph.ACTION,
                "Remove a subgraph and all its contents",
                action(mapper, DotCommand.DeleteSubgraph.ACTION)
                        .required("id", "Subgraph identifier")));
        result.add(new Variant(DotCommand.SetGraphAttr.ACTION,
                "Set a graph-level attribute such as rankdir or bgcolor",
                action(mapper, DotCommand.SetGraphAttr.ACTION)
                        .required("key", "Attribute name")
                        .required("value", "Attribute value")));
        result.add(new Variant(DotCommand.SetNodeDefault.ACTION,
                "Set default attributes for all nodes",
                action(mapper, DotCommand.SetNodeDefault.ACTION)
                        .required("attrs", "Default " + ATTRS)));
        result.add(new Variant(DotCommand.SetEdgeDefault.ACTION,
                "Set default attributes for all edges",
                action(mapper, DotCommand.SetEdgeDefault.ACTION)
                        .required("attrs", "Default " + ATTRS)));
        result.add(new Variant(DotCommand.DeleteAttr.ACTION,
                "Remove a graph-level attribute",
                action(mapper, DotCommand.DeleteAttr.ACTION)
                        .required("key", "Attribute name")));
        return result;
    }

    /** JSON schema accepted by {@link DotCommand#fromJson}. */
    public static ObjectNode getSchema() {
        ObjectNode result = Utilities.deterministicObjectMapper().createObjectNode();
        result.put("$schema", "http://json-schema.org/draft-07/schema#");
        result.put("title", "DotCommand");
        result.put("description", "An edit to a DOT graph");
        ArrayNode oneOf = result.putArray("oneOf");
        for (Variant variant: getVariants())
            oneOf.add(variant.toJson());
        return result;
    }

    public static List<Example> getExamples() {
        List<Example> result = new ArrayList<>();
        result.add(new Example("Create a node",
                new DotCommand.CreateNode("NodeA", "label=\"My Node\" shape=box fillcolor=\"#ccffcc\"")));
        result.add(new Example("Create a node inside a subgraph",
                new DotCommand.CreateNode("NodeB", "label=\"Inside Cluster\"", "cluster_Main")));
        result.add(new Example("Update a node's attributes",
                new DotCommand.UpdateNode("NodeA", "label=\"Updated\" color=red")));
        result.add(new Example("Delete a node",
                new DotCommand.DeleteNode("NodeA")));
        result.add(new Example("Delete a node with its edges",
                new DotCommand.DeleteNode("NodeA", true)));
        result.add(new Example("Create an edge",
                new DotCommand.CreateEdge("NodeA", "NodeB", "label=\"connects\" color=blue")));
        result.add(new Example("Create an edge with port",
                new DotCommand.CreateEdge("NodeA:p1", "NodeB:p2", "label=\"port connection\"")));
        result.add(new Example("Create an edge inside a subgraph",
                new DotCommand.CreateEdge("NodeA", "NodeB", "label=\"internal\"", "cluster_Main")));
        result.add(new Example("Update an edge",
                new DotCommand.UpdateEdge("NodeA", "NodeB", "label=\"modified\" style=dashed")));
        result.add(new Example("Delete an edge",
                new DotCommand.DeleteEdge("NodeA", "NodeB")));
        result.add(new Example("Create a subgraph/cluster",
                new DotCommand.CreateSubgraph("cluster_Main", null, "label=\"Main\"")));
        result.add(new Example("Create a nested subgraph",
                new DotCommand.CreateSubgraph("cluster_Inner", "cluster_Main")));
        result.add(new Example("Create anonymous subgraph",
                new DotCommand.CreateSubgraph(null, null)));
        result.add(new Example("Delete a subgraph",
                new DotCommand.DeleteSubgraph("cluster_Main")));
        result.add(new Example("Set graph-level attribute",
                new DotCommand.SetGraphAttr("rankdir", "LR")));
        result.add(new Example("Set default node attributes",
                new DotCommand.SetNodeDefault("shape=box style=filled fillcolor=\"#e8f4ff\"")));
        result.add(new Example("Set default edge attributes",
                new DotCommand.SetEdgeDefault("color=\"#666666\" arrowsize=0.9")));
        result.add(new Example("Delete a graph attribute",
                new DotCommand.DeleteAttr("rankdir")));
        return result;
    }

    static void appendExample(StringBuilder builder, String heading, Example example) {
        builder.append(heading).append(" ").append(example.description()).append("\n\n")
                .append("```json\n")
                .append(example.command().toJson().toPrettyString())
                .append("\n```\n\n");
    }

    /** The examples as a Markdown page. */
    public static String examplesMarkdown() {
        StringBuilder builder = new StringBuilder();
        builder.append("# DOT Command Examples\n\n")
                .append("These are valid JSON commands for modifying DOT graphs.\n\n");
        for (Example example: getExamples())
            appendExample(builder, "##", example);
        return builder.toString();
    }

    static boolean isRequired(ArrayNode required, String name) {
        for (JsonNode r: required) {
            if (r.asText().equals(name))
                return true;
        }
        return false;
    }

    /** Instructions for a language model which answers with JSON commands. */
    public static String llmPrompt() {
        StringBuilder builder = new StringBuilder();
        builder.append("# DOT Graph Manipulation Commands\n\n")
                .append("You are helping users modify DOT graph files. ")
                .append("Generate JSON commands that follow this schema:\n\n")
                .append("```json\n")
                .append(getSchema().toPrettyString())
                .append("\n```\n\n")
                .append("## Available Commands\n\n");
        for (Variant variant: getVariants()) {
            ObjectNode schema = variant.parameters().build();
            builder.append("- `").append(variant.action()).append("`: ")
                    .append(variant.description()).append("\n");
            ObjectNode properties = (ObjectNode) schema.get("properties");
            ArrayNode required = (ArrayNode) schema.get("required");
            Iterator<String> names = properties.fieldNames();
            while (names.hasNext()) {
                String name = names.next();
                if (name.equals("action"))
                    continue;
                builder.append("  - `").append(name).append("`: ")
                        .append(properties.get(name).get("description").asText())
                        .append(isRequired(required, name) ? " (required)" : " (optional)")
                        .append("\n");
            }
        }
        builder.append("\n## Command Examples\n\n");
        for (Example example: getExamples())
            appendExample(builder, "###", example);
        builder.append("## Important Notes\n\n")
                .append("1. **Parent subgraphs**: Use the `parent` field to nest nodes and edges inside subgraphs\n")
                .append("2. **Cluster names**: Subgraph ids starting with `cluster_` are rendered as visible clusters\n")
                .append("3. **Ports**: Node ids can include ports like `NodeA:p1` for record-based nodes\n")
                .append("4. **HTML labels**: Attributes can include HTML-like labels using angle brackets: `label=<...>`\n")
                .append("5. **Multiple commands**: Return a JSON array of commands for complex operations\n\n")
                .append("## Usage Pattern\n\n")
                .append("When a user asks to modify a graph, respond with a JSON array of commands:\n\n")
                .append("```json\n")
                .append(DotCommand.listToJson(List.of(
                        new DotCommand.CreateNode("A", "label=\"Node A\""),
                        new DotCommand.CreateNode("B", "label=\"Node B\""),
                        new DotCommand.CreateEdge("A", "B", "label=\"connects\""))).toPrettyString())
                .append("\n```\n");
        return builder.toString();
    }
}
