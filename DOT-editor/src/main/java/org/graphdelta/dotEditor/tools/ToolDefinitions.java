package org.graphdelta.dotEditor.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import org.graphdelta.util.JsonSchema;
import org.graphdelta.util.Utilities;

import java.util.ArrayList;
import java.util.List;

/** The tools offered to a language model which edits a graph, and the prompt describing them. */
public final class ToolDefinitions {
    private ToolDefinitions() {}

    public static final String SYSTEM_PROMPT =
            "You are a graph modification assistant. Users will ask you to modify DOT graphs.\n" +
            "\n" +
            "You have access to tools to query and modify the graph. Use these tools to:\n" +
            "1. Query current graph state (get_node, list_nodes, get_edges, find_nodes)\n" +
            "2. Create new elements (create_node, create_edge, create_cluster)\n" +
            "3. Update existing elements (update_node, update_edge, set_graph_attr)\n" +
            "4. Delete elements (delete_node, delete_edge, delete_cluster)\n" +
            "\n" +
            "When the user asks to modify a graph:\n" +
            "1. First query relevant information if needed\n" +
            "2. Then make the requested modifications\n" +
            "3. Be concise - don't query information you don't need\n" +
            "\n" +
            "Call a tool by answering with a JSON object: {\"name\": TOOL, \"parameters\": {...}}\n" +
            "\n" +
            "Example workflow for \"add a node called Server connected to DB\":\n" +
            "1. Call create_node with id=\"Server\", label=\"Server\"\n" +
            "2. Call create_edge with from=\"Server\", to=\"DB\"\n" +
            "\n" +
            "Example workflow for \"change node A to be red\":\n" +
            "1. Call update_node with id=\"A\", color=\"red\"\n" +
            "\n" +
            "Keep responses brief. Focus on the tools, not explanations.";

    public static List<ToolDefinition> getToolDefinitions() {
        ObjectMapper mapper = Utilities.deterministicObjectMapper();
        List<ToolDefinition> result = new ArrayList<>();
        result.add(new ToolDefinition("get_node", "Get details about a specific node in the graph",
                new JsonSchema(mapper)
                        .required("id", "The node ID to query")
                        .build(), true));
        result.add(new ToolDefinition("list_nodes", "List all nodes in the graph or within a specific subgraph",
                new JsonSchema(mapper)
                        .optional("parent", "Optional: parent subgraph to filter by")
                        .build(), true));
        result.add(new ToolDefinition("get_edges", "Get all edges connected to a node",
                new JsonSchema(mapper)
                        .required("node_id", "Node ID to get edges for")
                        .build(), true));
        result.add(new ToolDefinition("find_nodes", "Check which of the given node IDs exist in the graph",
                new JsonSchema(mapper)
                        .property("ids", "array", "Node IDs to look up", true)
                        .build(), true));
        result.add(new ToolDefinition("create_node", "Create a new node in the graph",
                new JsonSchema(mapper)
                        .required("id", "Unique identifier for the node")
                        .required("label", "Display label for the node")
                        .property("shape", "string", "Node shape (box, circle, ellipse, etc)", false,
                                "box", "circle", "ellipse", "diamond", "cylinder")
                        .optional("color", "Node color (hex or name)")
                        .optional("parent", "Parent subgraph to place node in")
                        .build(), false));
        result.add(new ToolDefinition("update_node", "Update an existing node's properties",
                new JsonSchema(mapper)
                        .required("id", "Node ID to update")
                        .optional("label", "New display label")
                        .optional("shape", "New node shape")
                        .optional("color", "New node color")
                        .build(), false));
        result.add(new ToolDefinition("delete_node", "Remove a node from the graph",
                new JsonSchema(mapper)
                        .required("id", "Node ID to delete")
                        .build(), false));
        result.add(new ToolDefinition("create_edge", "Create an edge between two nodes",
                new JsonSchema(mapper)
                        .required("from", "Source node ID")
                        .required("to", "Target node ID")
                        .optional("label", "Edge label")
                        .optional("color", "Edge color")
                        .optional("parent", "Parent subgraph to place the edge in")
                        .build(), false));
        result.add(new ToolDefinition("update_edge", "Change the label or color of an edge, creating it if needed",
                new JsonSchema(mapper)
                        .required("from", "Source node ID")
                        .required("to", "Target node ID")
                        .optional("label", "New edge label")
                        .optional("color", "New edge color")
                        .build(), false));
        result.add(new ToolDefinition("delete_edge", "Remove an edge between two nodes",
                new JsonSchema(mapper)
                        .required("from", "Source node ID")
                        .required("to", "Target node ID")
                        .build(), false));
        result.add(new ToolDefinition("create_cluster", "Create a new cluster/subgraph to group nodes",
                new JsonSchema(mapper)
                        .required("id", "Cluster identifier (use cluster_ prefix)")
                        .required("label", "Cluster display label")
                        .optional("parent", "Parent subgraph to nest the cluster in")
                        .build(), false));
        result.add(new ToolDefinition("delete_cluster", "Remove a cluster together with its contents",
                new JsonSchema(mapper)
                        .required("id", "Cluster identifier")
                        .build(), false));
        result.add(new ToolDefinition("set_graph_attr", "Set a graph-level attribute such as rankdir",
                new JsonSchema(mapper)
                        .required("key", "Attribute name")
                        .required("value", "Attribute value")
                        .build(), false));
        return result;
    }

    public static ArrayNode toJson(List<ToolDefinition> definitions) {
        ArrayNode result = Utilities.deterministicObjectMapper().createArrayNode();
        for (ToolDefinition definition: definitions)
            result.add(definition.toJson());
        return result;
    }

    /** True if the tool only reads the graph. */
    public static boolean isQueryTool(String name) {
        for (ToolDefinition definition: getToolDefinitions()) {
            if (definition.name().equals(name))
                return definition.query();
        }
        return false;
    }
}
