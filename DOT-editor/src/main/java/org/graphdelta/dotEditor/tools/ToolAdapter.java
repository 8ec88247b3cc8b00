/*
 * Copyright 2022 VMware, Inc.
 * SPDX-License-Identifier: MIT
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package org.graphdelta.dotEditor.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.graphdelta.dotEditor.backend.DotFormat;
import org.graphdelta.dotEditor.chunks.Chunk;
import org.graphdelta.dotEditor.chunks.ChunkKind;
import org.graphdelta.dotEditor.chunks.Chunks;
import org.graphdelta.dotEditor.commands.DotCommand;
import org.graphdelta.dotEditor.errors.CommandException;
import org.graphdelta.dotEditor.errors.CommandException.ErrorCode;
import org.graphdelta.util.IWritesLogs;
import org.graphdelta.util.Logger;
import org.graphdelta.util.Utilities;

import javax.annotation.Nullable;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Connects tool calls made by a language model to the editor.
 * Editing tools are translated into {@link DotCommand}s; query tools are answered
 * directly from a chunk list, which they never modify.
 */
public class ToolAdapter implements IWritesLogs {
    static final ToolAdapter INSTANCE = new ToolAdapter();

    private ToolAdapter() {}

    /** Collect the named optional string parameters into an attribute map. */
    static Map<String, String> collect(JsonNode params, String... names) {
        Map<String, String> result = new LinkedHashMap<>();
        for (String name: names) {
            String value = Utilities.getOptionalStringProperty(params, name);
            if (value != null)
                result.put(name, value);
        }
        return result;
    }

    @Nullable
    static String attributes(Map<String, String> attrs) {
        if (attrs.isEmpty())
            return null;
        return DotFormat.formatAttributes(attrs);
    }

    /** Translate an editing tool call into a command.
     * @throws CommandException UNKNOWN_TOOL for names which are not editing tools,
     *                          MISSING_PARAMETER if a required parameter is absent. */
    public static DotCommand toolCallToCommand(String name, JsonNode params) {
        Logger.INSTANCE.belowLevel(INSTANCE, 1)
                .append("Tool call ")
                .append(name)
                .append(" ")
                .appendSupplier(params::toString)
                .newline();
        return switch (name) {
            case "create_node" -> new DotCommand.CreateNode(
                    Utilities.getStringProperty(params, "id"),
                    attributes(collect(params, "label", "shape", "color")),
                    Utilities.getOptionalStringProperty(params, "parent"));
            case "update_node" -> {
                String id = Utilities.getStringProperty(params, "id");
                Map<String, String> attrs = collect(params, "label", "shape", "color");
                if (attrs.isEmpty())
                    throw new CommandException(ErrorCode.MISSING_PARAMETER,
                            "update_node needs at least one of 'label', 'shape', 'color'");
                yield new DotCommand.UpdateNode(id, attributes(attrs));
            }
            case "delete_node" -> new DotCommand.DeleteNode(Utilities.getStringProperty(params, "id"));
            case "create_edge" -> new DotCommand.CreateEdge(
                    Utilities.getStringProperty(params, "from"),
                    Utilities.getStringProperty(params, "to"),
                    attributes(collect(params, "label", "color")),
                    Utilities.getOptionalStringProperty(params, "parent"));
            case "update_edge" -> new DotCommand.UpdateEdge(
                    Utilities.getStringProperty(params, "from"),
                    Utilities.getStringProperty(params, "to"),
                    attributes(collect(params, "label", "color")));
            case "delete_edge" -> new DotCommand.DeleteEdge(
                    Utilities.getStringProperty(params, "from"),
                    Utilities.getStringProperty(params, "to"));
            case "create_cluster" -> new DotCommand.CreateSubgraph(
                    Utilities.getStringProperty(params, "id"),
                    Utilities.getOptionalStringProperty(params, "parent"),
                    attributes(collect(params, "label")));
            case "delete_cluster" -> new DotCommand.DeleteSubgraph(Utilities.getStringProperty(params, "id"));
            case "set_graph_attr" -> new DotCommand.SetGraphAttr(
                    Utilities.getStringProperty(params, "key"),
                    Utilities.getStringProperty(params, "value"));
            default -> throw new CommandException(ErrorCode.UNKNOWN_TOOL,
                    "Unknown tool " + Utilities.singleQuote(name));
        };
    }

    public static DotCommand toolCallToCommand(ToolCall call) {
        return toolCallToCommand(call.name(), call.parameters());
    }

    static ObjectNode attrsToJson(ObjectMapper mapper, Chunk chunk) {
        ObjectNode result = mapper.createObjectNode();
        for (var e: chunk.getAttrs().entrySet())
            result.put(e.getKey(), e.getValue());
        return result;
    }

    /** Answer a query tool call.  The chunk list is not modified.
     * @throws CommandException UNKNOWN_TOOL for names which are not query tools. */
    public static JsonNode executeQueryTool(String name, JsonNode params, List<Chunk> chunks) {
        ObjectMapper mapper = Utilities.deterministicObjectMapper();
        ObjectNode result = mapper.createObjectNode();
        switch (name) {
            case "get_node": {
                String id = Utilities.getStringProperty(params, "id");
                Chunk node = Chunks.find(chunks, ChunkKind.NODE, id);
                if (node == null)
                    throw new CommandException(ErrorCode.NODE_NOT_FOUND,
                            "Node " + Utilities.singleQuote(id) + " not found");
                result.put("id", id);
                result.set("attrs", attrsToJson(mapper, node));
                result.put("type", "node");
                break;
            }
            case "list_nodes": {
                String parentId = Utilities.getOptionalStringProperty(params, "parent");
                ArrayNode nodes = result.putArray("nodes");
                Chunk parent = null;
                if (parentId != null) {
                    parent = Chunks.find(chunks, ChunkKind.SUBGRAPH, parentId);
                    if (parent == null)
                        break;
                }
                for (Chunk c: parent == null ? chunks : Chunks.strictlyInside(chunks, parent)) {
                    if (c.kind != ChunkKind.NODE)
                        continue;
                    ObjectNode node = nodes.addObject();
                    node.put("id", c.getId());
                    node.set("attrs", attrsToJson(mapper, c));
                }
                break;
            }
            case "get_edges": {
                String nodeId = Utilities.getStringProperty(params, "node_id");
                ArrayNode edges = result.putArray("edges");
                for (Chunk c: chunks) {
                    if (!c.touches(nodeId))
                        continue;
                    ObjectNode edge = edges.addObject();
                    edge.put("from", c.getId());
                    edge.put("to", c.getExtra());
                    edge.set("attrs", attrsToJson(mapper, c));
                }
                break;
            }
            case "find_nodes": {
                JsonNode ids = Utilities.getProperty(params, "ids");
                if (!ids.isArray())
                    throw new CommandException(ErrorCode.INVALID_COMMAND, "Parameter 'ids' must be an array");
                ArrayNode found = result.putArray("found");
                ArrayNode missing = result.putArray("missing");
                for (JsonNode id: ids) {
                    String text = id.asText();
                    if (Chunks.indexOf(chunks, ChunkKind.NODE, text) >= 0)
                        found.add(text);
                    else
                        missing.add(text);
                }
                break;
            }
            default:
                throw new CommandException(ErrorCode.UNKNOWN_TOOL,
                        "Unknown query tool " + Utilities.singleQuote(name));
        }
        return result;
    }
}
