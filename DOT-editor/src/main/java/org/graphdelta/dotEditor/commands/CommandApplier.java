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

package org.graphdelta.dotEditor.commands;

import org.graphdelta.dotEditor.chunks.Chunk;
import org.graphdelta.dotEditor.chunks.ChunkKind;
import org.graphdelta.dotEditor.chunks.Chunks;
import org.graphdelta.dotEditor.chunks.LineRange;
import org.graphdelta.dotEditor.errors.CommandException;
import org.graphdelta.dotEditor.errors.CommandException.ErrorCode;
import org.graphdelta.dotEditor.parser.DotParser;
import org.graphdelta.util.IWritesLogs;
import org.graphdelta.util.Logger;
import org.graphdelta.util.Utilities;

import javax.annotation.Nullable;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies {@link DotCommand}s to a chunk list.
 * Every check and every insertion point is computed before the list is touched,
 * so a command which throws leaves the list unchanged.
 *
 * <p>Nodes and edges differ on update: {@link #updateNodeOrFail} rejects a missing node,
 * while {@link #upsertEdge} creates a missing edge.
 */
public class CommandApplier implements IWritesLogs {
    private final List<Chunk> chunks;

    public CommandApplier(List<Chunk> chunks) {
        this.chunks = chunks;
    }

    /** Apply one command to a chunk list.
     * @throws CommandException if the command is not applicable.
     * @throws org.graphdelta.dotEditor.errors.ParseError if the command's attribute text is malformed. */
    public static void apply(List<Chunk> chunks, DotCommand command) {
        new CommandApplier(chunks).apply(command);
    }

    public void apply(DotCommand command) {
        Logger.INSTANCE.belowLevel(this, 1)
                .append("Applying ")
                .appendSupplier(() -> command.toJson().toString())
                .newline();
        if (command instanceof DotCommand.CreateNode c) {
            this.createNode(c.id, c.attrs, c.parent);
        } else if (command instanceof DotCommand.UpdateNode c) {
            this.updateNodeOrFail(c.id, c.attrs);
        } else if (command instanceof DotCommand.DeleteNode c) {
            this.deleteNode(c.id, c.cascade);
        } else if (command instanceof DotCommand.CreateEdge c) {
            this.createEdge(c.from, c.to, c.attrs, c.parent);
        } else if (command instanceof DotCommand.UpdateEdge c) {
            this.upsertEdge(c.from, c.to, c.attrs);
        } else if (command instanceof DotCommand.DeleteEdge c) {
            this.deleteEdge(c.from, c.to);
        } else if (command instanceof DotCommand.CreateSubgraph c) {
            this.createSubgraph(c.id, c.parent, c.attrs);
        } else if (command instanceof DotCommand.DeleteSubgraph c) {
            this.deleteSubgraph(c.id);
        } else if (command instanceof DotCommand.SetGraphAttr c) {
            this.setGraphAttr(c.key, c.value);
        } else if (command instanceof DotCommand.SetNodeDefault c) {
            this.setDefault("node", c.attrs);
        } else if (command instanceof DotCommand.SetEdgeDefault c) {
            this.setDefault("edge", c.attrs);
        } else if (command instanceof DotCommand.DeleteAttr c) {
            this.deleteAttr(c.key);
        } else {
            throw new CommandException(ErrorCode.INVALID_COMMAND,
                    "Unsupported command " + command.getClass().getSimpleName());
        }
    }

    static Map<String, String> parseAttrs(@Nullable String attrs) {
        if (attrs == null || attrs.isBlank())
            return new LinkedHashMap<>();
        return DotParser.parseAttributes(attrs);
    }

    /** Where a new chunk goes: an index in the list and a line. */
    record InsertionPoint(int index, int line) {}

    /** Index of the subgraph which will receive a new chunk.
     * A subgraph created by the DSL has no lines, so nothing can be positioned inside it. */
    int parentIndex(String parentId) {
        int index = Chunks.indexOf(this.chunks, ChunkKind.SUBGRAPH, parentId);
        if (index < 0)
            throw new CommandException(ErrorCode.PARENT_SUBGRAPH_NOT_FOUND,
                    "Parent subgraph " + Utilities.singleQuote(parentId) + " not found");
        if (this.chunks.get(index).getRange().isSynthetic())
            throw new CommandException(ErrorCode.INVALID_COMMAND,
                    "Parent subgraph " + Utilities.singleQuote(parentId) +
                            " has no position in the document and cannot contain new chunks");
        return index;
    }

    /**
     * The position after the last chunk strictly inside the parent subgraph,
     * or right after the parent if it is empty.
     * The line may coincide with the parent's end line; the serializer still writes the
     * chunk inside the block, but strict containment (as used by list_nodes) excludes it.
     * Chunks already inserted on that line keep their place ahead of the new one.
     */
    InsertionPoint insideParent(String parentId) {
        int parentIndex = this.parentIndex(parentId);
        Chunk parent = this.chunks.get(parentIndex);
        int anchor = -1;
        for (int i = 0; i < this.chunks.size(); i++) {
            Chunk c = this.chunks.get(i);
            if (i == parentIndex || !parent.getRange().strictlyContains(c.getRange()))
                continue;
            if (anchor < 0 || c.getRange().end() >= this.chunks.get(anchor).getRange().end())
                anchor = i;
        }
        int index;
        int line;
        if (anchor < 0) {
            index = parentIndex + 1;
            line = parent.getRange().start() + 1;
        } else {
            index = anchor + 1;
            line = this.chunks.get(anchor).getRange().end() + 1;
        }
        while (index < this.chunks.size()) {
            LineRange next = this.chunks.get(index).getRange();
            if (next.start() != line || !parent.getRange().includes(next))
                break;
            index++;
        }
        InsertionPoint result = new InsertionPoint(index, line);
        Logger.INSTANCE.belowLevel(this, 2)
                .append("Inserting in ")
                .append(parentId)
                .append(" at index ")
                .append(result.index())
                .append(" line ")
                .append(result.line())
                .newline();
        return result;
    }

    /** The position after the last top-level chunk of this kind, or the end of the list. */
    InsertionPoint afterLastTopLevel(ChunkKind kind) {
        for (int i = this.chunks.size() - 1; i >= 0; i--) {
            Chunk c = this.chunks.get(i);
            if (c.kind == kind && Chunks.isTopLevel(this.chunks, c))
                return new InsertionPoint(i + 1, c.getRange().end() + 1);
        }
        return this.atEnd();
    }

    InsertionPoint atEnd() {
        return new InsertionPoint(this.chunks.size(), Chunks.maxEnd(this.chunks) + 1);
    }

    InsertionPoint insertionPoint(@Nullable String parent, ChunkKind kind) {
        if (parent != null)
            return this.insideParent(parent);
        return this.afterLastTopLevel(kind);
    }

    public void createNode(String id, @Nullable String attrs, @Nullable String parent) {
        if (Chunks.indexOf(this.chunks, ChunkKind.NODE, id) >= 0)
            throw new CommandException(ErrorCode.NODE_ALREADY_EXISTS,
                    "Node " + Utilities.singleQuote(id) + " already exists");
        Map<String, String> parsed = parseAttrs(attrs);
        InsertionPoint point = this.insertionPoint(parent, ChunkKind.NODE);
        this.chunks.add(point.index(), Chunk.node(id, parsed, new LineRange(point.line(), point.line())));
    }

    Chunk getNode(String id) {
        Chunk node = Chunks.find(this.chunks, ChunkKind.NODE, id);
        if (node == null)
            throw new CommandException(ErrorCode.NODE_NOT_FOUND,
                    "Node " + Utilities.singleQuote(id) + " not found");
        return node;
    }

    /** Merge attributes into an existing node; fails if the node does not exist. */
    public void updateNodeOrFail(String id, @Nullable String attrs) {
        Chunk node = this.getNode(id);
        Map<String, String> parsed = parseAttrs(attrs);
        node.mergeAttrs(parsed);
    }

    /** Remove a node; incident edges are removed only when cascading. */
    public void deleteNode(String id, boolean cascade) {
        Chunk node = this.getNode(id);
        this.chunks.removeIf(c -> c == node);
        if (cascade)
            this.chunks.removeIf(c -> c.touches(id));
    }

    public void createEdge(String from, String to, @Nullable String attrs, @Nullable String parent) {
        if (Chunks.indexOfEdge(this.chunks, from, to) >= 0)
            throw new CommandException(ErrorCode.EDGE_ALREADY_EXISTS,
                    "Edge " + from + " -> " + to + " already exists");
        Map<String, String> parsed = parseAttrs(attrs);
        InsertionPoint point = this.insertionPoint(parent, ChunkKind.EDGE);
        this.chunks.add(point.index(), Chunk.edge(from, to, parsed, new LineRange(point.line(), point.line())));
    }

    /** Merge attributes into an edge, appending a new edge if it does not exist. */
    public void upsertEdge(String from, String to, @Nullable String attrs) {
        Map<String, String> parsed = parseAttrs(attrs);
        Chunk edge = Chunks.findEdge(this.chunks, from, to);
        if (edge != null) {
            edge.mergeAttrs(parsed);
            return;
        }
        InsertionPoint point = this.atEnd();
        this.chunks.add(Chunk.edge(from, to, parsed, new LineRange(point.line(), point.line())));
    }

    public void deleteEdge(String from, String to) {
        int index = Chunks.indexOfEdge(this.chunks, from, to);
        if (index < 0)
            throw new CommandException(ErrorCode.EDGE_NOT_FOUND,
                    "Edge " + from + " -> " + to + " not found");
        this.chunks.remove(index);
    }

    /** A nested subgraph takes over the interior of its parent; a top-level subgraph
     * gets a window of lines after the end of the document. */
    public void createSubgraph(@Nullable String id, @Nullable String parent, @Nullable String attrs) {
        if (id != null && Chunks.indexOf(this.chunks, ChunkKind.SUBGRAPH, id) >= 0)
            throw new CommandException(ErrorCode.SUBGRAPH_ALREADY_EXISTS,
                    "Subgraph " + Utilities.singleQuote(id) + " already exists");
        Map<String, String> parsed = parseAttrs(attrs);
        if (parent != null) {
            int parentIndex = this.parentIndex(parent);
            LineRange outer = this.chunks.get(parentIndex).getRange();
            this.chunks.add(parentIndex + 1,
                    Chunk.subgraph(id, parsed, new LineRange(outer.start() + 1, outer.end() - 1)));
        } else {
            int next = Chunks.maxEnd(this.chunks) + 1;
            this.chunks.add(Chunk.subgraph(id, parsed, new LineRange(next, next + 10)));
        }
    }

    /** Remove a subgraph with everything its range includes. */
    public void deleteSubgraph(String id) {
        Chunk subgraph = Chunks.find(this.chunks, ChunkKind.SUBGRAPH, id);
        if (subgraph == null)
            throw new CommandException(ErrorCode.SUBGRAPH_NOT_FOUND,
                    "Subgraph " + Utilities.singleQuote(id) + " not found");
        LineRange range = subgraph.getRange();
        if (range.isSynthetic()) {
            this.chunks.removeIf(c -> c == subgraph);
            return;
        }
        int before = this.chunks.size();
        this.chunks.removeIf(c -> c == subgraph || (!c.getRange().isSynthetic() && range.includes(c.getRange())));
        Logger.INSTANCE.belowLevel(this, 2)
                .append("Deleted ")
                .append(before - this.chunks.size())
                .append(" chunks with subgraph ")
                .append(id)
                .newline();
    }

    public void setGraphAttr(String key, String value) {
        int index = Chunks.indexOfTopLevel(this.chunks, ChunkKind.ID_EQ, key);
        if (index >= 0) {
            this.chunks.get(index).setExtra(value);
            return;
        }
        this.chunks.add(0, Chunk.idEq(key, value, new LineRange(1, 1)));
    }

    /** Merge into the top-level "node" or "edge" attribute statement, creating it if needed. */
    public void setDefault(String target, String attrs) {
        Map<String, String> parsed = parseAttrs(attrs);
        int index = Chunks.indexOfTopLevel(this.chunks, ChunkKind.ATTR_STMT, target);
        if (index >= 0) {
            this.chunks.get(index).mergeAttrs(parsed);
            return;
        }
        for (int i = 0; i < this.chunks.size(); i++) {
            Chunk c = this.chunks.get(i);
            if (c.kind == ChunkKind.ATTR_STMT && Chunks.isTopLevel(this.chunks, c)) {
                this.chunks.add(i + 1, Chunk.attrStmt(target, parsed, c.getRange()));
                return;
            }
        }
        this.chunks.add(0, Chunk.attrStmt(target, parsed, new LineRange(1, 1)));
    }

    public void deleteAttr(String key) {
        int index = Chunks.indexOfTopLevel(this.chunks, ChunkKind.ID_EQ, key);
        if (index < 0)
            throw new CommandException(ErrorCode.ATTRIBUTE_NOT_FOUND,
                    "Attribute " + Utilities.singleQuote(key) + " not found");
        this.chunks.remove(index);
    }
}
