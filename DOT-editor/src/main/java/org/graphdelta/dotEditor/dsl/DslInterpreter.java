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

package org.graphdelta.dotEditor.dsl;

import org.graphdelta.dotEditor.IErrorReporter;
import org.graphdelta.dotEditor.chunks.Chunk;
import org.graphdelta.dotEditor.chunks.ChunkKind;
import org.graphdelta.dotEditor.chunks.Chunks;
import org.graphdelta.dotEditor.chunks.LineRange;
import org.graphdelta.dotEditor.dsl.DslCommand.ClusterCmd;
import org.graphdelta.dotEditor.dsl.DslCommand.EdgeCmd;
import org.graphdelta.dotEditor.dsl.DslCommand.GlobalCmd;
import org.graphdelta.dotEditor.dsl.DslCommand.NodeCmd;
import org.graphdelta.dotEditor.dsl.DslCommand.Operation;
import org.graphdelta.dotEditor.dsl.DslCommand.RankCmd;
import org.graphdelta.dotEditor.errors.BaseEditorException;
import org.graphdelta.dotEditor.errors.CommandException;
import org.graphdelta.dotEditor.errors.CommandException.ErrorCode;
import org.graphdelta.dotEditor.errors.SourcePosition;
import org.graphdelta.dotEditor.errors.SourcePositionRange;
import org.graphdelta.dotEditor.errors.UnimplementedException;
import org.graphdelta.util.IWritesLogs;
import org.graphdelta.util.Logger;
import org.graphdelta.util.Utilities;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Applies {@link DslCommand}s to a chunk list.
 * Unlike {@link org.graphdelta.dotEditor.commands.CommandApplier}, adding an existing
 * node, edge or cluster updates it, and updating a missing one adds it.
 * New chunks get the synthetic range, so the serializer emits them at the top level.
 */
public class DslInterpreter implements IWritesLogs {
    /** Attribute key which renames a node on update. */
    public static final String RENAME_KEY = "id";

    private final List<Chunk> chunks;

    public DslInterpreter(List<Chunk> chunks) {
        this.chunks = chunks;
    }

    public static void apply(List<Chunk> chunks, DslCommand command) {
        new DslInterpreter(chunks).apply(command);
    }

    /** Apply each command in order; failures are reported with the command's line and skipped.
     * @return The number of commands applied. */
    public static int applyCommands(List<Chunk> chunks, List<DslCommand> commands, IErrorReporter reporter) {
        DslInterpreter interpreter = new DslInterpreter(chunks);
        int applied = 0;
        for (DslCommand command: commands) {
            try {
                interpreter.apply(command);
                applied++;
            } catch (BaseEditorException ex) {
                SourcePositionRange range = command.line > 0 ?
                        new SourcePositionRange(new SourcePosition(command.line, 1)) :
                        ex.getPositionRange();
                reporter.reportProblem(range, false, ex.getErrorKind(),
                        ex.getMessage() != null ? ex.getMessage() : "");
            }
        }
        return applied;
    }

    public void apply(DslCommand command) {
        Logger.INSTANCE.belowLevel(this, 1)
                .append("Interpreting ")
                .append(command.toString())
                .newline();
        if (command instanceof NodeCmd c) {
            this.node(c);
        } else if (command instanceof EdgeCmd c) {
            this.edge(c);
        } else if (command instanceof ClusterCmd c) {
            this.cluster(c);
        } else if (command instanceof GlobalCmd c) {
            this.global(c);
        } else if (command instanceof RankCmd c) {
            this.rank(c);
        } else {
            throw new CommandException(ErrorCode.INVALID_COMMAND,
                    "Unsupported command " + command.getClass().getSimpleName());
        }
    }

    void node(NodeCmd command) {
        if (command.operation == Operation.DELETE) {
            Chunk node = Chunks.find(this.chunks, ChunkKind.NODE, command.id);
            if (node == null)
                throw new CommandException(ErrorCode.NODE_NOT_FOUND,
                        "Node " + Utilities.singleQuote(command.id) + " not found");
            this.chunks.removeIf(c -> c == node || c.touches(command.id));
            return;
        }
        if (command.operation == Operation.MOVE)
            throw new CommandException(ErrorCode.INVALID_COMMAND, "Nodes are moved with 'move: NODE, CLUSTER'");

        LinkedHashMap<String, String> attrs = new LinkedHashMap<>(command.attrs);
        String newId = attrs.remove(RENAME_KEY);
        Chunk node = Chunks.find(this.chunks, ChunkKind.NODE, command.id);
        if (newId != null && !newId.equals(command.id)) {
            if (node == null)
                throw new CommandException(ErrorCode.NODE_NOT_FOUND,
                        "Cannot rename missing node " + Utilities.singleQuote(command.id));
            if (Chunks.indexOf(this.chunks, ChunkKind.NODE, newId) >= 0)
                throw new CommandException(ErrorCode.NODE_ALREADY_EXISTS,
                        "Cannot rename " + Utilities.singleQuote(command.id) + " to existing node " +
                                Utilities.singleQuote(newId));
            this.rename(command.id, newId);
        }
        if (node != null) {
            node.mergeAttrs(attrs);
        } else {
            this.chunks.add(Chunk.node(command.id, attrs, LineRange.SYNTHETIC));
        }
    }

    /** Rename a node, rewriting the edges and rank groups which mention it. */
    void rename(String from, String to) {
        int edges = 0;
        for (Chunk c: this.chunks) {
            if (c.is(ChunkKind.NODE, from)) {
                c.setId(to);
            } else if (c.kind == ChunkKind.EDGE) {
                if (from.equals(c.getId())) {
                    c.setId(to);
                    edges++;
                }
                if (from.equals(c.getExtra())) {
                    c.setExtra(to);
                    edges++;
                }
            } else if (c.kind == ChunkKind.RANK && c.getExtra() != null) {
                List<String> nodes = new ArrayList<>(Arrays.asList(c.getExtra().split(",")));
                nodes.replaceAll(n -> n.equals(from) ? to : n);
                c.setExtra(String.join(",", nodes));
            }
        }
        Logger.INSTANCE.belowLevel(this, 2)
                .append("Renamed ")
                .append(from)
                .append(" to ")
                .append(to)
                .append(", ")
                .append(edges)
                .append(" edge endpoints rewritten")
                .newline();
    }

    void edge(EdgeCmd command) {
        Chunk edge = Chunks.findEdge(this.chunks, command.from, command.to);
        switch (command.operation) {
            case ADD, UPDATE -> {
                if (edge != null)
                    edge.mergeAttrs(command.attrs);
                else
                    this.chunks.add(Chunk.edge(command.from, command.to, command.attrs, LineRange.SYNTHETIC));
            }
            case DELETE -> {
                if (edge == null)
                    throw new CommandException(ErrorCode.EDGE_NOT_FOUND,
                            "Edge " + command.from + " -> " + command.to + " not found");
                this.chunks.removeIf(c -> c == edge);
            }
            case MOVE -> throw new CommandException(ErrorCode.INVALID_COMMAND, "Edges cannot be moved");
        }
    }

    void cluster(ClusterCmd command) {
        String id = command.clusterId();
        Chunk subgraph = Chunks.find(this.chunks, ChunkKind.SUBGRAPH, id);
        switch (command.operation) {
            case ADD, UPDATE -> {
                if (subgraph != null)
                    subgraph.mergeAttrs(command.attrs);
                else
                    this.chunks.add(Chunk.subgraph(id, command.attrs, LineRange.SYNTHETIC));
            }
            case DELETE -> {
                if (subgraph == null)
                    throw new CommandException(ErrorCode.SUBGRAPH_NOT_FOUND,
                            "Subgraph " + Utilities.singleQuote(id) + " not found");
                // The contents stay; they become children of the enclosing block.
                this.chunks.removeIf(c -> c == subgraph);
            }
            case MOVE -> throw new UnimplementedException(
                    "Moving node " + Utilities.singleQuote(command.node) + " into " +
                            Utilities.singleQuote(id) + " is not supported");
        }
    }

    void global(GlobalCmd command) {
        int index = Chunks.indexOfTopLevel(this.chunks, ChunkKind.ATTR_STMT, command.target.statement);
        if (index >= 0)
            this.chunks.get(index).mergeAttrs(command.attrs);
        else
            this.chunks.add(Chunk.attrStmt(command.target.statement, command.attrs, LineRange.SYNTHETIC));
    }

    void rank(RankCmd command) {
        this.chunks.add(Chunk.rank(command.kind.dotName(), String.join(",", command.nodes), LineRange.SYNTHETIC));
    }
}
