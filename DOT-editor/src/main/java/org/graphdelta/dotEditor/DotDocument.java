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

package org.graphdelta.dotEditor;

import com.fasterxml.jackson.databind.node.ArrayNode;
import org.graphdelta.dotEditor.backend.ToDot;
import org.graphdelta.dotEditor.chunks.Chunk;
import org.graphdelta.dotEditor.chunks.ChunkExtractor;
import org.graphdelta.dotEditor.commands.CommandApplier;
import org.graphdelta.dotEditor.commands.CommandBatch;
import org.graphdelta.dotEditor.commands.DotCommand;
import org.graphdelta.dotEditor.dsl.DslCommand;
import org.graphdelta.dotEditor.dsl.DslInterpreter;
import org.graphdelta.dotEditor.dsl.DslParser;
import org.graphdelta.dotEditor.errors.SourcePosition;
import org.graphdelta.dotEditor.errors.SourcePositionRange;
import org.graphdelta.dotEditor.parser.DotGraph;
import org.graphdelta.dotEditor.parser.DotParser;
import org.graphdelta.dotEditor.tools.ToolAdapter;
import org.graphdelta.dotEditor.tools.ToolCall;
import org.graphdelta.dotEditor.tools.ToolDefinitions;
import org.graphdelta.util.Utilities;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;

/**
 * One DOT graph being edited: its chunk list and its name.
 * This is the main entry point for programs using the editor as a library.
 */
public class DotDocument {
    public static final String CONVERTED = "Graph kind converted";

    private final List<Chunk> chunks;
    @Nullable
    private String name;

    public DotDocument(List<Chunk> chunks, @Nullable String name) {
        this.chunks = new ArrayList<>(chunks);
        this.name = name;
    }

    /** An empty graph. */
    public DotDocument() {
        this(new ArrayList<>(), null);
    }

    /** Parse DOT text.
     * @throws org.graphdelta.dotEditor.errors.ParseError if the text is not valid DOT. */
    public static DotDocument parse(String dot) {
        return parse(dot, null);
    }

    /** Parse DOT text, warning when the graph is undirected or strict:
     * the document is always written back as a plain digraph. */
    public static DotDocument parse(String dot, @Nullable IErrorReporter reporter) {
        DotGraph graph = DotParser.parse(dot);
        if (reporter != null && (graph.strict || !graph.directed)) {
            SourcePosition header = SourcePosition.fromOffset(graph.source, graph.start);
            reporter.reportWarning(new SourcePositionRange(header), CONVERTED,
                    "The output is always a digraph; " +
                            Utilities.singleQuote((graph.strict ? "strict " : "") +
                                    (graph.directed ? "digraph" : "graph")) + " is not kept");
        }
        return new DotDocument(ChunkExtractor.extract(graph), graph.id == null ? null : graph.id.value());
    }

    /** The live chunk list. */
    public List<Chunk> getChunks() {
        return this.chunks;
    }

    @Nullable
    public String getName() {
        return this.name;
    }

    public void setName(@Nullable String name) {
        this.name = name;
    }

    public void apply(DotCommand command) {
        CommandApplier.apply(this.chunks, command);
    }

    /** Apply commands, reporting and skipping the ones which fail.
     * @return The number of commands applied. */
    public int applyAll(List<DotCommand> commands, IErrorReporter reporter) {
        return new CommandBatch(reporter).applyAll(this.chunks, commands);
    }

    /** Apply all commands or none. */
    public int applyAtomically(List<DotCommand> commands, IErrorReporter reporter) {
        return new CommandBatch(reporter).applyAtomically(this.chunks, commands);
    }

    /** Run a script in the line-oriented editing language.
     * @throws org.graphdelta.dotEditor.errors.ParseError if the script is malformed;
     *         in that case the document is unchanged. */
    public int applyDsl(String script, IErrorReporter reporter) {
        List<DslCommand> commands = DslParser.parse(script);
        return DslInterpreter.applyCommands(this.chunks, commands, reporter);
    }

    /** Execute one tool call.  Query tools return their JSON answer;
     * editing tools modify the document and return null. */
    @Nullable
    public String executeTool(ToolCall call) {
        if (ToolDefinitions.isQueryTool(call.name()))
            return ToolAdapter.executeQueryTool(call.name(), call.parameters(), this.chunks).toPrettyString();
        this.apply(ToolAdapter.toolCallToCommand(call));
        return null;
    }

    public String toDot() {
        return ToDot.chunksToCompleteDot(this.chunks, this.name);
    }

    public ArrayNode chunksToJson() {
        ArrayNode result = Utilities.deterministicObjectMapper().createArrayNode();
        for (Chunk chunk: this.chunks)
            result.add(chunk.toJson());
        return result;
    }

    @Override
    public String toString() {
        return this.toDot();
    }
}
