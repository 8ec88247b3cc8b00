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

package org.graphdelta.dotEditor.chunks;

import org.graphdelta.dotEditor.parser.DotGraph;
import org.graphdelta.dotEditor.parser.DotNodeId;
import org.graphdelta.dotEditor.parser.DotParser;
import org.graphdelta.dotEditor.parser.DotStatement;
import org.graphdelta.dotEditor.parser.DotVisitor;
import org.graphdelta.util.IWritesLogs;
import org.graphdelta.util.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Flattens a DOT syntax tree into an ordered list of chunks annotated with line ranges.
 * A subgraph chunk precedes the chunks of its body; an edge chain
 * {@code a -> b -> c} produces one edge chunk per consecutive pair.
 * An anonymous subgraph holding only a rank assignment and plain node statements
 * becomes a single rank chunk.
 */
public class ChunkExtractor implements DotVisitor, IWritesLogs {
    private final List<Chunk> chunks;
    /** newlineOffsets[i] is the offset of the i-th newline in the source. */
    private final int[] newlineOffsets;

    public ChunkExtractor(String source) {
        this.chunks = new ArrayList<>();
        List<Integer> newlines = new ArrayList<>();
        for (int i = 0; i < source.length(); i++) {
            if (source.charAt(i) == '\n')
                newlines.add(i);
        }
        this.newlineOffsets = newlines.stream().mapToInt(i -> i).toArray();
    }

    /** Parse DOT text and extract its chunks.
     * @throws org.graphdelta.dotEditor.errors.ParseError on malformed input. */
    public static List<Chunk> parseToChunks(String dot) {
        DotGraph graph = DotParser.parse(dot);
        return extract(graph);
    }

    public static List<Chunk> extract(DotGraph graph) {
        ChunkExtractor extractor = new ChunkExtractor(graph.source);
        graph.accept(extractor);
        Logger.INSTANCE.belowLevel(extractor, 1)
                .append("Extracted ")
                .append(extractor.chunks.size())
                .append(" chunks")
                .newline();
        return extractor.chunks;
    }

    /** 1 + number of newlines strictly before the offset. */
    int lineOf(int offset) {
        int index = Arrays.binarySearch(this.newlineOffsets, offset);
        // Not found: index = -(insertion point) - 1, and the insertion point counts smaller offsets
        int before = index >= 0 ? index : -index - 1;
        return before + 1;
    }

    LineRange rangeOf(DotStatement statement) {
        return new LineRange(this.lineOf(statement.start), this.lineOf(statement.end));
    }

    @Override
    public void visit(DotStatement.NodeStatement statement) {
        this.chunks.add(Chunk.node(statement.node.asChunkId(),
                DotStatement.values(statement.attributes), this.rangeOf(statement)));
    }

    @Override
    public void visit(DotStatement.EdgeStatement statement) {
        LineRange range = this.rangeOf(statement);
        Map<String, String> attrs = DotStatement.values(statement.attributes);
        List<DotNodeId> operands = statement.operands;
        for (int i = 1; i < operands.size(); i++) {
            this.chunks.add(Chunk.edge(
                    operands.get(i - 1).asChunkId(), operands.get(i).asChunkId(), attrs, range));
        }
    }

    @Override
    public void visit(DotStatement.AttrStatement statement) {
        this.chunks.add(Chunk.attrStmt(statement.target,
                DotStatement.values(statement.attributes), this.rangeOf(statement)));
    }

    @Override
    public void visit(DotStatement.Assignment statement) {
        this.chunks.add(Chunk.idEq(statement.key.value(), statement.value.value(), this.rangeOf(statement)));
    }

    @Override
    public void visit(DotStatement.Subgraph statement) {
        LineRange range = this.rangeOf(statement);
        String rankKind = statement.getRankKind();
        if (rankKind != null) {
            List<String> nodes = new ArrayList<>();
            for (int i = 1; i < statement.body.size(); i++)
                nodes.add(((DotStatement.NodeStatement) statement.body.get(i)).node.asChunkId());
            this.chunks.add(Chunk.rank(rankKind, String.join(",", nodes), range));
            return;
        }
        String id = statement.id == null ? null : statement.id.value();
        this.chunks.add(Chunk.subgraph(id, Map.of(), range));
        DotVisitor.super.visit(statement);
    }
}
