package org.graphdelta.dotEditor.backend;

import org.graphdelta.dotEditor.chunks.Chunk;
import org.graphdelta.dotEditor.chunks.LineRange;
import org.graphdelta.util.IIndentStream;
import org.graphdelta.util.IWritesLogs;
import org.graphdelta.util.IndentStream;
import org.graphdelta.util.Logger;
import org.graphdelta.util.Utilities;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Rebuilds nested DOT text from a flat chunk list.
 * Chunks are sorted by start line; subgraph blocks are kept on a stack and closed
 * as soon as a chunk starts after the block's end line.  Output is always a digraph.
 */
public class ToDot implements IWritesLogs {
    public static final String DEFAULT_GRAPH_NAME = "G";

    /** A subgraph block which has been opened but not yet closed. */
    record OpenBlock(@Nullable String id, LineRange range) {
        /** A block with a synthetic end line is never closed by a following chunk. */
        boolean endsBefore(Chunk chunk) {
            return chunk.getRange().start() > this.range.end() && this.range.end() != 0;
        }
    }

    private final IIndentStream stream;
    private final List<OpenBlock> stack = new ArrayList<>();

    ToDot(IIndentStream stream) {
        this.stream = stream;
    }

    public static String chunksToCompleteDot(List<Chunk> chunks) {
        return chunksToCompleteDot(chunks, null);
    }

    /** Serialize a chunk list as a complete DOT digraph.
     * @param chunks     Chunks to serialize; the list is not modified.
     * @param graphName  Name of the graph; {@link #DEFAULT_GRAPH_NAME} if null. */
    public static String chunksToCompleteDot(List<Chunk> chunks, @Nullable String graphName) {
        StringBuilder builder = new StringBuilder();
        IndentStream stream = new IndentStream(builder);
        new ToDot(stream).write(chunks, Objects.requireNonNullElse(graphName, DEFAULT_GRAPH_NAME));
        return builder.toString();
    }

    void write(List<Chunk> chunks, String graphName) {
        List<Chunk> sorted = new ArrayList<>(chunks);
        // List.sort is stable, so a subgraph stays ahead of children starting on its line.
        sorted.sort(Comparator.comparingInt(c -> c.getRange().start()));

        this.stream.append("digraph ")
                .append(DotFormat.formatId(graphName))
                .append(" {")
                .increase();
        for (Chunk chunk: sorted) {
            while (!this.stack.isEmpty() && Utilities.last(this.stack).endsBefore(chunk))
                this.closeBlock();
            this.writeChunk(chunk);
        }
        while (!this.stack.isEmpty())
            this.closeBlock();
        this.stream.decrease()
                .append("}")
                .newline();
    }

    void closeBlock() {
        OpenBlock block = Utilities.removeLast(this.stack);
        Logger.INSTANCE.belowLevel(this, 2)
                .append("Closing subgraph ")
                .append(String.valueOf(block.id()))
                .append(" ")
                .append(block.range().toString())
                .newline();
        this.stream.decrease()
                .append("}")
                .newline();
    }

    void openBlock(Chunk chunk) {
        this.stream.append("subgraph ");
        if (chunk.getId() != null)
            this.stream.append(DotFormat.formatId(chunk.getId())).append(" ");
        this.stream.append("{").increase();
        if (!chunk.getAttrs().isEmpty()) {
            this.stream.append("graph [")
                    .append(DotFormat.formatAttributes(chunk.getAttrs()))
                    .append("];")
                    .newline();
        }
    }

    void writeChunk(Chunk chunk) {
        switch (chunk.kind) {
            case SUBGRAPH -> {
                this.openBlock(chunk);
                if (chunk.getRange().isSynthetic()) {
                    // Nothing can be positioned inside a block without a range.
                    this.stream.decrease().append("}").newline();
                } else {
                    this.stack.add(new OpenBlock(chunk.getId(), chunk.getRange()));
                }
            }
            case RANK -> this.stream.append(formatRank(chunk)).newline();
            default -> this.stream.append(formatStatement(chunk)).newline();
        }
    }

    static String formatRank(Chunk chunk) {
        StringBuilder builder = new StringBuilder("{ rank=")
                .append(DotFormat.formatValue(Objects.requireNonNullElse(chunk.getId(), "same")))
                .append(";");
        String nodes = Objects.requireNonNullElse(chunk.getExtra(), "");
        for (String node: nodes.split(",")) {
            if (node.isEmpty())
                continue;
            builder.append(" ").append(Utilities.doubleQuote(node)).append(";");
        }
        return builder.append(" }").toString();
    }

    static String bracketed(Chunk chunk, boolean always) {
        if (chunk.getAttrs().isEmpty() && !always)
            return "";
        return " [" + DotFormat.formatAttributes(chunk.getAttrs()) + "]";
    }

    /** Render a single statement chunk, without indentation or trailing newline. */
    public static String formatStatement(Chunk chunk) {
        String id = Objects.requireNonNullElse(chunk.getId(), "");
        return switch (chunk.kind) {
            case NODE -> DotFormat.formatId(id) + bracketed(chunk, false) + ";";
            case EDGE -> DotFormat.formatId(id) + " -> " +
                    DotFormat.formatId(Objects.requireNonNull(chunk.getExtra())) + bracketed(chunk, false) + ";";
            case ATTR_STMT -> id + bracketed(chunk, true) + ";";
            case ID_EQ -> DotFormat.formatId(id) + " = " +
                    DotFormat.formatValue(Objects.requireNonNullElse(chunk.getExtra(), "")) + ";";
            case RANK -> formatRank(chunk);
            case SUBGRAPH -> "subgraph " + (chunk.getId() == null ? "" : DotFormat.formatId(id) + " ") + "{ }";
        };
    }
}
