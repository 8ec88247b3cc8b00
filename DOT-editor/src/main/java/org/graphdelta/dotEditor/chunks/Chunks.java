package org.graphdelta.dotEditor.chunks;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;

/** Queries over a chunk list.  None of these modify the list. */
public final class Chunks {
    private Chunks() {}

    /** Index of the first chunk of the given kind and id, or -1. */
    public static int indexOf(List<Chunk> chunks, ChunkKind kind, @Nullable String id) {
        for (int i = 0; i < chunks.size(); i++) {
            if (chunks.get(i).is(kind, id))
                return i;
        }
        return -1;
    }

    @Nullable
    public static Chunk find(List<Chunk> chunks, ChunkKind kind, @Nullable String id) {
        int index = indexOf(chunks, kind, id);
        return index < 0 ? null : chunks.get(index);
    }

    public static int indexOfEdge(List<Chunk> chunks, String from, String to) {
        for (int i = 0; i < chunks.size(); i++) {
            if (chunks.get(i).isEdge(from, to))
                return i;
        }
        return -1;
    }

    @Nullable
    public static Chunk findEdge(List<Chunk> chunks, String from, String to) {
        int index = indexOfEdge(chunks, from, to);
        return index < 0 ? null : chunks.get(index);
    }

    /** A chunk is top-level if no subgraph in the list strictly contains its range. */
    public static boolean isTopLevel(List<Chunk> chunks, Chunk chunk) {
        for (Chunk c: chunks) {
            if (c != chunk && c.kind == ChunkKind.SUBGRAPH &&
                    c.getRange().strictlyContains(chunk.getRange()))
                return false;
        }
        return true;
    }

    /** Index of the first top-level chunk with this kind and id, or -1. */
    public static int indexOfTopLevel(List<Chunk> chunks, ChunkKind kind, @Nullable String id) {
        for (int i = 0; i < chunks.size(); i++) {
            Chunk c = chunks.get(i);
            if (c.is(kind, id) && isTopLevel(chunks, c))
                return i;
        }
        return -1;
    }

    /** Chunks whose range lies strictly inside the range of the parent. */
    public static List<Chunk> strictlyInside(List<Chunk> chunks, Chunk parent) {
        List<Chunk> result = new ArrayList<>();
        for (Chunk c: chunks) {
            if (c != parent && parent.getRange().strictlyContains(c.getRange()))
                result.add(c);
        }
        return result;
    }

    /** The largest end line in the list; 0 for an empty list. */
    public static int maxEnd(List<Chunk> chunks) {
        int result = 0;
        for (Chunk c: chunks)
            result = Math.max(result, c.getRange().end());
        return result;
    }

    /** Deep copy of a chunk list. */
    public static List<Chunk> copy(List<Chunk> chunks) {
        List<Chunk> result = new ArrayList<>(chunks.size());
        for (Chunk c: chunks)
            result.add(c.copy());
        return result;
    }
}
