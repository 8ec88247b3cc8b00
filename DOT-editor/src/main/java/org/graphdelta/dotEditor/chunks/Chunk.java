package org.graphdelta.dotEditor.chunks;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.graphdelta.util.Utilities;

import javax.annotation.Nullable;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A unit of parsed DOT structure: a node, an edge, a subgraph header,
 * an attribute statement, a graph-level assignment, or a rank group.
 * Nesting is not represented explicitly; it follows from the containment of line ranges.
 * Chunks are mutable; a chunk list is owned by a single document.
 */
public final class Chunk {
    public final ChunkKind kind;
    /** Node id, edge source, subgraph name, attribute statement target,
     * assignment key, or rank kind. */
    @Nullable
    private String id;
    /** Insertion-ordered attributes. */
    private final LinkedHashMap<String, String> attrs;
    private final LineRange range;
    /** Edge target, comma-separated rank nodes, or assignment value. */
    @Nullable
    private String extra;

    Chunk(ChunkKind kind, @Nullable String id, Map<String, String> attrs,
          LineRange range, @Nullable String extra) {
        this.kind = kind;
        this.id = id;
        this.attrs = new LinkedHashMap<>(attrs);
        this.range = range;
        this.extra = extra;
    }

    public static Chunk node(String id, Map<String, String> attrs, LineRange range) {
        return new Chunk(ChunkKind.NODE, Objects.requireNonNull(id), attrs, range, null);
    }

    public static Chunk edge(String from, String to, Map<String, String> attrs, LineRange range) {
        return new Chunk(ChunkKind.EDGE, Objects.requireNonNull(from), attrs, range, Objects.requireNonNull(to));
    }

    public static Chunk subgraph(@Nullable String id, Map<String, String> attrs, LineRange range) {
        return new Chunk(ChunkKind.SUBGRAPH, id, attrs, range, null);
    }

    /** @param target One of "graph", "node", "edge". */
    public static Chunk attrStmt(String target, Map<String, String> attrs, LineRange range) {
        Utilities.enforce(target.equals("graph") || target.equals("node") || target.equals("edge"),
                () -> "Illegal attribute statement target " + target);
        return new Chunk(ChunkKind.ATTR_STMT, target, attrs, range, null);
    }

    public static Chunk idEq(String key, String value, LineRange range) {
        return new Chunk(ChunkKind.ID_EQ, Objects.requireNonNull(key), Map.of(), range, Objects.requireNonNull(value));
    }

    /** @param rankKind  same, min, max, source, or sink.
     *  @param nodes     Comma-separated node ids. */
    public static Chunk rank(String rankKind, String nodes, LineRange range) {
        return new Chunk(ChunkKind.RANK, Objects.requireNonNull(rankKind), Map.of(), range, Objects.requireNonNull(nodes));
    }

    public Chunk copy() {
        return new Chunk(this.kind, this.id, this.attrs, this.range, this.extra);
    }

    @Nullable
    public String getId() {
        return this.id;
    }

    public void setId(@Nullable String id) {
        this.id = id;
    }

    /** Live view of the attributes. */
    public LinkedHashMap<String, String> getAttrs() {
        return this.attrs;
    }

    /** Right-biased merge: new values overwrite existing keys in place; new keys are appended. */
    public void mergeAttrs(Map<String, String> update) {
        this.attrs.putAll(update);
    }

    public LineRange getRange() {
        return this.range;
    }

    @Nullable
    public String getExtra() {
        return this.extra;
    }

    public void setExtra(@Nullable String extra) {
        this.extra = extra;
    }

    public boolean is(ChunkKind kind, @Nullable String id) {
        return this.kind == kind && Objects.equals(this.id, id);
    }

    public boolean isEdge(String from, String to) {
        return this.kind == ChunkKind.EDGE && from.equals(this.id) && to.equals(this.extra);
    }

    /** True if this is an edge with the node as source or target. */
    public boolean touches(String node) {
        return this.kind == ChunkKind.EDGE && (node.equals(this.id) || node.equals(this.extra));
    }

    public JsonNode toJson() {
        ObjectMapper mapper = Utilities.deterministicObjectMapper();
        ObjectNode result = mapper.createObjectNode();
        result.put("kind", this.kind.jsonName);
        if (this.id != null)
            result.put("id", this.id);
        ObjectNode attrs = result.putObject("attrs");
        for (var e: this.attrs.entrySet())
            attrs.put(e.getKey(), e.getValue());
        result.putArray("range").add(this.range.start()).add(this.range.end());
        if (this.extra != null)
            result.put("extra", this.extra);
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Chunk chunk = (Chunk) o;
        return this.kind == chunk.kind &&
                Objects.equals(this.id, chunk.id) &&
                this.attrs.equals(chunk.attrs) &&
                this.range.equals(chunk.range) &&
                Objects.equals(this.extra, chunk.extra);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.kind, this.id, this.attrs, this.range, this.extra);
    }

    @Override
    public String toString() {
        return this.kind.jsonName + " " + this.id +
                (this.extra != null ? " " + this.extra : "") +
                " " + this.attrs + " " + this.range;
    }
}
