package org.graphdelta.dotEditor.chunks;

/** The kinds of structure a chunk can represent. */
public enum ChunkKind {
    NODE("node"),
    EDGE("edge"),
    SUBGRAPH("subgraph"),
    ATTR_STMT("attr_stmt"),
    ID_EQ("id_eq"),
    RANK("rank");

    /** Name used in JSON. */
    public final String jsonName;

    ChunkKind(String jsonName) {
        this.jsonName = jsonName;
    }
}
