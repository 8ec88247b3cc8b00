package org.graphdelta.dotEditor.parser;

import javax.annotation.Nullable;

/** A node reference, optionally followed by a port and a compass point. */
public record DotNodeId(DotId id, @Nullable DotId port, @Nullable DotId compass) {
    public DotNodeId(DotId id) {
        this(id, null, null);
    }

    /** The node reference as stored in chunks: id[:port[:compass]]. */
    public String asChunkId() {
        StringBuilder builder = new StringBuilder(this.id.value());
        if (this.port != null)
            builder.append(":").append(this.port.value());
        if (this.compass != null)
            builder.append(":").append(this.compass.value());
        return builder.toString();
    }

    @Override
    public String toString() {
        return this.asChunkId();
    }
}
