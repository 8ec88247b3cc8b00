package org.graphdelta.dotEditor.parser;

import javax.annotation.Nullable;
import java.util.List;

/** A parsed DOT graph. */
public class DotGraph {
    public final boolean strict;
    public final boolean directed;
    @Nullable
    public final DotId id;
    public final List<DotStatement> body;
    /** The text the graph was parsed from; statement offsets refer to it. */
    public final String source;
    /** Offset of the graph header. */
    public final int start;

    public DotGraph(boolean strict, boolean directed, @Nullable DotId id,
                    List<DotStatement> body, String source, int start) {
        this.start = start;
        this.strict = strict;
        this.directed = directed;
        this.id = id;
        this.body = body;
        this.source = source;
    }

    public void accept(DotVisitor visitor) {
        for (DotStatement statement: this.body)
            statement.accept(visitor);
    }
}
