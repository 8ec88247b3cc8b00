package org.graphdelta.dotEditor.parser;

import javax.annotation.Nullable;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** A statement of a DOT graph body.  Offsets cover the statement text,
 * excluding any trailing separator. */
public abstract class DotStatement {
    /** Offset of the first character. */
    public final int start;
    /** Offset after the last character. */
    public final int end;

    protected DotStatement(int start, int end) {
        this.start = start;
        this.end = end;
    }

    public abstract void accept(DotVisitor visitor);

    /** node_id [attrs] */
    public static final class NodeStatement extends DotStatement {
        public final DotNodeId node;
        public final LinkedHashMap<String, DotId> attributes;

        public NodeStatement(int start, int end, DotNodeId node, LinkedHashMap<String, DotId> attributes) {
            super(start, end);
            this.node = node;
            this.attributes = attributes;
        }

        @Override
        public void accept(DotVisitor visitor) {
            visitor.visit(this);
        }
    }

    /** a -> b -> c [attrs]; operators are not recorded, since output is always directed. */
    public static final class EdgeStatement extends DotStatement {
        /** At least two elements. */
        public final List<DotNodeId> operands;
        public final LinkedHashMap<String, DotId> attributes;

        public EdgeStatement(int start, int end, List<DotNodeId> operands, LinkedHashMap<String, DotId> attributes) {
            super(start, end);
            this.operands = operands;
            this.attributes = attributes;
        }

        @Override
        public void accept(DotVisitor visitor) {
            visitor.visit(this);
        }
    }

    /** graph|node|edge [attrs] */
    public static final class AttrStatement extends DotStatement {
        /** Lower-case target: "graph", "node", or "edge". */
        public final String target;
        public final LinkedHashMap<String, DotId> attributes;

        public AttrStatement(int start, int end, String target, LinkedHashMap<String, DotId> attributes) {
            super(start, end);
            this.target = target;
            this.attributes = attributes;
        }

        @Override
        public void accept(DotVisitor visitor) {
            visitor.visit(this);
        }
    }

    /** key = value */
    public static final class Assignment extends DotStatement {
        public final DotId key;
        public final DotId value;

        public Assignment(int start, int end, DotId key, DotId value) {
            super(start, end);
            this.key = key;
            this.value = value;
        }

        @Override
        public void accept(DotVisitor visitor) {
            visitor.visit(this);
        }
    }

    /** [subgraph [id]] { body } */
    public static final class Subgraph extends DotStatement {
        @Nullable
        public final DotId id;
        public final List<DotStatement> body;

        public Subgraph(int start, int end, @Nullable DotId id, List<DotStatement> body) {
            super(start, end);
            this.id = id;
            this.body = body;
        }

        /** If the body is exactly a rank assignment followed by plain node statements,
         * as in { rank=same; A; B }, return the rank kind, else null. */
        @Nullable
        public String getRankKind() {
            if (this.id != null || this.body.isEmpty())
                return null;
            if (!(this.body.get(0) instanceof Assignment assignment))
                return null;
            if (!assignment.key.value().equals("rank"))
                return null;
            for (int i = 1; i < this.body.size(); i++) {
                if (!(this.body.get(i) instanceof NodeStatement node) || !node.attributes.isEmpty())
                    return null;
            }
            return assignment.value.value();
        }

        @Override
        public void accept(DotVisitor visitor) {
            visitor.visit(this);
        }
    }

    public static Map<String, String> values(Map<String, DotId> attributes) {
        LinkedHashMap<String, String> result = new LinkedHashMap<>();
        for (var e: attributes.entrySet())
            result.put(e.getKey(), e.getValue().value());
        return result;
    }
}
