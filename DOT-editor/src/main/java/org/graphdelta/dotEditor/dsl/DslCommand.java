package org.graphdelta.dotEditor.dsl;

import javax.annotation.Nullable;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** A command of the line-oriented editing language.  Attribute values are unquoted. */
public abstract class DslCommand {
    /** The source line the command was parsed from; 0 for commands built in code. */
    public final int line;

    protected DslCommand(int line) {
        this.line = line;
    }

    public enum Operation {
        ADD,
        UPDATE,
        DELETE,
        /** Only meaningful for clusters. */
        MOVE
    }

    /** Components compared by equals. */
    abstract List<Object> components();

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return this.components().equals(((DslCommand) o).components());
    }

    @Override
    public int hashCode() {
        return this.components().hashCode();
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + this.components();
    }

    public static final class NodeCmd extends DslCommand {
        public final Operation operation;
        public final String id;
        public final LinkedHashMap<String, String> attrs;

        public NodeCmd(int line, Operation operation, String id, Map<String, String> attrs) {
            super(line);
            this.operation = operation;
            this.id = Objects.requireNonNull(id);
            this.attrs = new LinkedHashMap<>(attrs);
        }

        @Override
        List<Object> components() {
            return List.of(this.operation, this.id, this.attrs);
        }
    }

    public static final class EdgeCmd extends DslCommand {
        public final Operation operation;
        public final String from;
        public final String to;
        public final LinkedHashMap<String, String> attrs;

        public EdgeCmd(int line, Operation operation, String from, String to, Map<String, String> attrs) {
            super(line);
            this.operation = operation;
            this.from = Objects.requireNonNull(from);
            this.to = Objects.requireNonNull(to);
            this.attrs = new LinkedHashMap<>(attrs);
        }

        @Override
        List<Object> components() {
            return List.of(this.operation, this.from, this.to, this.attrs);
        }
    }

    public static final class ClusterCmd extends DslCommand {
        public static final String PREFIX = "cluster_";

        public final Operation operation;
        /** The cluster id as written; see {@link #clusterId()}. */
        public final String id;
        public final LinkedHashMap<String, String> attrs;
        /** The node to move, for MOVE. */
        @Nullable
        public final String node;

        public ClusterCmd(int line, Operation operation, String id,
                          Map<String, String> attrs, @Nullable String node) {
            super(line);
            this.operation = operation;
            this.id = Objects.requireNonNull(id);
            this.attrs = new LinkedHashMap<>(attrs);
            this.node = node;
        }

        /** Graphviz draws a box only around subgraphs whose name starts with "cluster". */
        public String clusterId() {
            return normalize(this.id);
        }

        public static String normalize(String id) {
            return id.startsWith(PREFIX) ? id : PREFIX + id;
        }

        @Override
        List<Object> components() {
            return List.of(this.operation, this.id, this.attrs, Objects.requireNonNullElse(this.node, ""));
        }
    }

    public static final class GlobalCmd extends DslCommand {
        public enum Target {
            GRAPH("graph"),
            NODE("node"),
            EDGE("edge");

            /** Target of the DOT attribute statement. */
            public final String statement;

            Target(String statement) {
                this.statement = statement;
            }
        }

        public final Target target;
        public final LinkedHashMap<String, String> attrs;

        public GlobalCmd(int line, Target target, Map<String, String> attrs) {
            super(line);
            this.target = target;
            this.attrs = new LinkedHashMap<>(attrs);
        }

        @Override
        List<Object> components() {
            return List.of(this.target, this.attrs);
        }
    }

    public static final class RankCmd extends DslCommand {
        public enum Kind {
            SAME,
            MIN,
            MAX,
            SOURCE,
            SINK;

            public String dotName() {
                return this.name().toLowerCase();
            }
        }

        public final Kind kind;
        public final List<String> nodes;

        public RankCmd(int line, Kind kind, List<String> nodes) {
            super(line);
            this.kind = kind;
            this.nodes = List.copyOf(nodes);
        }

        @Override
        List<Object> components() {
            return List.of(this.kind, this.nodes);
        }
    }
}
