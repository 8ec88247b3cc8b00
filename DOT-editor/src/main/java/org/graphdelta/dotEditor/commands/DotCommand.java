package org.graphdelta.dotEditor.commands;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.graphdelta.dotEditor.errors.CommandException;
import org.graphdelta.util.Utilities;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * An edit to a chunk list.  In JSON a command is an object whose "action" property
 * holds the snake_case name of the variant, e.g.
 * <pre>{"action":"create_node","id":"A","attrs":"label=\"x\""}</pre>
 * Optional properties are omitted when absent.
 * The {@code attrs} properties hold DOT attribute text, such as {@code label="x" shape=box}.
 */
public abstract class DotCommand {
    /** Name of the variant in JSON. */
    public abstract String getAction();

    /** Add the variant-specific properties. */
    abstract void addProperties(ObjectNode node);

    public ObjectNode toJson() {
        ObjectMapper mapper = Utilities.deterministicObjectMapper();
        ObjectNode result = mapper.createObjectNode();
        result.put("action", this.getAction());
        this.addProperties(result);
        return result;
    }

    static void putOptional(ObjectNode node, String property, @Nullable String value) {
        if (value != null)
            node.put(property, value);
    }

    public static DotCommand fromJson(JsonNode node) {
        if (!node.isObject())
            throw new CommandException(CommandException.ErrorCode.INVALID_COMMAND,
                    "Command must be a JSON object, got " + node);
        String action = Utilities.getStringProperty(node, "action");
        return switch (action) {
            case CreateNode.ACTION -> new CreateNode(
                    Utilities.getStringProperty(node, "id"),
                    Utilities.getOptionalStringProperty(node, "attrs"),
                    Utilities.getOptionalStringProperty(node, "parent"));
            case UpdateNode.ACTION -> new UpdateNode(
                    Utilities.getStringProperty(node, "id"),
                    Utilities.getOptionalStringProperty(node, "attrs"));
            case DeleteNode.ACTION -> new DeleteNode(
                    Utilities.getStringProperty(node, "id"),
                    Utilities.getOptionalBooleanProperty(node, "cascade", false));
            case CreateEdge.ACTION -> new CreateEdge(
                    Utilities.getStringProperty(node, "from"),
                    Utilities.getStringProperty(node, "to"),
                    Utilities.getOptionalStringProperty(node, "attrs"),
                    Utilities.getOptionalStringProperty(node, "parent"));
            case UpdateEdge.ACTION -> new UpdateEdge(
                    Utilities.getStringProperty(node, "from"),
                    Utilities.getStringProperty(node, "to"),
                    Utilities.getOptionalStringProperty(node, "attrs"));
            case DeleteEdge.ACTION -> new DeleteEdge(
                    Utilities.getStringProperty(node, "from"),
                    Utilities.getStringProperty(node, "to"));
            case CreateSubgraph.ACTION -> new CreateSubgraph(
                    Utilities.getOptionalStringProperty(node, "id"),
                    Utilities.getOptionalStringProperty(node, "parent"),
                    Utilities.getOptionalStringProperty(node, "attrs"));
            case DeleteSubgraph.ACTION -> new DeleteSubgraph(
                    Utilities.getStringProperty(node, "id"));
            case SetGraphAttr.ACTION -> new SetGraphAttr(
                    Utilities.getStringProperty(node, "key"),
                    Utilities.getStringProperty(node, "value"));
            case SetNodeDefault.ACTION -> new SetNodeDefault(
                    Utilities.getStringProperty(node, "attrs"));
            case SetEdgeDefault.ACTION -> new SetEdgeDefault(
                    Utilities.getStringProperty(node, "attrs"));
            case DeleteAttr.ACTION -> new DeleteAttr(
                    Utilities.getStringProperty(node, "key"));
            default -> throw new CommandException(CommandException.ErrorCode.INVALID_COMMAND,
                    "Unknown action " + Utilities.singleQuote(action));
        };
    }

    /** Decode either a single command object or an array of commands. */
    public static List<DotCommand> listFromJson(JsonNode node) {
        List<DotCommand> result = new ArrayList<>();
        if (node.isArray()) {
            for (JsonNode element: node)
                result.add(fromJson(element));
        } else {
            result.add(fromJson(node));
        }
        return result;
    }

    public static ArrayNode listToJson(List<DotCommand> commands) {
        ArrayNode result = Utilities.deterministicObjectMapper().createArrayNode();
        for (DotCommand command: commands)
            result.add(command.toJson());
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return this.toJson().equals(((DotCommand) o).toJson());
    }

    @Override
    public int hashCode() {
        return this.toJson().hashCode();
    }

    @Override
    public String toString() {
        return this.toJson().toPrettyString();
    }

    public static final class CreateNode extends DotCommand {
        public static final String ACTION = "create_node";
        public final String id;
        @Nullable
        public final String attrs;
        /** Id of the subgraph which should contain the node. */
        @Nullable
        public final String parent;

        public CreateNode(String id, @Nullable String attrs, @Nullable String parent) {
            this.id = Objects.requireNonNull(id);
            this.attrs = attrs;
            this.parent = parent;
        }

        public CreateNode(String id, @Nullable String attrs) {
            this(id, attrs, null);
        }

        @Override
        public String getAction() {
            return ACTION;
        }

        @Override
        void addProperties(ObjectNode node) {
            node.put("id", this.id);
            putOptional(node, "attrs", this.attrs);
            putOptional(node, "parent", this.parent);
        }
    }

    public static final class UpdateNode extends DotCommand {
        public static final String ACTION = "update_node";
        public final String id;
        @Nullable
        public final String attrs;

        public UpdateNode(String id, @Nullable String attrs) {
            this.id = Objects.requireNonNull(id);
            this.attrs = attrs;
        }

        @Override
        public String getAction() {
            return ACTION;
        }

        @Override
        void addProperties(ObjectNode node) {
            node.put("id", this.id);
            putOptional(node, "attrs", this.attrs);
        }
    }

    public static final class DeleteNode extends DotCommand {
        public static final String ACTION = "delete_node";
        public final String id;
        /** When true the edges incident to the node are deleted too. */
        public final boolean cascade;

        public DeleteNode(String id, boolean cascade) {
            this.id = Objects.requireNonNull(id);
            this.cascade = cascade;
        }

        public DeleteNode(String id) {
            this(id, false);
        }

        @Override
        public String getAction() {
            return ACTION;
        }

        @Override
        void addProperties(ObjectNode node) {
            node.put("id", this.id);
            if (this.cascade)
                node.put("cascade", true);
        }
    }

    public static final class CreateEdge extends DotCommand {
        public static final String ACTION = "create_edge";
        public final String from;
        public final String to;
        @Nullable
        public final String attrs;
        @Nullable
        public final String parent;

        public CreateEdge(String from, String to, @Nullable String attrs, @Nullable String parent) {
            this.from = Objects.requireNonNull(from);
            this.to = Objects.requireNonNull(to);
            this.attrs = attrs;
            this.parent = parent;
        }

        public CreateEdge(String from, String to, @Nullable String attrs) {
            this(from, to, attrs, null);
        }

        @Override
        public String getAction() {
            return ACTION;
        }

        @Override
        void addProperties(ObjectNode node) {
            node.put("from", this.from);
            node.put("to", this.to);
            putOptional(node, "attrs", this.attrs);
            putOptional(node, "parent", this.parent);
        }
    }

    /** Creates the edge if it does not exist. */
    public static final class UpdateEdge extends DotCommand {
        public static final String ACTION = "update_edge";
        public final String from;
        public final String to;
        @Nullable
        public final String attrs;

        public UpdateEdge(String from, String to, @Nullable String attrs) {
            this.from = Objects.requireNonNull(from);
            this.to = Objects.requireNonNull(to);
            this.attrs = attrs;
        }

        @Override
        public String getAction() {
            return ACTION;
        }

        @Override
        void addProperties(ObjectNode node) {
            node.put("from", this.from);
            node.put("to", this.to);
            putOptional(node, "attrs", this.attrs);
        }
    }

    public static final class DeleteEdge extends DotCommand {
        public static final String ACTION = "delete_edge";
        public final String from;
        public final String to;

        public DeleteEdge(String from, String to) {
            this.from = Objects.requireNonNull(from);
            this.to = Objects.requireNonNull(to);
        }

        @Override
        public String getAction() {
            return ACTION;
        }

        @Override
        void addProperties(ObjectNode node) {
            node.put("from", this.from);
            node.put("to", this.to);
        }
    }

    public static final class CreateSubgraph extends DotCommand {
        public static final String ACTION = "create_subgraph";
        /** Null for an anonymous subgraph. */
        @Nullable
        public final String id;
        @Nullable
        public final String parent;
        @Nullable
        public final String attrs;

        public CreateSubgraph(@Nullable String id, @Nullable String parent, @Nullable String attrs) {
            this.id = id;
            this.parent = parent;
            this.attrs = attrs;
        }

        public CreateSubgraph(@Nullable String id, @Nullable String parent) {
            this(id, parent, null);
        }

        @Override
        public String getAction() {
            return ACTION;
        }

        @Override
        void addProperties(ObjectNode node) {
            putOptional(node, "id", this.id);
            putOptional(node, "parent", this.parent);
            putOptional(node, "attrs", this.attrs);
        }
    }

    public static final class DeleteSubgraph extends DotCommand {
        public static final String ACTION = "delete_subgraph";
        public final String id;

        public DeleteSubgraph(String id) {
            this.id = Objects.requireNonNull(id);
        }

        @Override
        public String getAction() {
            return ACTION;
        }

        @Override
        void addProperties(ObjectNode node) {
            node.put("id", this.id);
        }
    }

    public static final class SetGraphAttr extends DotCommand {
        public static final String ACTION = "set_graph_attr";
        public final String key;
        public final String value;

        public SetGraphAttr(String key, String value) {
            this.key = Objects.requireNonNull(key);
            this.value = Objects.requireNonNull(value);
        }

        @Override
        public String getAction() {
            return ACTION;
        }

        @Override
        void addProperties(ObjectNode node) {
            node.put("key", this.key);
            node.put("value", this.value);
        }
    }

    public static final class SetNodeDefault extends DotCommand {
        public static final String ACTION = "set_node_default";
        public final String attrs;

        public SetNodeDefault(String attrs) {
            this.attrs = Objects.requireNonNull(attrs);
        }

        @Override
        public String getAction() {
            return ACTION;
        }

        @Override
        void addProperties(ObjectNode node) {
            node.put("attrs", this.attrs);
        }
    }

    public static final class SetEdgeDefault extends DotCommand {
        public static final String ACTION = "set_edge_default";
        public final String attrs;

        public SetEdgeDefault(String attrs) {
            this.attrs = Objects.requireNonNull(attrs);
        }

        @Override
        public String getAction() {
            return ACTION;
        }

        @Override
        void addProperties(ObjectNode node) {
            node.put("attrs", this.attrs);
        }
    }

    /** Removes a graph-level assignment. */
    public static final class DeleteAttr extends DotCommand {
        public static final String ACTION = "delete_attr";
        public final String key;

        public DeleteAttr(String key) {
            this.key = Objects.requireNonNull(key);
        }

        @Override
        public String getAction() {
            return ACTION;
        }

        @Override
        void addProperties(ObjectNode node) {
            node.put("key", this.key);
        }
    }
}
