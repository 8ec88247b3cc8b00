package org.graphdelta.dotEditor.dsl;

import org.graphdelta.dotEditor.backend.DotFormat;
import org.graphdelta.dotEditor.commands.DotCommand;
import org.graphdelta.dotEditor.dsl.DslCommand.ClusterCmd;
import org.graphdelta.dotEditor.dsl.DslCommand.EdgeCmd;
import org.graphdelta.dotEditor.dsl.DslCommand.GlobalCmd;
import org.graphdelta.dotEditor.dsl.DslCommand.NodeCmd;
import org.graphdelta.dotEditor.dsl.DslCommand.RankCmd;
import org.graphdelta.dotEditor.errors.UnimplementedException;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Translates {@link DslCommand}s into {@link DotCommand}s.
 * Only commands whose meaning is the same in both languages are translated;
 * the others throw {@link UnimplementedException}.
 */
public final class DslLowering {
    private DslLowering() {}

    @Nullable
    static String attributes(Map<String, String> attrs) {
        if (attrs.isEmpty())
            return null;
        return DotFormat.formatAttributes(attrs);
    }

    public static List<DotCommand> lower(DslCommand command) {
        List<DotCommand> result = new ArrayList<>();
        if (command instanceof NodeCmd c) {
            switch (c.operation) {
                case ADD -> result.add(new DotCommand.CreateNode(c.id, attributes(c.attrs)));
                case UPDATE -> {
                    if (c.attrs.containsKey(DslInterpreter.RENAME_KEY))
                        throw new UnimplementedException("Renaming node " + c.id);
                    result.add(new DotCommand.UpdateNode(c.id, attributes(c.attrs)));
                }
                case DELETE -> result.add(new DotCommand.DeleteNode(c.id, true));
                case MOVE -> throw new UnimplementedException("Moving node " + c.id);
            }
        } else if (command instanceof EdgeCmd c) {
            switch (c.operation) {
                case ADD -> result.add(new DotCommand.CreateEdge(c.from, c.to, attributes(c.attrs)));
                case UPDATE -> result.add(new DotCommand.UpdateEdge(c.from, c.to, attributes(c.attrs)));
                case DELETE -> result.add(new DotCommand.DeleteEdge(c.from, c.to));
                case MOVE -> throw new UnimplementedException("Moving edge " + c.from + " -> " + c.to);
            }
        } else if (command instanceof ClusterCmd c) {
            switch (c.operation) {
                case ADD -> result.add(new DotCommand.CreateSubgraph(c.clusterId(), null, attributes(c.attrs)));
                // DeleteSubgraph also removes the contents, the DSL keeps them.
                case UPDATE, DELETE, MOVE -> throw new UnimplementedException(
                        c.operation.name().toLowerCase() + " of cluster " + c.clusterId());
            }
        } else if (command instanceof GlobalCmd c) {
            switch (c.target) {
                case GRAPH -> {
                    for (var e: c.attrs.entrySet())
                        result.add(new DotCommand.SetGraphAttr(e.getKey(), e.getValue()));
                }
                case NODE -> result.add(new DotCommand.SetNodeDefault(DotFormat.formatAttributes(c.attrs)));
                case EDGE -> result.add(new DotCommand.SetEdgeDefault(DotFormat.formatAttributes(c.attrs)));
            }
        } else if (command instanceof RankCmd c) {
            throw new UnimplementedException("Rank group " + c.kind.dotName());
        } else {
            throw new UnimplementedException(command.getClass().getSimpleName());
        }
        return result;
    }

    /** Lower a whole script; fails on the first command without a counterpart. */
    public static List<DotCommand> lowerAll(List<DslCommand> commands) {
        List<DotCommand> result = new ArrayList<>();
        for (DslCommand command: commands)
            result.addAll(lower(command));
        return result;
    }
}
