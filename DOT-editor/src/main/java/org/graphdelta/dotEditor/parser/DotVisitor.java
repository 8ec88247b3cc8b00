package org.graphdelta.dotEditor.parser;

/** Visitor over DOT statements.  The default for subgraphs visits the body in order. */
public interface DotVisitor {
    void visit(DotStatement.NodeStatement statement);

    void visit(DotStatement.EdgeStatement statement);

    void visit(DotStatement.AttrStatement statement);

    void visit(DotStatement.Assignment statement);

    default void visit(DotStatement.Subgraph statement) {
        for (DotStatement child: statement.body)
            child.accept(this);
    }
}
