package org.graphdelta.dotEditor.errors;

public interface IHasSourcePositionRange {
    SourcePositionRange getPositionRange();
}
