package org.graphdelta.dotEditor.errors;

import javax.annotation.Nullable;

/** Base class for all exceptions raised while parsing or editing a graph. */
public abstract class BaseEditorException extends RuntimeException implements IHasSourcePositionRange {
    protected final SourcePositionRange range;

    protected BaseEditorException(String message, SourcePositionRange range, @Nullable Throwable cause) {
        super(message, cause);
        this.range = range;
    }

    protected BaseEditorException(String message, SourcePositionRange range) {
        this(message, range, null);
    }

    protected BaseEditorException(String message) {
        this(message, SourcePositionRange.INVALID, null);
    }

    @Override
    public SourcePositionRange getPositionRange() {
        return this.range;
    }

    /** Short human-readable category of the error. */
    public abstract String getErrorKind();
}
