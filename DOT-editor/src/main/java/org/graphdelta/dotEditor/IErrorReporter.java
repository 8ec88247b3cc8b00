package org.graphdelta.dotEditor;

import org.graphdelta.dotEditor.errors.BaseEditorException;
import org.graphdelta.dotEditor.errors.IHasSourcePositionRange;
import org.graphdelta.dotEditor.errors.SourcePositionRange;

/** Interface for reporting errors and warnings without aborting the current operation. */
public interface IErrorReporter {
    void reportProblem(IHasSourcePositionRange range, boolean warning, String errorType, String message);

    default void reportError(BaseEditorException e) {
        this.reportProblem(e, false, e.getErrorKind(), e.getMessage() != null ? e.getMessage() : "");
    }

    default void reportError(SourcePositionRange range, String errorType, String message) {
        this.reportProblem(range, false, errorType, message);
    }

    default void reportWarning(SourcePositionRange range, String errorType, String message) {
        this.reportProblem(range, true, errorType, message);
    }

    /** True if any error (but not a warning) has been reported. */
    boolean hasErrors();
}
