package org.graphdelta.dotEditor.errors;

/** Raised when DOT text, attribute text, or DSL text does not conform to its grammar.
 * No partial result is ever produced together with this error. */
public class ParseError extends BaseEditorException {
    public static final String KIND = "Parse error";

    public ParseError(String message, SourcePositionRange range) {
        super(message, range);
    }

    public ParseError(String message, SourcePosition position) {
        this(message, new SourcePositionRange(position));
    }

    public ParseError(String message) {
        super(message);
    }

    @Override
    public String getErrorKind() {
        return KIND;
    }
}
