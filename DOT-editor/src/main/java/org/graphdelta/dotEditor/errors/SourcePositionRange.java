package org.graphdelta.dotEditor.errors;

import com.fasterxml.jackson.databind.node.ObjectNode;

/** A range of characters in a source text, with an inclusive end. */
public class SourcePositionRange implements IHasSourcePositionRange {
    public final SourcePosition start;
    public final SourcePosition end;

    public static final SourcePositionRange INVALID =
            new SourcePositionRange(SourcePosition.INVALID, SourcePosition.INVALID);

    public SourcePositionRange(SourcePosition start, SourcePosition end) {
        this.start = start;
        this.end = end;
    }

    /** A range covering a single character. */
    public SourcePositionRange(SourcePosition position) {
        this(position, position);
    }

    public boolean isValid() {
        return this.start.isValid() && this.end.isValid();
    }

    public boolean includes(SourcePosition position) {
        return this.start.beforeOrEqual(position) && position.beforeOrEqual(this.end);
    }

    @Override
    public SourcePositionRange getPositionRange() {
        return this;
    }

    /** Append the position information to a JSON node */
    public void appendAsJson(ObjectNode parent) {
        parent.put("start_line_number", this.start.line);
        parent.put("start_column", this.start.column);
        parent.put("end_line_number", this.end.line);
        parent.put("end_column", this.end.column);
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        SourcePositionRange that = (SourcePositionRange) o;
        return this.start.equals(that.start) && this.end.equals(that.end);
    }

    @Override
    public int hashCode() {
        return 31 * this.start.hashCode() + this.end.hashCode();
    }

    @Override
    public String toString() {
        return this.start + "--" + this.end;
    }
}
