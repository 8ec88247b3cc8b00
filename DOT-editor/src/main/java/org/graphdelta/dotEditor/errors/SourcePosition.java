package org.graphdelta.dotEditor.errors;

/** A position in a source text; lines and columns start at 1. */
public class SourcePosition implements Comparable<SourcePosition> {
    public final int line;
    public final int column;

    public static final SourcePosition INVALID = new SourcePosition(0, 0);

    public SourcePosition(int line, int column) {
        this.line = line;
        this.column = column;
    }

    public boolean isValid() {
        return this.line > 0 && this.column > 0;
    }

    /** Compute the position of a character offset within a text. */
    public static SourcePosition fromOffset(String text, int offset) {
        int line = 1;
        int lineStart = 0;
        int limit = Math.min(offset, text.length());
        for (int i = 0; i < limit; i++) {
            if (text.charAt(i) == '\n') {
                line++;
                lineStart = i + 1;
            }
        }
        return new SourcePosition(line, offset - lineStart + 1);
    }

    public boolean beforeOrEqual(SourcePosition other) {
        return this.compareTo(other) <= 0;
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        SourcePosition that = (SourcePosition) o;
        return this.line == that.line && this.column == that.column;
    }

    @Override
    public int hashCode() {
        return 31 * this.line + this.column;
    }

    @Override
    public int compareTo(SourcePosition other) {
        int compare = Integer.compare(this.line, other.line);
        if (compare != 0)
            return compare;
        return Integer.compare(this.column, other.column);
    }

    @Override
    public String toString() {
        return this.line + ":" + this.column;
    }
}
