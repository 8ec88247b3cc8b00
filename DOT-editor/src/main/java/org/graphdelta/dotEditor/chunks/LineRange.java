package org.graphdelta.dotEditor.chunks;

/** An inclusive range of source lines.  (0,0) marks a chunk created by an edit
 * which has no position in the original text. */
public record LineRange(int start, int end) {
    public static final LineRange SYNTHETIC = new LineRange(0, 0);

    public boolean isSynthetic() {
        return this.start == 0 && this.end == 0;
    }

    /** Strict containment, used to decide nesting. */
    public boolean strictlyContains(LineRange other) {
        return other.start > this.start && other.end < this.end;
    }

    /** Inclusive containment, used when deleting a subgraph with its contents. */
    public boolean includes(LineRange other) {
        return other.start >= this.start && other.end <= this.end;
    }

    @Override
    public String toString() {
        return "(" + this.start + "," + this.end + ")";
    }
}
