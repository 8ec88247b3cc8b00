package org.graphdelta.dotEditor.parser;

/** A DOT identifier as written in the source.
 * @param value  Unquoted value; HTML strings keep their angle brackets.
 * @param kind   How the identifier was written. */
public record DotId(String value, Kind kind) {
    public enum Kind {
        BARE,
        NUMERAL,
        QUOTED,
        HTML
    }

    public boolean isHtml() {
        return this.kind == Kind.HTML;
    }

    @Override
    public String toString() {
        return this.value;
    }
}
