package org.graphdelta.dotEditor.parser;

/** A lexical token of DOT text.
 * @param kind   Token kind.
 * @param text   For QUOTED tokens the unescaped contents; for HTML tokens the text including
 *               the outer angle brackets; otherwise the source text.
 * @param start  Offset of the first character.
 * @param end    Offset after the last character. */
public record Token(Kind kind, String text, int start, int end) {
    public enum Kind {
        ID("identifier"),
        NUMERAL("number"),
        QUOTED("quoted string"),
        HTML("HTML string"),
        LBRACE("'{'"),
        RBRACE("'}'"),
        LBRACKET("'['"),
        RBRACKET("']'"),
        EQUAL("'='"),
        SEMI("';'"),
        COMMA("','"),
        COLON("':'"),
        ARROW("'->'"),
        DASHDASH("'--'"),
        PLUS("'+'"),
        EOF("end of input");

        public final String description;

        Kind(String description) {
            this.description = description;
        }
    }

    /** True for tokens that can be used as a DOT ID. */
    public boolean isId() {
        return switch (this.kind) {
            case ID, NUMERAL, QUOTED, HTML -> true;
            default -> false;
        };
    }

    /** True if this is an unquoted identifier equal to the keyword, ignoring case. */
    public boolean isKeyword(String keyword) {
        return this.kind == Kind.ID && this.text.equalsIgnoreCase(keyword);
    }

    public String describe() {
        if (!this.isId())
            return this.kind.description;
        return this.kind.description + " '" + this.text + "'";
    }
}
