/*
 * Copyright 2022 VMware, Inc.
 * SPDX-License-Identifier: MIT
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package org.graphdelta.dotEditor.parser;

import org.graphdelta.dotEditor.errors.ParseError;
import org.graphdelta.dotEditor.errors.SourcePosition;
import org.graphdelta.dotEditor.errors.SourcePositionRange;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Recursive-descent parser for the subset of DOT handled by the editor.
 * Alternatives are tried in a fixed order:
 * assignment, attribute statement, edge statement, subgraph, node statement.
 * Text after the closing brace of the graph is never examined.
 */
public class DotParser {
    private final String text;
    private final DotLexer lexer;
    /** Tokens read ahead of the current position. */
    private final List<Token> lookahead = new ArrayList<>();
    /** End offset of the last token consumed. */
    private int lastEnd = 0;

    public DotParser(String text) {
        this.text = text;
        this.lexer = new DotLexer(text);
    }

    /** Parse a complete DOT graph.
     * @throws ParseError if the text is not a graph. */
    public static DotGraph parse(String text) {
        return new DotParser(text).parseGraph();
    }

    /** Parse a stand-alone attribute list such as {@code label="x", shape=box}.
     * The list may be enclosed in square brackets; pairs may be separated by
     * whitespace, commas, or semicolons.  Quoted values are unescaped.
     * @throws ParseError if the text is not an attribute list. */
    public static LinkedHashMap<String, String> parseAttributes(String text) {
        DotParser parser = new DotParser(text);
        LinkedHashMap<String, DotId> attributes = new LinkedHashMap<>();
        if (parser.peek(0).kind() == Token.Kind.LBRACKET) {
            attributes = parser.attrList();
        } else {
            parser.aList(attributes, Token.Kind.EOF);
        }
        parser.expect(Token.Kind.EOF);
        LinkedHashMap<String, String> result = new LinkedHashMap<>();
        for (var e: attributes.entrySet())
            result.put(e.getKey(), e.getValue().value());
        return result;
    }

    Token peek(int index) {
        while (this.lookahead.size() <= index) {
            if (!this.lookahead.isEmpty() &&
                    this.lookahead.get(this.lookahead.size() - 1).kind() == Token.Kind.EOF) {
                this.lookahead.add(this.lookahead.get(this.lookahead.size() - 1));
            } else {
                this.lookahead.add(this.lexer.next());
            }
        }
        return this.lookahead.get(index);
    }

    Token advance() {
        Token result = this.peek(0);
        this.lookahead.remove(0);
        this.lastEnd = result.end();
        return result;
    }

    boolean at(Token.Kind kind) {
        return this.peek(0).kind() == kind;
    }

    boolean accept(Token.Kind kind) {
        if (this.at(kind)) {
            this.advance();
            return true;
        }
        return false;
    }

    ParseError error(Token found, String expected) {
        SourcePositionRange range = new SourcePositionRange(
                SourcePosition.fromOffset(this.text, found.start()),
                SourcePosition.fromOffset(this.text, Math.max(found.start(), found.end() - 1)));
        return new ParseError("Expected " + expected + " but found " + found.describe(), range);
    }

    Token expect(Token.Kind kind) {
        Token token = this.peek(0);
        if (token.kind() != kind)
            throw this.error(token, kind.description);
        return this.advance();
    }

    DotGraph parseGraph() {
        boolean strict = false;
        int start = this.peek(0).start();
        if (this.peek(0).isKeyword("strict")) {
            this.advance();
            strict = true;
        }
        Token kind = this.peek(0);
        boolean directed;
        if (kind.isKeyword("digraph")) {
            directed = true;
        } else if (kind.isKeyword("graph")) {
            directed = false;
        } else {
            throw this.error(kind, "'graph' or 'digraph'");
        }
        this.advance();
        DotId id = null;
        if (this.peek(0).isId())
            id = this.id();
        this.expect(Token.Kind.LBRACE);
        List<DotStatement> body = this.stmtList();
        this.expect(Token.Kind.RBRACE);
        return new DotGraph(strict, directed, id, body, this.text, start);
    }

    List<DotStatement> stmtList() {
        List<DotStatement> result = new ArrayList<>();
        while (!this.at(Token.Kind.RBRACE)) {
            if (this.at(Token.Kind.EOF))
                throw this.error(this.peek(0), "'}'");
            result.add(this.stmt());
            this.accept(Token.Kind.SEMI);
        }
        return result;
    }

    boolean isKeyword(Token token) {
        return token.isKeyword("graph") || token.isKeyword("node") || token.isKeyword("edge")
                || token.isKeyword("subgraph") || token.isKeyword("digraph") || token.isKeyword("strict");
    }

    DotStatement stmt() {
        Token first = this.peek(0);
        int start = first.start();
        if (first.isId() && !this.isKeyword(first) && this.peek(1).kind() == Token.Kind.EQUAL) {
            DotId key = this.id();
            this.expect(Token.Kind.EQUAL);
            DotId value = this.id();
            return new DotStatement.Assignment(start, this.lastEnd, key, value);
        }
        if (first.isKeyword("graph") || first.isKeyword("node") || first.isKeyword("edge")) {
            this.advance();
            if (!this.at(Token.Kind.LBRACKET))
                throw this.error(this.peek(0), "'['");
            LinkedHashMap<String, DotId> attributes = this.attrList();
            return new DotStatement.AttrStatement(
                    start, this.lastEnd, first.text().toLowerCase(), attributes);
        }
        if (first.isKeyword("subgraph") || first.kind() == Token.Kind.LBRACE) {
            DotStatement.Subgraph subgraph = this.subgraph();
            if (this.at(Token.Kind.ARROW) || this.at(Token.Kind.DASHDASH))
                throw new ParseError("Subgraphs cannot be used as edge operands",
                        SourcePosition.fromOffset(this.text, this.peek(0).start()));
            return subgraph;
        }
        if (!first.isId() || this.isKeyword(first))
            throw this.error(first, "statement");
        DotNodeId node = this.nodeId();
        if (this.at(Token.Kind.ARROW) || this.at(Token.Kind.DASHDASH)) {
            List<DotNodeId> operands = new ArrayList<>();
            operands.add(node);
            while (this.accept(Token.Kind.ARROW) || this.accept(Token.Kind.DASHDASH)) {
                Token next = this.peek(0);
                if (next.kind() == Token.Kind.LBRACE || next.isKeyword("subgraph"))
                    throw this.error(next, "node identifier; subgraphs cannot be used as edge operands");
                operands.add(this.nodeId());
            }
            LinkedHashMap<String, DotId> attributes = new LinkedHashMap<>();
            if (this.at(Token.Kind.LBRACKET))
                attributes = this.attrList();
            return new DotStatement.EdgeStatement(start, this.lastEnd, operands, attributes);
        }
        LinkedHashMap<String, DotId> attributes = new LinkedHashMap<>();
        if (this.at(Token.Kind.LBRACKET))
            attributes = this.attrList();
        return new DotStatement.NodeStatement(start, this.lastEnd, node, attributes);
    }

    DotStatement.Subgraph subgraph() {
        int start = this.peek(0).start();
        DotId id = null;
        if (this.peek(0).isKeyword("subgraph")) {
            this.advance();
            if (this.peek(0).isId())
                id = this.id();
        }
        this.expect(Token.Kind.LBRACE);
        List<DotStatement> body = this.stmtList();
        this.expect(Token.Kind.RBRACE);
        return new DotStatement.Subgraph(start, this.lastEnd, id, body);
    }

    DotNodeId nodeId() {
        DotId id = this.id();
        DotId port = null;
        DotId compass = null;
        if (this.accept(Token.Kind.COLON)) {
            port = this.id();
            if (this.accept(Token.Kind.COLON))
                compass = this.id();
        }
        return new DotNodeId(id, port, compass);
    }

    /** One or more bracketed lists; later keys override earlier ones. */
    LinkedHashMap<String, DotId> attrList() {
        LinkedHashMap<String, DotId> result = new LinkedHashMap<>();
        while (this.accept(Token.Kind.LBRACKET)) {
            this.aList(result, Token.Kind.RBRACKET);
            this.expect(Token.Kind.RBRACKET);
        }
        return result;
    }

    void aList(LinkedHashMap<String, DotId> into, Token.Kind terminator) {
        while (!this.at(terminator)) {
            Token keyToken = this.peek(0);
            if (!keyToken.isId())
                throw this.error(keyToken, "attribute name");
            DotId key = this.id();
            this.expect(Token.Kind.EQUAL);
            DotId value = this.id();
            into.put(key.value(), value);
            if (!this.accept(Token.Kind.COMMA))
                this.accept(Token.Kind.SEMI);
        }
    }

    DotId id() {
        Token token = this.peek(0);
        switch (token.kind()) {
            case ID:
                this.advance();
                return new DotId(token.text(), DotId.Kind.BARE);
            case NUMERAL:
                this.advance();
                return new DotId(token.text(), DotId.Kind.NUMERAL);
            case HTML:
                this.advance();
                return new DotId(token.text(), DotId.Kind.HTML);
            case QUOTED: {
                this.advance();
                StringBuilder value = new StringBuilder(token.text());
                while (this.at(Token.Kind.PLUS)) {
                    this.advance();
                    value.append(this.expect(Token.Kind.QUOTED).text());
                }
                return new DotId(value.toString(), DotId.Kind.QUOTED);
            }
            default:
                throw this.error(token, "identifier");
        }
    }
}
