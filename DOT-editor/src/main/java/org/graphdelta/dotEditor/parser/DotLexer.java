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
import org.graphdelta.util.Utilities;

import java.util.ArrayList;
import java.util.List;

/** Splits DOT text into tokens.  Comments (C and C++ style) and preprocessor-style
 * lines starting with '#' are skipped. */
public class DotLexer {
    private final String text;
    private int offset;

    public DotLexer(String text) {
        this.text = text;
        this.offset = 0;
    }

    ParseError error(String message, int at) {
        return new ParseError(message, SourcePosition.fromOffset(this.text, at));
    }

    char peekChar(int delta) {
        int index = this.offset + delta;
        return index < this.text.length() ? this.text.charAt(index) : '\0';
    }

    boolean atLineStart(int at) {
        for (int i = at - 1; i >= 0; i--) {
            char c = this.text.charAt(i);
            if (c == '\n')
                return true;
            if (c != ' ' && c != '\t' && c != '\r')
                return false;
        }
        return true;
    }

    void skipSpaceAndComments() {
        while (this.offset < this.text.length()) {
            char c = this.text.charAt(this.offset);
            if (Character.isWhitespace(c)) {
                this.offset++;
            } else if (c == '/' && this.peekChar(1) == '/') {
                this.skipToLineEnd();
            } else if (c == '#' && this.atLineStart(this.offset)) {
                this.skipToLineEnd();
            } else if (c == '/' && this.peekChar(1) == '*') {
                int close = this.text.indexOf("*/", this.offset + 2);
                if (close < 0)
                    throw this.error("Unterminated comment", this.offset);
                this.offset = close + 2;
            } else {
                return;
            }
        }
    }

    void skipToLineEnd() {
        int newline = this.text.indexOf('\n', this.offset);
        this.offset = newline < 0 ? this.text.length() : newline + 1;
    }

    static boolean isIdStart(char c) {
        return Character.isLetter(c) || c == '_' || c >= 0x80;
    }

    static boolean isIdPart(char c) {
        return isIdStart(c) || Character.isDigit(c);
    }

    Token quoted(int start) {
        StringBuilder raw = new StringBuilder();
        int i = start + 1;
        while (i < this.text.length()) {
            char c = this.text.charAt(i);
            if (c == '"') {
                this.offset = i + 1;
                return new Token(Token.Kind.QUOTED, Utilities.unescape(raw.toString()), start, this.offset);
            }
            if (c == '\\' && i + 1 < this.text.length()) {
                char next = this.text.charAt(i + 1);
                if (next == '\n') {
                    // line continuation
                    i += 2;
                    continue;
                }
                raw.append(c).append(next);
                i += 2;
                continue;
            }
            raw.append(c);
            i++;
        }
        throw this.error("Unterminated string", start);
    }

    Token html(int start) {
        int depth = 0;
        for (int i = start; i < this.text.length(); i++) {
            char c = this.text.charAt(i);
            if (c == '<') {
                depth++;
            } else if (c == '>') {
                depth--;
                if (depth == 0) {
                    this.offset = i + 1;
                    return new Token(Token.Kind.HTML, this.text.substring(start, this.offset), start, this.offset);
                }
            }
        }
        throw this.error("Unbalanced HTML string", start);
    }

    Token numeral(int start) {
        int i = start;
        if (this.text.charAt(i) == '-')
            i++;
        boolean digits = false;
        while (i < this.text.length() && Character.isDigit(this.text.charAt(i))) {
            i++;
            digits = true;
        }
        if (i < this.text.length() && this.text.charAt(i) == '.') {
            i++;
            while (i < this.text.length() && Character.isDigit(this.text.charAt(i))) {
                i++;
                digits = true;
            }
        }
        if (!digits)
            throw this.error("Malformed number", start);
        this.offset = i;
        return new Token(Token.Kind.NUMERAL, this.text.substring(start, i), start, i);
    }

    Token punctuation(Token.Kind kind, int length) {
        int start = this.offset;
        this.offset += length;
        return new Token(kind, this.text.substring(start, this.offset), start, this.offset);
    }

    public Token next() {
        this.skipSpaceAndComments();
        int start = this.offset;
        if (start >= this.text.length())
            return new Token(Token.Kind.EOF, "", start, start);
        char c = this.text.charAt(start);
        switch (c) {
            case '{': return this.punctuation(Token.Kind.LBRACE, 1);
            case '}': return this.punctuation(Token.Kind.RBRACE, 1);
            case '[': return this.punctuation(Token.Kind.LBRACKET, 1);
            case ']': return this.punctuation(Token.Kind.RBRACKET, 1);
            case '=': return this.punctuation(Token.Kind.EQUAL, 1);
            case ';': return this.punctuation(Token.Kind.SEMI, 1);
            case ',': return this.punctuation(Token.Kind.COMMA, 1);
            case ':': return this.punctuation(Token.Kind.COLON, 1);
            case '+': return this.punctuation(Token.Kind.PLUS, 1);
            case '"': return this.quoted(start);
            case '<': return this.html(start);
            case '-':
                if (this.peekChar(1) == '>')
                    return this.punctuation(Token.Kind.ARROW, 2);
                if (this.peekChar(1) == '-')
                    return this.punctuation(Token.Kind.DASHDASH, 2);
                return this.numeral(start);
            default:
                break;
        }
        if (Character.isDigit(c) || c == '.')
            return this.numeral(start);
        if (isIdStart(c)) {
            int i = start;
            while (i < this.text.length() && isIdPart(this.text.charAt(i)))
                i++;
            this.offset = i;
            return new Token(Token.Kind.ID, this.text.substring(start, i), start, i);
        }
        throw this.error("Unexpected character " + Utilities.singleQuote(String.valueOf(c)), start);
    }

    /** Tokenize the whole text; the last token is always EOF. */
    public List<Token> tokenize() {
        List<Token> result = new ArrayList<>();
        while (true) {
            Token token = this.next();
            result.add(token);
            if (token.kind() == Token.Kind.EOF)
                return result;
        }
    }
}
