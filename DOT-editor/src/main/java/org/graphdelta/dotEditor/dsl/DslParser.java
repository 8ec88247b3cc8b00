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

package org.graphdelta.dotEditor.dsl;

import org.graphdelta.dotEditor.dsl.DslCommand.ClusterCmd;
import org.graphdelta.dotEditor.dsl.DslCommand.EdgeCmd;
import org.graphdelta.dotEditor.dsl.DslCommand.GlobalCmd;
import org.graphdelta.dotEditor.dsl.DslCommand.NodeCmd;
import org.graphdelta.dotEditor.dsl.DslCommand.Operation;
import org.graphdelta.dotEditor.dsl.DslCommand.RankCmd;
import org.graphdelta.dotEditor.errors.ParseError;
import org.graphdelta.dotEditor.errors.SourcePosition;
import org.graphdelta.util.Utilities;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;

/**
 * Parser for the line-oriented editing language.  Each non-blank line holds one command:
 * <pre>
 * node: A, "Label", color=red
 * update_node: A {id: B}
 * edge: A, B, label="x"
 * cluster: backend, "Back end"
 * graph: rankdir=LR
 * rank_same: A, B
 * </pre>
 * Lines starting with '#', '//' or a Markdown code fence are ignored.
 * Attributes are key=value pairs, optionally grouped in braces,
 * where key: value is also accepted.  Values may be bare, quoted, or HTML strings.
 */
public class DslParser {
    /** The arguments of one command line. */
    static final class Arguments {
        final List<String> positional = new ArrayList<>();
        final LinkedHashMap<String, String> attrs = new LinkedHashMap<>();
    }

    private final int lineNumber;
    private final String line;
    private int column;

    DslParser(int lineNumber, String line) {
        this.lineNumber = lineNumber;
        this.line = line;
        this.column = 0;
    }

    /** Parse a whole script.
     * @throws ParseError on the first malformed line; nothing is returned in that case. */
    public static List<DslCommand> parse(String script) {
        List<DslCommand> result = new ArrayList<>();
        String[] lines = script.split("\r?\n", -1);
        for (int i = 0; i < lines.length; i++) {
            String text = lines[i].strip();
            if (text.isEmpty() || text.startsWith("#") || text.startsWith("//") || text.startsWith("```"))
                continue;
            result.add(new DslParser(i + 1, lines[i]).command());
        }
        return result;
    }

    ParseError error(String message) {
        return new ParseError(message, new SourcePosition(this.lineNumber, this.column + 1));
    }

    boolean atEnd() {
        this.skipSpaces();
        return this.column >= this.line.length();
    }

    char peek() {
        this.skipSpaces();
        return this.column < this.line.length() ? this.line.charAt(this.column) : '\0';
    }

    void skipSpaces() {
        while (this.column < this.line.length() && Character.isWhitespace(this.line.charAt(this.column)))
            this.column++;
    }

    void expect(char c) {
        if (this.peek() != c)
            throw this.error("Expected " + Utilities.singleQuote(String.valueOf(c)));
        this.column++;
    }

    static boolean isBareChar(char c, boolean inBraces) {
        if (Character.isLetterOrDigit(c))
            return true;
        return switch (c) {
            case '_', '.', '-', '#', '/', '+', '%' -> true;
            case ':' -> !inBraces;
            default -> false;
        };
    }

    String value(boolean inBraces) {
        char c = this.peek();
        int start = this.column;
        if (c == '"') {
            StringBuilder raw = new StringBuilder();
            this.column++;
            while (this.column < this.line.length()) {
                char d = this.line.charAt(this.column);
                if (d == '"') {
                    this.column++;
                    return Utilities.unescape(raw.toString());
                }
                if (d == '\\' && this.column + 1 < this.line.length()) {
                    raw.append(d).append(this.line.charAt(this.column + 1));
                    this.column += 2;
                    continue;
                }
                raw.append(d);
                this.column++;
            }
            this.column = start;
            throw this.error("Unterminated string");
        }
        if (c == '<') {
            int depth = 0;
            for (int i = start; i < this.line.length(); i++) {
                char d = this.line.charAt(i);
                if (d == '<') {
                    depth++;
                } else if (d == '>' && --depth == 0) {
                    this.column = i + 1;
                    return this.line.substring(start, i + 1);
                }
            }
            throw this.error("Unbalanced HTML string");
        }
        while (this.column < this.line.length() && isBareChar(this.line.charAt(this.column), inBraces))
            this.column++;
        if (this.column == start)
            throw this.error("Expected a value");
        return this.line.substring(start, this.column);
    }

    /** Parse pairs inside braces; the opening brace has been consumed. */
    void braces(Arguments into) {
        while (this.peek() != '}') {
            if (this.atEnd())
                throw this.error("Expected '}'");
            String key = this.value(true);
            char separator = this.peek();
            if (separator != '=' && separator != ':')
                throw this.error("Expected '=' or ':' after " + Utilities.singleQuote(key));
            this.column++;
            into.attrs.put(key, this.value(true));
            if (this.peek() == ',')
                this.column++;
        }
        this.column++;
    }

    Arguments arguments() {
        Arguments result = new Arguments();
        while (!this.atEnd()) {
            if (this.peek() == '{') {
                this.column++;
                this.braces(result);
            } else {
                String argument = this.value(false);
                if (this.peek() == '=') {
                    this.column++;
                    result.attrs.put(argument, this.value(false));
                } else {
                    if (!result.attrs.isEmpty())
                        throw this.error("Positional argument " + Utilities.singleQuote(argument) +
                                " after attributes");
                    result.positional.add(argument);
                }
            }
            if (this.peek() == ',') {
                this.column++;
                if (this.atEnd())
                    throw this.error("Expected an argument after ','");
            }
        }
        return result;
    }

    /** Check the count of positional arguments; one optional trailing label is allowed
     * when withLabel is set, and becomes the first attribute. */
    LinkedHashMap<String, String> shape(String keyword, Arguments arguments, int required, boolean withLabel) {
        int count = arguments.positional.size();
        int max = required + (withLabel ? 1 : 0);
        if (count < required || count > max)
            throw this.error(Utilities.singleQuote(keyword) + " expects " +
                    (required == max ? required : required + " or " + max) +
                    " positional arguments, got " + count);
        LinkedHashMap<String, String> attrs = new LinkedHashMap<>();
        if (count > required)
            attrs.put("label", arguments.positional.get(required));
        attrs.putAll(arguments.attrs);
        return attrs;
    }


    void noAttributes(String keyword, Arguments arguments) {
        if (!arguments.attrs.isEmpty())
            throw this.error(Utilities.singleQuote(keyword) + " does not take attributes");
    }

    DslCommand command() {
        this.skipSpaces();
        int start = this.column;
        while (this.column < this.line.length() &&
                (Character.isLetterOrDigit(this.line.charAt(this.column)) || this.line.charAt(this.column) == '_'))
            this.column++;
        String keyword = this.line.substring(start, this.column).toLowerCase(Locale.ROOT);
        if (keyword.isEmpty())
            throw this.error("Expected a command");
        this.expect(':');
        Arguments args = this.arguments();
        int n = this.lineNumber;
        List<String> p = args.positional;
        switch (keyword) {
            case "node":
            case "update_node": {
                LinkedHashMap<String, String> attrs = this.shape(keyword, args, 1, true);
                Operation operation = keyword.equals("node") ? Operation.ADD : Operation.UPDATE;
                return new NodeCmd(n, operation, p.get(0), attrs);
            }
            case "delete_node":
                this.shape(keyword, args, 1, false);
                this.noAttributes(keyword, args);
                return new NodeCmd(n, Operation.DELETE, p.get(0), new LinkedHashMap<>());
            case "edge":
            case "update_edge": {
                LinkedHashMap<String, String> attrs = this.shape(keyword, args, 2, true);
                Operation operation = keyword.equals("edge") ? Operation.ADD : Operation.UPDATE;
                return new EdgeCmd(n, operation, p.get(0), p.get(1), attrs);
            }
            case "delete_edge":
                this.shape(keyword, args, 2, false);
                this.noAttributes(keyword, args);
                return new EdgeCmd(n, Operation.DELETE, p.get(0), p.get(1), new LinkedHashMap<>());
            case "cluster":
            case "subgraph":
            case "update_cluster":
            case "update_subgraph": {
                LinkedHashMap<String, String> attrs = this.shape(keyword, args, 1, true);
                Operation operation = keyword.startsWith("update_") ? Operation.UPDATE : Operation.ADD;
                return new ClusterCmd(n, operation, p.get(0), attrs, null);
            }
            case "delete_cluster":
            case "delete_subgraph":
                this.shape(keyword, args, 1, false);
                this.noAttributes(keyword, args);
                return new ClusterCmd(n, Operation.DELETE, p.get(0), new LinkedHashMap<>(), null);
            case "move":
                // move: NODE, CLUSTER
                this.shape(keyword, args, 2, false);
                this.noAttributes(keyword, args);
                return new ClusterCmd(n, Operation.MOVE, p.get(1), new LinkedHashMap<>(), p.get(0));
            case "graph":
                return new GlobalCmd(n, GlobalCmd.Target.GRAPH, this.globalAttributes(keyword, args));
            case "node_defaults":
                return new GlobalCmd(n, GlobalCmd.Target.NODE, this.globalAttributes(keyword, args));
            case "edge_defaults":
                return new GlobalCmd(n, GlobalCmd.Target.EDGE, this.globalAttributes(keyword, args));
            case "rank_same":
            case "rank_min":
            case "rank_max":
            case "rank_source":
            case "rank_sink": {
                this.noAttributes(keyword, args);
                if (args.positional.isEmpty())
                    throw this.error(Utilities.singleQuote(keyword) + " expects at least one node");
                RankCmd.Kind kind = RankCmd.Kind.valueOf(
                        keyword.substring("rank_".length()).toUpperCase(Locale.ROOT));
                return new RankCmd(n, kind, args.positional);
            }
            default:
                this.column = start;
                throw this.error("Unknown command " + Utilities.singleQuote(keyword));
        }
    }

    LinkedHashMap<String, String> globalAttributes(String keyword, Arguments arguments) {
        if (!arguments.positional.isEmpty() || arguments.attrs.isEmpty())
            throw this.error(Utilities.singleQuote(keyword) + " expects one or more key=value attributes");
        return arguments.attrs;
    }
}
