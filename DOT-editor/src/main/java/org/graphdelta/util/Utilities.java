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

package org.graphdelta.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.graphdelta.dotEditor.errors.CommandException;
import org.graphdelta.dotEditor.errors.InternalEditorError;
import org.jetbrains.annotations.Contract;

import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.function.Supplier;

public class Utilities {
    private Utilities() {}

    /** A custom version of assert, which is never compiled out.
     * @param expression  When this expression is false, this function throws. */
    @Contract("false, _ -> fail")
    public static void enforce(boolean expression, String message) {
        if (!expression)
            throw new InternalEditorError(message);
    }

    /** Like {@link #enforce(boolean, String)}, but the message is only built on failure. */
    @Contract("false, _ -> fail")
    public static void enforce(boolean expression, Supplier<String> message) {
        if (!expression)
            throw new InternalEditorError(message.get());
    }

    /** Escape the characters that cannot appear unescaped inside a DOT double-quoted string. */
    public static String escape(String value) {
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\' -> builder.append("\\\\");
                case '"' -> builder.append("\\\"");
                case '\n' -> builder.append("\\n");
                case '\r' -> builder.append("\\r");
                default -> builder.append(c);
            }
        }
        return builder.toString();
    }

    /** Inverse of {@link #escape}.  Escape sequences not produced by escape are kept verbatim,
     * so DOT escapes such as \l survive a round trip. */
    public static String unescape(String value) {
        if (value.indexOf('\\') < 0)
            return value;
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c != '\\' || i + 1 == value.length()) {
                builder.append(c);
                continue;
            }
            char next = value.charAt(i + 1);
            switch (next) {
                case '\\' -> builder.append('\\');
                case '"' -> builder.append('"');
                case 'n' -> builder.append('\n');
                case 'r' -> builder.append('\r');
                default -> builder.append(c).append(next);
            }
            i++;
        }
        return builder.toString();
    }

    /** Add double quotes around string and escape symbols that need it. */
    public static String doubleQuote(String value) {
        return "\"" + escape(value) + "\"";
    }

    /** Just adds single quotes around a string.  No escaping is performed. */
    public static String singleQuote(@Nullable String other) {
        return "'" + other + "'";
    }

    public static ObjectMapper deterministicObjectMapper() {
        return JsonMapper
                .builder()
                .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true)
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
                .configure(DeserializationFeature.FAIL_ON_READING_DUP_TREE_KEY, true)
                .build();
    }

    public static <T> T last(List<T> data) {
        enforce(!data.isEmpty(), "Extracting last element from empty list");
        return data.get(data.size() - 1);
    }

    public static <T> T removeLast(List<T> data) {
        enforce(!data.isEmpty(), "Removing from empty list");
        return data.remove(data.size() - 1);
    }

    /** A property which is absent or JSON null is reported as a missing parameter. */
    public static JsonNode getProperty(JsonNode node, String property) {
        JsonNode prop = node.get(property);
        if (prop == null || prop.isNull())
            throw new CommandException(CommandException.ErrorCode.MISSING_PARAMETER,
                    "Missing parameter " + singleQuote(property));
        return prop;
    }

    public static String getStringProperty(JsonNode node, String property) {
        return getProperty(node, property).asText();
    }

    @Nullable
    public static String getOptionalStringProperty(JsonNode node, String property) {
        JsonNode prop = node.get(property);
        if (prop == null || prop.isNull())
            return null;
        return prop.asText();
    }

    public static boolean getOptionalBooleanProperty(JsonNode node, String property, boolean defaultValue) {
        JsonNode prop = node.get(property);
        if (prop == null || prop.isNull())
            return defaultValue;
        return prop.asBoolean();
    }

    public static String readFile(String filename) throws IOException {
        return readFile(Paths.get(filename));
    }

    public static String readFile(Path filename) throws IOException {
        return Files.readString(filename, StandardCharsets.UTF_8);
    }
}
