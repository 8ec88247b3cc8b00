package org.graphdelta.dotEditor.backend;

import org.graphdelta.util.Utilities;

import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/** Quoting rules for emitting DOT text. */
public final class DotFormat {
    private DotFormat() {}

    static final Pattern SIMPLE_ID = Pattern.compile("[A-Za-z_\\x{80}-\\x{10FFFF}][A-Za-z_0-9\\x{80}-\\x{10FFFF}]*");
    static final Pattern NUMERAL = Pattern.compile("-?(\\.[0-9]+|[0-9]+(\\.[0-9]*)?)");
    static final Set<String> KEYWORDS = Set.of("node", "edge", "graph", "digraph", "subgraph", "strict");

    public static boolean isHtml(String value) {
        return value.length() >= 2 && value.startsWith("<") && value.endsWith(">");
    }

    /** True if the string can be emitted as a DOT ID without quotes. */
    public static boolean isSimpleId(String value) {
        if (KEYWORDS.contains(value.toLowerCase()))
            return false;
        return SIMPLE_ID.matcher(value).matches() || NUMERAL.matcher(value).matches();
    }

    static boolean isAlphanumeric(String value) {
        if (value.isEmpty())
            return false;
        return value.codePoints().allMatch(Character::isLetterOrDigit);
    }

    /** Format an attribute value: HTML strings bare, plain alphanumeric strings bare,
     * everything else (including the empty string) quoted and escaped. */
    public static String formatValue(String value) {
        if (isHtml(value) || isAlphanumeric(value))
            return value;
        return Utilities.doubleQuote(value);
    }

    /** Format an identifier: a node id, subgraph name, or attribute key.
     * Node ids with a port suffix are emitted bare when every component is simple. */
    public static String formatId(String id) {
        if (isHtml(id) || isSimpleId(id))
            return id;
        String[] parts = id.split(":", -1);
        if (parts.length >= 2 && parts.length <= 3) {
            boolean allSimple = true;
            for (String part: parts)
                allSimple = allSimple && isSimpleId(part);
            if (allSimple)
                return id;
        }
        return Utilities.doubleQuote(id);
    }

    /** key=value pairs joined with ", ". */
    public static String formatAttributes(Map<String, String> attrs) {
        StringBuilder builder = new StringBuilder();
        for (var e: attrs.entrySet()) {
            if (builder.length() > 0)
                builder.append(", ");
            builder.append(formatId(e.getKey()))
                    .append("=")
                    .append(formatValue(e.getValue()));
        }
        return builder.toString();
    }
}
