package org.graphdelta.dotEditor.tools;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.graphdelta.dotEditor.errors.CommandException;
import org.graphdelta.dotEditor.errors.CommandException.ErrorCode;
import org.graphdelta.util.Utilities;

/** A tool invocation produced by a language model: {"name": ..., "parameters": {...}}. */
public record ToolCall(String name, JsonNode parameters) {
    static final String FENCE = "```";

    /** Remove a surrounding Markdown code fence, with its optional language tag. */
    static String stripFence(String text) {
        String result = text.strip();
        if (!result.startsWith(FENCE))
            return result;
        int firstNewline = result.indexOf('\n');
        if (firstNewline < 0)
            return result;
        result = result.substring(firstNewline + 1);
        if (result.stripTrailing().endsWith(FENCE)) {
            result = result.stripTrailing();
            result = result.substring(0, result.length() - FENCE.length());
        }
        return result.strip();
    }

    public static ToolCall fromJson(JsonNode node) {
        if (!node.isObject())
            throw new CommandException(ErrorCode.INVALID_COMMAND, "Tool call must be a JSON object, got " + node);
        String name = Utilities.getStringProperty(node, "name");
        JsonNode parameters = node.get("parameters");
        if (parameters == null || parameters.isNull())
            // OpenAI-style calls name the property "arguments"
            parameters = node.get("arguments");
        if (parameters == null || parameters.isNull())
            parameters = Utilities.deterministicObjectMapper().createObjectNode();
        if (!parameters.isObject())
            throw new CommandException(ErrorCode.INVALID_COMMAND,
                    "Parameters of tool " + Utilities.singleQuote(name) + " must be a JSON object");
        return new ToolCall(name, parameters);
    }

    public static ToolCall parse(String text) {
        ObjectMapper mapper = Utilities.deterministicObjectMapper();
        try {
            return fromJson(mapper.readTree(stripFence(text)));
        } catch (JsonProcessingException ex) {
            throw new CommandException(ErrorCode.INVALID_COMMAND,
                    "Malformed tool call: " + ex.getOriginalMessage(), ex);
        }
    }
}
