package org.graphdelta.dotEditor.tools;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.graphdelta.util.Utilities;

/**
 * A tool offered to a language model.
 * @param name         Name used in tool calls.
 * @param description  What the tool does, in one sentence.
 * @param parameters   JSON schema of the parameters object.
 * @param query        True if the tool only reads the graph.
 */
public record ToolDefinition(String name, String description, ObjectNode parameters, boolean query) {
    public ObjectNode toJson() {
        ObjectNode result = Utilities.deterministicObjectMapper().createObjectNode();
        result.put("name", this.name);
        result.put("description", this.description);
        result.set("parameters", this.parameters);
        return result;
    }
}
