package org.graphdelta.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/** Builds the JSON schema of an object with flat properties. */
public final class JsonSchema {
    final ObjectNode schema;
    final ObjectNode properties;
    final ArrayNode required;

    public JsonSchema(ObjectMapper mapper) {
        this.schema = mapper.createObjectNode();
        this.schema.put("type", "object");
        this.properties = this.schema.putObject("properties");
        this.required = mapper.createArrayNode();
    }

    /** Add a property.
     * @param type    JSON type; arrays have string items.
     * @param values  If not empty, the only values allowed. */
    public JsonSchema property(String name, String type, String description, boolean required, String... values) {
        ObjectNode property = this.properties.putObject(name);
        property.put("type", type);
        property.put("description", description);
        if (type.equals("array"))
            property.putObject("items").put("type", "string");
        if (values.length > 0) {
            ArrayNode options = property.putArray("enum");
            for (String value: values)
                options.add(value);
        }
        if (required)
            this.required.add(name);
        return this;
    }

    public JsonSchema required(String name, String description) {
        return this.property(name, "string", description, true);
    }

    public JsonSchema optional(String name, String description) {
        return this.property(name, "string", description, false);
    }

    public ObjectNode build() {
        if (!this.required.isEmpty())
            this.schema.set("required", this.required);
        return this.schema;
    }
}
