package llmbridge.apiprovider;

import com.google.gson.JsonObject;

/**
 * A tool the model may call, described by a JSON-Schema parameters object.
 */
public final class ToolDefinition {
    private final String name;
    private final String description;
    private final JsonObject parameters;

    public ToolDefinition(String name, String description, JsonObject parameters) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Tool name cannot be empty");
        }
        this.name = name;
        this.description = description != null ? description : "";
        this.parameters = parameters != null ? parameters.deepCopy() : emptySchema();
    }

    public String getName() { return name; }
    public String getDescription() { return description; }
    public JsonObject getParameters() { return parameters.deepCopy(); }

    private static JsonObject emptySchema() {
        JsonObject schema = new JsonObject();
        schema.addProperty("type", "object");
        schema.add("properties", new JsonObject());
        return schema;
    }
}
