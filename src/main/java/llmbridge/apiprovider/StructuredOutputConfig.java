package llmbridge.apiprovider;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import llmbridge.apiprovider.exceptions.EncodingException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Constrained-output request: a JSON document (optionally schema-bound) or one value of an enum.
 * {@code prefill} is honored by Anthropic only, {@code propertyOrdering} by Gemini only.
 */
public class StructuredOutputConfig {

    public enum Format {
        JSON,
        ENUM
    }

    private final Format format;
    private final JsonElement schema;
    private final List<String> enumValues;
    private String prefill;
    private List<String> propertyOrdering = Collections.emptyList();

    private StructuredOutputConfig(Format format, JsonElement schema, List<String> enumValues) {
        this.format = format;
        this.schema = schema != null ? schema.deepCopy() : null;
        this.enumValues = enumValues != null ? Collections.unmodifiableList(new ArrayList<>(enumValues)) : Collections.emptyList();
    }

    public static StructuredOutputConfig json() {
        return new StructuredOutputConfig(Format.JSON, null, null);
    }

    public static StructuredOutputConfig json(JsonElement schema) {
        return new StructuredOutputConfig(Format.JSON, schema, null);
    }

    public static StructuredOutputConfig enumOf(List<String> values) {
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException("Enum output needs at least one value");
        }
        return new StructuredOutputConfig(Format.ENUM, null, values);
    }

    public Format getFormat() { return format; }
    public JsonElement getSchema() { return schema != null ? schema.deepCopy() : null; }
    public List<String> getEnumValues() { return enumValues; }
    public String getPrefill() { return prefill; }
    public List<String> getPropertyOrdering() { return propertyOrdering; }

    public void setPrefill(String prefill) { this.prefill = prefill; }

    public void setPropertyOrdering(List<String> propertyOrdering) {
        this.propertyOrdering = propertyOrdering != null
            ? Collections.unmodifiableList(new ArrayList<>(propertyOrdering)) : Collections.emptyList();
    }

    public boolean hasPrefill() {
        return prefill != null && !prefill.isEmpty();
    }

    /**
     * The schema as a JSON object, or null when none was given.
     * @throws EncodingException if a schema was given but is not an object
     */
    public JsonObject schemaObject(String providerName) throws EncodingException {
        if (schema == null || schema.isJsonNull()) {
            return null;
        }
        if (!schema.isJsonObject()) {
            throw new EncodingException(providerName, "Structured output schema must be a JSON object, got: " + schema);
        }
        return schema.getAsJsonObject().deepCopy();
    }
}
