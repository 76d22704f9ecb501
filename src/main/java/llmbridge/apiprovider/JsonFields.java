package llmbridge.apiprovider;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Null-tolerant field access for vendor JSON, where any field may be absent or null.
 */
final class JsonFields {
    private static final Logger logger = LoggerFactory.getLogger(JsonFields.class);

    private JsonFields() {
    }

    static String getString(JsonObject obj, String field) {
        if (obj == null || !obj.has(field)) {
            return null;
        }
        JsonElement value = obj.get(field);
        return value.isJsonPrimitive() ? value.getAsString() : null;
    }

    static String getString(JsonObject obj, String field, String fallback) {
        String value = getString(obj, field);
        return value != null ? value : fallback;
    }

    static int getInt(JsonObject obj, String field) {
        if (obj == null || !obj.has(field)) {
            return 0;
        }
        JsonElement value = obj.get(field);
        if (value.isJsonPrimitive() && value.getAsJsonPrimitive().isNumber()) {
            return value.getAsInt();
        }
        return 0;
    }

    static boolean getBoolean(JsonObject obj, String field) {
        if (obj == null || !obj.has(field)) {
            return false;
        }
        JsonElement value = obj.get(field);
        return value.isJsonPrimitive() && value.getAsJsonPrimitive().isBoolean() && value.getAsBoolean();
    }

    static JsonObject getObject(JsonObject obj, String field) {
        if (obj == null || !obj.has(field)) {
            return null;
        }
        JsonElement value = obj.get(field);
        return value.isJsonObject() ? value.getAsJsonObject() : null;
    }

    static JsonArray getArray(JsonObject obj, String field) {
        if (obj == null || !obj.has(field)) {
            return new JsonArray();
        }
        JsonElement value = obj.get(field);
        return value.isJsonArray() ? value.getAsJsonArray() : new JsonArray();
    }

    static boolean isEmpty(String value) {
        return value == null || value.isEmpty();
    }

    /**
     * Parse one stream frame. Frames that are not a JSON object are skipped with a warning.
     */
    static JsonObject parseFrame(String data, String providerName) {
        try {
            JsonElement parsed = JsonParser.parseString(data);
            if (parsed.isJsonObject()) {
                return parsed.getAsJsonObject();
            }
            logger.warn("[{}] Skipping non-object stream frame: {}", providerName, data);
        } catch (JsonParseException e) {
            logger.warn("[{}] Skipping malformed stream frame: {}", providerName, e.getMessage());
        }
        return null;
    }
}
