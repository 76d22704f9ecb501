package llmbridge.apiprovider;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.util.Objects;

/**
 * A tool invocation requested by the model. Arguments are always a complete JSON object.
 */
public final class ToolCall {
    /** Key used when accumulated arguments could not be parsed. */
    public static final String RAW_ARGUMENTS_KEY = "_raw";

    private final String id;
    private final String name;
    private final JsonObject args;

    public ToolCall(String id, String name, JsonObject args) {
        this.id = id;
        this.name = name;
        this.args = args != null ? args.deepCopy() : new JsonObject();
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public JsonObject getArgs() { return args.deepCopy(); }

    /**
     * Parse an accumulated argument fragment. Blank input yields an empty object;
     * anything that is not a JSON object is kept verbatim under {@value #RAW_ARGUMENTS_KEY}.
     */
    public static JsonObject parseArguments(String fragment) {
        if (fragment == null || fragment.trim().isEmpty()) {
            return new JsonObject();
        }
        JsonElement parsed;
        try {
            parsed = JsonParser.parseString(fragment);
        } catch (JsonParseException e) {
            return rawArguments(fragment);
        }
        return parsed.isJsonObject() ? parsed.getAsJsonObject() : rawArguments(fragment);
    }

    private static JsonObject rawArguments(String fragment) {
        JsonObject raw = new JsonObject();
        raw.addProperty(RAW_ARGUMENTS_KEY, fragment);
        return raw;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ToolCall)) return false;
        ToolCall other = (ToolCall) o;
        return Objects.equals(id, other.id) && Objects.equals(name, other.name) && args.equals(other.args);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, args);
    }

    @Override
    public String toString() {
        return "ToolCall{id=" + id + ", name=" + name + ", args=" + args + "}";
    }
}
