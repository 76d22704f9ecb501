package llmbridge.apiprovider;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import llmbridge.apiprovider.exceptions.APIProviderException;
import llmbridge.apiprovider.exceptions.EncodingException;
import llmbridge.apiprovider.exceptions.ResponseException;
import okhttp3.Request;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Adapter for a local Ollama server ({@code /api/chat}). Streams newline-delimited JSON.
 */
public class OllamaProvider extends APIProvider {
    private static final Logger logger = LoggerFactory.getLogger(OllamaProvider.class);

    static final String CHAT_ENDPOINT = "api/chat";

    private static final String[] THINKING_EXCLUDED = {"qwen3-coder", "qwen2-coder"};
    private static final String[] THINKING_MODELS = {"qwen3", "deepseek-r1", "deepseek-v3", "gpt-oss"};

    public OllamaProvider(APIProviderConfig config) {
        super(config, ProviderType.OLLAMA);
    }

    @Override
    protected void addAuthHeaders(Request.Builder builder) {
        // Plain Ollama needs no key; proxies in front of it may
        if (key != null && !key.isEmpty()) {
            builder.header("Authorization", "Bearer " + key);
        }
    }

    @Override
    protected StreamFrameReader.Format streamFormat() {
        return StreamFrameReader.Format.NDJSON;
    }

    /**
     * Whether the model accepts the {@code think} parameter.
     */
    public static boolean supportsThinking(String model) {
        if (model == null) {
            return false;
        }
        String lower = model.toLowerCase(Locale.ROOT);
        for (String excluded : THINKING_EXCLUDED) {
            if (lower.contains(excluded)) {
                return false;
            }
        }
        for (String pattern : THINKING_MODELS) {
            if (lower.contains(pattern)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public WireRequest encode(List<ChatMessage> messages, List<ToolDefinition> tools, boolean streaming,
                              GenerationOptions options) throws EncodingException {
        GenerationOptions resolved = resolveOptions(options);

        Map<String, String> callNames = new HashMap<>();
        JsonArray wireMessages = new JsonArray();
        for (ChatMessage message : messages) {
            switch (message.getRole()) {
                case UNSPECIFIED:
                    JsonObject system = new JsonObject();
                    system.addProperty("role", "system");
                    system.addProperty("content", message.getText());
                    wireMessages.add(system);
                    break;
                case USER:
                    encodeUserMessage(message, callNames, wireMessages);
                    break;
                case AGENT:
                    wireMessages.add(encodeAgentMessage(message, callNames));
                    break;
            }
        }

        JsonObject payload = new JsonObject();
        payload.addProperty("model", resolved.getModel());
        payload.add("messages", wireMessages);
        payload.addProperty("stream", streaming);

        JsonObject modelOptions = new JsonObject();
        if (resolved.getTemperature() != null) {
            modelOptions.addProperty("temperature", resolved.getTemperature());
        }
        modelOptions.addProperty("num_predict", resolved.getMaxTokens());
        payload.add("options", modelOptions);

        if (resolved.isThinkingEnabled() && supportsThinking(resolved.getModel())) {
            if (resolved.getModel().toLowerCase(Locale.ROOT).contains("gpt-oss")) {
                payload.addProperty("think", ReasoningConfig.effortString(resolved.getThinkingBudget()));
            } else {
                payload.addProperty("think", true);
            }
        }

        StructuredOutputConfig structured = resolved.getStructuredOutput();
        if (structured != null) {
            payload.add("format", responseFormat(structured));
        }

        if (tools != null && !tools.isEmpty()) {
            JsonArray wireTools = new JsonArray();
            for (ToolDefinition tool : tools) {
                JsonObject function = new JsonObject();
                function.addProperty("name", tool.getName());
                function.addProperty("description", tool.getDescription());
                function.add("parameters", tool.getParameters());

                JsonObject wireTool = new JsonObject();
                wireTool.addProperty("type", "function");
                wireTool.add("function", function);
                wireTools.add(wireTool);
            }
            payload.add("tools", wireTools);
        }

        return new WireRequest(type, CHAT_ENDPOINT, payload, streaming, null);
    }

    private void encodeUserMessage(ChatMessage message, Map<String, String> callNames, JsonArray out) {
        StringBuilder content = new StringBuilder();
        JsonArray images = new JsonArray();
        for (MessagePart part : message.getParts()) {
            switch (part.getKind()) {
                case TEXT:
                    content.append(((MessagePart.TextPart) part).getText());
                    break;
                case FILE:
                    MessagePart.FilePart file = (MessagePart.FilePart) part;
                    if (!file.hasData()) {
                        logger.warn("[{}] Dropping image reference {}, only inline images are supported",
                            name, file.getUri());
                        break;
                    }
                    if (MediaNormalizer.admitInline(file, MediaNormalizer.OLLAMA_IMAGE_LIMIT, name) != null) {
                        images.add(MediaNormalizer.toBase64(file));
                    }
                    break;
                case TOOL_RESULT:
                    // Flush what came before so the order survives
                    flushUserMessage(content, images, out);
                    content.setLength(0);
                    images = new JsonArray();

                    MessagePart.ToolResultPart result = (MessagePart.ToolResultPart) part;
                    String toolName = callNames.get(result.getToolCallId());
                    JsonObject toolMessage = new JsonObject();
                    toolMessage.addProperty("role", "tool");
                    toolMessage.addProperty("content",
                        result.isError() ? "Error: " + result.getContent() : result.getContent());
                    toolMessage.addProperty("tool_name", toolName != null ? toolName : result.getToolCallId());
                    out.add(toolMessage);
                    break;
                default:
                    logger.warn("[{}] Dropping {} part from a user message", name, part.getKind());
                    break;
            }
        }
        flushUserMessage(content, images, out);
    }

    private static void flushUserMessage(StringBuilder content, JsonArray images, JsonArray out) {
        if (content.length() == 0 && images.size() == 0) {
            return;
        }
        JsonObject user = new JsonObject();
        user.addProperty("role", "user");
        user.addProperty("content", content.toString());
        if (images.size() > 0) {
            user.add("images", images);
        }
        out.add(user);
    }

    private JsonObject encodeAgentMessage(ChatMessage message, Map<String, String> callNames) {
        JsonObject assistant = new JsonObject();
        assistant.addProperty("role", "assistant");
        assistant.addProperty("content", message.getText());
        if (message.getThinking() != null && !message.getThinking().getContent().isEmpty()) {
            assistant.addProperty("thinking", message.getThinking().getContent());
        }

        List<ToolCall> calls = message.getToolCalls();
        if (!calls.isEmpty()) {
            JsonArray toolCalls = new JsonArray();
            for (int i = 0; i < calls.size(); i++) {
                ToolCall call = calls.get(i);
                callNames.put(call.getId(), call.getName());

                JsonObject function = new JsonObject();
                function.addProperty("index", i);
                function.addProperty("name", call.getName());
                function.add("arguments", call.getArgs());

                JsonObject toolCall = new JsonObject();
                toolCall.addProperty("type", "function");
                toolCall.add("function", function);
                toolCalls.add(toolCall);
            }
            assistant.add("tool_calls", toolCalls);
        }
        return assistant;
    }

    private JsonElement responseFormat(StructuredOutputConfig structured) throws EncodingException {
        if (structured.getFormat() == StructuredOutputConfig.Format.ENUM) {
            JsonArray values = new JsonArray();
            for (String value : structured.getEnumValues()) {
                values.add(value);
            }
            JsonObject schema = new JsonObject();
            schema.addProperty("type", "string");
            schema.add("enum", values);
            return schema;
        }
        JsonObject schema = structured.schemaObject(name);
        if (schema == null) {
            return new JsonPrimitive("json");
        }
        return schema;
    }

    @Override
    protected CompletionResult parseCompletion(JsonObject response) throws APIProviderException {
        String error = JsonFields.getString(response, "error");
        if (error != null) {
            throw new APIProviderException(APIProviderException.ErrorCategory.SERVICE_ERROR,
                name, "executeOnce", -1, null, error);
        }
        JsonObject message = JsonFields.getObject(response, "message");
        if (message == null) {
            throw new ResponseException(name, "executeOnce",
                ResponseException.ResponseErrorType.MISSING_REQUIRED_FIELD, "message");
        }

        List<ToolCall> toolCalls = new ArrayList<>();
        JsonArray wireCalls = JsonFields.getArray(message, "tool_calls");
        for (int i = 0; i < wireCalls.size(); i++) {
            if (!wireCalls.get(i).isJsonObject()) continue;
            JsonObject function = JsonFields.getObject(wireCalls.get(i).getAsJsonObject(), "function");
            if (function == null) continue;
            String callName = JsonFields.getString(function, "name");
            toolCalls.add(new ToolCall(callId(i, callName), callName, arguments(function)));
        }

        String thinking = JsonFields.getString(message, "thinking", "");
        int tokens = JsonFields.getInt(response, "prompt_eval_count") + JsonFields.getInt(response, "eval_count");
        return new CompletionResult(JsonFields.getString(message, "content", ""), toolCalls, tokens,
            thinking.isEmpty() ? null : new ThinkingBlock(thinking, null),
            JsonFields.getString(response, "done_reason"));
    }

    static String callId(int index, String callName) {
        return "call_" + index + "_" + callName;
    }

    /**
     * Arguments are normally an object; some models send a JSON string instead.
     */
    static JsonObject arguments(JsonObject function) {
        if (function == null || !function.has("arguments")) {
            return new JsonObject();
        }
        JsonElement arguments = function.get("arguments");
        if (arguments.isJsonObject()) {
            return arguments.getAsJsonObject();
        }
        if (arguments.isJsonPrimitive()) {
            return ToolCall.parseArguments(arguments.getAsString());
        }
        return new JsonObject();
    }

    @Override
    protected StreamDecoder newStreamDecoder() {
        return new OllamaStreamDecoder(name);
    }
}
