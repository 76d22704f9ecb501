package llmbridge.apiprovider;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import llmbridge.apiprovider.exceptions.APIProviderException;
import llmbridge.apiprovider.exceptions.EncodingException;
import llmbridge.apiprovider.exceptions.ResponseException;
import okhttp3.Request;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * generateContent adapter. The assistant role is {@code model}, system text travels as a
 * user-role {@code systemInstruction}, and tool traffic is carried as parts.
 */
public class GeminiProvider extends APIProvider {
    private static final Logger logger = LoggerFactory.getLogger(GeminiProvider.class);

    static final String MODELS_PATH = "v1beta/models/";
    static final String GENERATE_CONTENT = ":generateContent";
    static final String STREAM_GENERATE_CONTENT = ":streamGenerateContent?alt=sse";
    static final String ENUM_MIME_TYPE = "text/x.enum";

    public GeminiProvider(APIProviderConfig config) {
        super(config, ProviderType.GEMINI);
    }

    @Override
    protected void addAuthHeaders(Request.Builder builder) {
        builder.header("x-goog-api-key", key);
    }

    @Override
    public WireRequest encode(List<ChatMessage> messages, List<ToolDefinition> tools, boolean streaming,
                              GenerationOptions options) throws EncodingException {
        GenerationOptions resolved = resolveOptions(options);

        Map<String, String> callNames = new HashMap<>();
        for (ChatMessage message : messages) {
            for (ToolCall call : message.getToolCalls()) {
                callNames.put(call.getId(), call.getName());
            }
        }

        StringBuilder system = new StringBuilder();
        JsonArray contents = new JsonArray();
        for (ChatMessage message : messages) {
            switch (message.getRole()) {
                case UNSPECIFIED:
                    String text = message.getText();
                    if (!text.isEmpty()) {
                        if (system.length() > 0) {
                            system.append("\n\n");
                        }
                        system.append(text);
                    }
                    break;
                case USER:
                    JsonArray userParts = encodeUserParts(message, callNames);
                    if (userParts.size() > 0) {
                        contents.add(content("user", userParts));
                    }
                    break;
                case AGENT:
                    JsonArray modelParts = encodeAgentParts(message);
                    if (modelParts.size() > 0) {
                        contents.add(content("model", modelParts));
                    }
                    break;
            }
        }

        JsonObject payload = new JsonObject();
        payload.add("contents", contents);
        if (system.length() > 0) {
            JsonArray systemParts = new JsonArray();
            systemParts.add(textPart(system.toString()));
            payload.add("systemInstruction", content("user", systemParts));
        }

        JsonObject generationConfig = new JsonObject();
        generationConfig.addProperty("maxOutputTokens", resolved.getMaxTokens());
        if (resolved.getTemperature() != null) {
            generationConfig.addProperty("temperature", resolved.getTemperature());
        }
        if (resolved.isThinkingEnabled()) {
            JsonObject thinkingConfig = new JsonObject();
            thinkingConfig.addProperty("thinkingBudget", resolved.getThinkingBudget());
            thinkingConfig.addProperty("includeThoughts", true);
            generationConfig.add("thinkingConfig", thinkingConfig);
        }
        StructuredOutputConfig structured = resolved.getStructuredOutput();
        if (structured != null) {
            applyStructuredOutput(structured, generationConfig);
        }
        payload.add("generationConfig", generationConfig);

        if (tools != null && !tools.isEmpty()) {
            JsonArray declarations = new JsonArray();
            for (ToolDefinition tool : tools) {
                JsonObject declaration = new JsonObject();
                declaration.addProperty("name", tool.getName());
                declaration.addProperty("description", tool.getDescription());
                declaration.add("parameters", tool.getParameters());
                declarations.add(declaration);
            }
            JsonObject toolGroup = new JsonObject();
            toolGroup.add("functionDeclarations", declarations);
            JsonArray wireTools = new JsonArray();
            wireTools.add(toolGroup);
            payload.add("tools", wireTools);
        }

        String endpoint = MODELS_PATH + modelPath(resolved.getModel())
            + (streaming ? STREAM_GENERATE_CONTENT : GENERATE_CONTENT);
        return new WireRequest(type, endpoint, payload, streaming, null);
    }

    private static String modelPath(String model) {
        return model.startsWith("models/") ? model.substring("models/".length()) : model;
    }

    private JsonArray encodeUserParts(ChatMessage message, Map<String, String> callNames) {
        JsonArray parts = new JsonArray();
        for (MessagePart part : message.getParts()) {
            switch (part.getKind()) {
                case TEXT:
                    String text = ((MessagePart.TextPart) part).getText();
                    if (!text.isEmpty()) {
                        parts.add(textPart(text));
                    }
                    break;
                case FILE:
                    JsonObject file = filePart((MessagePart.FilePart) part);
                    if (file != null) {
                        parts.add(file);
                    }
                    break;
                case TOOL_RESULT:
                    MessagePart.ToolResultPart result = (MessagePart.ToolResultPart) part;
                    String callName = callNames.get(result.getToolCallId());
                    JsonObject response = new JsonObject();
                    response.addProperty(result.isError() ? "error" : "content", result.getContent());

                    JsonObject functionResponse = new JsonObject();
                    functionResponse.addProperty("name", callName != null ? callName : result.getToolCallId());
                    functionResponse.add("response", response);

                    JsonObject wrapper = new JsonObject();
                    wrapper.add("functionResponse", functionResponse);
                    parts.add(wrapper);
                    break;
                default:
                    logger.warn("[{}] Dropping {} part from a user message", name, part.getKind());
                    break;
            }
        }
        return parts;
    }

    private JsonArray encodeAgentParts(ChatMessage message) {
        JsonArray parts = new JsonArray();
        String text = message.getText();
        if (!text.isEmpty()) {
            parts.add(textPart(text));
        }

        ThinkingBlock thinking = message.getThinking();
        boolean signatureAttached = false;
        for (ToolCall call : message.getToolCalls()) {
            JsonObject functionCall = new JsonObject();
            functionCall.addProperty("name", call.getName());
            functionCall.add("args", call.getArgs());

            JsonObject part = new JsonObject();
            part.add("functionCall", functionCall);
            if (!signatureAttached && thinking != null && thinking.isReplayable()) {
                part.addProperty("thoughtSignature", thinking.getSignature());
                signatureAttached = true;
            }
            parts.add(part);
        }
        return parts;
    }

    private JsonObject filePart(MessagePart.FilePart part) {
        if (!part.hasData()) {
            JsonObject fileData = new JsonObject();
            fileData.addProperty("mimeType", MediaNormalizer.resolveMediaType(part));
            fileData.addProperty("fileUri", part.getUri());
            JsonObject wrapper = new JsonObject();
            wrapper.add("fileData", fileData);
            return wrapper;
        }
        String mediaType = MediaNormalizer.admitInline(part, MediaNormalizer.GEMINI_INLINE_LIMIT, name);
        if (mediaType == null) {
            return null;
        }
        JsonObject inlineData = new JsonObject();
        inlineData.addProperty("mimeType", mediaType);
        inlineData.addProperty("data", MediaNormalizer.toBase64(part));
        JsonObject wrapper = new JsonObject();
        wrapper.add("inlineData", inlineData);
        return wrapper;
    }

    private void applyStructuredOutput(StructuredOutputConfig structured, JsonObject generationConfig)
            throws EncodingException {
        if (structured.getFormat() == StructuredOutputConfig.Format.ENUM) {
            JsonArray values = new JsonArray();
            for (String value : structured.getEnumValues()) {
                values.add(value);
            }
            JsonObject schema = new JsonObject();
            schema.addProperty("type", "STRING");
            schema.add("enum", values);
            generationConfig.addProperty("responseMimeType", ENUM_MIME_TYPE);
            generationConfig.add("responseSchema", schema);
            return;
        }

        generationConfig.addProperty("responseMimeType", "application/json");
        JsonObject schema = structured.schemaObject(name);
        if (schema == null) {
            return;
        }
        if (!structured.getPropertyOrdering().isEmpty()) {
            JsonArray ordering = new JsonArray();
            for (String property : structured.getPropertyOrdering()) {
                ordering.add(property);
            }
            schema.add("propertyOrdering", ordering);
        }
        generationConfig.add("responseSchema", schema);
    }

    private static JsonObject textPart(String text) {
        JsonObject part = new JsonObject();
        part.addProperty("text", text);
        return part;
    }

    private static JsonObject content(String role, JsonArray parts) {
        JsonObject content = new JsonObject();
        content.addProperty("role", role);
        content.add("parts", parts);
        return content;
    }

    @Override
    protected CompletionResult parseCompletion(JsonObject response) throws APIProviderException {
        JsonArray candidates = JsonFields.getArray(response, "candidates");
        if (candidates.size() == 0 || !candidates.get(0).isJsonObject()) {
            throw noCandidates(name, "executeOnce", response);
        }
        JsonObject candidate = candidates.get(0).getAsJsonObject();

        StringBuilder text = new StringBuilder();
        StringBuilder thinking = new StringBuilder();
        String signature = null;
        List<ToolCall> toolCalls = new ArrayList<>();

        for (JsonElement element : JsonFields.getArray(JsonFields.getObject(candidate, "content"), "parts")) {
            if (!element.isJsonObject()) continue;
            JsonObject part = element.getAsJsonObject();

            String partSignature = JsonFields.getString(part, "thoughtSignature");
            if (signature == null && !JsonFields.isEmpty(partSignature)) {
                signature = partSignature;
            }

            JsonObject functionCall = JsonFields.getObject(part, "functionCall");
            if (functionCall != null) {
                toolCalls.add(toolCallFromPart(functionCall));
            } else if (JsonFields.getBoolean(part, "thought")) {
                thinking.append(JsonFields.getString(part, "text", ""));
            } else {
                text.append(JsonFields.getString(part, "text", ""));
            }
        }

        int tokens = JsonFields.getInt(JsonFields.getObject(response, "usageMetadata"), "totalTokenCount");
        ThinkingBlock block = thinking.length() > 0 ? new ThinkingBlock(thinking.toString(), signature) : null;
        return new CompletionResult(text.toString(), toolCalls, tokens, block,
            JsonFields.getString(candidate, "finishReason"));
    }

    /**
     * Response without candidates; carries the block reason when the prompt was refused.
     */
    static ResponseException noCandidates(String providerName, String operation, JsonObject response) {
        String blockReason = JsonFields.getString(JsonFields.getObject(response, "promptFeedback"), "blockReason");
        if (blockReason != null) {
            return new ResponseException(providerName, operation, ResponseException.ResponseErrorType.BLOCKED, blockReason);
        }
        return new ResponseException(providerName, operation, ResponseException.ResponseErrorType.EMPTY_RESPONSE,
            "no candidates");
    }

    static ToolCall toolCallFromPart(JsonObject functionCall) {
        String callName = JsonFields.getString(functionCall, "name");
        JsonObject args = JsonFields.getObject(functionCall, "args");
        if (args == null) {
            args = new JsonObject();
        }
        String id = JsonFields.getString(functionCall, "id");
        return new ToolCall(JsonFields.isEmpty(id) ? stableCallId(callName, args) : id, callName, args);
    }

    /**
     * Deterministic id for a call the vendor sent without one; repeated chunks of the same
     * call map to the same id.
     */
    public static String stableCallId(String name, JsonObject args) {
        JsonObject key = new JsonObject();
        key.addProperty("name", name);
        key.add("args", args != null ? args : new JsonObject());
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(gson.toJson(key).getBytes(StandardCharsets.UTF_8));
            StringBuilder id = new StringBuilder("call_");
            for (int i = 0; i < 16; i++) {
                id.append(String.format("%02x", hash[i]));
            }
            return id.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    @Override
    protected String extractApiErrorCode(String responseBody) {
        String status = JsonFields.getString(errorObject(responseBody), "status");
        return status != null ? status : super.extractApiErrorCode(responseBody);
    }

    @Override
    protected StreamDecoder newStreamDecoder() {
        return new GeminiStreamDecoder(name);
    }
}
