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

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Responses API adapter. Reasoning models get an effort level and encrypted reasoning in
 * place of a temperature; organizations that may not receive reasoning summaries are
 * retried once without them.
 */
public class OpenAIProvider extends APIProvider {
    private static final Logger logger = LoggerFactory.getLogger(OpenAIProvider.class);

    static final String RESPONSES_ENDPOINT = "responses";
    static final String UNSUPPORTED_VALUE = "unsupported_value";

    private static final Pattern REASONING_MODEL = Pattern.compile("^(o1|o3|o4|gpt-5)(-.*)?$", Pattern.CASE_INSENSITIVE);

    public OpenAIProvider(APIProviderConfig config) {
        super(config, ProviderType.OPENAI);
    }

    @Override
    protected void addAuthHeaders(Request.Builder builder) {
        builder.header("Authorization", "Bearer " + key);
    }

    /**
     * Whether the model takes {@code reasoning} settings and rejects {@code temperature}.
     */
    public static boolean isReasoningModel(String model) {
        return model != null && REASONING_MODEL.matcher(model.trim()).matches();
    }

    @Override
    public WireRequest encode(List<ChatMessage> messages, List<ToolDefinition> tools, boolean streaming,
                              GenerationOptions options) throws EncodingException {
        GenerationOptions resolved = resolveOptions(options);
        boolean reasoningModel = isReasoningModel(resolved.getModel());

        StringBuilder instructions = new StringBuilder();
        JsonArray input = new JsonArray();
        for (ChatMessage message : messages) {
            switch (message.getRole()) {
                case UNSPECIFIED:
                    String text = message.getText();
                    if (!text.isEmpty()) {
                        if (instructions.length() > 0) {
                            instructions.append("\n");
                        }
                        instructions.append(text);
                    }
                    break;
                case USER:
                    encodeUserMessage(message, input);
                    break;
                case AGENT:
                    encodeAgentMessage(message, input);
                    break;
            }
        }
        if (input.size() == 0) {
            JsonArray content = new JsonArray();
            content.add(contentItem("input_text", ""));
            input.add(messageItem("user", content));
        }

        JsonObject payload = new JsonObject();
        payload.addProperty("model", resolved.getModel());
        if (instructions.length() > 0) {
            payload.addProperty("instructions", instructions.toString());
        }
        payload.add("input", input);
        payload.addProperty("max_output_tokens", resolved.getMaxTokens());
        payload.addProperty("stream", streaming);

        if (reasoningModel) {
            if (resolved.isThinkingEnabled()) {
                JsonObject reasoning = new JsonObject();
                reasoning.addProperty("effort", ReasoningConfig.effortString(resolved.getThinkingBudget()));
                reasoning.addProperty("summary", "auto");
                payload.add("reasoning", reasoning);

                JsonArray include = new JsonArray();
                include.add("reasoning.encrypted_content");
                payload.add("include", include);
            }
        } else if (resolved.getTemperature() != null) {
            payload.addProperty("temperature", resolved.getTemperature());
        }

        if (tools != null && !tools.isEmpty()) {
            JsonArray wireTools = new JsonArray();
            for (ToolDefinition tool : tools) {
                JsonObject wireTool = new JsonObject();
                wireTool.addProperty("type", "function");
                wireTool.addProperty("name", tool.getName());
                wireTool.addProperty("description", tool.getDescription());
                wireTool.add("parameters", tool.getParameters());
                wireTool.addProperty("strict", false);
                wireTools.add(wireTool);
            }
            payload.add("tools", wireTools);
            payload.addProperty("tool_choice", "auto");
        }

        StructuredOutputConfig structured = resolved.getStructuredOutput();
        if (structured != null) {
            JsonObject textConfig = new JsonObject();
            textConfig.add("format", responseFormat(structured));
            payload.add("text", textConfig);
        }

        return new WireRequest(type, RESPONSES_ENDPOINT, payload, streaming, null);
    }

    private void encodeUserMessage(ChatMessage message, JsonArray input) {
        JsonArray content = new JsonArray();
        for (MessagePart part : message.getParts()) {
            switch (part.getKind()) {
                case TEXT:
                    content.add(contentItem("input_text", ((MessagePart.TextPart) part).getText()));
                    break;
                case FILE:
                    JsonObject image = imageItem((MessagePart.FilePart) part);
                    if (image != null) {
                        content.add(image);
                    }
                    break;
                case TOOL_RESULT:
                    MessagePart.ToolResultPart result = (MessagePart.ToolResultPart) part;
                    JsonObject output = new JsonObject();
                    output.addProperty("type", "function_call_output");
                    output.addProperty("call_id", result.getToolCallId());
                    output.addProperty("output", result.isError() ? "Error: " + result.getContent() : result.getContent());
                    input.add(output);
                    break;
                default:
                    logger.warn("[{}] Dropping {} part from a user message", name, part.getKind());
                    break;
            }
        }
        if (content.size() > 0) {
            input.add(messageItem("user", content));
        }
    }

    private void encodeAgentMessage(ChatMessage message, JsonArray input) {
        String text = message.getText();
        if (!text.isEmpty()) {
            JsonArray content = new JsonArray();
            content.add(contentItem("output_text", text));
            input.add(messageItem("assistant", content));
        }
        for (ToolCall call : message.getToolCalls()) {
            JsonObject item = new JsonObject();
            item.addProperty("type", "function_call");
            item.addProperty("call_id", call.getId());
            item.addProperty("name", call.getName());
            item.addProperty("arguments", gson.toJson(call.getArgs()));
            input.add(item);
        }
    }

    private JsonObject imageItem(MessagePart.FilePart part) {
        String imageUrl;
        if (part.hasData()) {
            String mediaType = MediaNormalizer.admitInline(part, MediaNormalizer.OPENAI_IMAGE_LIMIT, name);
            if (mediaType == null) {
                return null;
            }
            imageUrl = "data:" + mediaType + ";base64," + MediaNormalizer.toBase64(part);
        } else {
            imageUrl = part.getUri();
        }
        JsonObject image = new JsonObject();
        image.addProperty("type", "input_image");
        image.addProperty("image_url", imageUrl);
        return image;
    }

    private JsonObject responseFormat(StructuredOutputConfig structured) throws EncodingException {
        JsonObject format = new JsonObject();
        JsonObject schema;
        if (structured.getFormat() == StructuredOutputConfig.Format.ENUM) {
            JsonArray values = new JsonArray();
            for (String value : structured.getEnumValues()) {
                values.add(value);
            }
            JsonObject valueSchema = new JsonObject();
            valueSchema.addProperty("type", "string");
            valueSchema.add("enum", values);

            JsonObject properties = new JsonObject();
            properties.add("value", valueSchema);
            JsonArray required = new JsonArray();
            required.add("value");

            schema = new JsonObject();
            schema.addProperty("type", "object");
            schema.add("properties", properties);
            schema.add("required", required);
            schema.addProperty("additionalProperties", false);
        } else {
            schema = structured.schemaObject(name);
            if (schema == null) {
                format.addProperty("type", "json_object");
                return format;
            }
        }
        format.addProperty("type", "json_schema");
        format.addProperty("name", "response");
        format.addProperty("strict", true);
        format.add("schema", schema);
        return format;
    }

    private static JsonObject contentItem(String itemType, String text) {
        JsonObject item = new JsonObject();
        item.addProperty("type", itemType);
        item.addProperty("text", text);
        return item;
    }

    private static JsonObject messageItem(String role, JsonArray content) {
        JsonObject item = new JsonObject();
        item.addProperty("type", "message");
        item.addProperty("role", role);
        item.add("content", content);
        return item;
    }

    /**
     * Organizations that are not verified for reasoning summaries get a 400; resend without
     * {@code reasoning.summary}.
     */
    @Override
    protected WireRequest fallbackRequest(WireRequest request, APIProviderException error) {
        if (error.getHttpStatusCode() != 400 || !UNSUPPORTED_VALUE.equals(error.getApiErrorCode())) {
            return null;
        }
        String message = error.getMessage() != null ? error.getMessage().toLowerCase(Locale.ROOT) : "";
        if (!message.contains("reasoning") || !message.contains("summar")) {
            return null;
        }
        JsonObject reasoning = JsonFields.getObject(request.getBody(), "reasoning");
        if (reasoning == null || !reasoning.has("summary")) {
            return null;
        }

        logger.warn("[{}] Reasoning summaries rejected, retrying without them", name);
        WireRequest retry = request.copy();
        retry.getBody().getAsJsonObject("reasoning").remove("summary");
        return retry;
    }

    @Override
    protected CompletionResult parseCompletion(JsonObject response) throws APIProviderException {
        String status = JsonFields.getString(response, "status");
        if (status != null && !"completed".equals(status)) {
            String reason = JsonFields.getString(JsonFields.getObject(response, "incomplete_details"), "reason");
            throw new ResponseException(name, "executeOnce", ResponseException.ResponseErrorType.INCOMPLETE_RESPONSE,
                "status " + status + (reason != null ? " (" + reason + ")" : ""));
        }
        JsonArray output = JsonFields.getArray(response, "output");
        if (output.size() == 0) {
            throw new ResponseException(name, "executeOnce", ResponseException.ResponseErrorType.EMPTY_RESPONSE);
        }

        StringBuilder text = new StringBuilder();
        List<ToolCall> toolCalls = new ArrayList<>();
        ThinkingBlock thinking = null;

        for (JsonElement element : output) {
            if (!element.isJsonObject()) continue;
            JsonObject item = element.getAsJsonObject();
            String itemType = JsonFields.getString(item, "type", "");
            switch (itemType) {
                case "message":
                    for (JsonElement content : JsonFields.getArray(item, "content")) {
                        if (content.isJsonObject()
                                && "output_text".equals(JsonFields.getString(content.getAsJsonObject(), "type"))) {
                            text.append(JsonFields.getString(content.getAsJsonObject(), "text", ""));
                        }
                    }
                    break;
                case "function_call":
                    toolCalls.add(toolCallFromItem(item, null));
                    break;
                case "reasoning":
                    thinking = new ThinkingBlock(summaryText(item), encryptedContent(item));
                    break;
                default:
                    logger.debug("[{}] Ignoring output item of type {}", name, itemType);
                    break;
            }
        }

        int tokens = JsonFields.getInt(JsonFields.getObject(response, "usage"), "total_tokens");
        return new CompletionResult(text.toString(), toolCalls, tokens, thinking, status);
    }

    /**
     * Tool call from a {@code function_call} item; {@code arguments} overrides the item's own.
     */
    static ToolCall toolCallFromItem(JsonObject item, String arguments) {
        String callId = JsonFields.getString(item, "call_id");
        if (JsonFields.isEmpty(callId)) {
            callId = JsonFields.getString(item, "id");
        }
        String args = arguments != null ? arguments : JsonFields.getString(item, "arguments", "");
        return new ToolCall(callId, JsonFields.getString(item, "name"), ToolCall.parseArguments(args));
    }

    static String summaryText(JsonObject reasoningItem) {
        StringBuilder summary = new StringBuilder();
        for (JsonElement element : JsonFields.getArray(reasoningItem, "summary")) {
            if (!element.isJsonObject()) continue;
            String text = JsonFields.getString(element.getAsJsonObject(), "text");
            if (!JsonFields.isEmpty(text)) {
                if (summary.length() > 0) {
                    summary.append("\n");
                }
                summary.append(text);
            }
        }
        return summary.toString().trim();
    }

    /**
     * {@code encrypted_content} arrives either as a string or as {@code {"data": ...}}.
     */
    static String encryptedContent(JsonObject reasoningItem) {
        if (reasoningItem == null || !reasoningItem.has("encrypted_content")) {
            return "";
        }
        JsonElement value = reasoningItem.get("encrypted_content");
        if (value.isJsonPrimitive()) {
            return value.getAsString();
        }
        if (value.isJsonObject()) {
            return JsonFields.getString(value.getAsJsonObject(), "data", "");
        }
        return "";
    }

    @Override
    protected StreamDecoder newStreamDecoder() {
        return new OpenAIStreamDecoder(name);
    }
}
