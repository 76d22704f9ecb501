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
import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Messages API adapter. When extended thinking is on, every tool-calling assistant turn
 * must replay its signed thinking block, so turns that lost theirs are dropped together
 * with their tool results.
 */
public class AnthropicProvider extends APIProvider {
    private static final Logger logger = LoggerFactory.getLogger(AnthropicProvider.class);

    static final String MESSAGES_ENDPOINT = "v1/messages";
    static final String ANTHROPIC_VERSION = "2023-06-01";
    static final String INTERLEAVED_THINKING_BETA = "interleaved-thinking-2025-05-14";
    static final String EMPTY_TOOL_RESULT = "(no output)";

    public AnthropicProvider(APIProviderConfig config) {
        super(config, ProviderType.ANTHROPIC);
    }

    @Override
    protected void addAuthHeaders(Request.Builder builder) {
        builder.header("x-api-key", key)
               .header("anthropic-version", ANTHROPIC_VERSION);
    }

    @Override
    public WireRequest encode(List<ChatMessage> messages, List<ToolDefinition> tools, boolean streaming,
                              GenerationOptions options) throws EncodingException {
        GenerationOptions resolved = resolveOptions(options);
        boolean thinking = resolved.isThinkingEnabled();

        Set<ChatMessage> omitted = thinking ? unreplayableTurns(messages) : Collections.emptySet();
        Set<String> omittedCallIds = new HashSet<>();
        for (ChatMessage message : omitted) {
            for (ToolCall call : message.getToolCalls()) {
                omittedCallIds.add(call.getId());
            }
        }

        StringBuilder system = new StringBuilder();
        JsonArray wireMessages = new JsonArray();
        for (ChatMessage message : messages) {
            if (omitted.contains(message)) {
                continue;
            }
            switch (message.getRole()) {
                case UNSPECIFIED:
                    appendSystem(system, message.getText());
                    break;
                case USER:
                    encodeUserMessage(message, omittedCallIds, wireMessages);
                    break;
                case AGENT:
                    JsonObject agent = encodeAgentMessage(message, thinking);
                    if (agent != null) {
                        wireMessages.add(agent);
                    }
                    break;
            }
        }

        StructuredOutputConfig structured = resolved.getStructuredOutput();
        if (structured != null) {
            appendSystem(system, structuredOutputInstruction(structured));
            if (structured.hasPrefill()) {
                if (thinking) {
                    logger.debug("[{}] Ignoring response prefill, not allowed with extended thinking", name);
                } else {
                    JsonArray prefill = new JsonArray();
                    prefill.add(textBlock(structured.getPrefill()));
                    wireMessages.add(wireMessage("assistant", prefill));
                }
            }
        }

        JsonObject payload = new JsonObject();
        payload.addProperty("model", resolved.getModel());
        payload.addProperty("max_tokens", resolved.getMaxTokens());
        if (system.length() > 0) {
            payload.addProperty("system", system.toString());
        }
        payload.add("messages", wireMessages);
        payload.addProperty("stream", streaming);

        Map<String, String> headers = new LinkedHashMap<>();
        if (thinking) {
            int budget = Math.min(resolved.getThinkingBudget(), resolved.getMaxTokens() - 1);
            if (budget < 1) {
                throw new EncodingException(name,
                    "max_tokens " + resolved.getMaxTokens() + " leaves no room for a thinking budget");
            }
            JsonObject thinkingConfig = new JsonObject();
            thinkingConfig.addProperty("type", "enabled");
            thinkingConfig.addProperty("budget_tokens", budget);
            payload.add("thinking", thinkingConfig);
            payload.addProperty("temperature", 1.0);
            headers.put("anthropic-beta", INTERLEAVED_THINKING_BETA);
        } else if (resolved.getTemperature() != null) {
            payload.addProperty("temperature", resolved.getTemperature());
        }

        if (tools != null && !tools.isEmpty()) {
            JsonArray wireTools = new JsonArray();
            for (ToolDefinition tool : tools) {
                JsonObject wireTool = new JsonObject();
                wireTool.addProperty("name", tool.getName());
                wireTool.addProperty("description", tool.getDescription());
                wireTool.add("input_schema", tool.getParameters());
                wireTools.add(wireTool);
            }
            payload.add("tools", wireTools);
        }

        return new WireRequest(type, MESSAGES_ENDPOINT, payload, streaming, headers);
    }

    /**
     * Tool-calling assistant turns without a replayable thinking block. Fails when that is
     * every such turn, since nothing of the tool history could be sent.
     */
    private Set<ChatMessage> unreplayableTurns(List<ChatMessage> messages) throws EncodingException {
        Set<ChatMessage> missing = Collections.newSetFromMap(new IdentityHashMap<>());
        int toolTurns = 0;
        for (ChatMessage message : messages) {
            if (message.getRole() == ChatMessage.Role.AGENT && message.hasToolCalls()) {
                toolTurns++;
                if (message.getThinking() == null || !message.getThinking().isReplayable()) {
                    missing.add(message);
                }
            }
        }
        if (missing.isEmpty()) {
            return missing;
        }
        if (missing.size() == toolTurns) {
            throw new EncodingException(name, "Extended thinking is enabled but none of the " + toolTurns
                + " tool-calling assistant turns carries a signed thinking block");
        }
        logger.warn("[{}] Omitting {} of {} tool-calling turns that have no signed thinking block",
            name, missing.size(), toolTurns);
        return missing;
    }

    private void encodeUserMessage(ChatMessage message, Set<String> omittedCallIds, JsonArray out)
            throws EncodingException {
        JsonArray pending = new JsonArray();
        for (MessagePart part : message.getParts()) {
            switch (part.getKind()) {
                case TEXT:
                    String text = ((MessagePart.TextPart) part).getText();
                    if (!text.isEmpty()) {
                        pending.add(textBlock(text));
                    }
                    break;
                case FILE:
                    JsonObject image = imageBlock((MessagePart.FilePart) part);
                    if (image != null) {
                        pending.add(image);
                    }
                    break;
                case TOOL_RESULT:
                    MessagePart.ToolResultPart result = (MessagePart.ToolResultPart) part;
                    if (omittedCallIds.contains(result.getToolCallId())) {
                        break;
                    }
                    // Keep order: whatever preceded the result goes out first
                    if (pending.size() > 0) {
                        out.add(wireMessage("user", pending));
                        pending = new JsonArray();
                    }
                    JsonArray resultContent = new JsonArray();
                    resultContent.add(toolResultBlock(result));
                    out.add(wireMessage("user", resultContent));
                    break;
                default:
                    logger.warn("[{}] Dropping {} part from a user message", name, part.getKind());
                    break;
            }
        }
        if (pending.size() > 0) {
            out.add(wireMessage("user", pending));
        }
    }

    private JsonObject encodeAgentMessage(ChatMessage message, boolean thinking) {
        JsonArray content = new JsonArray();

        ThinkingBlock block = message.getThinking();
        if (thinking && block != null && block.isReplayable()) {
            JsonObject thinkingBlock = new JsonObject();
            thinkingBlock.addProperty("type", "thinking");
            thinkingBlock.addProperty("thinking", block.getContent());
            thinkingBlock.addProperty("signature", block.getSignature());
            content.add(thinkingBlock);
        }

        String text = message.getText();
        if (!text.isEmpty()) {
            content.add(textBlock(text));
        }

        for (ToolCall call : message.getToolCalls()) {
            JsonObject toolUse = new JsonObject();
            toolUse.addProperty("type", "tool_use");
            toolUse.addProperty("id", call.getId());
            toolUse.addProperty("name", call.getName());
            toolUse.add("input", call.getArgs());
            content.add(toolUse);
        }

        return content.size() > 0 ? wireMessage("assistant", content) : null;
    }

    private JsonObject imageBlock(MessagePart.FilePart part) throws EncodingException {
        if (!part.hasData()) {
            throw new EncodingException(name, "File references by URI are not supported, send the bytes inline: "
                + part.getUri());
        }
        String mediaType = MediaNormalizer.admitInline(part, MediaNormalizer.ANTHROPIC_IMAGE_LIMIT, name);
        if (mediaType == null) {
            return null;
        }
        JsonObject source = new JsonObject();
        source.addProperty("type", "base64");
        source.addProperty("media_type", mediaType);
        source.addProperty("data", MediaNormalizer.toBase64(part));

        JsonObject image = new JsonObject();
        image.addProperty("type", "image");
        image.add("source", source);
        return image;
    }

    private static JsonObject toolResultBlock(MessagePart.ToolResultPart result) {
        JsonObject block = new JsonObject();
        block.addProperty("type", "tool_result");
        block.addProperty("tool_use_id", result.getToolCallId());
        block.addProperty("content", result.getContent().isEmpty() ? EMPTY_TOOL_RESULT : result.getContent());
        if (result.isError()) {
            block.addProperty("is_error", true);
        }
        return block;
    }

    private static JsonObject textBlock(String text) {
        JsonObject block = new JsonObject();
        block.addProperty("type", "text");
        block.addProperty("text", text);
        return block;
    }

    private static JsonObject wireMessage(String role, JsonArray content) {
        JsonObject message = new JsonObject();
        message.addProperty("role", role);
        message.add("content", content);
        return message;
    }

    private static void appendSystem(StringBuilder system, String text) {
        if (text == null || text.isEmpty()) {
            return;
        }
        if (system.length() > 0) {
            system.append("\n\n");
        }
        system.append(text);
    }

    private String structuredOutputInstruction(StructuredOutputConfig structured) throws EncodingException {
        if (structured.getFormat() == StructuredOutputConfig.Format.ENUM) {
            return "Respond with exactly one of the following values and nothing else: "
                + String.join(", ", structured.getEnumValues());
        }
        JsonObject schema = structured.schemaObject(name);
        if (schema == null) {
            return "Respond only with valid JSON.";
        }
        return "Respond only with a JSON object that conforms to this JSON schema:\n" + gson.toJson(schema);
    }

    @Override
    protected CompletionResult parseCompletion(JsonObject response) throws APIProviderException {
        if (!response.has("content")) {
            throw new ResponseException(name, "executeOnce",
                ResponseException.ResponseErrorType.MISSING_REQUIRED_FIELD, "content");
        }

        StringBuilder text = new StringBuilder();
        StringBuilder thinking = new StringBuilder();
        String signature = null;
        List<ToolCall> toolCalls = new ArrayList<>();

        for (JsonElement element : JsonFields.getArray(response, "content")) {
            if (!element.isJsonObject()) continue;
            JsonObject block = element.getAsJsonObject();
            String blockType = JsonFields.getString(block, "type", "");
            switch (blockType) {
                case "text":
                    text.append(JsonFields.getString(block, "text", ""));
                    break;
                case "thinking":
                    thinking.append(JsonFields.getString(block, "thinking", ""));
                    signature = JsonFields.getString(block, "signature", signature);
                    break;
                case "tool_use":
                    JsonObject input = JsonFields.getObject(block, "input");
                    toolCalls.add(new ToolCall(JsonFields.getString(block, "id"),
                        JsonFields.getString(block, "name"), input != null ? input : new JsonObject()));
                    break;
                default:
                    logger.debug("[{}] Ignoring content block of type {}", name, blockType);
                    break;
            }
        }

        JsonObject usage = JsonFields.getObject(response, "usage");
        int tokens = JsonFields.getInt(usage, "input_tokens") + JsonFields.getInt(usage, "output_tokens");

        ThinkingBlock block = thinking.length() > 0 ? new ThinkingBlock(thinking.toString(), signature) : null;
        return new CompletionResult(text.toString(), toolCalls, tokens, block,
            JsonFields.getString(response, "stop_reason"));
    }

    @Override
    protected StreamDecoder newStreamDecoder() {
        return new AnthropicStreamDecoder(name);
    }
}
