package llmbridge.apiprovider;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import llmbridge.apiprovider.exceptions.APIProviderException;
import llmbridge.apiprovider.exceptions.ResponseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Decodes Responses API server-sent events. The API announces finished tool calls and
 * reasoning items more than once, so both are deduplicated by id.
 */
class OpenAIStreamDecoder implements StreamDecoder {
    private static final Logger logger = LoggerFactory.getLogger(OpenAIStreamDecoder.class);
    private static final String OPERATION = "executeStreaming";

    private final String providerName;
    private final Map<String, Reasoning> reasoning = new LinkedHashMap<>();
    private final Set<String> completedReasoning = new HashSet<>();
    private final Map<String, PendingCall> calls = new HashMap<>();
    private final Set<String> emittedCalls = new HashSet<>();
    private int tokensUsed;
    private boolean complete;

    private static final class Reasoning {
        final StringBuilder summary = new StringBuilder();
        boolean streamed;
        int summaryIndex = -1;
    }

    private static final class PendingCall {
        final JsonObject item;
        final StringBuilder arguments = new StringBuilder();

        PendingCall(JsonObject item) {
            this.item = item;
        }
    }

    OpenAIStreamDecoder(String providerName) {
        this.providerName = providerName;
    }

    @Override
    public boolean onFrame(String eventType, String data, StreamEventSink sink) {
        JsonObject event = JsonFields.parseFrame(data, providerName);
        if (event == null) {
            return true;
        }

        String type = !JsonFields.isEmpty(eventType) ? eventType : JsonFields.getString(event, "type", "");
        switch (type) {
            case "response.output_item.added":
                itemAdded(JsonFields.getObject(event, "item"));
                break;

            case "response.reasoning_summary_text.delta":
                summaryDelta(event, sink);
                break;

            case "response.reasoning_summary_text.done":
            case "response.reasoning_summary_part.done":
                // The final item carries the complete summary
                break;

            case "response.output_item.done":
                itemDone(JsonFields.getObject(event, "item"), sink);
                break;

            case "response.output_text.delta":
                String text = textDelta(event);
                if (!text.isEmpty()) {
                    sink.emit(StreamEvent.text(text));
                }
                break;

            case "response.function_call_arguments.delta":
                PendingCall pending = calls.get(JsonFields.getString(event, "item_id", ""));
                if (pending != null) {
                    pending.arguments.append(JsonFields.getString(event, "delta", ""));
                } else {
                    logger.debug("[{}] Argument delta for unknown item {}", providerName, JsonFields.getString(event, "item_id"));
                }
                break;

            case "response.function_call_arguments.done":
                PendingCall finished = calls.get(JsonFields.getString(event, "item_id", ""));
                if (finished != null) {
                    String arguments = JsonFields.getString(event, "arguments", finished.arguments.toString());
                    emitCall(OpenAIProvider.toolCallFromItem(finished.item, arguments), sink);
                }
                break;

            case "response.completed":
                JsonObject usage = JsonFields.getObject(JsonFields.getObject(event, "response"), "usage");
                tokensUsed = JsonFields.getInt(usage, "total_tokens");
                complete = true;
                return false;

            case "response.failed":
                JsonObject failure = JsonFields.getObject(JsonFields.getObject(event, "response"), "error");
                sink.emit(StreamEvent.error(vendorError(failure)));
                return false;

            case "response.incomplete":
                String reason = JsonFields.getString(
                    JsonFields.getObject(JsonFields.getObject(event, "response"), "incomplete_details"), "reason");
                sink.emit(StreamEvent.error(new ResponseException(providerName, OPERATION,
                    ResponseException.ResponseErrorType.INCOMPLETE_RESPONSE, reason)));
                return false;

            case "error":
                JsonObject error = JsonFields.getObject(event, "error");
                sink.emit(StreamEvent.error(vendorError(error != null ? error : event)));
                return false;

            default:
                break;
        }
        return true;
    }

    private void itemAdded(JsonObject item) {
        String itemType = JsonFields.getString(item, "type", "");
        String id = JsonFields.getString(item, "id", "");
        if ("reasoning".equals(itemType)) {
            reasoning.putIfAbsent(id, new Reasoning());
        } else if ("function_call".equals(itemType)) {
            calls.put(id, new PendingCall(item));
        }
    }

    private void summaryDelta(JsonObject event, StreamEventSink sink) {
        String delta = JsonFields.getString(event, "delta", "");
        Reasoning block = reasoning.computeIfAbsent(JsonFields.getString(event, "item_id", ""), k -> new Reasoning());
        int index = JsonFields.getInt(event, "summary_index");
        if (block.summaryIndex >= 0 && index != block.summaryIndex && block.summary.length() > 0) {
            block.summary.append("\n");
        }
        block.summaryIndex = index;
        block.streamed = true;
        block.summary.append(delta);
        if (!delta.isEmpty()) {
            sink.emit(StreamEvent.thinking(delta));
        }
    }

    private void itemDone(JsonObject item, StreamEventSink sink) {
        String itemType = JsonFields.getString(item, "type", "");
        if ("reasoning".equals(itemType)) {
            String id = JsonFields.getString(item, "id", "");
            Reasoning block = reasoning.computeIfAbsent(id, k -> new Reasoning());
            String summary = OpenAIProvider.summaryText(item);
            if (!block.streamed && !summary.isEmpty()) {
                sink.emit(StreamEvent.thinking(summary));
            }
            if (completedReasoning.add(id)) {
                String content = block.streamed ? block.summary.toString().trim() : summary;
                sink.emit(StreamEvent.thinkingComplete(content, OpenAIProvider.encryptedContent(item)));
            }
        } else if ("function_call".equals(itemType)) {
            emitCall(OpenAIProvider.toolCallFromItem(item, null), sink);
        }
    }

    private void emitCall(ToolCall call, StreamEventSink sink) {
        if (emittedCalls.add(call.getId())) {
            sink.emit(StreamEvent.toolCall(call));
        }
    }

    /**
     * {@code delta} is a string, or an object with {@code text}; older events only have {@code text}.
     */
    private static String textDelta(JsonObject event) {
        if (event.has("delta")) {
            JsonElement delta = event.get("delta");
            if (delta.isJsonPrimitive()) {
                return delta.getAsString();
            }
            if (delta.isJsonObject()) {
                return JsonFields.getString(delta.getAsJsonObject(), "text", "");
            }
        }
        return JsonFields.getString(event, "text", "");
    }

    private APIProviderException vendorError(JsonObject error) {
        return new APIProviderException(APIProviderException.ErrorCategory.SERVICE_ERROR, providerName, OPERATION,
            -1, JsonFields.getString(error, "code"), JsonFields.getString(error, "message", "Response failed"));
    }

    @Override
    public void onEnd(StreamEventSink sink) {
        for (Map.Entry<String, Reasoning> entry : reasoning.entrySet()) {
            if (completedReasoning.add(entry.getKey())) {
                sink.emit(StreamEvent.thinkingComplete(entry.getValue().summary.toString().trim(), ""));
            }
        }
        sink.emit(StreamEvent.done(tokensUsed));
    }

    @Override
    public boolean isComplete() {
        return complete;
    }

    @Override
    public int getTokensUsed() {
        return tokensUsed;
    }
}
