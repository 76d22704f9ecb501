package llmbridge.apiprovider;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import llmbridge.apiprovider.exceptions.APIProviderException;

import java.util.Map;
import java.util.TreeMap;

/**
 * Decodes {@code /api/chat} NDJSON chunks. Tool calls are merged by {@code function.index}
 * and emitted together, in index order, when the stream finishes.
 */
class OllamaStreamDecoder implements StreamDecoder {
    private static final String OPERATION = "executeStreaming";

    private final String providerName;
    private final TreeMap<Integer, PendingCall> calls = new TreeMap<>();
    private final StringBuilder thinking = new StringBuilder();
    private boolean inThinking;
    private int tokensUsed;
    private boolean complete;

    private static final class PendingCall {
        String name;
        final JsonObject args = new JsonObject();
        final StringBuilder fragments = new StringBuilder();

        ToolCall toToolCall(int index) {
            JsonObject merged = args.deepCopy();
            if (fragments.length() > 0) {
                JsonObject parsed = ToolCall.parseArguments(fragments.toString());
                for (Map.Entry<String, JsonElement> entry : parsed.entrySet()) {
                    merged.add(entry.getKey(), entry.getValue());
                }
            }
            return new ToolCall(OllamaProvider.callId(index, name), name, merged);
        }
    }

    OllamaStreamDecoder(String providerName) {
        this.providerName = providerName;
    }

    @Override
    public boolean onFrame(String eventType, String data, StreamEventSink sink) {
        JsonObject chunk = JsonFields.parseFrame(data, providerName);
        if (chunk == null) {
            return true;
        }

        String error = JsonFields.getString(chunk, "error");
        if (error != null) {
            sink.emit(StreamEvent.error(new APIProviderException(APIProviderException.ErrorCategory.SERVICE_ERROR,
                providerName, OPERATION, -1, null, error)));
            return false;
        }

        JsonObject message = JsonFields.getObject(chunk, "message");
        String thought = JsonFields.getString(message, "thinking", "");
        if (!thought.isEmpty()) {
            inThinking = true;
            thinking.append(thought);
            sink.emit(StreamEvent.thinking(thought));
        }

        String content = JsonFields.getString(message, "content", "");
        if (!content.isEmpty()) {
            closeThinking(sink);
            sink.emit(StreamEvent.text(content));
        }

        for (JsonElement element : JsonFields.getArray(message, "tool_calls")) {
            if (!element.isJsonObject()) continue;
            JsonObject function = JsonFields.getObject(element.getAsJsonObject(), "function");
            if (function == null) continue;
            closeThinking(sink);
            mergeCall(function);
        }

        if (JsonFields.getBoolean(chunk, "done")) {
            tokensUsed = JsonFields.getInt(chunk, "prompt_eval_count") + JsonFields.getInt(chunk, "eval_count");
            complete = true;
            return false;
        }
        return true;
    }

    private void mergeCall(JsonObject function) {
        int index = function.has("index") && function.get("index").isJsonPrimitive()
            ? JsonFields.getInt(function, "index") : -1;
        if (index < 0) {
            index = calls.isEmpty() ? 0 : calls.lastKey() + 1;
        }
        PendingCall call = calls.computeIfAbsent(index, k -> new PendingCall());

        String callName = JsonFields.getString(function, "name");
        if (!JsonFields.isEmpty(callName)) {
            call.name = callName;
        }

        JsonElement arguments = function.get("arguments");
        if (arguments == null) {
            return;
        }
        if (arguments.isJsonObject()) {
            for (Map.Entry<String, JsonElement> entry : arguments.getAsJsonObject().entrySet()) {
                call.args.add(entry.getKey(), entry.getValue());
            }
        } else if (arguments.isJsonPrimitive()) {
            call.fragments.append(arguments.getAsString());
        }
    }

    private void closeThinking(StreamEventSink sink) {
        if (inThinking) {
            sink.emit(StreamEvent.thinkingComplete(thinking.toString(), null));
            thinking.setLength(0);
            inThinking = false;
        }
    }

    @Override
    public void onEnd(StreamEventSink sink) {
        closeThinking(sink);
        for (Map.Entry<Integer, PendingCall> entry : calls.entrySet()) {
            sink.emit(StreamEvent.toolCall(entry.getValue().toToolCall(entry.getKey())));
        }
        calls.clear();
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
