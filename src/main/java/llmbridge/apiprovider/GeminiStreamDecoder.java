package llmbridge.apiprovider;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import llmbridge.apiprovider.exceptions.APIProviderException;

import java.util.HashSet;
import java.util.Set;

/**
 * Decodes streamGenerateContent chunks. Reasoning arrives as ordinary text parts flagged
 * {@code thought}; a block ends at its signature, at the next non-thought part, or at
 * the end of the stream.
 *
 * <p>Gemini also flags the confirmation text it writes right after a function call as a
 * thought. Once a call was seen, flagged parts are therefore emitted as text.
 */
class GeminiStreamDecoder implements StreamDecoder {
    private static final String OPERATION = "executeStreaming";

    private final String providerName;
    private final Set<String> emittedCalls = new HashSet<>();
    private final StringBuilder thinking = new StringBuilder();
    private boolean inThinking;
    private boolean sawToolCall;
    private int tokensUsed;
    private boolean complete;

    GeminiStreamDecoder(String providerName) {
        this.providerName = providerName;
    }

    @Override
    public boolean onFrame(String eventType, String data, StreamEventSink sink) {
        JsonObject chunk = JsonFields.parseFrame(data, providerName);
        if (chunk == null) {
            return true;
        }

        JsonObject error = JsonFields.getObject(chunk, "error");
        if (error != null) {
            sink.emit(StreamEvent.error(new APIProviderException(APIProviderException.ErrorCategory.SERVICE_ERROR,
                providerName, OPERATION, JsonFields.getInt(error, "code"), JsonFields.getString(error, "status"),
                JsonFields.getString(error, "message", "Stream error"))));
            return false;
        }

        JsonObject usage = JsonFields.getObject(chunk, "usageMetadata");
        if (usage != null && usage.has("totalTokenCount")) {
            tokensUsed = JsonFields.getInt(usage, "totalTokenCount");
        }

        JsonArray candidates = JsonFields.getArray(chunk, "candidates");
        if (candidates.size() == 0 || !candidates.get(0).isJsonObject()) {
            if (JsonFields.getString(JsonFields.getObject(chunk, "promptFeedback"), "blockReason") != null) {
                sink.emit(StreamEvent.error(GeminiProvider.noCandidates(providerName, OPERATION, chunk)));
                return false;
            }
            return true;
        }

        JsonObject candidate = candidates.get(0).getAsJsonObject();
        JsonObject content = JsonFields.getObject(candidate, "content");
        for (JsonElement element : JsonFields.getArray(content, "parts")) {
            if (element.isJsonObject()) {
                onPart(element.getAsJsonObject(), sink);
            }
        }
        // Only the last chunk carries a finish reason
        if (!JsonFields.isEmpty(JsonFields.getString(candidate, "finishReason"))) {
            complete = true;
        }
        return true;
    }

    private void onPart(JsonObject part, StreamEventSink sink) {
        String signature = JsonFields.getString(part, "thoughtSignature");
        JsonObject functionCall = JsonFields.getObject(part, "functionCall");

        if (functionCall != null) {
            if (inThinking) {
                completeThinking(signature, sink);
            }
            ToolCall call = GeminiProvider.toolCallFromPart(functionCall);
            if (emittedCalls.add(call.getId())) {
                sink.emit(StreamEvent.toolCall(call));
            }
            sawToolCall = true;
            return;
        }

        String text = JsonFields.getString(part, "text", "");
        if (JsonFields.getBoolean(part, "thought") && !sawToolCall) {
            inThinking = true;
            thinking.append(text);
            if (!text.isEmpty()) {
                sink.emit(StreamEvent.thinking(text));
            }
            if (!JsonFields.isEmpty(signature)) {
                completeThinking(signature, sink);
            }
            return;
        }

        if (inThinking) {
            completeThinking(signature, sink);
        }
        if (!text.isEmpty()) {
            sink.emit(StreamEvent.text(text));
        }
    }

    private void completeThinking(String signature, StreamEventSink sink) {
        sink.emit(StreamEvent.thinkingComplete(thinking.toString(), signature));
        thinking.setLength(0);
        inThinking = false;
    }

    @Override
    public void onEnd(StreamEventSink sink) {
        if (inThinking) {
            completeThinking(null, sink);
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
