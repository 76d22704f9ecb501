package llmbridge.apiprovider;

import com.google.gson.JsonObject;
import llmbridge.apiprovider.exceptions.APIProviderException;
import llmbridge.apiprovider.exceptions.ModelException;
import llmbridge.apiprovider.exceptions.RateLimitException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.TreeMap;

/**
 * Decodes Messages API server-sent events. Content blocks are tracked by their index
 * from {@code content_block_start} to {@code content_block_stop}.
 */
class AnthropicStreamDecoder implements StreamDecoder {
    private static final Logger logger = LoggerFactory.getLogger(AnthropicStreamDecoder.class);
    private static final String OPERATION = "executeStreaming";

    private final String providerName;
    private final Map<Integer, Block> blocks = new TreeMap<>();
    private int inputTokens;
    private int outputTokens;
    private String stopReason;
    private boolean complete;

    private static final class Block {
        final String type;
        final String id;
        final String name;
        final StringBuilder content = new StringBuilder();
        final StringBuilder signature = new StringBuilder();

        Block(String type, String id, String name) {
            this.type = type;
            this.id = id;
            this.name = name;
        }
    }

    AnthropicStreamDecoder(String providerName) {
        this.providerName = providerName;
    }

    @Override
    public boolean onFrame(String eventType, String data, StreamEventSink sink) {
        JsonObject event = JsonFields.parseFrame(data, providerName);
        if (event == null) {
            return true;
        }

        String type = JsonFields.getString(event, "type", eventType != null ? eventType : "");
        switch (type) {
            case "message_start":
                JsonObject usage = JsonFields.getObject(JsonFields.getObject(event, "message"), "usage");
                inputTokens = JsonFields.getInt(usage, "input_tokens");
                outputTokens = JsonFields.getInt(usage, "output_tokens");
                break;

            case "content_block_start":
                startBlock(JsonFields.getInt(event, "index"), JsonFields.getObject(event, "content_block"), sink);
                break;

            case "content_block_delta":
                applyDelta(JsonFields.getInt(event, "index"), JsonFields.getObject(event, "delta"), sink);
                break;

            case "content_block_stop":
                finishBlock(JsonFields.getInt(event, "index"), sink);
                break;

            case "message_delta":
                JsonObject deltaUsage = JsonFields.getObject(event, "usage");
                if (deltaUsage != null && deltaUsage.has("output_tokens")) {
                    outputTokens = JsonFields.getInt(deltaUsage, "output_tokens");
                }
                stopReason = JsonFields.getString(JsonFields.getObject(event, "delta"), "stop_reason", stopReason);
                break;

            case "message_stop":
                complete = true;
                return false;

            case "error":
                sink.emit(StreamEvent.error(vendorError(JsonFields.getObject(event, "error"))));
                return false;

            default:
                // ping and future event types
                break;
        }
        return true;
    }

    private void startBlock(int index, JsonObject contentBlock, StreamEventSink sink) {
        String blockType = JsonFields.getString(contentBlock, "type", "");
        Block block = new Block(blockType, JsonFields.getString(contentBlock, "id"),
            JsonFields.getString(contentBlock, "name"));
        blocks.put(index, block);

        if ("text".equals(blockType)) {
            String initial = JsonFields.getString(contentBlock, "text", "");
            if (!initial.isEmpty()) {
                sink.emit(StreamEvent.text(initial));
            }
        } else if ("thinking".equals(blockType)) {
            String initial = JsonFields.getString(contentBlock, "thinking", "");
            if (!initial.isEmpty()) {
                block.content.append(initial);
                sink.emit(StreamEvent.thinking(initial));
            }
        }
    }

    private void applyDelta(int index, JsonObject delta, StreamEventSink sink) {
        String deltaType = JsonFields.getString(delta, "type", "");
        Block block = blocks.get(index);
        switch (deltaType) {
            case "text_delta":
                String text = JsonFields.getString(delta, "text", "");
                if (!text.isEmpty()) {
                    sink.emit(StreamEvent.text(text));
                }
                break;
            case "thinking_delta":
                String thinking = JsonFields.getString(delta, "thinking", "");
                if (block == null) {
                    block = new Block("thinking", null, null);
                    blocks.put(index, block);
                }
                block.content.append(thinking);
                if (!thinking.isEmpty()) {
                    sink.emit(StreamEvent.thinking(thinking));
                }
                break;
            case "signature_delta":
                if (block != null) {
                    block.signature.append(JsonFields.getString(delta, "signature", ""));
                }
                break;
            case "input_json_delta":
                if (block != null) {
                    block.content.append(JsonFields.getString(delta, "partial_json", ""));
                } else {
                    logger.warn("[{}] Tool input delta for unknown block {}", providerName, index);
                }
                break;
            default:
                logger.debug("[{}] Ignoring delta of type {}", providerName, deltaType);
                break;
        }
    }

    private void finishBlock(int index, StreamEventSink sink) {
        Block block = blocks.remove(index);
        if (block == null) {
            return;
        }
        if ("thinking".equals(block.type)) {
            sink.emit(StreamEvent.thinkingComplete(block.content.toString(), block.signature.toString()));
        } else if ("tool_use".equals(block.type)) {
            sink.emit(StreamEvent.toolCall(new ToolCall(block.id, block.name,
                ToolCall.parseArguments(block.content.toString()))));
        }
    }

    private APIProviderException vendorError(JsonObject error) {
        String errorType = JsonFields.getString(error, "type", "error");
        String message = JsonFields.getString(error, "message", "Stream error");
        switch (errorType) {
            case "overloaded_error":
                return new ModelException(providerName, OPERATION, ModelException.ModelErrorType.MODEL_OVERLOADED,
                    -1, errorType, message);
            case "rate_limit_error":
                return new RateLimitException(providerName, OPERATION, -1, errorType, message, null);
            default:
                return new APIProviderException(APIProviderException.ErrorCategory.SERVICE_ERROR,
                    providerName, OPERATION, -1, errorType, message);
        }
    }

    @Override
    public void onEnd(StreamEventSink sink) {
        for (Block block : blocks.values()) {
            if ("thinking".equals(block.type)) {
                sink.emit(StreamEvent.thinkingComplete(block.content.toString(), block.signature.toString()));
            }
        }
        blocks.clear();
        if (stopReason != null) {
            logger.debug("[{}] Stream finished: {}", providerName, stopReason);
        }
        sink.emit(StreamEvent.done(getTokensUsed()));
    }

    @Override
    public boolean isComplete() {
        return complete;
    }

    @Override
    public int getTokensUsed() {
        return inputTokens + outputTokens;
    }
}
