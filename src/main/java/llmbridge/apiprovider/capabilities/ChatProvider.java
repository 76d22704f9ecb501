package llmbridge.apiprovider.capabilities;

import llmbridge.apiprovider.ChatMessage;
import llmbridge.apiprovider.CompletionResult;
import llmbridge.apiprovider.EventStream;
import llmbridge.apiprovider.GenerationOptions;
import llmbridge.apiprovider.ToolDefinition;
import llmbridge.apiprovider.WireRequest;
import llmbridge.apiprovider.exceptions.APIProviderException;
import llmbridge.apiprovider.exceptions.EncodingException;

import java.util.List;

/**
 * The adapter contract every provider implements: encode a canonical conversation,
 * then execute it once or as a stream.
 */
public interface ChatProvider {

    /**
     * Encode a canonical conversation into a vendor request.
     * @param messages The conversation, read-only
     * @param tools Tools the model may call; may be empty
     * @param streaming Whether the request will be executed with {@link #executeStreaming}
     * @param options Generation settings; null fields take the provider defaults
     * @return The encoded request
     * @throws EncodingException if the conversation cannot be represented for this vendor
     */
    WireRequest encode(List<ChatMessage> messages, List<ToolDefinition> tools, boolean streaming,
                       GenerationOptions options) throws EncodingException;

    /**
     * Execute a request and parse the single response document (blocking).
     * @param request A request produced by {@link #encode} with streaming off
     * @return The parsed result
     * @throws APIProviderException if the request fails or the response is unusable
     */
    CompletionResult executeOnce(WireRequest request) throws APIProviderException;

    /**
     * Execute a request and decode the response incrementally on a worker thread.
     * @param request A request produced by {@link #encode} with streaming on
     * @return The event stream; it ends with exactly one DONE or ERROR event
     * @throws APIProviderException if the stream cannot be started
     */
    EventStream executeStreaming(WireRequest request) throws APIProviderException;
}
