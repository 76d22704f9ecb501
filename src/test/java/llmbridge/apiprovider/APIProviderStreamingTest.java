package llmbridge.apiprovider;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;

import llmbridge.apiprovider.exceptions.APIProviderException;
import llmbridge.apiprovider.exceptions.RateLimitException;
import llmbridge.apiprovider.exceptions.ResponseException;
import llmbridge.apiprovider.exceptions.StreamCancelledException;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end streaming through {@link APIProvider} for each vendor adapter.
 */
class APIProviderStreamingTest {

    private MockWebServer server;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void anthropicStreamEndsWithOneDone() throws Exception {
        server.enqueue(sse(
            "event: message_start\ndata: {\"type\":\"message_start\",\"message\":{\"usage\":{\"input_tokens\":9,\"output_tokens\":1}}}\n\n"
                + "event: ping\ndata: {\"type\":\"ping\"}\n\n"
                + "event: content_block_start\ndata: {\"type\":\"content_block_start\",\"index\":0,\"content_block\":{\"type\":\"text\",\"text\":\"\"}}\n\n"
                + "event: content_block_delta\ndata: {\"type\":\"content_block_delta\",\"index\":0,\"delta\":{\"type\":\"text_delta\",\"text\":\"Hel\"}}\n\n"
                + "event: content_block_delta\ndata: {\"type\":\"content_block_delta\",\"index\":0,\"delta\":{\"type\":\"text_delta\",\"text\":\"lo\"}}\n\n"
                + "event: content_block_stop\ndata: {\"type\":\"content_block_stop\",\"index\":0}\n\n"
                + "event: message_delta\ndata: {\"type\":\"message_delta\",\"delta\":{\"stop_reason\":\"end_turn\"},\"usage\":{\"output_tokens\":3}}\n\n"
                + "event: message_stop\ndata: {\"type\":\"message_stop\"}\n\n"));
        APIProviderConfig config = config("claude", APIProvider.ProviderType.ANTHROPIC);
        GenerationOptions options = new GenerationOptions();
        options.setThinkingEnabled(true);

        List<StreamEvent> events;
        try (EventStream stream = new AnthropicProvider(config)
                .streamCompletion(List.of(ChatMessage.user("hi")), null, options)) {
            events = stream.collect();
        }

        assertThat(texts(events)).isEqualTo("Hello");
        assertDoneLast(events, 12);
        RecordedRequest recorded = server.takeRequest();
        assertThat(recorded.getHeader("anthropic-beta")).isEqualTo(AnthropicProvider.INTERLEAVED_THINKING_BETA);
        assertThat(recorded.getBody().readUtf8()).contains("\"stream\":true");
    }

    @Test
    void openAIStreamEndsWithOneDone() throws Exception {
        server.enqueue(sse(
            "event: response.created\ndata: {\"type\":\"response.created\"}\n\n"
                + "event: response.output_text.delta\ndata: {\"type\":\"response.output_text.delta\",\"delta\":\"Hi \"}\n\n"
                + "event: response.output_text.delta\ndata: {\"type\":\"response.output_text.delta\",\"delta\":\"there\"}\n\n"
                + "event: response.completed\ndata: {\"type\":\"response.completed\",\"response\":{\"usage\":{\"total_tokens\":21}}}\n\n"));

        List<StreamEvent> events = new OpenAIProvider(config("openai", APIProvider.ProviderType.OPENAI))
            .streamCompletion(List.of(ChatMessage.user("hi")), null, null).collect();

        assertThat(texts(events)).isEqualTo("Hi there");
        assertDoneLast(events, 21);
    }

    @Test
    void geminiStreamEndsWithOneDone() throws Exception {
        server.enqueue(sse(
            "data: {\"candidates\":[{\"content\":{\"role\":\"model\",\"parts\":[{\"text\":\"Sure\"}]}}]}\n\n"
                + "data: {\"candidates\":[{\"content\":{\"role\":\"model\",\"parts\":[{\"functionCall\":"
                + "{\"name\":\"search\",\"args\":{\"q\":\"x\"}}}]},\"finishReason\":\"STOP\"}],"
                + "\"usageMetadata\":{\"totalTokenCount\":33}}\n\n"));

        List<StreamEvent> events = new GeminiProvider(config("gemini", APIProvider.ProviderType.GEMINI))
            .streamCompletion(List.of(ChatMessage.user("find x")), null, null).collect();

        assertThat(events).extracting(StreamEvent::getType).containsExactly(
            StreamEvent.Type.TEXT, StreamEvent.Type.TOOL_CALL, StreamEvent.Type.DONE);
        assertDoneLast(events, 33);
        assertThat(server.takeRequest().getPath()).endsWith(":streamGenerateContent?alt=sse");
    }

    @Test
    void ollamaStreamEndsWithOneDone() throws Exception {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/x-ndjson")
            .setBody("{\"message\":{\"role\":\"assistant\",\"content\":\"Hey\"},\"done\":false}\n"
                + "{\"message\":{\"role\":\"assistant\",\"content\":\"!\"},\"done\":false}\n"
                + "{\"message\":{\"role\":\"assistant\",\"content\":\"\"},\"done\":true,\"prompt_eval_count\":4,\"eval_count\":2}\n"));

        List<StreamEvent> events = new OllamaProvider(config("ollama", APIProvider.ProviderType.OLLAMA))
            .streamCompletion(List.of(ChatMessage.user("hi")), null, null).collect();

        assertThat(texts(events)).isEqualTo("Hey!");
        assertDoneLast(events, 6);
    }

    @Test
    void anthropicStreamCutInsideAToolCallIsInterrupted() throws Exception {
        server.enqueue(sse(
            "event: message_start\ndata: {\"type\":\"message_start\",\"message\":{\"usage\":{\"input_tokens\":9,\"output_tokens\":0}}}\n\n"
                + "event: content_block_start\ndata: {\"type\":\"content_block_start\",\"index\":0,\"content_block\":"
                + "{\"type\":\"tool_use\",\"id\":\"42\",\"name\":\"lookup\",\"input\":{}}}\n\n"
                + "event: content_block_delta\ndata: {\"type\":\"content_block_delta\",\"index\":0,\"delta\":"
                + "{\"type\":\"input_json_delta\",\"partial_json\":\"{\\\"a\\\":\"}}\n\n"));

        List<StreamEvent> events = new AnthropicProvider(config("claude", APIProvider.ProviderType.ANTHROPIC))
            .streamCompletion(List.of(ChatMessage.user("hi")), null, null).collect();

        assertThat(events).hasSize(1);
        assertThat(events.get(0).getError()).isInstanceOfSatisfying(ResponseException.class, e ->
            assertThat(e.getResponseErrorType()).isEqualTo(ResponseException.ResponseErrorType.STREAM_INTERRUPTED));
    }

    @Test
    void ollamaStreamWithoutDoneIsInterrupted() throws Exception {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/x-ndjson")
            .setBody("{\"message\":{\"role\":\"assistant\",\"content\":\"Hal\"},\"done\":false}\n"));

        List<StreamEvent> events = new OllamaProvider(config("ollama", APIProvider.ProviderType.OLLAMA))
            .streamCompletion(List.of(ChatMessage.user("hi")), null, null).collect();

        assertThat(events).extracting(StreamEvent::getType)
            .containsExactly(StreamEvent.Type.TEXT, StreamEvent.Type.ERROR);
        assertThat(events.get(1).getError()).isInstanceOf(ResponseException.class);
    }

    @Test
    void geminiStreamWithoutFinishReasonIsInterrupted() throws Exception {
        server.enqueue(sse("data: {\"candidates\":[{\"content\":{\"role\":\"model\",\"parts\":[{\"text\":\"Par\"}]}}]}\n\n"));

        List<StreamEvent> events = new GeminiProvider(config("gemini", APIProvider.ProviderType.GEMINI))
            .streamCompletion(List.of(ChatMessage.user("hi")), null, null).collect();

        assertThat(events).extracting(StreamEvent::getType)
            .containsExactly(StreamEvent.Type.TEXT, StreamEvent.Type.ERROR);
    }

    @Test
    void httpErrorBecomesTheTerminalEvent() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(429).setHeader("Retry-After", "7").setBody(
            "{\"type\":\"error\",\"error\":{\"type\":\"rate_limit_error\",\"message\":\"Slow down\"}}"));

        List<StreamEvent> events = new AnthropicProvider(config("claude", APIProvider.ProviderType.ANTHROPIC))
            .streamCompletion(List.of(ChatMessage.user("hi")), null, null).collect();

        assertThat(events).hasSize(1);
        APIProviderException error = events.get(0).getError();
        assertThat(error).isInstanceOf(RateLimitException.class);
        assertThat(error.getRetryAfterSeconds()).isEqualTo(7);
        assertThat(error.getMessage()).isEqualTo("Slow down");
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void openAIStreamFallsBackWithoutSummaries() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(400).setBody("{\"error\":{\"message\":\"Your organization "
            + "must be verified to generate reasoning summaries.\",\"code\":\"unsupported_value\"}}"));
        server.enqueue(sse("event: response.output_text.delta\ndata: {\"delta\":\"ok\"}\n\n"
            + "event: response.completed\ndata: {\"response\":{\"usage\":{\"total_tokens\":5}}}\n\n"));
        APIProviderConfig config = config("openai", APIProvider.ProviderType.OPENAI);
        config.setModel("o3");
        GenerationOptions options = new GenerationOptions();
        options.setThinkingEnabled(true);

        List<StreamEvent> events = new OpenAIProvider(config)
            .streamCompletion(List.of(ChatMessage.user("hi")), null, options).collect();

        assertThat(texts(events)).isEqualTo("ok");
        assertDoneLast(events, 5);
        assertThat(server.takeRequest().getBody().readUtf8()).contains("\"summary\":\"auto\"");
        assertThat(server.takeRequest().getBody().readUtf8()).doesNotContain("summary");
    }

    @Test
    void cancelledStreamEndsWithCancellationInsteadOfDone() throws Exception {
        StringBuilder body = new StringBuilder();
        for (int i = 0; i < 200; i++) {
            body.append("{\"message\":{\"content\":\"chunk ").append(i).append(" \"},\"done\":false}\n");
        }
        body.append("{\"done\":true}\n");
        server.enqueue(new MockResponse().setBody(body.toString()).throttleBody(256, 50, TimeUnit.MILLISECONDS));

        EventStream stream = new OllamaProvider(config("ollama", APIProvider.ProviderType.OLLAMA))
            .streamCompletion(List.of(ChatMessage.user("hi")), null, null);
        StreamEvent first = stream.poll(5, TimeUnit.SECONDS);
        stream.cancel();

        assertThat(first).isNotNull();
        assertThat(first.getType()).isEqualTo(StreamEvent.Type.TEXT);
        assertThat(stream.isCancelled()).isTrue();
        List<StreamEvent> rest = stream.collect();
        assertThat(rest).hasSize(1);
        assertThat(rest.get(0).getError()).isInstanceOf(StreamCancelledException.class);
    }

    @Test
    void streamingRequestIsRejectedByExecuteOnce() throws Exception {
        OllamaProvider provider = new OllamaProvider(config("ollama", APIProvider.ProviderType.OLLAMA));
        WireRequest streaming = provider.encode(List.of(ChatMessage.user("hi")), null, true, null);
        WireRequest blocking = provider.encode(List.of(ChatMessage.user("hi")), null, false, null);

        assertThatThrownBy(() -> provider.executeOnce(streaming)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> provider.executeStreaming(blocking)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void observerSeesCompletedCalls() throws Exception {
        server.enqueue(new MockResponse().setBody(
            "{\"message\":{\"role\":\"assistant\",\"content\":\"ok\"},\"done\":true,\"prompt_eval_count\":3,\"eval_count\":4}"));
        List<Integer> tokens = Collections.synchronizedList(new ArrayList<>());
        OllamaProvider provider = new OllamaProvider(config("ollama", APIProvider.ProviderType.OLLAMA));
        provider.setCallObserver(new CallObserver() {
            @Override
            public void onCallSucceeded(String providerName, String operation, Duration latency, int tokensUsed) {
                tokens.add(tokensUsed);
            }

            @Override
            public void onCallFailed(String providerName, String operation, Duration latency, APIProviderException error) {
            }
        });

        provider.createCompletion(List.of(ChatMessage.user("hi")), null, null);

        assertThat(tokens).containsExactly(7);
    }

    private APIProviderConfig config(String name, APIProvider.ProviderType type) {
        APIProviderConfig config = new APIProviderConfig(name, type);
        config.setUrl(server.url("/").toString());
        config.setKey("test-key");
        config.setMaxRetries(1);
        return config;
    }

    private static MockResponse sse(String body) {
        return new MockResponse().setHeader("Content-Type", "text/event-stream").setBody(body);
    }

    private static String texts(List<StreamEvent> events) {
        StringBuilder text = new StringBuilder();
        for (StreamEvent event : events) {
            if (event.getType() == StreamEvent.Type.TEXT) {
                text.append(event.getText());
            }
        }
        return text.toString();
    }

    private static void assertDoneLast(List<StreamEvent> events, int tokens) {
        assertThat(events).filteredOn(StreamEvent::isTerminal).hasSize(1);
        StreamEvent last = events.get(events.size() - 1);
        assertThat(last.getType()).isEqualTo(StreamEvent.Type.DONE);
        assertThat(last.getTokensUsed()).isEqualTo(tokens);
    }
}
