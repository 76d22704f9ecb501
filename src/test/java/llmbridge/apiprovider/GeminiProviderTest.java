package llmbridge.apiprovider;

import java.util.Arrays;
import java.util.List;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import llmbridge.apiprovider.exceptions.APIProviderException;
import llmbridge.apiprovider.exceptions.ResponseException;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link GeminiProvider}.
 */
class GeminiProviderTest {

    private MockWebServer server;
    private GeminiProvider provider;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        APIProviderConfig config = new APIProviderConfig("gemini", APIProvider.ProviderType.GEMINI);
        config.setUrl(server.url("/").toString());
        config.setKey("AIza-test");
        config.setModel("models/gemini-test");
        config.setMaxRetries(1);
        provider = new GeminiProvider(config);
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void endpointDependsOnStreaming() throws Exception {
        List<ChatMessage> messages = List.of(ChatMessage.user("hi"));

        assertThat(provider.encode(messages, null, false, null).getEndpoint())
            .isEqualTo("v1beta/models/gemini-test:generateContent");
        assertThat(provider.encode(messages, null, true, null).getEndpoint())
            .isEqualTo("v1beta/models/gemini-test:streamGenerateContent?alt=sse");
    }

    @Test
    void systemTextBecomesSystemInstruction() throws Exception {
        List<ChatMessage> messages = Arrays.asList(
            ChatMessage.system("Rule one."),
            ChatMessage.system("Rule two."),
            ChatMessage.user("hi"),
            ChatMessage.agent("hello"));

        JsonObject body = provider.encode(messages, null, false, null).getBody();

        JsonObject instruction = body.getAsJsonObject("systemInstruction");
        assertThat(instruction.get("role").getAsString()).isEqualTo("user");
        assertThat(instruction.getAsJsonArray("parts").get(0).getAsJsonObject().get("text").getAsString())
            .isEqualTo("Rule one.\n\nRule two.");

        JsonArray contents = body.getAsJsonArray("contents");
        assertThat(contents).hasSize(2);
        assertThat(contents.get(1).getAsJsonObject().get("role").getAsString()).isEqualTo("model");
    }

    @Test
    void toolTrafficTravelsAsParts() throws Exception {
        JsonObject args = new JsonObject();
        args.addProperty("path", "a.txt");
        List<ChatMessage> messages = Arrays.asList(
            ChatMessage.user("Read a.txt"),
            ChatMessage.agent(new ThinkingBlock("plan", "sig-g"),
                MessagePart.toolCall("c1", "read_file", args),
                MessagePart.toolCall("c2", "stat_file", args)),
            ChatMessage.user(MessagePart.toolResult("c1", "contents"), MessagePart.toolError("c2", "missing")));

        JsonArray contents = provider.encode(messages, null, false, null).getBody().getAsJsonArray("contents");

        JsonArray modelParts = contents.get(1).getAsJsonObject().getAsJsonArray("parts");
        assertThat(modelParts).hasSize(2);
        JsonObject firstCall = modelParts.get(0).getAsJsonObject();
        assertThat(firstCall.getAsJsonObject("functionCall").get("name").getAsString()).isEqualTo("read_file");
        assertThat(firstCall.get("thoughtSignature").getAsString()).isEqualTo("sig-g");
        assertThat(modelParts.get(1).getAsJsonObject().has("thoughtSignature")).isFalse();

        JsonArray userParts = contents.get(2).getAsJsonObject().getAsJsonArray("parts");
        JsonObject ok = userParts.get(0).getAsJsonObject().getAsJsonObject("functionResponse");
        assertThat(ok.get("name").getAsString()).isEqualTo("read_file");
        assertThat(ok.getAsJsonObject("response").get("content").getAsString()).isEqualTo("contents");
        JsonObject failed = userParts.get(1).getAsJsonObject().getAsJsonObject("functionResponse");
        assertThat(failed.get("name").getAsString()).isEqualTo("stat_file");
        assertThat(failed.getAsJsonObject("response").get("error").getAsString()).isEqualTo("missing");
    }

    @Test
    void filesAreInlinedOrReferenced() throws Exception {
        byte[] gif = {'G', 'I', 'F', '8', '9', 'a', 0, 0};
        ChatMessage user = ChatMessage.user(
            MessagePart.file(gif, null),
            MessagePart.fileUri("gs://bucket/cat.png", "image/png"));

        JsonArray parts = provider.encode(List.of(user), null, false, null).getBody()
            .getAsJsonArray("contents").get(0).getAsJsonObject().getAsJsonArray("parts");

        assertThat(parts.get(0).getAsJsonObject().getAsJsonObject("inlineData").get("mimeType").getAsString())
            .isEqualTo("image/gif");
        JsonObject fileData = parts.get(1).getAsJsonObject().getAsJsonObject("fileData");
        assertThat(fileData.get("fileUri").getAsString()).isEqualTo("gs://bucket/cat.png");
        assertThat(fileData.get("mimeType").getAsString()).isEqualTo("image/png");
    }

    @Test
    void generationConfigCarriesThinkingAndSchema() throws Exception {
        JsonObject schema = JsonParser.parseString(
            "{\"type\":\"OBJECT\",\"properties\":{\"b\":{\"type\":\"STRING\"},\"a\":{\"type\":\"STRING\"}}}")
            .getAsJsonObject();
        StructuredOutputConfig structured = StructuredOutputConfig.json(schema);
        structured.setPropertyOrdering(Arrays.asList("a", "b"));
        GenerationOptions options = new GenerationOptions();
        options.setThinkingEnabled(true);
        options.setThinkingBudget(2048);
        options.setStructuredOutput(structured);

        JsonObject config = provider.encode(List.of(ChatMessage.user("go")), null, false, options)
            .getBody().getAsJsonObject("generationConfig");

        assertThat(config.get("maxOutputTokens").getAsInt()).isEqualTo(4096);
        assertThat(config.getAsJsonObject("thinkingConfig").get("thinkingBudget").getAsInt()).isEqualTo(2048);
        assertThat(config.getAsJsonObject("thinkingConfig").get("includeThoughts").getAsBoolean()).isTrue();
        assertThat(config.get("responseMimeType").getAsString()).isEqualTo("application/json");
        assertThat(config.getAsJsonObject("responseSchema").getAsJsonArray("propertyOrdering").toString())
            .isEqualTo("[\"a\",\"b\"]");
        assertThat(schema.has("propertyOrdering")).isFalse();
    }

    @Test
    void enumOutputUsesTheEnumMimeType() throws Exception {
        GenerationOptions options = new GenerationOptions();
        options.setStructuredOutput(StructuredOutputConfig.enumOf(Arrays.asList("POSITIVE", "NEGATIVE")));

        JsonObject config = provider.encode(List.of(ChatMessage.user("tone?")), null, false, options)
            .getBody().getAsJsonObject("generationConfig");

        assertThat(config.get("responseMimeType").getAsString()).isEqualTo(GeminiProvider.ENUM_MIME_TYPE);
        assertThat(config.getAsJsonObject("responseSchema").get("type").getAsString()).isEqualTo("STRING");
    }

    @Test
    void stableCallIdIsDeterministic() {
        JsonObject args = new JsonObject();
        args.addProperty("q", "x");

        String id = GeminiProvider.stableCallId("search", args);

        assertThat(id).matches("call_[0-9a-f]{32}");
        assertThat(GeminiProvider.stableCallId("search", args.deepCopy())).isEqualTo(id);
        assertThat(GeminiProvider.stableCallId("lookup", args)).isNotEqualTo(id);
    }

    @Test
    void parsesCandidateParts() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"candidates\":[{\"content\":{\"role\":\"model\",\"parts\":["
            + "{\"text\":\"Thinking it over.\",\"thought\":true},"
            + "{\"text\":\"Searching.\"},"
            + "{\"functionCall\":{\"name\":\"search\",\"args\":{\"q\":\"x\"}},\"thoughtSignature\":\"sig-1\"}]},"
            + "\"finishReason\":\"STOP\"}],\"usageMetadata\":{\"totalTokenCount\":77}}"));

        CompletionResult result = provider.createCompletion(List.of(ChatMessage.user("find x")), null, null);

        assertThat(result.getText()).isEqualTo("Searching.");
        assertThat(result.getThinking()).isEqualTo(new ThinkingBlock("Thinking it over.", "sig-1"));
        assertThat(result.getTokensUsed()).isEqualTo(77);
        assertThat(result.getFinishReason()).isEqualTo("STOP");
        ToolCall call = result.getToolCalls().get(0);
        assertThat(call.getId()).isEqualTo(GeminiProvider.stableCallId("search", call.getArgs()));

        RecordedRequest recorded = server.takeRequest();
        assertThat(recorded.getPath()).isEqualTo("/v1beta/models/gemini-test:generateContent");
        assertThat(recorded.getHeader("x-goog-api-key")).isEqualTo("AIza-test");
    }

    @Test
    void blockedPromptIsReported() {
        server.enqueue(new MockResponse().setBody("{\"promptFeedback\":{\"blockReason\":\"SAFETY\"}}"));

        assertThatThrownBy(() -> provider.createCompletion(List.of(ChatMessage.user("...")), null, null))
            .isInstanceOfSatisfying(ResponseException.class, e -> {
                assertThat(e.getResponseErrorType()).isEqualTo(ResponseException.ResponseErrorType.BLOCKED);
                assertThat(e.getMessage()).contains("SAFETY");
            });
    }

    @Test
    void errorCodeComesFromStatus() {
        server.enqueue(new MockResponse().setResponseCode(400).setBody(
            "{\"error\":{\"code\":400,\"message\":\"API key not valid.\",\"status\":\"INVALID_ARGUMENT\"}}"));

        assertThatThrownBy(() -> provider.createCompletion(List.of(ChatMessage.user("hi")), null, null))
            .isInstanceOfSatisfying(APIProviderException.class, e -> {
                assertThat(e.getApiErrorCode()).isEqualTo("INVALID_ARGUMENT");
                assertThat(e.getMessage()).isEqualTo("API key not valid.");
            });
    }

    @Test
    void plainTextRoundTrip() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"candidates\":[{\"content\":{\"role\":\"model\","
            + "\"parts\":[{\"text\":\"Paris.\"}]},\"finishReason\":\"STOP\"}],"
            + "\"usageMetadata\":{\"totalTokenCount\":15}}"));

        WireRequest request = provider.encode(List.of(ChatMessage.user("Capital of France?")), null, false, null);
        CompletionResult result = provider.executeOnce(request);

        JsonArray contents = request.getBody().getAsJsonArray("contents");
        assertThat(contents).hasSize(1);
        assertThat(contents.get(0).getAsJsonObject().get("role").getAsString()).isEqualTo("user");
        assertThat(request.getBody().has("systemInstruction")).isFalse();
        assertThat(result.getText()).isEqualTo("Paris.");
        assertThat(result.getToolCalls()).isEmpty();
        assertThat(result.getTokensUsed()).isEqualTo(15);
        assertThat(result.getThinking()).isNull();
        assertThat(result.getFinishReason()).isEqualTo("STOP");
    }
}
