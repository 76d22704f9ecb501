package llmbridge.apiprovider;

import java.util.ArrayList;
import java.util.List;

import llmbridge.apiprovider.exceptions.ResponseException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link OpenAIStreamDecoder}.
 */
class OpenAIStreamDecoderTest {

    private final OpenAIStreamDecoder decoder = new OpenAIStreamDecoder("openai");

    private final List<StreamEvent> events = new ArrayList<>();

    private final StreamEventSink sink = event -> events.add(event);

    @Test
    void toolCallAnnouncedTwiceIsEmittedOnce() {
        feed("response.output_item.added", "{\"item\":{\"type\":\"function_call\",\"id\":\"fc_1\","
            + "\"call_id\":\"7\",\"name\":\"lookup\",\"arguments\":\"\"}}");
        feed("response.function_call_arguments.delta", "{\"item_id\":\"fc_1\",\"delta\":\"{\\\"q\\\":\"}");
        feed("response.function_call_arguments.delta", "{\"item_id\":\"fc_1\",\"delta\":\"\\\"x\\\"}\"}");
        feed("response.output_item.done", "{\"item\":{\"type\":\"function_call\",\"id\":\"fc_1\","
            + "\"call_id\":\"7\",\"name\":\"lookup\",\"arguments\":\"{\\\"q\\\":\\\"x\\\"}\"}}");
        feed("response.function_call_arguments.done", "{\"item_id\":\"fc_1\",\"arguments\":\"{\\\"q\\\":\\\"x\\\"}\"}");

        assertThat(events).hasSize(1);
        ToolCall call = events.get(0).getToolCall();
        assertThat(call.getId()).isEqualTo("7");
        assertThat(call.getName()).isEqualTo("lookup");
        assertThat(call.getArgs().get("q").getAsString()).isEqualTo("x");
    }

    @Test
    void argumentsDoneWithoutPayloadUsesAccumulatedDeltas() {
        feed("response.output_item.added", "{\"item\":{\"type\":\"function_call\",\"id\":\"fc_2\","
            + "\"call_id\":\"call_2\",\"name\":\"sum\"}}");
        feed("response.function_call_arguments.delta", "{\"item_id\":\"fc_2\",\"delta\":\"{\\\"a\\\":1,\"}");
        feed("response.function_call_arguments.delta", "{\"item_id\":\"fc_2\",\"delta\":\"\\\"b\\\":2}\"}");
        feed("response.function_call_arguments.done", "{\"item_id\":\"fc_2\"}");

        assertThat(events.get(0).getToolCall().getArgs().get("b").getAsInt()).isEqualTo(2);
    }

    @Test
    void summaryPartsAreSeparatedAndCompletedWithEncryptedContent() {
        feed("response.output_item.added", "{\"item\":{\"type\":\"reasoning\",\"id\":\"rs_1\"}}");
        feed("response.reasoning_summary_text.delta", "{\"item_id\":\"rs_1\",\"summary_index\":0,\"delta\":\"First.\"}");
        feed("response.reasoning_summary_text.delta", "{\"item_id\":\"rs_1\",\"summary_index\":1,\"delta\":\"Second.\"}");
        feed("response.output_item.done", "{\"item\":{\"type\":\"reasoning\",\"id\":\"rs_1\","
            + "\"summary\":[{\"text\":\"First.\"},{\"text\":\"Second.\"}],\"encrypted_content\":\"enc\"}}");
        feed("response.output_item.done", "{\"item\":{\"type\":\"reasoning\",\"id\":\"rs_1\"}}");
        feed("response.output_text.delta", "{\"delta\":\"Answer\"}");

        assertThat(events).extracting(StreamEvent::getType).containsExactly(
            StreamEvent.Type.THINKING, StreamEvent.Type.THINKING, StreamEvent.Type.THINKING_COMPLETE,
            StreamEvent.Type.TEXT);
        assertThat(events.get(2).getThinking()).isEqualTo(new ThinkingBlock("First.\nSecond.", "enc"));
    }

    @Test
    void summaryOnlyInTheFinalItemIsStillEmitted() {
        feed("response.output_item.done", "{\"item\":{\"type\":\"reasoning\",\"id\":\"rs_2\","
            + "\"summary\":[{\"text\":\"Whole summary.\"}],\"encrypted_content\":{\"data\":\"enc2\"}}}");

        assertThat(events).extracting(StreamEvent::getType)
            .containsExactly(StreamEvent.Type.THINKING, StreamEvent.Type.THINKING_COMPLETE);
        assertThat(events.get(1).getThinking()).isEqualTo(new ThinkingBlock("Whole summary.", "enc2"));
    }

    @Test
    void textDeltaAcceptsObjectAndLegacyShapes() {
        feed(null, "{\"type\":\"response.output_text.delta\",\"delta\":{\"text\":\"a\"}}");
        feed(null, "{\"type\":\"response.output_text.delta\",\"text\":\"b\"}");

        assertThat(events).extracting(StreamEvent::getText).containsExactly("a", "b");
    }

    @Test
    void eventHeaderWinsOverPayloadType() {
        feed("response.output_text.delta",
            "{\"type\":\"response.reasoning_summary_text.delta\",\"delta\":\"visible\"}");

        assertThat(events).hasSize(1);
        assertThat(events.get(0).getType()).isEqualTo(StreamEvent.Type.TEXT);
        assertThat(events.get(0).getText()).isEqualTo("visible");
    }

    @Test
    void completedRecordsUsageAndEndsTheStream() {
        feed("response.output_item.added", "{\"item\":{\"type\":\"reasoning\",\"id\":\"rs_3\"}}");
        feed("response.reasoning_summary_text.delta", "{\"item_id\":\"rs_3\",\"summary_index\":0,\"delta\":\"open\"}");

        boolean more = decoder.onFrame("response.completed",
            "{\"response\":{\"usage\":{\"total_tokens\":99}}}", sink);
        decoder.onEnd(sink);

        assertThat(more).isFalse();
        assertThat(decoder.isComplete()).isTrue();
        assertThat(events).extracting(StreamEvent::getType).containsExactly(
            StreamEvent.Type.THINKING, StreamEvent.Type.THINKING_COMPLETE, StreamEvent.Type.DONE);
        assertThat(events.get(1).getThinking().getContent()).isEqualTo("open");
        assertThat(events.get(2).getTokensUsed()).isEqualTo(99);
    }

    @Test
    void incompleteResponseEndsWithAnError() {
        boolean more = decoder.onFrame("response.incomplete",
            "{\"response\":{\"incomplete_details\":{\"reason\":\"content_filter\"}}}", sink);

        assertThat(more).isFalse();
        assertThat(decoder.isComplete()).isFalse();
        assertThat(events.get(0).getError()).isInstanceOfSatisfying(ResponseException.class, e -> {
            assertThat(e.getResponseErrorType()).isEqualTo(ResponseException.ResponseErrorType.INCOMPLETE_RESPONSE);
            assertThat(e.getMessage()).contains("content_filter");
        });
    }

    @Test
    void failedResponseCarriesTheVendorCode() {
        decoder.onFrame("response.failed",
            "{\"response\":{\"error\":{\"code\":\"server_error\",\"message\":\"try again\"}}}", sink);

        assertThat(events.get(0).getError().getApiErrorCode()).isEqualTo("server_error");
        assertThat(events.get(0).getError().getMessage()).isEqualTo("try again");
    }

    private void feed(String eventType, String data) {
        assertThat(decoder.onFrame(eventType, data, sink)).isTrue();
    }
}
