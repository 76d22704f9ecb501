package llmbridge.apiprovider;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import llmbridge.apiprovider.exceptions.APIProviderException;
import llmbridge.apiprovider.exceptions.StreamCancelledException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link EventStream}.
 */
class EventStreamTest {

    @Test
    void eventsAfterTheTerminalEventAreDiscarded() throws Exception {
        EventStream stream = new EventStream("test");

        assertThat(stream.emit(StreamEvent.text("a"))).isTrue();
        assertThat(stream.emit(StreamEvent.done(7))).isTrue();
        assertThat(stream.emit(StreamEvent.text("late"))).isFalse();
        assertThat(stream.emit(StreamEvent.error(new APIProviderException(
            APIProviderException.ErrorCategory.SERVICE_ERROR, "test", "op", "late")))).isFalse();

        List<StreamEvent> events = stream.collect();
        assertThat(events).extracting(StreamEvent::getType)
            .containsExactly(StreamEvent.Type.TEXT, StreamEvent.Type.DONE);
        assertThat(events.get(1).getTokensUsed()).isEqualTo(7);
        assertThat(stream.next()).isNull();
    }

    @Test
    void iterationEndsAfterTheTerminalEvent() {
        EventStream stream = new EventStream("test");
        stream.emit(StreamEvent.thinking("hmm"));
        stream.emit(StreamEvent.text("hello"));
        stream.emit(StreamEvent.done(0));

        List<StreamEvent.Type> types = new ArrayList<>();
        for (StreamEvent event : stream) {
            types.add(event.getType());
        }
        assertThat(types).containsExactly(StreamEvent.Type.THINKING, StreamEvent.Type.TEXT, StreamEvent.Type.DONE);
    }

    @Test
    void fullQueueBlocksTheProducerUntilTheConsumerTakes() throws Exception {
        EventStream stream = new EventStream("test", 1);
        assertThat(stream.emit(StreamEvent.text("first"))).isTrue();

        CompletableFuture<Boolean> second = CompletableFuture.supplyAsync(() -> stream.emit(StreamEvent.text("second")));
        Thread.sleep(200);
        assertThat(second).isNotDone();

        assertThat(stream.next().getText()).isEqualTo("first");
        assertThat(second.get(2, TimeUnit.SECONDS)).isTrue();
        assertThat(stream.next().getText()).isEqualTo("second");
    }

    @Test
    void cancelReleasesABlockedProducer() throws Exception {
        EventStream stream = new EventStream("test", 1);
        stream.emit(StreamEvent.text("first"));
        CompletableFuture<Boolean> blocked = CompletableFuture.supplyAsync(() -> stream.emit(StreamEvent.text("second")));

        stream.cancel();

        assertThat(blocked.get(2, TimeUnit.SECONDS)).isFalse();
        assertThat(stream.isCancelled()).isTrue();
        assertThat(stream.emit(StreamEvent.done(0))).isFalse();

        StreamEvent terminal = stream.next();
        assertThat(terminal.getType()).isEqualTo(StreamEvent.Type.ERROR);
        assertThat(terminal.getError()).isInstanceOfSatisfying(StreamCancelledException.class, e -> {
            assertThat(e.getCancellationReason()).isEqualTo(StreamCancelledException.CancellationReason.USER_REQUESTED);
            assertThat(e.getCategory()).isEqualTo(APIProviderException.ErrorCategory.CANCELLED);
            assertThat(e.getProviderName()).isEqualTo("test");
        });
        assertThat(stream.next()).isNull();
    }

    @Test
    void cancelWakesAConsumerWaitingOnAnEmptyStream() throws Exception {
        EventStream stream = new EventStream("test");
        CompletableFuture<StreamEvent> waiting = CompletableFuture.supplyAsync(() -> {
            try {
                return stream.next();
            } catch (InterruptedException e) {
                throw new IllegalStateException(e);
            }
        });
        Thread.sleep(100);
        assertThat(waiting).isNotDone();

        stream.cancel();

        StreamEvent terminal = waiting.get(2, TimeUnit.SECONDS);
        assertThat(terminal.getError()).isInstanceOf(StreamCancelledException.class);
        assertThat(stream.poll(10, TimeUnit.MILLISECONDS)).isNull();
    }

    @Test
    void pollAfterCancelReturnsTheCancellationOnce() throws Exception {
        EventStream stream = new EventStream("test");
        stream.emit(StreamEvent.text("queued"));

        stream.cancel();

        assertThat(stream.poll(10, TimeUnit.MILLISECONDS).getError()).isInstanceOf(StreamCancelledException.class);
        assertThat(stream.poll(10, TimeUnit.MILLISECONDS)).isNull();
        assertThat(stream.collect()).isEmpty();
    }

    @Test
    void closeBeforeTheEndCancels() {
        EventStream stream = new EventStream("test");
        stream.emit(StreamEvent.text("partial"));

        stream.close();

        assertThat(stream.isCancelled()).isTrue();
    }

    @Test
    void closeAfterTheEndDoesNotCancel() throws Exception {
        EventStream stream = new EventStream("test");
        stream.emit(StreamEvent.done(0));
        assertThat(stream.next().getType()).isEqualTo(StreamEvent.Type.DONE);

        stream.close();

        assertThat(stream.isCancelled()).isFalse();
        assertThat(stream.isTerminated()).isTrue();
    }

    @Test
    void pollTimesOutOnAnEmptyStream() throws Exception {
        EventStream stream = new EventStream("test");

        assertThat(stream.poll(50, TimeUnit.MILLISECONDS)).isNull();
        assertThat(stream.getProviderName()).isEqualTo("test");
    }
}
