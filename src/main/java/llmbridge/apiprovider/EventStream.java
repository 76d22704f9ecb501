package llmbridge.apiprovider;

import llmbridge.apiprovider.exceptions.StreamCancelledException;
import okhttp3.Call;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Bounded queue of canonical events between the worker decoding one response and the
 * caller consuming it.
 *
 * <p>The producer side ({@link #emit}) is used by exactly one worker thread at a time.
 * Everything emitted after the first DONE/ERROR is discarded, so consumers see exactly
 * one terminal event, last. {@link #close()} cancels the underlying HTTP call, which
 * releases the connection and makes the worker stop reading. A consumer still reading
 * after a cancel receives a terminal ERROR carrying a {@link StreamCancelledException}.
 */
public class EventStream implements Iterable<StreamEvent>, StreamEventSink, AutoCloseable {
    public static final int DEFAULT_CAPACITY = 100;

    private static final long POLL_INTERVAL_MS = 50;

    private final String providerName;
    private final BlockingQueue<StreamEvent> queue;
    private volatile boolean cancelled;
    private volatile boolean terminated;
    private volatile Call call;
    private boolean terminalConsumed;

    public EventStream(String providerName) {
        this(providerName, DEFAULT_CAPACITY);
    }

    public EventStream(String providerName, int capacity) {
        this.providerName = providerName;
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    /**
     * Bind the in-flight HTTP call so that cancellation can abort it.
     */
    void attach(Call call) {
        this.call = call;
        if (cancelled) {
            call.cancel();
        }
    }

    // Producer side

    @Override
    public boolean emit(StreamEvent event) {
        if (terminated || cancelled) {
            return false;
        }
        if (event.isTerminal()) {
            terminated = true;
        }
        try {
            while (!queue.offer(event, POLL_INTERVAL_MS, TimeUnit.MILLISECONDS)) {
                if (cancelled) {
                    return false;
                }
            }
            // A cancel racing the offer discards the event on the consumer side
            return !cancelled;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel();
            return false;
        }
    }

    public String getProviderName() {
        return providerName;
    }

    public boolean isTerminated() {
        return terminated;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    // Consumer side

    /**
     * Block until the next event arrives. After a cancel the next call returns the
     * cancellation ERROR, whatever was still queued.
     * @return the next event, or null once the terminal event was consumed
     */
    public StreamEvent next() throws InterruptedException {
        while (!terminalConsumed) {
            if (cancelled) {
                queue.clear();
                return consume(cancelledEvent());
            }
            StreamEvent event = queue.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
            if (event != null && !cancelled) {
                return consume(event);
            }
        }
        return null;
    }

    /**
     * Wait up to the given time for the next event.
     * @return the event, or null on timeout or end of stream
     */
    public StreamEvent poll(long timeout, TimeUnit unit) throws InterruptedException {
        if (terminalConsumed) {
            return null;
        }
        if (cancelled) {
            queue.clear();
            return consume(cancelledEvent());
        }
        StreamEvent event = queue.poll(timeout, unit);
        if (cancelled) {
            queue.clear();
            return consume(cancelledEvent());
        }
        return event != null ? consume(event) : null;
    }

    private StreamEvent consume(StreamEvent event) {
        if (event.isTerminal()) {
            terminalConsumed = true;
        }
        return event;
    }

    private StreamEvent cancelledEvent() {
        return StreamEvent.error(new StreamCancelledException(providerName, "executeStreaming",
            StreamCancelledException.CancellationReason.USER_REQUESTED));
    }

    /**
     * Drain the stream to its terminal event.
     */
    public List<StreamEvent> collect() throws InterruptedException {
        List<StreamEvent> events = new ArrayList<>();
        StreamEvent event;
        while ((event = next()) != null) {
            events.add(event);
        }
        return events;
    }

    /**
     * Stop the stream from the consumer side. Idempotent.
     */
    public void cancel() {
        cancelled = true;
        Call current = call;
        if (current != null) {
            current.cancel();
        }
        queue.clear();
    }

    @Override
    public void close() {
        if (!terminalConsumed) {
            cancel();
        }
    }

    @Override
    public Iterator<StreamEvent> iterator() {
        return new Iterator<StreamEvent>() {
            private StreamEvent pending;
            private boolean finished;

            @Override
            public boolean hasNext() {
                if (pending != null) {
                    return true;
                }
                if (finished) {
                    return false;
                }
                try {
                    pending = EventStream.this.next();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    cancel();
                    pending = null;
                }
                if (pending == null) {
                    finished = true;
                }
                return pending != null;
            }

            @Override
            public StreamEvent next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                StreamEvent event = pending;
                pending = null;
                return event;
            }
        };
    }
}
