package llmbridge.apiprovider;

/**
 * Per-stream state machine turning vendor frames into canonical events.
 * One instance serves exactly one stream on one thread; its accumulation state dies with it.
 */
public interface StreamDecoder {

    /**
     * Handle one frame.
     *
     * @param eventType the SSE {@code event:} header, or null when absent (always null for NDJSON)
     * @param data the frame payload
     * @return false once the vendor signalled the logical end of the stream
     */
    boolean onFrame(String eventType, String data, StreamEventSink sink);

    /**
     * Flush anything still open and emit the terminal DONE event.
     */
    void onEnd(StreamEventSink sink);

    /**
     * Whether the vendor's end-of-response marker was seen. A body that runs out before it
     * was cut off.
     */
    boolean isComplete();

    int getTokensUsed();
}
