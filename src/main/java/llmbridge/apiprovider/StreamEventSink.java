package llmbridge.apiprovider;

/**
 * Receiver of canonical events produced by a stream decoder.
 */
public interface StreamEventSink {

    /**
     * @return false if the event was not delivered (consumer gone or stream already terminated)
     */
    boolean emit(StreamEvent event);
}
