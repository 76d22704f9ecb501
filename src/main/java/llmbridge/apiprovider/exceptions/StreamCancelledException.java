package llmbridge.apiprovider.exceptions;

/**
 * Exception reported to a stream consumer that is still waiting after the stream
 * was cancelled.
 */
public class StreamCancelledException extends APIProviderException {

    public enum CancellationReason {
        USER_REQUESTED("Consumer cancelled the stream"),
        INTERRUPTED("Waiting thread was interrupted");

        private final String description;

        CancellationReason(String description) {
            this.description = description;
        }

        public String getDescription() { return description; }
    }

    private final CancellationReason cancellationReason;

    public StreamCancelledException(String providerName, String operation, CancellationReason reason) {
        super(ErrorCategory.CANCELLED, providerName, operation, reason.getDescription());
        this.cancellationReason = reason;
    }

    public CancellationReason getCancellationReason() {
        return cancellationReason;
    }
}
