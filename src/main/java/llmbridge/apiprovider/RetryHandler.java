package llmbridge.apiprovider;

import llmbridge.apiprovider.exceptions.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;

/**
 * Handles retry logic for API provider operations
 */
public class RetryHandler {
    private static final Logger logger = LoggerFactory.getLogger(RetryHandler.class);

    public static final int DEFAULT_MAX_RETRIES = 3;
    private static final int BASE_BACKOFF_MS = 1000; // 1 second
    private static final int MAX_BACKOFF_MS = 90000; // 90 seconds

    private final int maxRetries;
    private final String providerName;
    private final CallObserver observer;
    private final int baseBackoffMs;

    public RetryHandler(int maxRetries, String providerName, CallObserver observer) {
        this(maxRetries, providerName, observer, BASE_BACKOFF_MS);
    }

    RetryHandler(int maxRetries, String providerName, CallObserver observer, int baseBackoffMs) {
        this.maxRetries = Math.max(1, maxRetries);
        this.providerName = providerName;
        this.observer = observer;
        this.baseBackoffMs = baseBackoffMs;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    /**
     * Execute a callable operation with retry logic. Each attempt runs the callable
     * from scratch.
     */
    public <T> T executeWithRetryCallable(Callable<T> operation, String operationName) throws APIProviderException {
        APIProviderException lastException = null;

        for (int attempt = 1; attempt <= maxRetries; attempt++) {
            try {
                return operation.call();
            } catch (APIProviderException e) {
                lastException = e;

                if (!shouldRetry(e, attempt)) {
                    throw e;
                }

                if (observer != null) {
                    observer.onRetry(e, attempt, maxRetries);
                }

                if (attempt < maxRetries) {
                    waitForRetry(e, attempt, operationName);
                }
            } catch (Exception e) {
                // Convert non-API exceptions to APIProviderException
                throw new APIProviderException(
                    APIProviderException.ErrorCategory.SERVICE_ERROR,
                    providerName,
                    operationName,
                    -1, null,
                    "Unexpected error: " + e.getMessage(),
                    false, null, e
                );
            }
        }

        // If we get here, all retries failed
        throw lastException;
    }

    private boolean shouldRetry(APIProviderException e, int attempt) {
        return attempt < maxRetries && e.isRetryable();
    }

    private void waitForRetry(APIProviderException e, int attempt, String operationName) throws StreamCancelledException {
        int waitTimeMs = calculateWaitTime(e, attempt);
        logger.info("[{}] Waiting {} ms before retrying {}", providerName, waitTimeMs, operationName);

        try {
            Thread.sleep(waitTimeMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new StreamCancelledException(providerName, operationName,
                StreamCancelledException.CancellationReason.INTERRUPTED);
        }
    }

    int calculateWaitTime(APIProviderException e, int attempt) {
        // For rate limit errors, use the provided retry-after if available
        if (e.getCategory() == APIProviderException.ErrorCategory.RATE_LIMIT &&
            e.getRetryAfterSeconds() != null) {
            // long math: a huge header must not wrap to a negative wait
            return (int) Math.min(Math.max(0L, e.getRetryAfterSeconds()) * 1000L, MAX_BACKOFF_MS);
        }

        // For other errors, use exponential backoff with jitter
        int backoffMs = baseBackoffMs * (int) Math.pow(2, attempt - 1);

        // Add jitter (+/-12.5%)
        int jitter = (int) (backoffMs * 0.25 * (Math.random() - 0.5));
        backoffMs += jitter;

        // Cap at maximum backoff
        return Math.min(backoffMs, MAX_BACKOFF_MS);
    }
}
