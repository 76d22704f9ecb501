package llmbridge.apiprovider;

import llmbridge.apiprovider.exceptions.APIProviderException;

import java.time.Duration;

/**
 * Sink for call latency, token counts and errors. {@link APIProviderLogger} is the default.
 */
public interface CallObserver {

    void onCallSucceeded(String providerName, String operation, Duration latency, int tokensUsed);

    void onCallFailed(String providerName, String operation, Duration latency, APIProviderException error);

    default void onRetry(APIProviderException error, int attempt, int maxAttempts) {
    }
}
