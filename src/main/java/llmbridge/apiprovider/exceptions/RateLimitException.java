package llmbridge.apiprovider.exceptions;

/**
 * Exception for rate limiting errors (HTTP 429 or a vendor rate-limit payload)
 */
public class RateLimitException extends APIProviderException {

    public RateLimitException(String providerName, String operation, int httpStatusCode,
                            String apiErrorCode, String message, Integer retryAfterSeconds) {
        super(ErrorCategory.RATE_LIMIT, providerName, operation, httpStatusCode, apiErrorCode,
              message, true, retryAfterSeconds, null);
    }
}
