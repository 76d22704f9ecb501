package llmbridge.apiprovider.exceptions;

/**
 * Checked failure of an encode, request or stream against one vendor.
 *
 * <p>Vendor error payloads keep their code in {@link #getApiErrorCode()} and their
 * message as the exception message, so callers see what the vendor said rather than
 * a generic label. Whether the failure is worth another attempt follows from the
 * category, or from the subclass for categories that are only sometimes transient
 * (an overloaded model, for one).
 */
public class APIProviderException extends Exception {
    private final ErrorCategory category;
    private final String providerName;
    private final String operation;
    private final int httpStatusCode;
    private final String apiErrorCode;
    private final boolean retryable;
    private final Integer retryAfterSeconds;

    public enum ErrorCategory {
        AUTHENTICATION("Authentication Error", false),
        NETWORK("Network Error", true),
        RATE_LIMIT("Rate Limit Exceeded", true),
        MODEL_ERROR("Model Error", false),
        CONFIGURATION("Configuration Error", false),
        RESPONSE_ERROR("Response Error", false),
        SERVICE_ERROR("Service Error", true),
        TIMEOUT("Timeout Error", true),
        CANCELLED("Request Cancelled", false);

        private final String displayName;
        private final boolean transientFailure;

        ErrorCategory(String displayName, boolean transientFailure) {
            this.displayName = displayName;
            this.transientFailure = transientFailure;
        }

        public String getDisplayName() { return displayName; }

        /**
         * Whether every failure of this category may succeed when the request is sent again.
         */
        public boolean isTransient() { return transientFailure; }
    }

    public APIProviderException(ErrorCategory category, String providerName, String operation,
                                String message) {
        this(category, providerName, operation, -1, null, message, false, null, null);
    }

    public APIProviderException(ErrorCategory category, String providerName, String operation,
                                int httpStatusCode, String apiErrorCode, String message) {
        this(category, providerName, operation, httpStatusCode, apiErrorCode, message, false, null, null);
    }

    /**
     * @param retryable marks this failure as transient even when its category is not
     * @param retryAfterSeconds the vendor's {@code Retry-After}, or null
     */
    public APIProviderException(ErrorCategory category, String providerName, String operation,
                                int httpStatusCode, String apiErrorCode, String message,
                                boolean retryable, Integer retryAfterSeconds, Throwable cause) {
        super(message, cause);
        this.category = category;
        this.providerName = providerName;
        this.operation = operation;
        this.httpStatusCode = httpStatusCode;
        this.apiErrorCode = apiErrorCode;
        this.retryable = retryable;
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public ErrorCategory getCategory() { return category; }
    public String getProviderName() { return providerName; }
    public String getOperation() { return operation; }

    /**
     * @return the HTTP status, or -1 when the failure did not come with one
     */
    public int getHttpStatusCode() { return httpStatusCode; }
    public String getApiErrorCode() { return apiErrorCode; }
    public Integer getRetryAfterSeconds() { return retryAfterSeconds; }

    public boolean isRetryable() {
        return retryable || category.isTransient();
    }
}
