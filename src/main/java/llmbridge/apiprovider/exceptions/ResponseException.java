package llmbridge.apiprovider.exceptions;

/**
 * Exception for response documents that are unusable even though the HTTP exchange
 * itself succeeded.
 */
public class ResponseException extends APIProviderException {

    public enum ResponseErrorType {
        MALFORMED_JSON("Response contains invalid JSON"),
        MISSING_REQUIRED_FIELD("Required field missing from response"),
        UNEXPECTED_FORMAT("Response format is not as expected"),
        EMPTY_RESPONSE("Received empty response"),
        INCOMPLETE_RESPONSE("Response did not complete"),
        BLOCKED("Response was blocked by the provider"),
        STREAM_INTERRUPTED("Response stream was interrupted");

        private final String description;

        ResponseErrorType(String description) {
            this.description = description;
        }

        public String getDescription() { return description; }
    }

    private final ResponseErrorType responseErrorType;

    public ResponseException(String providerName, String operation, ResponseErrorType errorType) {
        super(ErrorCategory.RESPONSE_ERROR, providerName, operation, errorType.getDescription());
        this.responseErrorType = errorType;
    }

    public ResponseException(String providerName, String operation, ResponseErrorType errorType,
                           String detail) {
        super(ErrorCategory.RESPONSE_ERROR, providerName, operation,
              detail == null || detail.isEmpty() ? errorType.getDescription() : errorType.getDescription() + ": " + detail);
        this.responseErrorType = errorType;
    }

    public ResponseException(String providerName, String operation, ResponseErrorType errorType,
                           Throwable cause) {
        super(ErrorCategory.RESPONSE_ERROR, providerName, operation, -1, null,
              errorType.getDescription(), false, null, cause);
        this.responseErrorType = errorType;
    }

    public ResponseErrorType getResponseErrorType() {
        return responseErrorType;
    }
}
