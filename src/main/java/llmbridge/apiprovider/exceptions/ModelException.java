package llmbridge.apiprovider.exceptions;

/**
 * Exception for model-related errors
 */
public class ModelException extends APIProviderException {

    public enum ModelErrorType {
        MODEL_NOT_FOUND("The specified model was not found or is not available"),
        CONTEXT_LENGTH_EXCEEDED("Input exceeds the model's maximum context length"),
        TOKEN_LIMIT_EXCEEDED("Response would exceed the maximum token limit"),
        MODEL_OVERLOADED("The model is currently overloaded");

        private final String description;

        ModelErrorType(String description) {
            this.description = description;
        }

        public String getDescription() { return description; }
    }

    private final ModelErrorType modelErrorType;

    /**
     * The vendor message is kept when present; the generic description is the fallback.
     */
    public ModelException(String providerName, String operation, ModelErrorType errorType,
                        int httpStatusCode, String apiErrorCode, String vendorMessage) {
        super(ErrorCategory.MODEL_ERROR, providerName, operation, httpStatusCode, apiErrorCode,
              vendorMessage != null ? vendorMessage : errorType.getDescription(),
              errorType == ModelErrorType.MODEL_OVERLOADED, null, null);
        this.modelErrorType = errorType;
    }

    public ModelErrorType getModelErrorType() {
        return modelErrorType;
    }
}
