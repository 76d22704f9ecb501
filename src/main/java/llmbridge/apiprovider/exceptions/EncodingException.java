package llmbridge.apiprovider.exceptions;

/**
 * Exception for conversations that cannot be represented as a valid request for
 * the target provider. Raised before anything is sent and never retried.
 */
public class EncodingException extends APIProviderException {

    public EncodingException(String providerName, String message) {
        super(ErrorCategory.CONFIGURATION, providerName, "encode", message);
    }
}
