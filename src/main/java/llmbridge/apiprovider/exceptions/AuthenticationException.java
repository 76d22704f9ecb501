package llmbridge.apiprovider.exceptions;

/**
 * Exception for rejected or missing credentials (HTTP 401/403)
 */
public class AuthenticationException extends APIProviderException {

    public AuthenticationException(String providerName, String operation, int httpStatusCode,
                                 String apiErrorCode, String message) {
        super(ErrorCategory.AUTHENTICATION, providerName, operation, httpStatusCode, apiErrorCode,
              message, false, null, null);
    }
}
