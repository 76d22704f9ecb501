package llmbridge.apiprovider.exceptions;

/**
 * Exception for transport failures: the request never produced an HTTP response,
 * or the response stream broke while it was being read.
 */
public class NetworkException extends APIProviderException {

    public enum NetworkErrorType {
        CONNECTION_FAILED("Cannot connect to server"),
        TIMEOUT("Request timed out"),
        SSL_ERROR("SSL/TLS connection failed"),
        DNS_ERROR("Cannot resolve hostname"),
        CONNECTION_LOST("Connection was lost during request");

        private final String description;

        NetworkErrorType(String description) {
            this.description = description;
        }

        public String getDescription() { return description; }
    }

    private final NetworkErrorType networkErrorType;

    public NetworkException(String providerName, String operation, NetworkErrorType errorType,
                          Throwable cause) {
        super(errorType == NetworkErrorType.TIMEOUT ? ErrorCategory.TIMEOUT : ErrorCategory.NETWORK,
              providerName, operation, -1, null, errorType.getDescription(), true, null, cause);
        this.networkErrorType = errorType;
    }

    public NetworkException(String providerName, String operation, String message, Throwable cause) {
        super(ErrorCategory.NETWORK, providerName, operation, -1, null, message, true, null, cause);
        this.networkErrorType = null;
    }

    public NetworkErrorType getNetworkErrorType() {
        return networkErrorType;
    }
}
