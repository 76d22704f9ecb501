package llmbridge.apiprovider.factory;

import llmbridge.apiprovider.APIProvider;

/**
 * Thrown when no factory can build an adapter for the requested provider type.
 */
public class UnsupportedProviderException extends Exception {

    private final APIProvider.ProviderType requestedType;
    private final String factoryName;

    public UnsupportedProviderException(APIProvider.ProviderType requestedType, String factoryName) {
        this(requestedType, factoryName,
            String.format("Factory '%s' does not support provider type '%s'", factoryName, requestedType));
    }

    public UnsupportedProviderException(APIProvider.ProviderType requestedType, String factoryName, String message) {
        super(message);
        this.requestedType = requestedType;
        this.factoryName = factoryName;
    }

    public APIProvider.ProviderType getRequestedType() {
        return requestedType;
    }

    public String getFactoryName() {
        return factoryName;
    }
}
