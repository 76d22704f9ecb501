package llmbridge.apiprovider.factory;

import llmbridge.apiprovider.APIProvider;
import llmbridge.apiprovider.APIProviderConfig;

/**
 * Creates the adapter for one provider type.
 */
public interface APIProviderFactory {

    /**
     * Create an adapter from configuration
     * @param config The provider configuration; unset fields take the type's defaults
     * @return A configured adapter
     * @throws UnsupportedProviderException if the configuration is for another provider type
     */
    APIProvider createProvider(APIProviderConfig config) throws UnsupportedProviderException;

    /**
     * Get the provider type this factory creates
     */
    APIProvider.ProviderType getProviderType();

    default boolean supports(APIProvider.ProviderType type) {
        return type == getProviderType();
    }

    default String getFactoryName() {
        return getClass().getSimpleName();
    }
}
