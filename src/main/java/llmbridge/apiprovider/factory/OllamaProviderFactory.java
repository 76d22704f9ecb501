package llmbridge.apiprovider.factory;

import llmbridge.apiprovider.APIProvider;
import llmbridge.apiprovider.APIProviderConfig;
import llmbridge.apiprovider.OllamaProvider;

/**
 * Factory for local Ollama adapters.
 */
public class OllamaProviderFactory implements APIProviderFactory {

    @Override
    public APIProvider createProvider(APIProviderConfig config) throws UnsupportedProviderException {
        if (!supports(config.getType())) {
            throw new UnsupportedProviderException(config.getType(), getFactoryName());
        }
        return new OllamaProvider(config);
    }

    @Override
    public APIProvider.ProviderType getProviderType() {
        return APIProvider.ProviderType.OLLAMA;
    }
}
