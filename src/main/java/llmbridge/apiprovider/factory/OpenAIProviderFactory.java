package llmbridge.apiprovider.factory;

import llmbridge.apiprovider.APIProvider;
import llmbridge.apiprovider.APIProviderConfig;
import llmbridge.apiprovider.OpenAIProvider;

/**
 * Factory for Responses API adapters.
 */
public class OpenAIProviderFactory implements APIProviderFactory {

    @Override
    public APIProvider createProvider(APIProviderConfig config) throws UnsupportedProviderException {
        if (!supports(config.getType())) {
            throw new UnsupportedProviderException(config.getType(), getFactoryName());
        }
        return new OpenAIProvider(config);
    }

    @Override
    public APIProvider.ProviderType getProviderType() {
        return APIProvider.ProviderType.OPENAI;
    }
}
