package llmbridge.apiprovider.factory;

import llmbridge.apiprovider.APIProvider;
import llmbridge.apiprovider.APIProviderConfig;
import llmbridge.apiprovider.AnthropicProvider;

/**
 * Factory for Messages API adapters.
 */
public class AnthropicProviderFactory implements APIProviderFactory {

    @Override
    public APIProvider createProvider(APIProviderConfig config) throws UnsupportedProviderException {
        if (!supports(config.getType())) {
            throw new UnsupportedProviderException(config.getType(), getFactoryName());
        }
        return new AnthropicProvider(config);
    }

    @Override
    public APIProvider.ProviderType getProviderType() {
        return APIProvider.ProviderType.ANTHROPIC;
    }
}
