package llmbridge.apiprovider.factory;

import llmbridge.apiprovider.APIProvider;
import llmbridge.apiprovider.APIProviderConfig;
import llmbridge.apiprovider.GeminiProvider;

/**
 * Factory for Gemini generateContent adapters.
 */
public class GeminiProviderFactory implements APIProviderFactory {

    @Override
    public APIProvider createProvider(APIProviderConfig config) throws UnsupportedProviderException {
        if (!supports(config.getType())) {
            throw new UnsupportedProviderException(config.getType(), getFactoryName());
        }
        return new GeminiProvider(config);
    }

    @Override
    public APIProvider.ProviderType getProviderType() {
        return APIProvider.ProviderType.GEMINI;
    }
}
