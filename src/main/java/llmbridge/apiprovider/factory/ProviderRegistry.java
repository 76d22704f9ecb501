package llmbridge.apiprovider.factory;

import llmbridge.apiprovider.APIProvider;
import llmbridge.apiprovider.APIProviderConfig;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Maps provider types to their factories. Instances are independent; build one with
 * {@link #withDefaults()} or register factories explicitly.
 */
public class ProviderRegistry {

    private final Map<APIProvider.ProviderType, APIProviderFactory> factories =
        new EnumMap<>(APIProvider.ProviderType.class);

    /**
     * Registry holding the built-in factory for every provider type
     */
    public static ProviderRegistry withDefaults() {
        ProviderRegistry registry = new ProviderRegistry();
        registry.registerFactory(new AnthropicProviderFactory());
        registry.registerFactory(new OpenAIProviderFactory());
        registry.registerFactory(new GeminiProviderFactory());
        registry.registerFactory(new OllamaProviderFactory());
        return registry;
    }

    /**
     * Register a factory, replacing any previous one for the same type
     * @param factory The factory to register
     */
    public synchronized void registerFactory(APIProviderFactory factory) {
        if (factory == null) {
            throw new IllegalArgumentException("Factory cannot be null");
        }
        APIProvider.ProviderType type = factory.getProviderType();
        if (type == null) {
            throw new IllegalArgumentException("Factory must specify a provider type");
        }
        factories.put(type, factory);
    }

    /**
     * Create a provider using the appropriate factory
     * @param config The provider configuration
     * @return A configured provider instance
     * @throws UnsupportedProviderException if no factory is registered for the provider type
     */
    public APIProvider createProvider(APIProviderConfig config) throws UnsupportedProviderException {
        if (config == null) {
            throw new IllegalArgumentException("Provider config cannot be null");
        }
        APIProvider.ProviderType type = config.getType();
        APIProviderFactory factory = getFactory(type);
        if (factory == null) {
            throw new UnsupportedProviderException(type, "ProviderRegistry",
                "No factory registered for provider type: " + type);
        }
        return factory.createProvider(config);
    }

    public synchronized boolean isSupported(APIProvider.ProviderType type) {
        return type != null && factories.containsKey(type);
    }

    public synchronized Set<APIProvider.ProviderType> getSupportedTypes() {
        return factories.isEmpty() ? EnumSet.noneOf(APIProvider.ProviderType.class) : EnumSet.copyOf(factories.keySet());
    }

    /**
     * @return The factory, or null if none is registered
     */
    public synchronized APIProviderFactory getFactory(APIProvider.ProviderType type) {
        return type != null ? factories.get(type) : null;
    }
}
