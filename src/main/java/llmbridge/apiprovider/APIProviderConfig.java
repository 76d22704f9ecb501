package llmbridge.apiprovider;

import llmbridge.apiprovider.factory.ProviderRegistry;
import llmbridge.apiprovider.factory.UnsupportedProviderException;

import java.util.Locale;

/**
 * Settings for one configured provider. {@link #withDefaults()} is the explicit
 * default-filling step; nothing here reads process-wide state.
 */
public class APIProviderConfig {
    public static final int DEFAULT_TIMEOUT_SECONDS = 120;

    private String name;
    private String model;
    private Integer maxTokens;
    private String url;
    private String key;
    private boolean disableTlsVerification;
    private APIProvider.ProviderType type;
    private Integer timeout;
    private Integer maxRetries;
    private ReasoningConfig.EffortLevel reasoningEffort = ReasoningConfig.EffortLevel.NONE;

    public APIProviderConfig(String name, APIProvider.ProviderType type) {
        this.name = name;
        this.type = type;
    }

    public APIProviderConfig(
            String name,
            APIProvider.ProviderType type,
            String model,
            Integer maxTokens,
            String url,
            String key,
            boolean disableTlsVerification,
            Integer timeout) {
        this.name = name;
        this.type = type;
        this.model = model;
        this.maxTokens = maxTokens;
        this.url = url;
        this.key = key;
        this.disableTlsVerification = disableTlsVerification;
        this.timeout = timeout;
    }

    private APIProviderConfig(APIProviderConfig other) {
        this(other.name, other.type, other.model, other.maxTokens, other.url, other.key,
             other.disableTlsVerification, other.timeout);
        this.maxRetries = other.maxRetries;
        this.reasoningEffort = other.reasoningEffort;
    }

    /**
     * Copy with every unset field filled from the per-type defaults:
     * base URL, model, max tokens (4096), timeout (120 s) and retries (3).
     */
    public APIProviderConfig withDefaults() {
        if (type == null) {
            throw new IllegalArgumentException("Provider type is required for '" + name + "'");
        }
        APIProviderConfig resolved = new APIProviderConfig(this);
        if (resolved.name == null || resolved.name.isEmpty()) {
            resolved.name = type.name().toLowerCase(Locale.ROOT);
        }
        if (resolved.url == null || resolved.url.isEmpty()) {
            resolved.url = type.getDefaultUrl();
        }
        if (resolved.model == null || resolved.model.isEmpty()) {
            resolved.model = type.getDefaultModel();
        }
        if (resolved.maxTokens == null || resolved.maxTokens <= 0) {
            resolved.maxTokens = GenerationOptions.DEFAULT_MAX_TOKENS;
        }
        if (resolved.timeout == null || resolved.timeout <= 0) {
            resolved.timeout = DEFAULT_TIMEOUT_SECONDS;
        }
        if (resolved.maxRetries == null || resolved.maxRetries <= 0) {
            resolved.maxRetries = RetryHandler.DEFAULT_MAX_RETRIES;
        }
        if (resolved.key == null) {
            resolved.key = "";
        }
        if (resolved.reasoningEffort == null) {
            resolved.reasoningEffort = ReasoningConfig.EffortLevel.NONE;
        }
        return resolved;
    }

    // Getters
    public String getName() { return name; }
    public APIProvider.ProviderType getType() { return type; }
    public String getModel() { return model; }
    public Integer getMaxTokens() { return maxTokens; }
    public String getUrl() { return url; }
    public String getKey() { return key; }
    public boolean isDisableTlsVerification() { return disableTlsVerification; }
    public Integer getTimeout() { return timeout; }
    public Integer getMaxRetries() { return maxRetries; }
    public ReasoningConfig.EffortLevel getReasoningEffort() { return reasoningEffort; }

    // Setters
    public void setName(String name) { this.name = name; }
    public void setType(APIProvider.ProviderType type) { this.type = type; }
    public void setModel(String model) { this.model = model; }
    public void setMaxTokens(Integer maxTokens) { this.maxTokens = maxTokens; }
    public void setUrl(String url) { this.url = url; }
    public void setKey(String key) { this.key = key; }
    public void setDisableTlsVerification(boolean disableTlsVerification) { this.disableTlsVerification = disableTlsVerification; }
    public void setTimeout(Integer timeout) { this.timeout = timeout; }
    public void setMaxRetries(Integer maxRetries) { this.maxRetries = maxRetries; }
    public void setReasoningEffort(ReasoningConfig.EffortLevel reasoningEffort) { this.reasoningEffort = reasoningEffort; }

    /**
     * Create a provider using the default factories
     * @return Configured API provider instance
     * @throws IllegalArgumentException if no factory supports the provider type
     */
    public APIProvider createProvider() {
        try {
            return ProviderRegistry.withDefaults().createProvider(this);
        } catch (UnsupportedProviderException e) {
            throw new IllegalArgumentException("Failed to create provider: " + e.getMessage(), e);
        }
    }

    @Override
    public String toString() {
        return "APIProviderConfig{name=" + name + ", type=" + type + ", model=" + model + ", url=" + url + "}";
    }
}
