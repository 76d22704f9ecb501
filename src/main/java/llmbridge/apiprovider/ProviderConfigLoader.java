package llmbridge.apiprovider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds provider configurations from properties of the form
 * {@code llmbridge.providers.<name>.<field>=value}. Values may reference environment
 * variables as {@code ${NAME}}, which keeps API keys out of the file.
 *
 * <pre>
 * llmbridge.providers.claude.type=anthropic
 * llmbridge.providers.claude.key=${ANTHROPIC_API_KEY}
 * llmbridge.providers.claude.reasoningEffort=medium
 * </pre>
 */
public class ProviderConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ProviderConfigLoader.class);

    public static final String PREFIX = "llmbridge.providers.";

    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([A-Za-z_][A-Za-z0-9_]*)}");

    private final Function<String, String> environment;

    public ProviderConfigLoader() {
        this(System::getenv);
    }

    /**
     * @param environment lookup for {@code ${NAME}} placeholders; returns null for unset names
     */
    public ProviderConfigLoader(Function<String, String> environment) {
        this.environment = environment;
    }

    public List<APIProviderConfig> load(Reader reader) throws IOException {
        Properties properties = new Properties();
        properties.load(reader);
        return load(properties);
    }

    /**
     * One configuration per provider name, ordered by name. Defaults are not filled in here.
     * @throws IllegalArgumentException if a provider has no type or a value cannot be parsed
     */
    public List<APIProviderConfig> load(Properties properties) {
        Map<String, Map<String, String>> fieldsByProvider = new TreeMap<>();
        for (String key : properties.stringPropertyNames()) {
            if (!key.startsWith(PREFIX)) continue;

            String rest = key.substring(PREFIX.length());
            int dot = rest.indexOf('.');
            if (dot <= 0 || dot == rest.length() - 1) {
                logger.warn("Ignoring malformed provider setting {}", key);
                continue;
            }
            fieldsByProvider.computeIfAbsent(rest.substring(0, dot), k -> new HashMap<>())
                .put(rest.substring(dot + 1), resolvePlaceholders(properties.getProperty(key)));
        }

        List<APIProviderConfig> configs = new ArrayList<>();
        for (Map.Entry<String, Map<String, String>> entry : fieldsByProvider.entrySet()) {
            configs.add(toConfig(entry.getKey(), entry.getValue()));
        }
        logger.debug("Loaded {} provider configuration(s)", configs.size());
        return configs;
    }

    private APIProviderConfig toConfig(String name, Map<String, String> fields) {
        String type = fields.get("type");
        if (type == null || type.trim().isEmpty()) {
            throw new IllegalArgumentException("Provider '" + name + "' has no type");
        }
        APIProviderConfig config = new APIProviderConfig(name, APIProvider.ProviderType.fromString(type));

        for (Map.Entry<String, String> field : fields.entrySet()) {
            String value = field.getValue().trim();
            switch (field.getKey()) {
                case "type":
                    break;
                case "model":
                    config.setModel(value);
                    break;
                case "url":
                    config.setUrl(value);
                    break;
                case "key":
                    config.setKey(value);
                    break;
                case "maxTokens":
                    config.setMaxTokens(parseInt(name, field.getKey(), value));
                    break;
                case "timeout":
                    config.setTimeout(parseInt(name, field.getKey(), value));
                    break;
                case "maxRetries":
                    config.setMaxRetries(parseInt(name, field.getKey(), value));
                    break;
                case "disableTlsVerification":
                    config.setDisableTlsVerification(Boolean.parseBoolean(value));
                    break;
                case "reasoningEffort":
                    config.setReasoningEffort(ReasoningConfig.parseEffort(value));
                    break;
                default:
                    logger.warn("[{}] Ignoring unknown provider setting {}", name, field.getKey());
                    break;
            }
        }
        return config;
    }

    /**
     * Replace {@code ${NAME}} references. Unset variables become empty with a warning.
     */
    String resolvePlaceholders(String value) {
        Matcher matcher = PLACEHOLDER.matcher(value);
        StringBuffer resolved = new StringBuffer();
        while (matcher.find()) {
            String variable = matcher.group(1);
            String replacement = environment.apply(variable);
            if (replacement == null) {
                logger.warn("Environment variable {} is not set", variable);
                replacement = "";
            }
            matcher.appendReplacement(resolved, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(resolved);
        return resolved.toString();
    }

    private static int parseInt(String provider, String field, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Provider '" + provider + "': " + field + " is not a number: " + value, e);
        }
    }
}
