package llmbridge.apiprovider.capabilities;

import llmbridge.apiprovider.StructuredOutputConfig;

/**
 * Interface for providers that can constrain output to JSON or an enum.
 */
public interface StructuredOutputProvider {

    /**
     * Check if this provider supports the given structured output format
     * @param format The requested format
     * @return true if the format is supported
     */
    default boolean supportsStructuredOutput(StructuredOutputConfig.Format format) {
        return true;
    }
}
