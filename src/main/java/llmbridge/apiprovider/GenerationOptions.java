package llmbridge.apiprovider;

/**
 * Per-call generation settings. Unset (null) fields are filled from the provider
 * configuration by {@link #withDefaults}.
 */
public class GenerationOptions {
    public static final int DEFAULT_MAX_TOKENS = 4096;
    public static final int DEFAULT_THINKING_BUDGET = 10000;

    private String model;
    private Integer maxTokens;
    private Double temperature;
    private Boolean thinkingEnabled;
    private Integer thinkingBudget;
    private StructuredOutputConfig structuredOutput;

    public GenerationOptions() {
    }

    private GenerationOptions(GenerationOptions other) {
        this.model = other.model;
        this.maxTokens = other.maxTokens;
        this.temperature = other.temperature;
        this.thinkingEnabled = other.thinkingEnabled;
        this.thinkingBudget = other.thinkingBudget;
        this.structuredOutput = other.structuredOutput;
    }

    /**
     * Default-filling step. Returns a copy in which model, max tokens, thinking flag and
     * thinking budget are always set:
     * <ul>
     *   <li>model and max tokens come from the provider configuration, then {@value #DEFAULT_MAX_TOKENS}</li>
     *   <li>thinking follows the configured reasoning effort when the caller did not choose</li>
     *   <li>the budget comes from the effort level, then {@value #DEFAULT_THINKING_BUDGET}</li>
     * </ul>
     * Temperature and structured output stay as given.
     */
    public static GenerationOptions withDefaults(GenerationOptions options, String defaultModel,
                                                 Integer defaultMaxTokens, ReasoningConfig reasoning) {
        GenerationOptions resolved = options != null ? new GenerationOptions(options) : new GenerationOptions();
        ReasoningConfig effort = reasoning != null ? reasoning : new ReasoningConfig();

        if (resolved.model == null || resolved.model.isEmpty()) {
            resolved.model = defaultModel;
        }
        if (resolved.maxTokens == null || resolved.maxTokens <= 0) {
            resolved.maxTokens = defaultMaxTokens != null && defaultMaxTokens > 0 ? defaultMaxTokens : DEFAULT_MAX_TOKENS;
        }
        if (resolved.thinkingEnabled == null) {
            resolved.thinkingEnabled = effort.isEnabled();
        }
        if (resolved.thinkingBudget == null || resolved.thinkingBudget <= 0) {
            resolved.thinkingBudget = effort.isEnabled() ? effort.getBudget() : DEFAULT_THINKING_BUDGET;
        }
        return resolved;
    }

    // Getters
    public String getModel() { return model; }
    public Integer getMaxTokens() { return maxTokens; }
    public Double getTemperature() { return temperature; }
    public boolean isThinkingEnabled() { return Boolean.TRUE.equals(thinkingEnabled); }
    public Integer getThinkingBudget() { return thinkingBudget; }
    public StructuredOutputConfig getStructuredOutput() { return structuredOutput; }

    // Setters
    public void setModel(String model) { this.model = model; }
    public void setMaxTokens(Integer maxTokens) { this.maxTokens = maxTokens; }
    public void setTemperature(Double temperature) { this.temperature = temperature; }
    public void setThinkingEnabled(Boolean thinkingEnabled) { this.thinkingEnabled = thinkingEnabled; }
    public void setThinkingBudget(Integer thinkingBudget) { this.thinkingBudget = thinkingBudget; }
    public void setStructuredOutput(StructuredOutputConfig structuredOutput) { this.structuredOutput = structuredOutput; }
}
