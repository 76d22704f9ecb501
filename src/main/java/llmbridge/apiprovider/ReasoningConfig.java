package llmbridge.apiprovider;

import java.util.Locale;

/**
 * Configuration for LLM reasoning/thinking effort.
 * Providers take reasoning settings in different shapes:
 * - Anthropic / Gemini: a token budget
 * - OpenAI Responses: reasoning.effort string derived from the budget
 * - Ollama: think boolean, or an effort string for gpt-oss models
 */
public class ReasoningConfig {

    /** Budgets at or below this map to LOW effort. */
    public static final int LOW_EFFORT_MAX_BUDGET = 1024;
    /** Budgets at or below this (and above the LOW bound) map to MEDIUM effort. */
    public static final int MEDIUM_EFFORT_MAX_BUDGET = 8192;

    public enum EffortLevel {
        NONE,    // Don't send any reasoning parameters
        LOW,     // Minimal reasoning
        MEDIUM,  // Balanced reasoning
        HIGH     // Maximum reasoning depth
    }

    private EffortLevel effort;

    public ReasoningConfig() {
        this.effort = EffortLevel.NONE;
    }

    public ReasoningConfig(EffortLevel effort) {
        this.effort = effort != null ? effort : EffortLevel.NONE;
    }

    public EffortLevel getEffort() {
        return effort;
    }

    public void setEffort(EffortLevel effort) {
        this.effort = effort != null ? effort : EffortLevel.NONE;
    }

    /**
     * Check if reasoning is enabled (not NONE).
     */
    public boolean isEnabled() {
        return effort != EffortLevel.NONE;
    }

    /**
     * Token budget for this effort level. Returns 0 if effort is NONE.
     */
    public int getBudget() {
        switch (effort) {
            case LOW:
                return 2000;
            case MEDIUM:
                return 10000;
            case HIGH:
                return 25000;
            default:
                return 0;
        }
    }

    /**
     * Map a reasoning token budget onto an effort level.
     */
    public static EffortLevel fromBudget(int budget) {
        if (budget <= 0) {
            return EffortLevel.NONE;
        }
        if (budget <= LOW_EFFORT_MAX_BUDGET) {
            return EffortLevel.LOW;
        }
        if (budget <= MEDIUM_EFFORT_MAX_BUDGET) {
            return EffortLevel.MEDIUM;
        }
        return EffortLevel.HIGH;
    }

    /**
     * Lowercase effort string for a budget ("low", "medium", "high"), or null for no budget.
     */
    public static String effortString(int budget) {
        EffortLevel level = fromBudget(budget);
        return level == EffortLevel.NONE ? null : level.name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse an effort level from a string (case-insensitive).
     */
    public static EffortLevel parseEffort(String value) {
        if (value == null || value.trim().isEmpty() || value.equalsIgnoreCase("none")) {
            return EffortLevel.NONE;
        }
        try {
            return EffortLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown reasoning effort: " + value, e);
        }
    }

    @Override
    public String toString() {
        return "ReasoningConfig{effort=" + effort + "}";
    }
}
