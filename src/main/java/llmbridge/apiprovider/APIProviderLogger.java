package llmbridge.apiprovider;

import llmbridge.apiprovider.exceptions.APIProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Structured logging and per-provider call statistics. Default {@link CallObserver}.
 */
public class APIProviderLogger implements CallObserver {
    private static final Logger logger = LoggerFactory.getLogger(APIProviderLogger.class);

    private final ConcurrentHashMap<String, ProviderStats> stats = new ConcurrentHashMap<>();

    @Override
    public void onCallSucceeded(String providerName, String operation, Duration latency, int tokensUsed) {
        logger.debug("[{}] {} completed in {} ms, {} tokens", providerName, operation, latency.toMillis(), tokensUsed);
        statsFor(providerName).recordSuccess(latency, tokensUsed);
    }

    /**
     * Log an API provider error with structured information
     */
    @Override
    public void onCallFailed(String providerName, String operation, Duration latency, APIProviderException e) {
        if (e.getCategory() == APIProviderException.ErrorCategory.CANCELLED) {
            logger.info("[{}] {} cancelled after {} ms", providerName, operation, latency.toMillis());
        } else {
            logger.error(formatErrorMessage(e), e);
            // Log additional context if available
            if (e.getCause() != null) {
                logger.debug("Underlying cause: {} - {}", e.getCause().getClass().getSimpleName(), e.getCause().getMessage());
            }
        }
        statsFor(providerName).recordError(e.getCategory());
    }

    /**
     * Log a warning for retry attempts
     */
    @Override
    public void onRetry(APIProviderException e, int attempt, int maxAttempts) {
        logger.warn("[{}] Retry {}/{} for {}: {}",
            e.getProviderName(), attempt, maxAttempts, e.getOperation(), e.getCategory().getDisplayName());
        statsFor(e.getProviderName()).recordRetry();
    }

    /**
     * Get statistics for diagnostics, or null if the provider made no calls
     */
    public ProviderStats getStats(String providerName) {
        return stats.get(providerName);
    }

    public Map<String, ProviderStats> getAllStats() {
        return new ConcurrentHashMap<>(stats);
    }

    public void clearStats() {
        stats.clear();
    }

    /**
     * Generate a diagnostics report
     */
    public String generateDiagnosticsReport() {
        StringBuilder report = new StringBuilder();
        report.append("=== API Provider Statistics ===\n\n");

        if (stats.isEmpty()) {
            report.append("No calls recorded.\n");
            return report.toString();
        }

        for (Map.Entry<String, ProviderStats> entry : stats.entrySet()) {
            ProviderStats providerStats = entry.getValue();
            report.append(String.format("Provider: %s\n", entry.getKey()));
            report.append(String.format("  Successful Calls: %d\n", providerStats.getSuccessfulCalls()));
            report.append(String.format("  Total Errors: %d\n", providerStats.getTotalErrors()));
            report.append(String.format("  Total Retries: %d\n", providerStats.getTotalRetries()));
            report.append(String.format("  Tokens Used: %d\n", providerStats.getTotalTokens()));

            report.append("  Errors by Category:\n");
            for (APIProviderException.ErrorCategory category : APIProviderException.ErrorCategory.values()) {
                int count = providerStats.getCategoryCount(category);
                if (count > 0) {
                    report.append(String.format("    %s: %d\n", category.getDisplayName(), count));
                }
            }

            report.append(String.format("  Success Rate: %.1f%%\n", providerStats.getSuccessRate() * 100));
            report.append("\n");
        }

        return report.toString();
    }

    private ProviderStats statsFor(String providerName) {
        return stats.computeIfAbsent(providerName != null ? providerName : "unknown", k -> new ProviderStats());
    }

    private static String formatErrorMessage(APIProviderException e) {
        StringBuilder message = new StringBuilder();

        message.append(String.format("[%s] %s failed", e.getProviderName(), e.getOperation()));
        message.append(String.format(" - %s", e.getCategory().getDisplayName()));

        if (e.getHttpStatusCode() > 0) {
            message.append(String.format(" (HTTP %d)", e.getHttpStatusCode()));
        }

        if (e.getApiErrorCode() != null && !e.getApiErrorCode().isEmpty()) {
            message.append(String.format(" [%s]", e.getApiErrorCode()));
        }

        if (e.getMessage() != null) {
            message.append(": ").append(e.getMessage());
        }

        return message.toString();
    }

    /**
     * Counters for one provider
     */
    public static class ProviderStats {
        private final AtomicInteger successfulCalls = new AtomicInteger(0);
        private final AtomicInteger totalErrors = new AtomicInteger(0);
        private final AtomicInteger totalRetries = new AtomicInteger(0);
        private final AtomicLong totalTokens = new AtomicLong(0);
        private final AtomicLong totalLatencyMs = new AtomicLong(0);
        private final AtomicLong lastErrorTime = new AtomicLong(0);
        private final ConcurrentHashMap<APIProviderException.ErrorCategory, AtomicInteger> categoryStats =
            new ConcurrentHashMap<>();

        void recordSuccess(Duration latency, int tokensUsed) {
            successfulCalls.incrementAndGet();
            totalTokens.addAndGet(tokensUsed);
            totalLatencyMs.addAndGet(latency.toMillis());
        }

        void recordError(APIProviderException.ErrorCategory category) {
            totalErrors.incrementAndGet();
            lastErrorTime.set(System.currentTimeMillis());
            categoryStats.computeIfAbsent(category, k -> new AtomicInteger(0)).incrementAndGet();
        }

        void recordRetry() {
            totalRetries.incrementAndGet();
        }

        public int getSuccessfulCalls() { return successfulCalls.get(); }
        public int getTotalErrors() { return totalErrors.get(); }
        public int getTotalRetries() { return totalRetries.get(); }
        public long getTotalTokens() { return totalTokens.get(); }
        public long getLastErrorTime() { return lastErrorTime.get(); }

        public int getCategoryCount(APIProviderException.ErrorCategory category) {
            AtomicInteger count = categoryStats.get(category);
            return count != null ? count.get() : 0;
        }

        public long getAverageLatencyMs() {
            int calls = successfulCalls.get();
            return calls == 0 ? 0 : totalLatencyMs.get() / calls;
        }

        /**
         * Fraction of finished calls that succeeded; 1.0 when nothing was recorded.
         */
        public double getSuccessRate() {
            int total = successfulCalls.get() + totalErrors.get();
            return total == 0 ? 1.0 : (double) successfulCalls.get() / total;
        }
    }
}
