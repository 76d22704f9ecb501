package llmbridge.apiprovider;

import java.net.ConnectException;
import java.util.concurrent.atomic.AtomicInteger;

import llmbridge.apiprovider.exceptions.APIProviderException;
import llmbridge.apiprovider.exceptions.AuthenticationException;
import llmbridge.apiprovider.exceptions.ModelException;
import llmbridge.apiprovider.exceptions.NetworkException;
import llmbridge.apiprovider.exceptions.RateLimitException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link RetryHandler}.
 */
class RetryHandlerTest {

    private final APIProviderLogger observer = new APIProviderLogger();

    private final RetryHandler handler = new RetryHandler(3, "test", observer, 1);

    @Test
    void retriesServiceErrorsUntilSuccess() throws Exception {
        AtomicInteger attempts = new AtomicInteger();

        String result = handler.executeWithRetryCallable(() -> {
            if (attempts.incrementAndGet() < 3) {
                throw new APIProviderException(APIProviderException.ErrorCategory.SERVICE_ERROR,
                    "test", "executeOnce", 503, null, "unavailable", true, null, null);
            }
            return "ok";
        }, "executeOnce");

        assertThat(result).isEqualTo("ok");
        assertThat(attempts).hasValue(3);
        assertThat(observer.getStats("test").getTotalRetries()).isEqualTo(2);
    }

    @Test
    void authenticationErrorsAreNotRetried() {
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> handler.executeWithRetryCallable(() -> {
            attempts.incrementAndGet();
            throw new AuthenticationException("test", "executeOnce", 401, "authentication_error", "bad key");
        }, "executeOnce")).isInstanceOf(AuthenticationException.class).hasMessage("bad key");

        assertThat(attempts).hasValue(1);
    }

    @Test
    void lastErrorIsRethrownWhenAttemptsRunOut() {
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> handler.executeWithRetryCallable(() -> {
            attempts.incrementAndGet();
            throw new NetworkException("test", "executeOnce", NetworkException.NetworkErrorType.CONNECTION_FAILED,
                new ConnectException("refused"));
        }, "executeOnce")).isInstanceOf(NetworkException.class);

        assertThat(attempts).hasValue(3);
    }

    @Test
    void unexpectedExceptionsAreWrapped() {
        assertThatThrownBy(() -> handler.executeWithRetryCallable(() -> {
            throw new IllegalStateException("boom");
        }, "executeOnce"))
            .isInstanceOf(APIProviderException.class)
            .hasMessageContaining("boom")
            .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void retryAfterIsHonoredAndCapped() {
        RetryHandler production = new RetryHandler(3, "test", observer);

        assertThat(production.calculateWaitTime(
            new RateLimitException("test", "op", 429, null, "slow down", 5), 1)).isEqualTo(5000);
        assertThat(production.calculateWaitTime(
            new RateLimitException("test", "op", 429, null, "slow down", 600), 1)).isEqualTo(90000);
    }

    @Test
    void hugeRetryAfterIsCappedInsteadOfOverflowing() {
        RetryHandler production = new RetryHandler(3, "test", observer);

        assertThat(production.calculateWaitTime(
            new RateLimitException("test", "op", 429, null, "slow down", Integer.MAX_VALUE), 1)).isEqualTo(90000);
        assertThat(production.calculateWaitTime(
            new RateLimitException("test", "op", 429, null, "slow down", 2_147_484), 1)).isEqualTo(90000);
        assertThat(production.calculateWaitTime(
            new RateLimitException("test", "op", 429, null, "slow down", -3), 1)).isZero();
    }

    @Test
    void modelErrorsAreRetriedOnlyWhenOverloaded() {
        AtomicInteger overloaded = new AtomicInteger();
        assertThatThrownBy(() -> handler.executeWithRetryCallable(() -> {
            overloaded.incrementAndGet();
            throw new ModelException("test", "executeOnce", ModelException.ModelErrorType.MODEL_OVERLOADED,
                529, "overloaded_error", "Overloaded");
        }, "executeOnce")).isInstanceOf(ModelException.class);

        AtomicInteger rejected = new AtomicInteger();
        assertThatThrownBy(() -> handler.executeWithRetryCallable(() -> {
            rejected.incrementAndGet();
            throw new APIProviderException(APIProviderException.ErrorCategory.CONFIGURATION,
                "test", "executeOnce", 400, "invalid_request_error", "bad request");
        }, "executeOnce")).hasMessage("bad request");

        assertThat(overloaded).hasValue(3);
        assertThat(rejected).hasValue(1);
    }

    @Test
    void backoffGrowsExponentiallyWithJitter() {
        RetryHandler production = new RetryHandler(5, "test", observer);
        APIProviderException error = new APIProviderException(APIProviderException.ErrorCategory.SERVICE_ERROR,
            "test", "op", "unavailable");

        assertThat(production.calculateWaitTime(error, 1)).isBetween(875, 1125);
        assertThat(production.calculateWaitTime(error, 3)).isBetween(3500, 4500);
    }
}
