package com.ruach.formation.application.guard;

import java.util.concurrent.Callable;
import java.util.logging.Logger;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;

/**
 * Sequential retry with exponential backoff, built on Resilience4j.
 * <p>
 * On exhaustion the last underlying exception is rethrown as is, never
 * wrapped, so callers can branch on the original cause.
 * </p>
 */
public class RetryExecutor {

    private static final Logger log = Logger.getLogger(RetryExecutor.class.getName());

    private final String name;

    public RetryExecutor(String name) {
        this.name = name;
    }

    /**
     * Invokes {@code operation}, retrying failures up to
     * {@code options.maxAttempts()} attempts in total.
     *
     * @return the first successful result
     * @throws Exception the failure of the last attempt
     */
    public <T> T withRetry(Callable<T> operation, RetryOptions options) throws Exception {
        RetryConfig.Builder<Object> config = RetryConfig.custom()
                .maxAttempts(options.maxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        Math.max(1L, options.initialDelayMs()), options.backoffMultiplier()))
                .retryExceptions(Exception.class);
        if (!options.ignoredExceptions().isEmpty()) {
            config.ignoreExceptions(toArray(options));
        }

        Retry retry = Retry.of(name, config.build());
        retry.getEventPublisher().onRetry(event -> log.warning(String.format(
                "action=retry name=%s attempt=%d waitMs=%d error=%s",
                name, event.getNumberOfRetryAttempts(), event.getWaitInterval().toMillis(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "none")));

        return retry.executeCallable(operation);
    }

    @SuppressWarnings("unchecked")
    private static Class<? extends Throwable>[] toArray(RetryOptions options) {
        return options.ignoredExceptions().toArray(new Class[0]);
    }
}
