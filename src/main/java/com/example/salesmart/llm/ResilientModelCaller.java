package com.example.salesmart.llm;

import java.time.Duration;
import java.util.List;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.JsonNode;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;

/**
 * Every model call in the pipeline goes through here.
 *
 * Up to {@code llm.retry.max-attempts} attempts; a retryable failure waits
 * {@code baseDelay * 2^attempt} (attempt counted from 0) before the next try.
 * Fatal failures are rethrown at once, the last failure is rethrown on exhaustion.
 * The {@link ModelCallGuard} is consulted before every attempt, so a cancelled
 * or expired run stops retrying with the guard's exception.
 */
@Component
public class ResilientModelCaller {

    private static final Logger log = LoggerFactory.getLogger(ResilientModelCaller.class);

    private final ModelClient modelClient;
    private final RetryableErrorClassifier classifier;
    private final int maxAttempts;
    private final Duration baseDelay;
    private final Duration defaultTimeout;

    public ResilientModelCaller(ModelClient modelClient, RetryableErrorClassifier classifier,
            ModelProperties properties) {
        this.modelClient = modelClient;
        this.classifier = classifier;
        this.maxAttempts = Math.max(1, properties.getRetry().getMaxAttempts());
        this.baseDelay = properties.getRetry().getBaseDelay();
        this.defaultTimeout = properties.getTimeout();
    }

    static RetryConfig retryConfig(int maxAttempts, Duration baseDelay, RetryableErrorClassifier classifier,
            ModelCallGuard guard) {
        return RetryConfig.custom()
                .maxAttempts(Math.max(1, maxAttempts))
                .intervalFunction(backoff(baseDelay, guard))
                .retryOnException(e -> !guard.exhausted() && classifier.isRetryable(e))
                .build();
    }

    /** {@code baseDelay * 2^(attempt-1)}, never longer than the guard has left. */
    static IntervalFunction backoff(Duration baseDelay, ModelCallGuard guard) {
        IntervalFunction exponential = IntervalFunction.ofExponentialBackoff(baseDelay, 2.0);
        return attempt -> Math.min(exponential.apply(attempt), guard.remainingMs());
    }

    /**
     * @throws ModelBackendException when the last allowed attempt fails
     * @throws RuntimeException whatever {@code guard} throws once the caller's time is up
     */
    public ModelResponse call(String prompt, JsonNode responseSchema, boolean jsonMode, Duration timeout,
            ModelCallGuard guard) {
        Duration perAttempt = timeout != null ? timeout : defaultTimeout;
        Retry retry = newRetry(guard);
        Supplier<ModelResponse> decorated = Retry.decorateSupplier(retry, () -> {
            guard.beforeAttempt();
            Duration left = Duration.ofMillis(Math.min(perAttempt.toMillis(), guard.remainingMs()));
            return modelClient.generate(new ModelRequest(prompt, responseSchema, List.of(), jsonMode, left));
        });
        try {
            return decorated.get();
        } catch (ModelBackendException e) {
            // time ran out while the last attempt was failing
            guard.beforeAttempt();
            throw e;
        }
    }

    Retry newRetry(ModelCallGuard guard) {
        Retry retry = Retry.of("model-" + modelClient.provider(),
                retryConfig(maxAttempts, baseDelay, classifier, guard));
        retry.getEventPublisher()
                .onRetry(e -> log.warn("[ModelRetry] provider={} attempt={} wait={}ms error={}",
                        modelClient.provider(), e.getNumberOfRetryAttempts(), e.getWaitInterval().toMillis(),
                        describe(e.getLastThrowable())))
                .onError(e -> log.error("[ModelRetry] provider={} gave up after {} attempts: {}",
                        modelClient.provider(), e.getNumberOfRetryAttempts(), describe(e.getLastThrowable())))
                .onIgnoredError(e -> log.warn("[ModelRetry] provider={} not retried: {}",
                        modelClient.provider(), describe(e.getLastThrowable())));
        return retry;
    }

    public Duration defaultTimeout() {
        return defaultTimeout;
    }

    private static String describe(Throwable t) {
        if (t instanceof ModelBackendException) {
            ModelBackendException backend = (ModelBackendException) t;
            return backend.getProvider() + " status=" + backend.getStatusCode() + " code=" + backend.getProviderCode()
                    + ": " + backend.getMessage();
        }
        return t == null ? "" : t.getClass().getSimpleName() + ": " + t.getMessage();
    }
}
