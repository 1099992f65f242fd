package com.pdftranslator.backend.services.provider;

import java.util.function.Predicate;

import com.pdftranslator.backend.config.TranslatorProperties;
import com.pdftranslator.backend.exceptions.ProviderException;

import lombok.extern.slf4j.Slf4j;

/**
 * Bounded-attempt retry with exponential backoff, shared by the OCR and translation call sites.
 * Only failures accepted by the retryable predicate are retried; everything else is rethrown on
 * the attempt where it happened.
 */
@Slf4j
public final class RetryPolicy {

    @FunctionalInterface
    public interface Attempt<T> {
        T run(int attempt) throws Exception;
    }

    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final int maxAttempts;
    private final long initialBackoffMs;
    private final double multiplier;
    private final long maxBackoffMs;
    private final Predicate<Throwable> retryable;
    private final Sleeper sleeper;

    public RetryPolicy(int maxAttempts,
                       long initialBackoffMs,
                       double multiplier,
                       long maxBackoffMs,
                       Predicate<Throwable> retryable,
                       Sleeper sleeper) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.initialBackoffMs = Math.max(0, initialBackoffMs);
        this.multiplier = Math.max(1.0, multiplier);
        this.maxBackoffMs = Math.max(this.initialBackoffMs, maxBackoffMs);
        this.retryable = retryable;
        this.sleeper = sleeper;
    }

    public static RetryPolicy from(TranslatorProperties.Retry retry) {
        return new RetryPolicy(
                retry.getMaxAttempts(),
                retry.getInitialBackoffMs(),
                retry.getMultiplier(),
                retry.getMaxBackoffMs(),
                RetryPolicy::isTransientProviderFailure,
                Thread::sleep
        );
    }

    public static boolean isTransientProviderFailure(Throwable t) {
        return t instanceof ProviderException pe && pe.isTransient();
    }

    public RetryPolicy withSleeper(Sleeper newSleeper) {
        return new RetryPolicy(maxAttempts, initialBackoffMs, multiplier, maxBackoffMs, retryable, newSleeper);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Delay after the given failed attempt (1-based): initial, initial*m, initial*m^2... capped.
     */
    public long backoffMillis(int failedAttempt) {
        double delay = initialBackoffMs * Math.pow(multiplier, Math.max(0, failedAttempt - 1));
        return (long) Math.min(delay, (double) maxBackoffMs);
    }

    public <T> T execute(String operation, Attempt<T> call) {
        for (int attempt = 1; ; attempt++) {
            try {
                return call.run(attempt);
            } catch (Exception e) {
                boolean canRetry = retryable.test(e) && attempt < maxAttempts;
                log.warn("[Retry] {} failed (attempt={}/{} retry={}): {}",
                        operation, attempt, maxAttempts, canRetry, e.getMessage());
                if (!canRetry) {
                    throw asRuntime(e);
                }
                pause(operation, backoffMillis(attempt));
            }
        }
    }

    private void pause(String operation, long millis) {
        if (millis <= 0) return;
        try {
            sleeper.sleep(millis);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw ProviderException.permanent("retry", operation + " interrupted during backoff", ie);
        }
    }

    private static RuntimeException asRuntime(Exception e) {
        if (e instanceof RuntimeException re) return re;
        return ProviderException.permanent("retry", e.getMessage(), e);
    }
}
