package com.pdftranslator.backend.services.provider;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import com.pdftranslator.backend.config.AsyncExecutorConfig;
import com.pdftranslator.backend.exceptions.ProviderException;

/**
 * Runs a blocking provider call with a deadline. A call that misses the deadline is reported as a
 * transient failure; it is not interrupted and finishes in the background. A call the executor
 * cannot take is transient as well.
 */
@Component
public class ProviderCallGuard {

    private final Executor executor;

    public ProviderCallGuard(@Qualifier(AsyncExecutorConfig.PROVIDER_CALL_EXECUTOR) Executor executor) {
        this.executor = executor;
    }

    public <T> T call(String provider, Duration timeout, Callable<T> call) {
        CompletableFuture<T> future;
        try {
            future = CompletableFuture.supplyAsync(() -> {
                try {
                    return call.call();
                } catch (RuntimeException e) {
                    throw e;
                } catch (Exception e) {
                    throw new CompletionException(e);
                }
            }, executor);
        } catch (RejectedExecutionException e) {
            throw ProviderException.transientFailure(provider, "No free slot to call " + provider, e);
        }

        try {
            return future.get(Math.max(1, timeout.toMillis()), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw ProviderException.transientFailure(provider, provider + " call timed out after " + timeout.toSeconds() + "s", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw ProviderException.permanent(provider, "Interrupted while waiting for " + provider, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() instanceof CompletionException ce && ce.getCause() != null
                    ? ce.getCause()
                    : e.getCause();
            if (cause instanceof Exception ex) {
                throw OpenAiErrorClassifier.classify(provider, ex);
            }
            throw ProviderException.permanent(provider, provider + " call failed: " + cause, cause);
        }
    }
}
