package com.pdftranslator.backend.exceptions;

/**
 * Failure of an external OCR or translation capability.
 *
 * Transient failures (timeouts, rate limits, 5xx, I/O) are retried by
 * {@link com.pdftranslator.backend.services.provider.RetryPolicy}; the others surface at once.
 */
public class ProviderException extends RuntimeException {

    private final String provider;
    private final boolean transientFailure;

    public ProviderException(String provider, String message, boolean transientFailure, Throwable cause) {
        super(message, cause);
        this.provider = provider;
        this.transientFailure = transientFailure;
    }

    public static ProviderException transientFailure(String provider, String message, Throwable cause) {
        return new ProviderException(provider, message, true, cause);
    }

    public static ProviderException permanent(String provider, String message, Throwable cause) {
        return new ProviderException(provider, message, false, cause);
    }

    public String getProvider() {
        return provider;
    }

    public boolean isTransient() {
        return transientFailure;
    }
}
