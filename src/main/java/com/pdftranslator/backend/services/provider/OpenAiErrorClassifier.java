package com.pdftranslator.backend.services.provider;

import com.openai.errors.OpenAIException;
import com.openai.errors.OpenAIIoException;
import com.openai.errors.OpenAIServiceException;
import com.pdftranslator.backend.exceptions.ProviderException;

/**
 * Maps SDK exceptions onto {@link ProviderException}: 408, 409, 429 and 5xx answers and I/O
 * problems are transient, other HTTP errors (bad request, auth, not found) are not.
 */
public final class OpenAiErrorClassifier {

    private OpenAiErrorClassifier() {
    }

    public static ProviderException classify(String provider, Exception e) {
        if (e instanceof ProviderException pe) {
            return pe;
        }
        if (e instanceof OpenAIServiceException se) {
            int status = se.statusCode();
            boolean transientStatus = status == 408 || status == 409 || status == 429 || status >= 500;
            String message = "HTTP " + status + " from " + provider + ": " + trim(se.getMessage());
            return new ProviderException(provider, message, transientStatus, e);
        }
        if (e instanceof OpenAIIoException) {
            return ProviderException.transientFailure(provider, "I/O error calling " + provider + ": " + trim(e.getMessage()), e);
        }
        if (e instanceof OpenAIException) {
            // Unparseable or unexpected responses; worth another attempt.
            return ProviderException.transientFailure(provider, "Unexpected response from " + provider + ": " + trim(e.getMessage()), e);
        }
        return ProviderException.permanent(provider, "Call to " + provider + " failed: " + e, e);
    }

    private static String trim(String message) {
        if (message == null) return "";
        String m = message.trim();
        return m.length() <= 300 ? m : m.substring(0, 297) + "...";
    }
}
