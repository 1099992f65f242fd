package com.pdftranslator.backend.services.provider;

import java.time.Duration;

import org.springframework.stereotype.Component;

import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import com.pdftranslator.backend.exceptions.ProviderException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Component
@RequiredArgsConstructor
@Slf4j
public class OpenRouterClientFactory {

    public static final String PROVIDER = "openrouter";

    private final OpenRouterProperties properties;

    private volatile OpenAIClient client;

    public OpenAIClient getClient() {
        OpenAIClient current = client;
        if (current != null) return current;

        synchronized (this) {
            if (client != null) return client;

            String key = properties.getApiKey() == null ? "" : properties.getApiKey().trim();
            if (key.isEmpty()) {
                throw ProviderException.permanent(PROVIDER, "OPENROUTER_API_KEY is not set", null);
            }

            log.info("[OpenRouter] Creating client baseUrl='{}' timeoutSeconds={}",
                    properties.getBaseUrl(), properties.getTimeoutSeconds());
            client = OpenAIOkHttpClient.builder()
                    .apiKey(key)
                    .baseUrl(properties.getBaseUrl())
                    .timeout(Duration.ofSeconds(Math.max(1, properties.getTimeoutSeconds())))
                    // Retries are driven by RetryPolicy so attempt counts stay accurate.
                    .maxRetries(0)
                    .build();
            return client;
        }
    }
}
