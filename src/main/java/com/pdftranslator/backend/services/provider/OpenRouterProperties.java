package com.pdftranslator.backend.services.provider;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Data;

/**
 * OpenAI-compatible endpoint used for both translation and vision OCR. Defaults to OpenRouter;
 * pointing {@code base-url} at api.openai.com works the same way.
 */
@Data
@ConfigurationProperties(prefix = "openrouter")
public class OpenRouterProperties {

    private String apiKey = "";

    private String baseUrl = "https://openrouter.ai/api/v1";

    /**
     * HTTP timeout of the SDK client; the pipeline applies its own per-call timeout on top.
     */
    private int timeoutSeconds = 120;
}
