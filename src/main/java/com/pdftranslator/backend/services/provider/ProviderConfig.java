package com.pdftranslator.backend.services.provider;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.pdftranslator.backend.config.TranslatorProperties;

@Configuration
public class ProviderConfig {

    @Bean
    public RetryPolicy providerRetryPolicy(TranslatorProperties properties) {
        return RetryPolicy.from(properties.getRetry());
    }
}
