package com.pdftranslator.backend.services.ocr;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.pdftranslator.backend.services.provider.OpenRouterChatClient;

import lombok.extern.slf4j.Slf4j;

@Configuration
@EnableConfigurationProperties(OcrProperties.class)
@Slf4j
public class OcrConfiguration {

    @Bean
    @ConditionalOnProperty(prefix = "translator.ocr", name = "provider", havingValue = OcrProperties.PROVIDER_VISION_MODEL, matchIfMissing = true)
    public OcrProvider visionModelOcrProvider(OpenRouterChatClient chatClient, OcrProperties ocrProperties) {
        log.info("[OCR] Enabled: provider=vision-model model='{}' renderDpi={} maxConcurrency={}",
                safe(ocrProperties.getModel()),
                ocrProperties.getRenderDpi(),
                ocrProperties.getMaxConcurrency());
        return new VisionModelOcrProvider(chatClient, ocrProperties);
    }

    @Bean
    @ConditionalOnProperty(prefix = "translator.ocr", name = "provider", havingValue = OcrProperties.PROVIDER_TESSERACT)
    public OcrProvider tesseractOcrProvider(OcrProperties ocrProperties) {
        log.info("[OCR] Enabled: provider=tesseract language='{}' tessdataPath='{}' renderDpi={}",
                safe(ocrProperties.getLanguage()),
                safe(ocrProperties.getTessdataPath()),
                ocrProperties.getRenderDpi());
        return new TesseractOcrProvider(ocrProperties);
    }

    @Bean
    @ConditionalOnMissingBean(OcrProvider.class)
    public OcrProvider disabledOcrProvider() {
        log.info("[OCR] Disabled (translator.ocr.provider=disabled)");
        return new DisabledOcrProvider();
    }

    private static String safe(String value) {
        return value == null ? "" : value;
    }
}
