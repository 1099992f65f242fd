package com.pdftranslator.backend.services.ocr;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "translator.ocr")
public class OcrProperties {

    public static final String PROVIDER_VISION_MODEL = "vision-model";
    public static final String PROVIDER_TESSERACT = "tesseract";
    public static final String PROVIDER_DISABLED = "disabled";

    /**
     * "vision-model" (chat model reading the page image), "tesseract" (local) or "disabled".
     */
    private String provider = PROVIDER_VISION_MODEL;

    /**
     * Vision model used when provider is "vision-model".
     */
    private String model = "google/gemini-2.5-flash-lite";

    /**
     * Render DPI for OCR.
     */
    private int renderDpi = 170;

    /**
     * Spans reported below this confidence (0..1) are ignored.
     */
    private double minSpanConfidence = 0.3;

    private int maxConcurrency = 2;

    private int timeoutSeconds = 120;

    /**
     * Tesseract language(s), e.g. "tur", "eng", or "tur+eng".
     */
    private String language = "tur+eng";

    /**
     * Optional path that contains the "tessdata" directory.
     * If empty, Tess4J/Tesseract will rely on OS installation and environment.
     */
    private String tessdataPath = "";

    public String getProvider() {
        return provider;
    }

    public void setProvider(String provider) {
        this.provider = provider;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public int getRenderDpi() {
        return renderDpi;
    }

    public void setRenderDpi(int renderDpi) {
        this.renderDpi = renderDpi;
    }

    public double getMinSpanConfidence() {
        return minSpanConfidence;
    }

    public void setMinSpanConfidence(double minSpanConfidence) {
        this.minSpanConfidence = minSpanConfidence;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }

    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public void setTimeoutSeconds(int timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    public String getLanguage() {
        return language;
    }

    public void setLanguage(String language) {
        this.language = language;
    }

    public String getTessdataPath() {
        return tessdataPath;
    }

    public void setTessdataPath(String tessdataPath) {
        this.tessdataPath = tessdataPath;
    }
}
