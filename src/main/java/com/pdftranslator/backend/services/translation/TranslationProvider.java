package com.pdftranslator.backend.services.translation;

public interface TranslationProvider {

    String name();

    /**
     * @param model model to use; the primary and the fallback model go through the same provider
     * @throws com.pdftranslator.backend.exceptions.ProviderException when the call fails
     */
    TranslationResult translate(String text, String sourceLang, String targetLang, String model);
}
