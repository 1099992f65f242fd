package com.pdftranslator.backend.exceptions;

public class UnsupportedLanguagePairException extends BadRequestException {

    public UnsupportedLanguagePairException(String sourceLang, String targetLang) {
        super("Unsupported language pair: " + sourceLang + " -> " + targetLang);
    }
}
