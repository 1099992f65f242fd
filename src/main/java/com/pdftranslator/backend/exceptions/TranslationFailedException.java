package com.pdftranslator.backend.exceptions;

/**
 * Every translation batch of a job failed; there is nothing worth reconstructing.
 */
public class TranslationFailedException extends RuntimeException {

    public TranslationFailedException(String message) {
        super(message);
    }
}
