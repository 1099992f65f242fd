package com.pdftranslator.backend.exceptions;

/**
 * The uploaded file cannot be processed at all: encrypted, unreadable, empty, too large or over
 * the page limit. Raised before any credit is debited.
 */
public class UnsupportedDocumentException extends RuntimeException {

    public UnsupportedDocumentException(String message) {
        super(message);
    }

    public UnsupportedDocumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
