package com.pdftranslator.backend.exceptions;

public class ReconstructionException extends RuntimeException {

    public ReconstructionException(String message, Throwable cause) {
        super(message, cause);
    }
}
