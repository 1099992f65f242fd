package com.pdftranslator.backend.exceptions;

import lombok.Getter;

@Getter
public class InsufficientCreditsException extends RuntimeException {

    private final long ownerId;
    private final int required;
    private final int available;

    public InsufficientCreditsException(long ownerId, int required, int available) {
        super("Insufficient credits: required=" + required + " available=" + available);
        this.ownerId = ownerId;
        this.required = required;
        this.available = available;
    }
}
