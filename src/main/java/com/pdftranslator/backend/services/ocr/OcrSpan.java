package com.pdftranslator.backend.services.ocr;

/**
 * A recognised run of text. Coordinates are whatever the provider reported (image pixels or
 * page points) until {@link OcrFallbackInvoker} normalises them.
 */
public record OcrSpan(String text, float x0, float y0, float x1, float y1, double confidence) {

    public float width() {
        return Math.abs(x1 - x0);
    }

    public float height() {
        return Math.abs(y1 - y0);
    }

    public OcrSpan scaled(float sx, float sy) {
        return new OcrSpan(text, x0 * sx, y0 * sy, x1 * sx, y1 * sy, confidence);
    }
}
