package com.pdftranslator.backend.services.ocr;

import java.util.List;

/**
 * OCR outcome of one page. Spans are already in page points and filtered; an empty span list
 * always comes with {@code failed} set.
 */
public record PageOcrResult(int pageIndex, List<OcrSpan> spans, boolean failed, String errorTag, int attempts) {

    public static final String TAG_NO_SPANS = "OCR_NO_USABLE_SPANS";
    public static final String TAG_PROVIDER_UNAVAILABLE = "OCR_PROVIDER_UNAVAILABLE";
    public static final String TAG_PAGE_ERROR = "OCR_PAGE_ERROR";

    public PageOcrResult {
        spans = List.copyOf(spans);
    }

    public static PageOcrResult success(int pageIndex, List<OcrSpan> spans, int attempts) {
        if (spans.isEmpty()) {
            return failure(pageIndex, TAG_NO_SPANS, attempts);
        }
        return new PageOcrResult(pageIndex, spans, false, null, attempts);
    }

    public static PageOcrResult failure(int pageIndex, String errorTag, int attempts) {
        return new PageOcrResult(pageIndex, List.of(), true, errorTag, attempts);
    }
}
