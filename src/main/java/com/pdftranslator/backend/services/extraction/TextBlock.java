package com.pdftranslator.backend.services.extraction;

import java.util.Objects;

import lombok.Getter;

/**
 * A positioned unit of source text. Geometry and source text never change; the translation is
 * filled in by the batcher, or the block is tagged with the reason it stayed untranslated.
 */
@Getter
public class TextBlock {

    private final int pageIndex;
    private final int readingOrder;
    private final BoundingBox box;
    private final String sourceText;
    private final double confidence;
    private final float fontSizeHint;
    private final boolean fromOcr;
    /** Fill colour of the source text as 0xRRGGBB. */
    private final int colorRgb;

    private String translatedText;
    private String errorTag;

    public TextBlock(int pageIndex,
                     int readingOrder,
                     BoundingBox box,
                     String sourceText,
                     double confidence,
                     float fontSizeHint,
                     boolean fromOcr) {
        this(pageIndex, readingOrder, box, sourceText, confidence, fontSizeHint, fromOcr, 0x000000);
    }

    public TextBlock(int pageIndex,
                     int readingOrder,
                     BoundingBox box,
                     String sourceText,
                     double confidence,
                     float fontSizeHint,
                     boolean fromOcr,
                     int colorRgb) {
        this.pageIndex = pageIndex;
        this.readingOrder = readingOrder;
        this.box = Objects.requireNonNull(box, "box");
        this.sourceText = sourceText == null ? "" : sourceText;
        this.confidence = confidence;
        this.fontSizeHint = fontSizeHint;
        this.fromOcr = fromOcr;
        this.colorRgb = colorRgb & 0xFFFFFF;
    }

    public boolean isTranslated() {
        return translatedText != null && !translatedText.isBlank();
    }

    public void applyTranslation(String text) {
        if (translatedText != null) {
            throw new IllegalStateException("Block " + pageIndex + "/" + readingOrder + " already translated");
        }
        this.translatedText = text;
        this.errorTag = null;
    }

    public void markFailed(String tag) {
        if (translatedText != null) {
            throw new IllegalStateException("Block " + pageIndex + "/" + readingOrder + " already translated");
        }
        this.errorTag = tag;
    }

    @Override
    public String toString() {
        return "TextBlock{page=" + pageIndex + ", order=" + readingOrder + ", box=" + box
                + ", chars=" + sourceText.length() + ", ocr=" + fromOcr + "}";
    }
}
