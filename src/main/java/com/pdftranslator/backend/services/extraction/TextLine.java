package com.pdftranslator.backend.services.extraction;

/**
 * One visual line of the text layer with its glyph statistics. {@code colorRgb} is the fill
 * colour of the line's first glyph as 0xRRGGBB.
 */
record TextLine(String text, BoundingBox box, float fontSize, int glyphCount, int cleanGlyphCount, int colorRgb) {

    TextLine(String text, BoundingBox box, float fontSize, int glyphCount, int cleanGlyphCount) {
        this(text, box, fontSize, glyphCount, cleanGlyphCount, 0x000000);
    }

    double glyphConfidence() {
        return glyphCount == 0 ? 0.0 : (double) cleanGlyphCount / glyphCount;
    }
}
