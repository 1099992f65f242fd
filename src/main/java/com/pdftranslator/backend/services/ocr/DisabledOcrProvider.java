package com.pdftranslator.backend.services.ocr;

import java.awt.image.BufferedImage;
import java.util.List;

/**
 * Used when OCR is switched off. Recognises nothing, so every scan-like page ends up as an OCR
 * failure of that page only, not of the job.
 */
public class DisabledOcrProvider implements OcrProvider {

    @Override
    public String name() {
        return "disabled";
    }

    @Override
    public List<OcrSpan> recognize(BufferedImage image, String sourceLang) {
        return List.of();
    }
}
