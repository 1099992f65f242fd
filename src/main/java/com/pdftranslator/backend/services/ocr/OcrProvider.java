package com.pdftranslator.backend.services.ocr;

import java.awt.image.BufferedImage;
import java.util.List;

public interface OcrProvider {

    String name();

    /**
     * Recognises text spans on a rendered page image.
     *
     * @throws com.pdftranslator.backend.exceptions.ProviderException when the capability fails
     */
    List<OcrSpan> recognize(BufferedImage image, String sourceLang);
}
