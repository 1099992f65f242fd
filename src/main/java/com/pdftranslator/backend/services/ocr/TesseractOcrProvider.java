package com.pdftranslator.backend.services.ocr;

import java.awt.Rectangle;
import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;

import com.pdftranslator.backend.exceptions.ProviderException;

import net.sourceforge.tess4j.ITessAPI;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.Word;

public class TesseractOcrProvider implements OcrProvider {

    private final OcrProperties ocrProperties;

    /**
     * Tess4J's {@link Tesseract} is not thread-safe. Keep one instance per thread.
     */
    private final ThreadLocal<Tesseract> threadLocalTesseract;

    public TesseractOcrProvider(OcrProperties ocrProperties) {
        this.ocrProperties = ocrProperties;
        this.threadLocalTesseract = ThreadLocal.withInitial(this::createTesseract);
    }

    @Override
    public String name() {
        return "tesseract";
    }

    @Override
    public List<OcrSpan> recognize(BufferedImage image, String sourceLang) {
        if (image == null) return List.of();

        List<Word> lines;
        try {
            lines = threadLocalTesseract.get().getWords(image, ITessAPI.TessPageIteratorLevel.RIL_TEXTLINE);
        } catch (RuntimeException | LinkageError e) {
            // Missing tessdata or a broken native library; retrying will not help.
            throw ProviderException.permanent(name(), "Tesseract failed: " + e.getMessage(), e);
        }

        List<OcrSpan> spans = new ArrayList<>();
        for (Word line : lines) {
            String text = line.getText() == null ? "" : line.getText().strip();
            Rectangle r = line.getBoundingBox();
            if (text.isEmpty() || r == null) continue;
            spans.add(new OcrSpan(
                    text,
                    r.x,
                    r.y,
                    r.x + r.width,
                    r.y + r.height,
                    line.getConfidence() / 100.0
            ));
        }
        return spans;
    }

    private Tesseract createTesseract() {
        Tesseract tesseract = new Tesseract();

        String datapath = ocrProperties.getTessdataPath();
        if (datapath != null && !datapath.isBlank()) {
            tesseract.setDatapath(datapath);
        }

        String language = ocrProperties.getLanguage();
        if (language != null && !language.isBlank()) {
            tesseract.setLanguage(language);
        }

        return tesseract;
    }
}
