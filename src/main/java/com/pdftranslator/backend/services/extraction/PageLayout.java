package com.pdftranslator.backend.services.extraction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.pdftranslator.backend.enums.PageClassification;

import lombok.Getter;

@Getter
public class PageLayout {

    private final int pageIndex;
    private final float width;
    private final float height;
    private final PageClassification classification;
    private final int charCount;
    private final double textConfidence;

    private final List<TextBlock> blocks = new ArrayList<>();

    private boolean ocrFailed;
    private String ocrErrorTag;

    public PageLayout(int pageIndex,
                      float width,
                      float height,
                      PageClassification classification,
                      int charCount,
                      double textConfidence,
                      List<TextBlock> blocks) {
        this.pageIndex = pageIndex;
        this.width = width;
        this.height = height;
        this.classification = classification;
        this.charCount = charCount;
        this.textConfidence = textConfidence;
        if (blocks != null) {
            this.blocks.addAll(blocks);
        }
    }

    public List<TextBlock> getBlocks() {
        return Collections.unmodifiableList(blocks);
    }

    public boolean needsOcr() {
        return classification.needsOcr();
    }

    /**
     * Replaces the page's blocks with the ones recognised by OCR.
     */
    public void attachOcrBlocks(List<TextBlock> ocrBlocks) {
        if (!needsOcr()) {
            throw new IllegalStateException("Page " + pageIndex + " has a text layer; OCR blocks not expected");
        }
        blocks.clear();
        blocks.addAll(ocrBlocks);
        ocrFailed = false;
        ocrErrorTag = null;
    }

    public void markOcrFailed(String tag) {
        blocks.clear();
        ocrFailed = true;
        ocrErrorTag = tag;
    }

    public int failedBlockCount() {
        return (int) blocks.stream().filter(b -> !b.isTranslated()).count();
    }
}
