package com.pdftranslator.backend.services.layout;

import java.awt.Color;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.springframework.stereotype.Service;

import com.pdftranslator.backend.exceptions.ReconstructionException;
import com.pdftranslator.backend.services.extraction.BoundingBox;
import com.pdftranslator.backend.services.extraction.ExtractedDocument;
import com.pdftranslator.backend.services.extraction.PageLayout;
import com.pdftranslator.backend.services.extraction.TextBlock;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes translations over the original pages. Every translated block is painted white and the
 * fitted text is drawn inside the block's box, clipped to it. Untranslated blocks are left alone so
 * the source glyphs (or scanned image) stay visible.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LayoutReconstructor {

    /**
     * Baseline of the first line below the box top, as a share of the font size.
     */
    private static final float ASCENT = 0.78f;

    private final FontResolver fontResolver;
    private final TextFitter textFitter;

    public ReconstructionResult reconstruct(byte[] originalPdf, ExtractedDocument extracted) {
        long startMs = System.currentTimeMillis();

        try (PDDocument document = PDDocument.load(originalPdf)) {
            if (document.getNumberOfPages() != extracted.pageCount()) {
                throw new ReconstructionException("Page count changed: document has " + document.getNumberOfPages()
                        + " pages, layout has " + extracted.pageCount(), null);
            }

            ResolvedFont font = fontResolver.resolve(document);
            int rendered = 0;
            int clipped = 0;
            int untranslated = 0;

            for (PageLayout layout : extracted.pages()) {
                if (layout.getBlocks().isEmpty()) continue;

                PDPage page = document.getPage(layout.getPageIndex());
                PDRectangle crop = page.getCropBox();

                try (PDPageContentStream cs = new PDPageContentStream(document, page, PDPageContentStream.AppendMode.APPEND, true, true)) {
                    for (TextBlock block : layout.getBlocks()) {
                        if (!block.isTranslated()) {
                            untranslated++;
                            continue;
                        }
                        boolean wasClipped = drawBlock(cs, crop, font, block);
                        rendered++;
                        if (wasClipped) clipped++;
                    }
                }
            }

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            document.save(out);

            log.info("[Layout] Completed: pages={} renderedBlocks={} clippedBlocks={} untranslatedBlocks={} embeddedFont={} elapsedMs={}",
                    extracted.pageCount(), rendered, clipped, untranslated, font.embedded(), System.currentTimeMillis() - startMs);
            return new ReconstructionResult(out.toByteArray(), rendered, clipped, untranslated);
        } catch (ReconstructionException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new ReconstructionException("Failed to assemble translated PDF: " + e.getMessage(), e);
        }
    }

    private boolean drawBlock(PDPageContentStream cs, PDRectangle crop, ResolvedFont font, TextBlock block) throws IOException {
        BoundingBox box = block.getBox().clampTo(crop.getWidth(), crop.getHeight());
        if (box.width() < 1f || box.height() < 1f) {
            return false;
        }

        FittedText fitted = textFitter.fit(block.getTranslatedText(), font, box.width(), box.height(), block.getFontSizeHint());

        float left = crop.getLowerLeftX() + box.x();
        float bottom = crop.getLowerLeftY() + crop.getHeight() - box.bottom();
        float top = crop.getLowerLeftY() + crop.getHeight() - box.y();

        cs.saveGraphicsState();
        cs.setNonStrokingColor(Color.WHITE);
        cs.addRect(left, bottom, box.width(), box.height());
        cs.fill();

        cs.addRect(left, bottom, box.width(), box.height());
        cs.clip();

        cs.setNonStrokingColor(new Color(block.getColorRgb()));
        cs.beginText();
        cs.setFont(font.font(), fitted.fontSize());
        cs.setLeading(fitted.leading());
        cs.newLineAtOffset(left, top - fitted.fontSize() * ASCENT);
        for (int i = 0; i < fitted.lines().size(); i++) {
            if (i > 0) cs.newLine();
            cs.showText(fitted.lines().get(i));
        }
        cs.endText();
        cs.restoreGraphicsState();

        return fitted.clipped();
    }
}
