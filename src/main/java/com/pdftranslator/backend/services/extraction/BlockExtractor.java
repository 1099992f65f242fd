package com.pdftranslator.backend.services.extraction;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.springframework.stereotype.Service;

import com.pdftranslator.backend.config.TranslatorProperties;
import com.pdftranslator.backend.enums.PageClassification;
import com.pdftranslator.backend.exceptions.UnsupportedDocumentException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Splits a PDF into pages of positioned text blocks and decides, per page, whether the text layer
 * can be used or the page has to go through OCR. Pure function of the input bytes: no provider
 * calls, no persistence.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BlockExtractor {

    private static final float POINTS_PER_INCH = 72f;

    private final TranslatorProperties properties;

    /**
     * Opens the document only far enough to validate it and count its pages.
     */
    public DocumentInspection inspect(byte[] pdfBytes, int maxPages) {
        try (PDDocument document = open(pdfBytes)) {
            int pages = validate(document, maxPages);
            return new DocumentInspection(pages, pdfBytes.length);
        } catch (IOException e) {
            throw new UnsupportedDocumentException("Could not close PDF: " + e.getMessage(), e);
        }
    }

    public ExtractedDocument extract(byte[] pdfBytes, int maxPages) {
        long startMs = System.currentTimeMillis();

        try (PDDocument document = open(pdfBytes)) {
            int pageCount = validate(document, maxPages);
            PositionalTextStripper stripper = new PositionalTextStripper();

            List<PageLayout> pages = new ArrayList<>(pageCount);
            for (int i = 0; i < pageCount; i++) {
                pages.add(extractPage(document, stripper, i));
            }

            ExtractedDocument result = new ExtractedDocument(pageCount, pages);
            log.info("[Extract] Completed: pages={} ocrPages={} blocks={} elapsedMs={}",
                    pageCount,
                    result.pagesNeedingOcr().size(),
                    result.allBlocks().size(),
                    System.currentTimeMillis() - startMs);
            return result;
        } catch (UnsupportedDocumentException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new UnsupportedDocumentException("Could not read PDF text layer: " + e.getMessage(), e);
        }
    }

    private PageLayout extractPage(PDDocument document, PositionalTextStripper stripper, int pageIndex) throws IOException {
        PDPage page = document.getPage(pageIndex);
        PDRectangle box = page.getCropBox();
        float width = box.getWidth();
        float height = box.getHeight();

        List<TextLine> lines = stripper.stripPage(document, pageIndex);

        int chars = 0;
        int glyphs = 0;
        int clean = 0;
        for (TextLine line : lines) {
            chars += nonWhitespace(line.text());
            glyphs += line.glyphCount();
            clean += line.cleanGlyphCount();
        }
        double confidence = glyphs == 0 ? 0.0 : (double) clean / glyphs;

        PageClassification classification = classify(chars, confidence, width, height);
        List<TextBlock> blocks = classification == PageClassification.TEXT
                ? groupIntoBlocks(pageIndex, lines)
                : List.of();

        log.debug("[Extract] page={} size={}x{} chars={} glyphConfidence={} classification={} blocks={}",
                pageIndex, width, height, chars, String.format("%.2f", confidence), classification, blocks.size());

        return new PageLayout(pageIndex, width, height, classification, chars, confidence, blocks);
    }

    PageClassification classify(int chars, double glyphConfidence, float width, float height) {
        TranslatorProperties.Extraction cfg = properties.getExtraction();

        double areaSqIn = Math.max(1e-6, (width / POINTS_PER_INCH) * (height / POINTS_PER_INCH));
        double density = chars / areaSqIn;

        if (chars <= cfg.getMinTextChars() || density < cfg.getMinCharDensity()) {
            return PageClassification.SCAN;
        }
        if (glyphConfidence < cfg.getMinTextConfidence()) {
            return PageClassification.LOW_CONFIDENCE_TEXT;
        }
        return PageClassification.TEXT;
    }

    /**
     * Merges consecutive lines into blocks while they stay vertically close, horizontally
     * overlapping and of similar font size.
     */
    List<TextBlock> groupIntoBlocks(int pageIndex, List<TextLine> lines) {
        TranslatorProperties.Extraction cfg = properties.getExtraction();
        List<TextBlock> blocks = new ArrayList<>();
        List<TextLine> current = new ArrayList<>();

        for (TextLine line : lines) {
            if (!current.isEmpty() && startsNewBlock(current.get(current.size() - 1), line, cfg)) {
                addBlock(blocks, pageIndex, current);
                current = new ArrayList<>();
            }
            current.add(line);
        }
        addBlock(blocks, pageIndex, current);
        return blocks;
    }

    private static boolean startsNewBlock(TextLine previous, TextLine line, TranslatorProperties.Extraction cfg) {
        float lineHeight = Math.max(1f, previous.box().height());
        float gap = line.box().y() - previous.box().bottom();
        if (gap > lineHeight * cfg.getBlockGapFactor()) return true;
        // Sorting by position can put a line back above the previous one (next column).
        if (line.box().y() < previous.box().y() - lineHeight * 0.5f) return true;

        boolean overlaps = line.box().x() < previous.box().right() && line.box().right() > previous.box().x();
        if (!overlaps) return true;

        float a = Math.max(0.1f, previous.fontSize());
        float b = Math.max(0.1f, line.fontSize());
        return Math.abs(a - b) / Math.max(a, b) > cfg.getFontSizeTolerance();
    }

    private static void addBlock(List<TextBlock> blocks, int pageIndex, List<TextLine> lines) {
        if (lines.isEmpty()) return;

        StringBuilder text = new StringBuilder();
        BoundingBox box = null;
        float fontSize = 0f;
        int glyphs = 0;
        int clean = 0;
        for (TextLine line : lines) {
            if (text.length() > 0) text.append(' ');
            text.append(line.text());
            box = box == null ? line.box() : box.union(line.box());
            fontSize = Math.max(fontSize, line.fontSize());
            glyphs += line.glyphCount();
            clean += line.cleanGlyphCount();
        }

        String source = text.toString().strip();
        if (nonWhitespace(source) < 2) return;

        double confidence = glyphs == 0 ? 0.0 : (double) clean / glyphs;
        int color = lines.get(0).colorRgb();
        blocks.add(new TextBlock(pageIndex, blocks.size(), box, source, confidence, fontSize, false, color));
    }

    private static PDDocument open(byte[] pdfBytes) {
        if (pdfBytes == null || pdfBytes.length == 0) {
            throw new UnsupportedDocumentException("Empty file");
        }
        try {
            return PDDocument.load(pdfBytes);
        } catch (InvalidPasswordException e) {
            throw new UnsupportedDocumentException("PDF is password protected", e);
        } catch (IOException e) {
            throw new UnsupportedDocumentException("File is not a readable PDF: " + e.getMessage(), e);
        }
    }

    private static int validate(PDDocument document, int maxPages) {
        if (document.isEncrypted()) {
            throw new UnsupportedDocumentException("PDF is encrypted");
        }
        int pages = document.getNumberOfPages();
        if (pages <= 0) {
            throw new UnsupportedDocumentException("PDF has no pages");
        }
        if (pages > maxPages) {
            throw new UnsupportedDocumentException("PDF has " + pages + " pages; the limit is " + maxPages);
        }
        return pages;
    }

    private static int nonWhitespace(String s) {
        int n = 0;
        for (int i = 0; i < s.length(); i++) {
            if (!Character.isWhitespace(s.charAt(i))) n++;
        }
        return n;
    }
}
