package com.pdftranslator.backend.support;

import java.awt.Color;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.encryption.AccessPermission;
import org.apache.pdfbox.pdmodel.encryption.StandardProtectionPolicy;
import org.apache.pdfbox.pdmodel.font.PDType1Font;

/**
 * Builds small in-memory PDFs for tests. Each page is described by its paragraphs; an empty list
 * gives a page without a text layer.
 */
public final class TestPdfs {

    public static final float FONT_SIZE = 11f;
    public static final float LEADING = 14f;

    private TestPdfs() {
    }

    public static byte[] pages(List<List<String>> pages) {
        try (PDDocument document = new PDDocument()) {
            for (List<String> paragraphs : pages) {
                PDPage page = new PDPage(PDRectangle.A4);
                document.addPage(page);
                if (paragraphs.isEmpty()) continue;

                try (PDPageContentStream cs = new PDPageContentStream(document, page)) {
                    float y = page.getMediaBox().getHeight() - 72f;
                    for (String paragraph : paragraphs) {
                        cs.beginText();
                        cs.setFont(PDType1Font.HELVETICA, FONT_SIZE);
                        cs.newLineAtOffset(72f, y);
                        cs.showText(paragraph);
                        cs.endText();
                        // blank line between paragraphs so each one becomes its own block
                        y -= LEADING * 3;
                    }
                }
            }
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            document.save(out);
            return out.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * One page with a single paragraph filled in {@code color}.
     */
    public static byte[] coloredPage(String paragraph, Color color) {
        try (PDDocument document = new PDDocument()) {
            PDPage page = new PDPage(PDRectangle.A4);
            document.addPage(page);
            try (PDPageContentStream cs = new PDPageContentStream(document, page)) {
                cs.setNonStrokingColor(color);
                cs.beginText();
                cs.setFont(PDType1Font.HELVETICA, FONT_SIZE);
                cs.newLineAtOffset(72f, page.getMediaBox().getHeight() - 72f);
                cs.showText(paragraph);
                cs.endText();
            }
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            document.save(out);
            return out.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static byte[] textPages(int count) {
        List<List<String>> pages = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            pages.add(List.of("Page " + (i + 1) + " of the quarterly report describes revenue and costs."));
        }
        return pages(pages);
    }

    public static byte[] blankPages(int count) {
        List<List<String>> pages = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            pages.add(List.of());
        }
        return pages(pages);
    }

    public static byte[] encrypted() {
        try (PDDocument document = new PDDocument()) {
            document.addPage(new PDPage(PDRectangle.A4));
            StandardProtectionPolicy policy = new StandardProtectionPolicy("owner", "user", new AccessPermission());
            policy.setEncryptionKeyLength(128);
            document.protect(policy);
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            document.save(out);
            return out.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
