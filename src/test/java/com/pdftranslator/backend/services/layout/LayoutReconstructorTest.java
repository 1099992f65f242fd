package com.pdftranslator.backend.services.layout;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.awt.Color;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.apache.pdfbox.contentstream.operator.Operator;
import org.apache.pdfbox.cos.COSNumber;
import org.apache.pdfbox.pdfparser.PDFStreamParser;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.text.PDFTextStripper;
import org.junit.jupiter.api.Test;

import com.pdftranslator.backend.config.TranslatorProperties;
import com.pdftranslator.backend.exceptions.ReconstructionException;
import com.pdftranslator.backend.services.extraction.BlockExtractor;
import com.pdftranslator.backend.services.extraction.ExtractedDocument;
import com.pdftranslator.backend.services.extraction.TextBlock;
import com.pdftranslator.backend.support.TestPdfs;

class LayoutReconstructorTest {

    private final TranslatorProperties properties = new TranslatorProperties();
    private final BlockExtractor extractor = new BlockExtractor(properties);
    private final LayoutReconstructor reconstructor;

    LayoutReconstructorTest() {
        // no TrueType candidates: always the standard font, independent of the machine
        properties.getLayout().setFontCandidates(new ArrayList<>());
        reconstructor = new LayoutReconstructor(new FontResolver(properties), new TextFitter(properties));
    }

    @Test
    void reconstruct_drawsTranslationsOnTheOriginalPages() throws IOException {
        byte[] original = TestPdfs.pages(List.of(
                List.of("The meeting starts at nine in the morning."),
                List.of("Please bring the signed contract with you.")
        ));
        ExtractedDocument doc = extractor.extract(original, 150);
        List<TextBlock> blocks = doc.allBlocks();
        blocks.get(0).applyTranslation("Toplanti sabah dokuzda baslar.");
        blocks.get(1).applyTranslation("Lutfen imzali sozlesmeyi getirin.");

        ReconstructionResult result = reconstructor.reconstruct(original, doc);

        assertThat(result.renderedBlocks()).isEqualTo(2);
        assertThat(result.untranslatedBlocks()).isZero();
        assertThat(result.clippedBlocks()).isZero();
        try (PDDocument out = PDDocument.load(result.pdfBytes())) {
            assertThat(out.getNumberOfPages()).isEqualTo(2);
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setStartPage(2);
            stripper.setEndPage(2);
            assertThat(stripper.getText(out)).contains("imzali");
        }
    }

    @Test
    void reconstruct_leavesUntranslatedBlocksAlone() {
        byte[] original = TestPdfs.pages(List.of(List.of(
                "First paragraph that will be translated.",
                "Second paragraph whose batch failed."
        )));
        ExtractedDocument doc = extractor.extract(original, 150);
        doc.allBlocks().get(0).applyTranslation("Cevrilen ilk paragraf.");
        doc.allBlocks().get(1).markFailed("TRANSLATION_BATCH_FAILED");

        ReconstructionResult result = reconstructor.reconstruct(original, doc);

        assertThat(result.renderedBlocks()).isEqualTo(1);
        assertThat(result.untranslatedBlocks()).isEqualTo(1);
    }

    @Test
    void reconstruct_drawsTranslationInTheSourceTextColour() throws IOException {
        byte[] original = TestPdfs.coloredPage("Overdue invoices and unpaid balances are shown in red on this page.", Color.RED);
        ExtractedDocument doc = extractor.extract(original, 150);
        doc.allBlocks().get(0).applyTranslation("Vadesi gecmis faturalar kirmizi gosterilir.");

        ReconstructionResult result = reconstructor.reconstruct(original, doc);

        try (PDDocument out = PDDocument.load(result.pdfBytes())) {
            List<List<Float>> textFills = fillColoursOfTextShows(out.getPage(0));
            // the source paragraph first, then the wrapped translation lines
            assertThat(textFills.size()).isGreaterThanOrEqualTo(2);
            assertThat(textFills).allSatisfy(rgb -> assertThat(rgb).containsExactly(1f, 0f, 0f));
        }
    }

    @Test
    void reconstruct_rejectsLayoutForADifferentDocument() {
        ExtractedDocument twoPages = extractor.extract(TestPdfs.textPages(2), 150);

        assertThatThrownBy(() -> reconstructor.reconstruct(TestPdfs.textPages(3), twoPages))
                .isInstanceOf(ReconstructionException.class)
                .hasMessageContaining("Page count");
    }

    private static List<List<Float>> fillColoursOfTextShows(PDPage page) throws IOException {
        PDFStreamParser parser = new PDFStreamParser(page);
        parser.parse();
        List<List<Float>> fills = new ArrayList<>();
        List<Float> operands = new ArrayList<>();
        List<Float> currentFill = List.of(0f, 0f, 0f);
        for (Object token : parser.getTokens()) {
            if (token instanceof COSNumber number) {
                operands.add(number.floatValue());
                continue;
            }
            if (token instanceof Operator op) {
                if ("rg".equals(op.getName()) && operands.size() >= 3) {
                    currentFill = List.copyOf(operands.subList(operands.size() - 3, operands.size()));
                } else if ("Tj".equals(op.getName()) || "TJ".equals(op.getName())) {
                    fills.add(currentFill);
                }
                operands.clear();
            }
        }
        return fills;
    }
}
