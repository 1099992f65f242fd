package com.pdftranslator.backend.services.extraction;

import java.io.IOException;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import org.apache.pdfbox.contentstream.operator.color.SetNonStrokingColor;
import org.apache.pdfbox.contentstream.operator.color.SetNonStrokingColorN;
import org.apache.pdfbox.contentstream.operator.color.SetNonStrokingColorSpace;
import org.apache.pdfbox.contentstream.operator.color.SetNonStrokingDeviceCMYKColor;
import org.apache.pdfbox.contentstream.operator.color.SetNonStrokingDeviceGrayColor;
import org.apache.pdfbox.contentstream.operator.color.SetNonStrokingDeviceRGBColor;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;

/**
 * Text stripper that records where each line sits instead of only producing a string.
 * Coordinates are the direction-adjusted ones PDFBox reports (top-left origin). The fill colour
 * operators are registered so each glyph's colour can be read from the graphics state.
 */
class PositionalTextStripper extends PDFTextStripper {

    private final List<TextLine> lines = new ArrayList<>();
    private final Map<TextPosition, Integer> glyphColors = new IdentityHashMap<>();

    private StringBuilder text = new StringBuilder();
    private float minX;
    private float minTop;
    private float maxX;
    private float maxBottom;
    private float fontSize;
    private int glyphs;
    private int cleanGlyphs;
    private Integer colorRgb;

    PositionalTextStripper() throws IOException {
        super();
        addOperator(new SetNonStrokingColorSpace());
        addOperator(new SetNonStrokingColor());
        addOperator(new SetNonStrokingColorN());
        addOperator(new SetNonStrokingDeviceGrayColor());
        addOperator(new SetNonStrokingDeviceRGBColor());
        addOperator(new SetNonStrokingDeviceCMYKColor());
        setSortByPosition(true);
        resetLine();
    }

    List<TextLine> stripPage(PDDocument document, int pageIndex) throws IOException {
        lines.clear();
        glyphColors.clear();
        resetLine();
        setStartPage(pageIndex + 1);
        setEndPage(pageIndex + 1);
        getText(document);
        flushLine();
        glyphColors.clear();
        return new ArrayList<>(lines);
    }

    @Override
    protected void processTextPosition(TextPosition text) {
        glyphColors.put(text, currentFillColor());
        super.processTextPosition(text);
    }

    private int currentFillColor() {
        try {
            return getGraphicsState().getNonStrokingColor().toRGB();
        } catch (IOException | RuntimeException e) {
            // Pattern and some ICC fills have no plain RGB value.
            return 0x000000;
        }
    }

    @Override
    protected void writeString(String string, List<TextPosition> textPositions) throws IOException {
        for (TextPosition tp : textPositions) {
            if (colorRgb == null) {
                colorRgb = glyphColors.get(tp);
            }
            String unicode = tp.getUnicode();
            glyphs++;
            if (isClean(unicode)) {
                cleanGlyphs++;
            }

            float left = tp.getXDirAdj();
            float right = left + tp.getWidthDirAdj();
            float baseline = tp.getYDirAdj();
            // heightDir under-reports many fonts; an ascent of 0.75em keeps a line box at least one em tall.
            float top = baseline - Math.max(tp.getHeightDir(), tp.getFontSizeInPt() * 0.75f);

            minX = Math.min(minX, left);
            maxX = Math.max(maxX, right);
            minTop = Math.min(minTop, top);
            maxBottom = Math.max(maxBottom, baseline);
            fontSize = Math.max(fontSize, tp.getFontSizeInPt());
        }
        text.append(string);
    }

    @Override
    protected void writeWordSeparator() throws IOException {
        text.append(' ');
    }

    @Override
    protected void writeLineSeparator() throws IOException {
        flushLine();
    }

    private void flushLine() {
        String content = text.toString().strip();
        if (!content.isEmpty() && glyphs > 0 && maxX > minX) {
            // Descenders sit below the baseline; a quarter of the font size covers them.
            float bottom = maxBottom + fontSize * 0.25f;
            lines.add(new TextLine(
                    content,
                    BoundingBox.fromCorners(minX, minTop, maxX, Math.max(bottom, minTop + 1f)),
                    fontSize,
                    glyphs,
                    cleanGlyphs,
                    colorRgb == null ? 0x000000 : colorRgb
            ));
        }
        resetLine();
    }

    private void resetLine() {
        text = new StringBuilder();
        minX = Float.MAX_VALUE;
        minTop = Float.MAX_VALUE;
        maxX = -Float.MAX_VALUE;
        maxBottom = -Float.MAX_VALUE;
        fontSize = 0f;
        glyphs = 0;
        cleanGlyphs = 0;
        colorRgb = null;
    }

    static boolean isClean(String unicode) {
        if (unicode == null || unicode.isEmpty()) return false;
        for (int i = 0; i < unicode.length(); i++) {
            char c = unicode.charAt(i);
            if (c == '\uFFFD') return false;
            if (Character.isISOControl(c) && !Character.isWhitespace(c)) return false;
            if (Character.getType(c) == Character.PRIVATE_USE) return false;
        }
        return true;
    }
}
