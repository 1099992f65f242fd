package com.pdftranslator.backend.services.layout;

import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Component;

import com.pdftranslator.backend.config.TranslatorProperties;

import lombok.RequiredArgsConstructor;

/**
 * Wraps text into a fixed box. Tries the preferred size first and shrinks step by step down to
 * the minimum; text that still does not fit is cut at the last line that fits and marked with an
 * ellipsis.
 */
@Component
@RequiredArgsConstructor
public class TextFitter {

    static final String CLIP_INDICATOR = "…";
    static final String CLIP_INDICATOR_FALLBACK = "...";

    /**
     * Slack for rounding in measured box heights.
     */
    private static final float HEIGHT_TOLERANCE = 0.5f;

    private final TranslatorProperties properties;

    public FittedText fit(String text, ResolvedFont font, float boxWidth, float boxHeight, float preferredSize) {
        TranslatorProperties.Layout cfg = properties.getLayout();
        float min = cfg.getMinFontSize();
        float max = Math.max(min, cfg.getMaxFontSize());
        float step = cfg.getFontSizeStep() > 0 ? cfg.getFontSizeStep() : 1f;
        String clean = font.sanitize(text).strip();

        float size = clamp(preferredSize > 0 ? preferredSize : max, min, max);
        while (true) {
            List<String> lines = wrap(clean, font, size, boxWidth);
            if (heightOf(lines.size(), size, cfg.getLineSpacing()) <= boxHeight + HEIGHT_TOLERANCE) {
                return new FittedText(lines, size, size * cfg.getLineSpacing(), false);
            }
            if (size <= min) break;
            size = Math.max(min, size - step);
        }

        return clip(clean, font, min, boxWidth, boxHeight, cfg.getLineSpacing());
    }

    private FittedText clip(String text, ResolvedFont font, float size, float boxWidth, float boxHeight, float lineSpacing) {
        List<String> lines = wrap(text, font, size, boxWidth);
        int fitting = 1;
        while (fitting < lines.size() && heightOf(fitting + 1, size, lineSpacing) <= boxHeight + HEIGHT_TOLERANCE) {
            fitting++;
        }

        List<String> kept = new ArrayList<>(lines.subList(0, fitting));
        String indicator = font.canEncode(CLIP_INDICATOR.charAt(0)) ? CLIP_INDICATOR : CLIP_INDICATOR_FALLBACK;
        String last = kept.get(kept.size() - 1);
        while (!last.isEmpty() && font.width(last + indicator, size) > boxWidth) {
            last = last.substring(0, last.length() - 1);
        }
        kept.set(kept.size() - 1, last.stripTrailing() + indicator);
        return new FittedText(kept, size, size * lineSpacing, true);
    }

    /**
     * Greedy word wrap. Explicit line breaks are kept and words wider than the box are split.
     */
    List<String> wrap(String text, ResolvedFont font, float size, float maxWidth) {
        List<String> lines = new ArrayList<>();
        for (String paragraph : text.split("\n", -1)) {
            String[] words = paragraph.strip().split(" +");
            StringBuilder line = new StringBuilder();
            for (String word : words) {
                if (word.isEmpty()) continue;
                String candidate = line.length() == 0 ? word : line + " " + word;
                if (font.width(candidate, size) <= maxWidth) {
                    line.setLength(0);
                    line.append(candidate);
                    continue;
                }
                if (line.length() > 0) {
                    lines.add(line.toString());
                    line.setLength(0);
                }
                String rest = word;
                while (font.width(rest, size) > maxWidth && rest.length() > 1) {
                    int cut = longestPrefix(rest, font, size, maxWidth);
                    lines.add(rest.substring(0, cut));
                    rest = rest.substring(cut);
                }
                line.append(rest);
            }
            if (line.length() > 0) {
                lines.add(line.toString());
            }
        }
        if (lines.isEmpty()) {
            lines.add("");
        }
        return lines;
    }

    private static int longestPrefix(String word, ResolvedFont font, float size, float maxWidth) {
        int cut = 1;
        while (cut < word.length() && font.width(word.substring(0, cut + 1), size) <= maxWidth) {
            cut++;
        }
        return cut;
    }

    /**
     * First line takes one em, each further line one leading.
     */
    static float heightOf(int lineCount, float size, float lineSpacing) {
        if (lineCount <= 0) return 0f;
        return size + (lineCount - 1) * size * lineSpacing;
    }

    private static float clamp(float v, float min, float max) {
        return Math.max(min, Math.min(max, v));
    }
}
