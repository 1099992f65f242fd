package com.pdftranslator.backend.services.layout;

import java.io.IOException;
import java.text.Normalizer;
import java.util.HashMap;
import java.util.Map;

import org.apache.pdfbox.pdmodel.font.PDFont;

/**
 * A font bound to one output document, plus the rules for turning arbitrary text into text the
 * font can encode.
 */
public class ResolvedFont {

    private static final Map<Character, String> FOLDS = Map.of(
            'ı', "i",
            'İ', "I",
            'ğ', "g",
            'Ğ', "G",
            'ş', "s",
            'Ş', "S",
            '’', "'",
            '‘', "'",
            '“', "\"",
            '”', "\""
    );

    private final PDFont font;
    private final boolean embedded;
    private final Map<Character, Boolean> encodable = new HashMap<>();

    public ResolvedFont(PDFont font, boolean embedded) {
        this.font = font;
        this.embedded = embedded;
    }

    public PDFont font() {
        return font;
    }

    public boolean embedded() {
        return embedded;
    }

    /**
     * Width of {@code text} at {@code size} points. The text must already be sanitized.
     */
    public float width(String text, float size) {
        try {
            return font.getStringWidth(text) / 1000f * size;
        } catch (IOException | IllegalArgumentException e) {
            // Fall back to an average glyph width rather than failing the page.
            return text.length() * size * 0.55f;
        }
    }

    public boolean canEncode(char c) {
        return encodable.computeIfAbsent(c, this::tryEncode);
    }

    /**
     * Replaces characters the font cannot show: folded to their base letter when possible,
     * otherwise '?'. Line breaks are kept; other control characters become spaces.
     */
    public String sanitize(String text) {
        if (text == null || text.isEmpty()) return "";
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\n') {
                sb.append(c);
            } else if (Character.isISOControl(c) || Character.isWhitespace(c)) {
                sb.append(' ');
            } else if (canEncode(c)) {
                sb.append(c);
            } else {
                sb.append(fold(c));
            }
        }
        return sb.toString();
    }

    private String fold(char c) {
        String mapped = FOLDS.get(c);
        if (mapped == null) {
            String decomposed = Normalizer.normalize(String.valueOf(c), Normalizer.Form.NFD);
            mapped = decomposed.replaceAll("\\p{M}", "");
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < mapped.length(); i++) {
            char m = mapped.charAt(i);
            sb.append(canEncode(m) ? m : '?');
        }
        return sb.length() == 0 ? "?" : sb.toString();
    }

    private boolean tryEncode(char c) {
        try {
            font.encode(String.valueOf(c));
            return true;
        } catch (IOException | IllegalArgumentException e) {
            return false;
        }
    }
}
