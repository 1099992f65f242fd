package com.pdftranslator.backend.services.layout;

import java.util.List;

/**
 * Text laid out for one box: the lines to draw, the font size, and whether the last line ends in
 * a clipping indicator because the full text did not fit even at the minimum size.
 */
public record FittedText(List<String> lines, float fontSize, float leading, boolean clipped) {

    public FittedText {
        lines = List.copyOf(lines);
    }
}
