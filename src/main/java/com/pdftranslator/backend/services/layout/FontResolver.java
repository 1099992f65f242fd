package com.pdftranslator.backend.services.layout;

import java.io.File;
import java.io.IOException;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.font.PDType0Font;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.springframework.stereotype.Component;

import com.pdftranslator.backend.config.TranslatorProperties;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Picks the font used for translated text. An embeddable TrueType font covers Turkish letters;
 * without one the standard Helvetica is used and unsupported letters are folded.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FontResolver {

    private final TranslatorProperties properties;

    public ResolvedFont resolve(PDDocument document) {
        for (String candidate : properties.getLayout().getFontCandidates()) {
            if (candidate == null || candidate.isBlank()) continue;
            File file = new File(candidate);
            if (!file.isFile()) continue;
            try {
                return new ResolvedFont(PDType0Font.load(document, file), true);
            } catch (IOException e) {
                log.warn("[Layout] Could not load font '{}': {}", candidate, e.getMessage());
            }
        }
        log.debug("[Layout] No TrueType font available; using Helvetica");
        return new ResolvedFont(PDType1Font.HELVETICA, false);
    }
}
