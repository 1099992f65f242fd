package com.pdftranslator.backend.services.translation;

import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Component;

import com.pdftranslator.backend.config.TranslatorProperties;
import com.pdftranslator.backend.services.Sha256;
import com.pdftranslator.backend.services.extraction.TextBlock;

import lombok.RequiredArgsConstructor;

/**
 * Cuts blocks into segments and groups the segments, in reading order, into batches bounded by
 * character and segment counts. The plan only depends on the block texts and the configuration.
 */
@Component
@RequiredArgsConstructor
public class BatchPlanner {

    /**
     * A long block is only split at a space that leaves at least this many characters behind.
     */
    private static final int MIN_CHUNK_BEFORE_BOUNDARY = 150;

    private final TranslatorProperties properties;

    public List<BatchRequest> plan(List<TextBlock> blocks, String sourceLang, String targetLang) {
        TranslatorProperties.Translation cfg = properties.getTranslation();
        int maxChars = Math.max(1, cfg.getMaxBatchChars());
        int maxSegments = Math.max(1, cfg.getMaxBatchSegments());

        List<BatchRequest> batches = new ArrayList<>();
        List<TranslationSegment> current = new ArrayList<>();
        int currentChars = 0;

        for (int i = 0; i < blocks.size(); i++) {
            List<String> chunks = chunk(blocks.get(i).getSourceText(), cfg.getMaxSegmentChars());
            for (int part = 0; part < chunks.size(); part++) {
                String text = chunks.get(part);
                boolean full = current.size() >= maxSegments || currentChars + text.length() > maxChars;
                if (!current.isEmpty() && full) {
                    batches.add(toBatch(batches.size(), current, sourceLang, targetLang));
                    current = new ArrayList<>();
                    currentChars = 0;
                }
                current.add(new TranslationSegment(i, part, text));
                currentChars += text.length();
            }
        }
        if (!current.isEmpty()) {
            batches.add(toBatch(batches.size(), current, sourceLang, targetLang));
        }
        return batches;
    }

    /**
     * Splits text into pieces of at most {@code chunkSize} characters, preferring the last space
     * inside the window.
     */
    static List<String> chunk(String text, int chunkSize) {
        String t = text == null ? "" : text.strip();
        if (t.isEmpty()) return List.of();
        int size = Math.max(1, chunkSize);
        if (t.length() <= size) return List.of(t);

        List<String> chunks = new ArrayList<>();
        int cursor = 0;
        while (cursor < t.length()) {
            int end = Math.min(cursor + size, t.length());
            if (end < t.length()) {
                int boundary = t.lastIndexOf(' ', end - 1);
                if (boundary > cursor + MIN_CHUNK_BEFORE_BOUNDARY) {
                    end = boundary;
                }
            }
            String part = t.substring(cursor, end).strip();
            if (!part.isEmpty()) {
                chunks.add(part);
            }
            cursor = end;
        }
        return chunks;
    }

    private static BatchRequest toBatch(int index, List<TranslationSegment> segments, String sourceLang, String targetLang) {
        String hash = Sha256.hex(sourceLang + "|" + targetLang + "|" + SegmentCodec.encode(
                segments.stream().map(TranslationSegment::text).toList()));
        return new BatchRequest(index, segments, hash);
    }
}
