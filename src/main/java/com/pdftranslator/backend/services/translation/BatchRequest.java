package com.pdftranslator.backend.services.translation;

import java.util.List;

/**
 * Segments sent to the translation capability together. The content hash identifies the exact
 * request so a checkpoint is only reused for identical input.
 */
public record BatchRequest(int batchIndex, List<TranslationSegment> segments, String contentHash) {

    public BatchRequest {
        segments = List.copyOf(segments);
    }

    public List<String> texts() {
        return segments.stream().map(TranslationSegment::text).toList();
    }

    public int charCount() {
        return segments.stream().mapToInt(s -> s.text().length()).sum();
    }
}
