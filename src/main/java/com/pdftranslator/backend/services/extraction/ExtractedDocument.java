package com.pdftranslator.backend.services.extraction;

import java.util.List;

public record ExtractedDocument(int pageCount, List<PageLayout> pages) {

    public ExtractedDocument {
        pages = List.copyOf(pages);
    }

    public PageLayout page(int index) {
        return pages.get(index);
    }

    public List<PageLayout> pagesNeedingOcr() {
        return pages.stream().filter(PageLayout::needsOcr).toList();
    }

    /**
     * Blocks of every page in page order, then reading order.
     */
    public List<TextBlock> allBlocks() {
        return pages.stream().flatMap(p -> p.getBlocks().stream()).toList();
    }
}
