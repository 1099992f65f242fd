package com.pdftranslator.backend.services.layout;

public record ReconstructionResult(byte[] pdfBytes, int renderedBlocks, int clippedBlocks, int untranslatedBlocks) {
}
