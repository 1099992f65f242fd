package com.pdftranslator.backend.services.translation;

/**
 * A piece of one block's text. Long blocks produce several parts that are re-joined in order.
 *
 * @param blockIndex position of the block in the list given to the planner
 */
public record TranslationSegment(int blockIndex, int part, String text) {
}
