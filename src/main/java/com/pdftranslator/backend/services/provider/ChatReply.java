package com.pdftranslator.backend.services.provider;

/**
 * Text of the first choice of a chat completion. {@code truncated} is set when the model stopped
 * because it ran out of output tokens.
 */
public record ChatReply(String content, boolean truncated) {
}
