package com.pdftranslator.backend.services.translation;

import java.util.Locale;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.openai.models.chat.completions.ChatCompletionCreateParams;
import com.pdftranslator.backend.services.provider.ChatReply;
import com.pdftranslator.backend.services.provider.OpenRouterChatClient;
import com.pdftranslator.backend.services.provider.OpenRouterClientFactory;

import lombok.RequiredArgsConstructor;

@Component
@RequiredArgsConstructor
public class OpenRouterTranslationProvider implements TranslationProvider {

    static final double NORMAL_CONFIDENCE = 0.95;
    static final double TRUNCATED_CONFIDENCE = 0.2;

    private static final String SYSTEM_PROMPT = "You are a high-precision translator.";

    private static final Map<String, String> LANGUAGE_NAMES = Map.of(
            "tr", "Turkish",
            "en", "English"
    );

    private final OpenRouterChatClient chatClient;

    @Override
    public String name() {
        return OpenRouterClientFactory.PROVIDER;
    }

    @Override
    public TranslationResult translate(String text, String sourceLang, String targetLang, String model) {
        ChatCompletionCreateParams params = ChatCompletionCreateParams.builder()
                .model(model)
                .addSystemMessage(SYSTEM_PROMPT)
                .addUserMessage(buildPrompt(text, sourceLang, targetLang))
                .temperature(0.0)
                .build();

        ChatReply reply = chatClient.complete(params);
        // A reply cut off by the token limit is missing part of the text.
        double confidence = reply.truncated() ? TRUNCATED_CONFIDENCE : NORMAL_CONFIDENCE;
        return new TranslationResult(reply.content(), confidence);
    }

    static String buildPrompt(String text, String sourceLang, String targetLang) {
        return "Translate the text from " + languageName(sourceLang) + " to " + languageName(targetLang) + ". "
                + "Preserve meaning, numbers, special symbols, and inline structure. "
                + "Lines of the form " + SegmentCodec.MARKER_EXAMPLE + " are segment markers: keep each one unchanged on its own line. "
                + "Return only translated text without commentary.\n\n"
                + "TEXT:\n" + text;
    }

    private static String languageName(String code) {
        if (code == null) return "";
        return LANGUAGE_NAMES.getOrDefault(code.toLowerCase(Locale.ROOT), code);
    }
}
