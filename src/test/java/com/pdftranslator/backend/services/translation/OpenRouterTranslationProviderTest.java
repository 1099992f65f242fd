package com.pdftranslator.backend.services.translation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import com.pdftranslator.backend.services.provider.ChatReply;
import com.pdftranslator.backend.services.provider.OpenRouterChatClient;

class OpenRouterTranslationProviderTest {

    private final OpenRouterChatClient chatClient = Mockito.mock(OpenRouterChatClient.class);
    private final OpenRouterTranslationProvider provider = new OpenRouterTranslationProvider(chatClient);

    @Test
    void translate_finishedReply_carriesNormalConfidence() {
        when(chatClient.complete(any())).thenReturn(new ChatReply("<<<1>>>\nMerhaba", false));

        TranslationResult result = provider.translate("<<<1>>>\nHello", "en", "tr", "primary-model");

        assertThat(result.text()).isEqualTo("<<<1>>>\nMerhaba");
        assertThat(result.confidence()).isEqualTo(OpenRouterTranslationProvider.NORMAL_CONFIDENCE);
    }

    @Test
    void translate_replyCutOffByTokenLimit_isBelowTheDefaultThreshold() {
        when(chatClient.complete(any())).thenReturn(new ChatReply("<<<1>>>\nMerh", true));

        TranslationResult result = provider.translate("<<<1>>>\nHello", "en", "tr", "primary-model");

        assertThat(result.confidence()).isEqualTo(OpenRouterTranslationProvider.TRUNCATED_CONFIDENCE);
        assertThat(result.confidence()).isLessThan(0.5);
    }

    @Test
    void buildPrompt_namesBothLanguagesAndKeepsMarkersIntact() {
        String prompt = OpenRouterTranslationProvider.buildPrompt("<<<1>>>\nMerhaba", "tr", "en");

        assertThat(prompt).contains("from Turkish to English");
        assertThat(prompt).contains(SegmentCodec.MARKER_EXAMPLE);
        assertThat(prompt).endsWith("TEXT:\n<<<1>>>\nMerhaba");
    }
}
