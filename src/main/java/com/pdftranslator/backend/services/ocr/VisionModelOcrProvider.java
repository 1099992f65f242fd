package com.pdftranslator.backend.services.ocr;

import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

import javax.imageio.ImageIO;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openai.models.chat.completions.ChatCompletionContentPart;
import com.openai.models.chat.completions.ChatCompletionContentPartImage;
import com.openai.models.chat.completions.ChatCompletionContentPartText;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import com.pdftranslator.backend.exceptions.ProviderException;
import com.pdftranslator.backend.services.provider.ChatReply;
import com.pdftranslator.backend.services.provider.OpenRouterChatClient;

import lombok.extern.slf4j.Slf4j;

/**
 * OCR through a multimodal chat model: the page image goes in, a JSON array of spans in image
 * pixel coordinates comes out.
 */
@Slf4j
public class VisionModelOcrProvider implements OcrProvider {

    private static final String PROMPT = "Extract readable text blocks from this page image and return strict JSON array only. "
            + "Each item must have: text, x0, y0, x1, y1, confidence. "
            + "Coordinates must be in image pixel space.";

    private final OpenRouterChatClient chatClient;
    private final OcrProperties ocrProperties;

    private final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public VisionModelOcrProvider(OpenRouterChatClient chatClient, OcrProperties ocrProperties) {
        this.chatClient = chatClient;
        this.ocrProperties = ocrProperties;
    }

    @Override
    public String name() {
        return "vision-model";
    }

    @Override
    public List<OcrSpan> recognize(BufferedImage image, String sourceLang) {
        if (image == null) return List.of();

        String dataUrl = "data:image/png;base64," + Base64.getEncoder().encodeToString(toPng(image));

        ChatCompletionCreateParams params = ChatCompletionCreateParams.builder()
                .model(ocrProperties.getModel())
                .addUserMessageOfArrayOfContentParts(List.of(
                        ChatCompletionContentPart.ofText(ChatCompletionContentPartText.builder()
                                .text("Source language hint: " + sourceLang + ". " + PROMPT)
                                .build()),
                        ChatCompletionContentPart.ofImageUrl(ChatCompletionContentPartImage.builder()
                                .imageUrl(ChatCompletionContentPartImage.ImageUrl.builder()
                                        .url(dataUrl)
                                        .build())
                                .build())
                ))
                .temperature(0.0)
                .build();

        ChatReply reply = chatClient.complete(params);
        return parseSpans(reply.content());
    }

    List<OcrSpan> parseSpans(String raw) {
        String json = stripCodeFences(raw);
        VisionSpanJson[] parsed;
        try {
            parsed = objectMapper.readValue(json, VisionSpanJson[].class);
        } catch (IOException e) {
            // Malformed output usually parses on a second try.
            throw ProviderException.transientFailure(name(), "OCR response is not a JSON array of spans", e);
        }

        List<OcrSpan> spans = new ArrayList<>();
        if (parsed == null) return spans;

        for (VisionSpanJson s : parsed) {
            if (s == null || s.text == null || s.x0 == null || s.y0 == null || s.x1 == null || s.y1 == null) continue;
            spans.add(new OcrSpan(s.text.strip(), s.x0, s.y0, s.x1, s.y1, normaliseConfidence(s.confidence)));
        }
        log.debug("[OCR] Vision model returned {} spans ({} usable)", parsed.length, spans.size());
        return spans;
    }

    /**
     * Some models answer 0..100 instead of 0..1; a missing value counts as neutral.
     */
    private static double normaliseConfidence(Double value) {
        if (value == null || value.isNaN()) return 0.5;
        double v = value > 1.0 ? value / 100.0 : value;
        return Math.max(0.0, Math.min(1.0, v));
    }

    static String stripCodeFences(String raw) {
        if (raw == null) return "";
        String s = raw.trim();
        if (s.startsWith("```")) {
            // Remove leading ```json or ```
            int firstNewline = s.indexOf('\n');
            if (firstNewline >= 0) {
                s = s.substring(firstNewline + 1);
            }
            int lastFence = s.lastIndexOf("```");
            if (lastFence >= 0) {
                s = s.substring(0, lastFence);
            }
        }
        return s.trim();
    }

    private byte[] toPng(BufferedImage image) {
        try (ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            ImageIO.write(image, "png", out);
            return out.toByteArray();
        } catch (IOException e) {
            throw ProviderException.permanent(name(), "Could not encode page image", e);
        }
    }

    private static final class VisionSpanJson {
        public String text;
        public Float x0;
        public Float y0;
        public Float x1;
        public Float y1;
        public Double confidence;
    }
}
