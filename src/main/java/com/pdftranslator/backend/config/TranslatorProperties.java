package com.pdftranslator.backend.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Data;

/**
 * Pipeline-wide settings loaded from the "translator" prefix.
 *
 * OCR settings live in {@link com.pdftranslator.backend.services.ocr.OcrProperties} and provider
 * credentials in {@link com.pdftranslator.backend.services.provider.OpenRouterProperties}.
 */
@Data
@ConfigurationProperties(prefix = "translator")
public class TranslatorProperties {

    private String version = "0.1.0";

    private Limits limits = new Limits();
    private Worker worker = new Worker();
    private Extraction extraction = new Extraction();
    private Translation translation = new Translation();
    private Retry retry = new Retry();
    private Layout layout = new Layout();
    private Storage storage = new Storage();
    private Admin admin = new Admin();
    private Cleanup cleanup = new Cleanup();

    @Data
    public static class Limits {

        /**
         * Hard page ceiling per job; larger documents are rejected before any debit.
         */
        private int maxPages = 150;

        private int maxFileMb = 80;

        /**
         * Hours after job creation during which the artifact can be downloaded.
         */
        private int retentionHours = 24;

        /**
         * Allowed "source-target" pairs.
         */
        private List<String> languagePairs = new ArrayList<>(List.of("tr-en", "en-tr"));

        public long maxFileBytes() {
            return (long) maxFileMb * 1024L * 1024L;
        }

        public boolean isSupportedPair(String sourceLang, String targetLang) {
            if (sourceLang == null || targetLang == null) return false;
            String pair = sourceLang.trim().toLowerCase(Locale.ROOT) + "-" + targetLang.trim().toLowerCase(Locale.ROOT);
            return languagePairs.stream().anyMatch(p -> p.equalsIgnoreCase(pair));
        }
    }

    @Data
    public static class Worker {

        /**
         * Concurrent job executions; excess jobs wait in the queue.
         */
        private int poolSize = 2;

        private int queueCapacity = 200;

        /**
         * Re-queue jobs left mid-pipeline by a previous process at startup.
         */
        private boolean recoverOnStartup = true;
    }

    @Data
    public static class Extraction {

        /**
         * Pages with this many non-whitespace characters or fewer have no usable text layer.
         */
        private int minTextChars = 20;

        /**
         * Non-whitespace characters per square inch below which a page is treated as scan-like.
         */
        private double minCharDensity = 0.2;

        /**
         * Share of cleanly mapped glyphs below which a text page is routed to OCR instead.
         */
        private double minTextConfidence = 0.6;

        /**
         * Lines whose vertical gap exceeds this multiple of the line height start a new block.
         */
        private double blockGapFactor = 0.9;

        /**
         * Font sizes differing by more than this ratio split a block.
         */
        private double fontSizeTolerance = 0.25;
    }

    @Data
    public static class Translation {

        private String model = "google/gemini-2.5-flash-lite";

        /**
         * Model used once per batch when the primary fails or returns a low-confidence result.
         */
        private String fallbackModel = "google/gemini-2.5-flash";

        private int maxBatchChars = 3500;

        private int maxBatchSegments = 40;

        /**
         * Blocks longer than this are split on whitespace into several segments.
         */
        private int maxSegmentChars = 1200;

        /**
         * Results below this confidence trigger the fallback model.
         */
        private double minConfidence = 0.5;

        private int maxConcurrency = 4;

        private int timeoutSeconds = 90;

        private boolean cacheEnabled = true;
    }

    @Data
    public static class Retry {

        private int maxAttempts = 3;

        private long initialBackoffMs = 400;

        private double multiplier = 3.0;

        private long maxBackoffMs = 5000;
    }

    @Data
    public static class Layout {

        private float minFontSize = 6f;

        private float maxFontSize = 20f;

        private float fontSizeStep = 0.5f;

        /**
         * Leading as a multiple of the font size.
         */
        private float lineSpacing = 1.15f;

        /**
         * TrueType files tried in order; the first loadable one is embedded.
         */
        private List<String> fontCandidates = new ArrayList<>(List.of(
                "/usr/share/fonts/truetype/dejavu/DejaVuSans.ttf",
                "/usr/share/fonts/dejavu/DejaVuSans.ttf",
                "/usr/share/fonts/truetype/liberation/LiberationSans-Regular.ttf",
                "C:/Windows/Fonts/arial.ttf",
                "/Library/Fonts/Arial.ttf"
        ));
    }

    @Data
    public static class Storage {

        private String baseDir = "data/storage";
    }

    @Data
    public static class Admin {

        private String apiToken = "";
    }

    @Data
    public static class Cleanup {

        private boolean enabled = true;

        private long fixedDelayMs = 15 * 60 * 1000L;
    }
}
