package com.pdftranslator.backend.services.translation;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import com.pdftranslator.backend.config.AsyncExecutorConfig;
import com.pdftranslator.backend.config.TranslatorProperties;
import com.pdftranslator.backend.exceptions.ProviderException;
import com.pdftranslator.backend.exceptions.TranslationFailedException;
import com.pdftranslator.backend.services.extraction.TextBlock;
import com.pdftranslator.backend.services.provider.ProviderCallGuard;
import com.pdftranslator.backend.services.provider.RetryPolicy;

import lombok.extern.slf4j.Slf4j;

/**
 * Translates every block of a job in size-bounded batches.
 *
 * Each batch goes to the primary model with the shared retry budget. When the primary fails or
 * answers with low confidence, the batch is sent once to the fallback model. A batch that still
 * has no acceptable answer leaves its blocks untranslated with an error tag; only when every
 * batch fails does the whole step fail.
 */
@Service
@Slf4j
public class TranslationBatcher {

    public static final String TAG_BATCH_FAILED = "TRANSLATION_BATCH_FAILED";
    public static final String TAG_NO_TEXT = "NO_SOURCE_TEXT";

    private static final String CACHE_MODEL = "cache";

    private final BatchPlanner planner;
    private final TranslationProvider provider;
    private final TranslationCacheService cache;
    private final BatchCheckpointStore checkpoints;
    private final ProviderCallGuard callGuard;
    private final RetryPolicy retryPolicy;
    private final TranslatorProperties properties;
    private final Executor batchExecutor;

    public TranslationBatcher(BatchPlanner planner,
                              TranslationProvider provider,
                              TranslationCacheService cache,
                              BatchCheckpointStore checkpoints,
                              ProviderCallGuard callGuard,
                              RetryPolicy retryPolicy,
                              TranslatorProperties properties,
                              @Qualifier(AsyncExecutorConfig.BATCH_EXECUTOR) Executor batchExecutor) {
        this.planner = planner;
        this.provider = provider;
        this.cache = cache;
        this.checkpoints = checkpoints;
        this.callGuard = callGuard;
        this.retryPolicy = retryPolicy;
        this.properties = properties;
        this.batchExecutor = batchExecutor;
    }

    /**
     * Fills in the translated text of {@code blocks}, or tags the ones that could not be translated.
     *
     * @param jobId owner of the batch checkpoints; {@code null} disables checkpointing
     */
    public TranslationOutcome translate(UUID jobId, List<TextBlock> blocks, String sourceLang, String targetLang) {
        if (blocks.isEmpty()) return TranslationOutcome.empty();

        long startMs = System.currentTimeMillis();
        List<BatchRequest> batches = planner.plan(blocks, sourceLang, targetLang);

        List<CompletableFuture<BatchResult>> futures = new ArrayList<>();
        for (BatchRequest batch : batches) {
            futures.add(CompletableFuture.supplyAsync(
                    () -> processBatch(jobId, batch, sourceLang, targetLang), batchExecutor));
        }
        List<BatchResult> results = futures.stream().map(CompletableFuture::join).toList();

        Map<Integer, Integer> partCounts = new HashMap<>();
        for (BatchRequest batch : batches) {
            for (TranslationSegment seg : batch.segments()) {
                partCounts.merge(seg.blockIndex(), seg.part() + 1, Math::max);
            }
        }

        Map<Integer, String[]> partsByBlock = new HashMap<>();
        Map<Integer, String> failedByBlock = new HashMap<>();
        for (BatchResult result : results) {
            List<TranslationSegment> segments = result.batch().segments();
            for (int i = 0; i < segments.size(); i++) {
                TranslationSegment seg = segments.get(i);
                if (result.translations() == null) {
                    failedByBlock.put(seg.blockIndex(), result.errorTag());
                    continue;
                }
                String[] parts = partsByBlock.computeIfAbsent(seg.blockIndex(), k -> new String[partCounts.get(k)]);
                parts[seg.part()] = result.translations().get(i);
            }
        }

        int translated = 0;
        int failed = 0;
        for (int i = 0; i < blocks.size(); i++) {
            TextBlock block = blocks.get(i);
            String[] parts = partsByBlock.get(i);
            String failure = failedByBlock.get(i);
            if (failure == null && parts == null) {
                block.markFailed(TAG_NO_TEXT);
                failed++;
            } else if (failure != null || Arrays.stream(parts).anyMatch(p -> p == null)) {
                block.markFailed(failure != null ? failure : TAG_BATCH_FAILED);
                failed++;
            } else {
                block.applyTranslation(String.join("\n", parts).strip());
                translated++;
            }
        }

        int failedBatches = (int) results.stream().filter(r -> r.translations() == null).count();
        int fallbackBatches = (int) results.stream().filter(BatchResult::usedFallback).count();
        int resumed = (int) results.stream().filter(BatchResult::fromCheckpoint).count();
        int cachedSegments = results.stream().mapToInt(BatchResult::cachedSegments).sum();

        log.info("[Translate] Completed: jobId={} batches={} failedBatches={} fallbackBatches={} resumedBatches={} "
                        + "cachedSegments={} blocks={} failedBlocks={} elapsedMs={}",
                jobId, batches.size(), failedBatches, fallbackBatches, resumed, cachedSegments,
                blocks.size(), failed, System.currentTimeMillis() - startMs);

        if (!batches.isEmpty() && failedBatches == batches.size()) {
            Optional<ProviderException> permanent = results.stream()
                    .map(BatchResult::permanentError)
                    .filter(e -> e != null)
                    .findFirst();
            if (permanent.isPresent()) {
                throw permanent.get();
            }
            throw new TranslationFailedException("All " + batches.size() + " translation batches failed");
        }

        return new TranslationOutcome(batches.size(), failedBatches, translated, failed, fallbackBatches, resumed, cachedSegments);
    }

    BatchResult processBatch(UUID jobId, BatchRequest batch, String sourceLang, String targetLang) {
        try {
            return attemptBatch(jobId, batch, sourceLang, targetLang);
        } catch (RuntimeException e) {
            log.error("[Translate] jobId={} batch={} failed unexpectedly", jobId, batch.batchIndex(), e);
            String tag = TAG_BATCH_FAILED + ": " + e.getClass().getSimpleName();
            return new BatchResult(batch, null, tag, null, false, false, 0);
        }
    }

    private BatchResult attemptBatch(UUID jobId, BatchRequest batch, String sourceLang, String targetLang) {
        Optional<List<String>> checkpoint = checkpoints.findSucceeded(jobId, batch);
        if (checkpoint.isPresent()) {
            log.debug("[Translate] jobId={} batch={} reused from checkpoint", jobId, batch.batchIndex());
            return new BatchResult(batch, checkpoint.get(), null, null, false, true, 0);
        }

        List<String> texts = batch.texts();
        String[] out = new String[texts.size()];
        List<Integer> pending = new ArrayList<>();
        for (int i = 0; i < texts.size(); i++) {
            Optional<String> hit = cache.lookup(sourceLang, targetLang, texts.get(i));
            if (hit.isPresent()) {
                out[i] = hit.get();
            } else {
                pending.add(i);
            }
        }
        int cached = texts.size() - pending.size();

        if (pending.isEmpty()) {
            List<String> all = List.of(out);
            checkpoints.recordSuccess(jobId, batch, CACHE_MODEL, 0, 1.0, all);
            return new BatchResult(batch, all, null, null, false, false, cached);
        }

        List<String> pendingTexts = pending.stream().map(texts::get).toList();
        TranslatorProperties.Translation cfg = properties.getTranslation();

        ModelAnswer answer = ask(cfg.getModel(), batch.batchIndex(), pendingTexts, sourceLang, targetLang);
        int attempts = answer.attempts();
        boolean usedFallback = false;
        ProviderException permanent = answer.permanentError();

        if (!answer.acceptable(cfg.getMinConfidence()) && hasFallback(cfg)) {
            log.warn("[Translate] jobId={} batch={} primary model '{}' unusable ({}); trying fallback '{}'",
                    jobId, batch.batchIndex(), cfg.getModel(), answer.problem(), cfg.getFallbackModel());
            usedFallback = true;
            answer = ask(cfg.getFallbackModel(), batch.batchIndex(), pendingTexts, sourceLang, targetLang);
            attempts += answer.attempts();
            permanent = answer.permanentError();
        }

        if (!answer.acceptable(cfg.getMinConfidence())) {
            String tag = TAG_BATCH_FAILED + ": " + answer.problem();
            log.warn("[Translate] jobId={} batch={} failed after {} calls: {}", jobId, batch.batchIndex(), attempts, answer.problem());
            checkpoints.recordFailure(jobId, batch, answer.model(), attempts, tag);
            return new BatchResult(batch, null, tag, permanent, usedFallback, false, cached);
        }

        for (int i = 0; i < pending.size(); i++) {
            String translated = answer.translations().get(i);
            out[pending.get(i)] = translated;
            cache.store(sourceLang, targetLang, pendingTexts.get(i), translated, answer.model());
        }
        List<String> all = List.of(out);
        checkpoints.recordSuccess(jobId, batch, answer.model(), attempts, answer.confidence(), all);
        return new BatchResult(batch, all, null, null, usedFallback, false, cached);
    }

    private ModelAnswer ask(String model, int batchIndex, List<String> texts, String sourceLang, String targetLang) {
        String request = SegmentCodec.encode(texts);
        Duration timeout = Duration.ofSeconds(Math.max(1, properties.getTranslation().getTimeoutSeconds()));
        AtomicInteger attempts = new AtomicInteger();

        try {
            TranslationResult result = retryPolicy.execute(
                    "translate batch=" + batchIndex + " model=" + model,
                    attempt -> {
                        attempts.set(attempt);
                        return callGuard.call(provider.name(), timeout,
                                () -> provider.translate(request, sourceLang, targetLang, model));
                    });

            Optional<List<String>> decoded = SegmentCodec.decode(result.text(), texts.size());
            if (decoded.isEmpty()) {
                return new ModelAnswer(model, null, 0.0, attempts.get(), "segment markers do not match", null);
            }
            return new ModelAnswer(model, decoded.get(), result.confidence(), attempts.get(),
                    "confidence " + result.confidence(), null);
        } catch (ProviderException e) {
            return new ModelAnswer(model, null, 0.0, attempts.get(), e.getMessage(), e.isTransient() ? null : e);
        }
    }

    private static boolean hasFallback(TranslatorProperties.Translation cfg) {
        return cfg.getFallbackModel() != null && !cfg.getFallbackModel().isBlank();
    }

    private record ModelAnswer(String model,
                               List<String> translations,
                               double confidence,
                               int attempts,
                               String problem,
                               ProviderException permanentError) {

        boolean acceptable(double minConfidence) {
            return translations != null && confidence >= minConfidence;
        }
    }

    record BatchResult(BatchRequest batch,
                       List<String> translations,
                       String errorTag,
                       ProviderException permanentError,
                       boolean usedFallback,
                       boolean fromCheckpoint,
                       int cachedSegments) {
    }
}
