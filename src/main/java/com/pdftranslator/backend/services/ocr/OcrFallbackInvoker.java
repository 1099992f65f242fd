package com.pdftranslator.backend.services.ocr;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import com.pdftranslator.backend.config.AsyncExecutorConfig;
import com.pdftranslator.backend.exceptions.ProviderException;
import com.pdftranslator.backend.exceptions.UnsupportedDocumentException;
import com.pdftranslator.backend.services.extraction.BoundingBox;
import com.pdftranslator.backend.services.extraction.PageLayout;
import com.pdftranslator.backend.services.extraction.TextBlock;
import com.pdftranslator.backend.services.provider.ProviderCallGuard;
import com.pdftranslator.backend.services.provider.RetryPolicy;

import lombok.extern.slf4j.Slf4j;

/**
 * Rasterises scan-like pages and turns the OCR provider's spans into positioned blocks.
 *
 * A page with no usable spans, or whose provider stayed unavailable for the whole retry budget,
 * comes back as a failed page, as does a page that breaks in rendering or span handling. A
 * non-transient provider error is rethrown and fails the job.
 */
@Service
@Slf4j
public class OcrFallbackInvoker {

    private static final float MIN_SPAN_SIZE = 4f;

    private final OcrProvider ocrProvider;
    private final OcrProperties ocrProperties;
    private final ProviderCallGuard callGuard;
    private final RetryPolicy retryPolicy;
    private final Executor ocrExecutor;

    public OcrFallbackInvoker(OcrProvider ocrProvider,
                              OcrProperties ocrProperties,
                              ProviderCallGuard callGuard,
                              RetryPolicy retryPolicy,
                              @Qualifier(AsyncExecutorConfig.OCR_EXECUTOR) Executor ocrExecutor) {
        this.ocrProvider = ocrProvider;
        this.ocrProperties = ocrProperties;
        this.callGuard = callGuard;
        this.retryPolicy = retryPolicy;
        this.ocrExecutor = ocrExecutor;
    }

    /**
     * Runs OCR for the given pages concurrently (bounded by the OCR executor) and reports each
     * finished page to {@code onPageDone} as soon as it is known.
     */
    public List<PageOcrResult> recognizePages(byte[] pdfBytes,
                                              List<PageLayout> pages,
                                              String sourceLang,
                                              Consumer<PageOcrResult> onPageDone) {
        if (pages.isEmpty()) return List.of();

        long startMs = System.currentTimeMillis();
        try (PDDocument document = PDDocument.load(pdfBytes)) {
            PDFRenderer renderer = new PDFRenderer(document);

            List<CompletableFuture<PageOcrResult>> futures = new ArrayList<>();
            for (PageLayout page : pages) {
                futures.add(CompletableFuture.supplyAsync(() -> {
                    PageOcrResult result = recognizePage(renderer, page, sourceLang);
                    onPageDone.accept(result);
                    return result;
                }, ocrExecutor));
            }

            // In-flight calls are allowed to finish before a fatal error is reported.
            List<PageOcrResult> results = new ArrayList<>();
            RuntimeException fatal = null;
            for (CompletableFuture<PageOcrResult> future : futures) {
                try {
                    results.add(future.join());
                } catch (CompletionException e) {
                    if (fatal == null) {
                        fatal = e.getCause() instanceof RuntimeException re ? re : e;
                    }
                }
            }
            if (fatal != null) throw fatal;

            long failed = results.stream().filter(PageOcrResult::failed).count();
            log.info("[OCR] Completed: pages={} failed={} provider={} elapsedMs={}",
                    results.size(), failed, ocrProvider.name(), System.currentTimeMillis() - startMs);
            return results;
        } catch (IOException e) {
            throw new UnsupportedDocumentException("Could not render PDF for OCR: " + e.getMessage(), e);
        }
    }

    PageOcrResult recognizePage(PDFRenderer renderer, PageLayout page, String sourceLang) {
        int dpi = Math.max(72, ocrProperties.getRenderDpi());
        AtomicInteger attempts = new AtomicInteger();
        BufferedImage image = null;

        try {
            image = render(renderer, page.getPageIndex(), dpi);
            BufferedImage pageImage = image;
            List<OcrSpan> raw = retryPolicy.execute(
                    "ocr page=" + page.getPageIndex(),
                    attempt -> {
                        attempts.set(attempt);
                        return callGuard.call(
                                ocrProvider.name(),
                                Duration.ofSeconds(Math.max(1, ocrProperties.getTimeoutSeconds())),
                                () -> ocrProvider.recognize(pageImage, sourceLang));
                    });

            List<OcrSpan> usable = normalise(raw, page, pageImage.getWidth(), pageImage.getHeight());
            log.debug("[OCR] page={} rawSpans={} usableSpans={} attempts={}",
                    page.getPageIndex(), raw.size(), usable.size(), attempts.get());
            return PageOcrResult.success(page.getPageIndex(), usable, attempts.get());
        } catch (ProviderException e) {
            if (!e.isTransient()) {
                throw e;
            }
            log.warn("[OCR] page={} skipped after {} attempts: {}", page.getPageIndex(), attempts.get(), e.getMessage());
            return PageOcrResult.failure(page.getPageIndex(), PageOcrResult.TAG_PROVIDER_UNAVAILABLE, attempts.get());
        } catch (RuntimeException e) {
            log.error("[OCR] page={} failed unexpectedly", page.getPageIndex(), e);
            return PageOcrResult.failure(page.getPageIndex(), PageOcrResult.TAG_PAGE_ERROR, attempts.get());
        } finally {
            // Help GC/free native memory sooner
            if (image != null) image.flush();
        }
    }

    /**
     * Scales pixel coordinates to page points when the spans are clearly larger than the page,
     * then drops spans that are too small, too short or too uncertain to place.
     */
    List<OcrSpan> normalise(List<OcrSpan> spans, PageLayout page, int imageWidth, int imageHeight) {
        if (spans == null || spans.isEmpty()) return List.of();

        float maxX = 0f;
        float maxY = 0f;
        for (OcrSpan s : spans) {
            maxX = Math.max(maxX, Math.max(s.x0(), s.x1()));
            maxY = Math.max(maxY, Math.max(s.y0(), s.y1()));
        }

        float sx = 1f;
        float sy = 1f;
        if (maxX > page.getWidth() * 1.25f || maxY > page.getHeight() * 1.25f) {
            sx = page.getWidth() / Math.max(imageWidth, 1);
            sy = page.getHeight() / Math.max(imageHeight, 1);
        }

        List<OcrSpan> usable = new ArrayList<>();
        for (OcrSpan s : spans) {
            String text = s.text() == null ? "" : s.text().strip();
            if (text.length() < 2) continue;
            if (s.confidence() < ocrProperties.getMinSpanConfidence()) continue;

            OcrSpan scaled = s.scaled(sx, sy);
            BoundingBox box = BoundingBox.fromCorners(scaled.x0(), scaled.y0(), scaled.x1(), scaled.y1())
                    .clampTo(page.getWidth(), page.getHeight());
            if (box.width() < MIN_SPAN_SIZE || box.height() < MIN_SPAN_SIZE) continue;

            usable.add(new OcrSpan(text, box.x(), box.y(), box.right(), box.bottom(), s.confidence()));
        }
        return usable;
    }

    /**
     * Blocks for spans already normalised to page points, in the order the provider reported them.
     */
    public List<TextBlock> toBlocks(int pageIndex, List<OcrSpan> spans) {
        List<TextBlock> blocks = new ArrayList<>(spans.size());
        for (OcrSpan s : spans) {
            BoundingBox box = BoundingBox.fromCorners(s.x0(), s.y0(), s.x1(), s.y1());
            float fontHint = Math.max(7f, Math.min(16f, box.height() * 0.72f));
            blocks.add(new TextBlock(pageIndex, blocks.size(), box, s.text(), s.confidence(), fontHint, true));
        }
        return blocks;
    }

    private BufferedImage render(PDFRenderer renderer, int pageIndex, int dpi) {
        // PDFRenderer shares the document's resources and is not safe for parallel rendering.
        synchronized (renderer) {
            try {
                return renderer.renderImageWithDPI(pageIndex, dpi, ImageType.RGB);
            } catch (IOException e) {
                throw new UnsupportedDocumentException("Could not render page " + pageIndex + ": " + e.getMessage(), e);
            }
        }
    }
}
