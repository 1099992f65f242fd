package com.pdftranslator.backend.services.jobs;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.data.domain.PageRequest;

import com.pdftranslator.backend.entities.TranslationJob;
import com.pdftranslator.backend.enums.FailureReason;
import com.pdftranslator.backend.enums.JobStatus;
import com.pdftranslator.backend.exceptions.InsufficientCreditsException;
import com.pdftranslator.backend.exceptions.ProviderException;
import com.pdftranslator.backend.exceptions.UnsupportedDocumentException;
import com.pdftranslator.backend.repositories.TranslationJobRepository;
import com.pdftranslator.backend.services.credits.CreditLedgerService;
import com.pdftranslator.backend.services.ocr.OcrProvider;
import com.pdftranslator.backend.services.translation.TranslationProvider;
import com.pdftranslator.backend.services.translation.TranslationResult;
import com.pdftranslator.backend.support.TestPdfs;

@SpringBootTest
class TranslationPipelineIntegrationTest {

    @Autowired
    TranslationJobService jobService;

    @Autowired
    CreditLedgerService creditLedger;

    @Autowired
    TranslationJobRepository jobRepository;

    @MockBean
    TranslationProvider translationProvider;

    @MockBean
    OcrProvider ocrProvider;

    @BeforeEach
    void setUp() {
        when(translationProvider.name()).thenReturn("stub");
        when(translationProvider.translate(anyString(), anyString(), anyString(), anyString()))
                .thenAnswer(inv -> new TranslationResult(prefixed(inv.getArgument(0)), 0.95));
        when(ocrProvider.name()).thenReturn("stub-ocr");
        when(ocrProvider.recognize(any(), anyString())).thenReturn(List.of());
    }

    @Test
    void textDocument_isTranslatedAndDownloadable() throws Exception {
        long owner = 1001L;
        creditLedger.grant(owner, 10, "test", null);

        TranslationJob accepted = jobService.submit(owner, "en", "tr", "report.pdf", TestPdfs.textPages(2));

        assertThat(accepted.getCreditsCharged()).isEqualTo(2);
        assertThat(creditLedger.balance(owner)).isEqualTo(8);

        TranslationJob done = awaitFinished(accepted.getId());
        assertThat(done.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(done.getWarningCount()).isZero();
        assertThat(done.getPagesProcessed()).isEqualTo(2);

        StoredArtifact artifact = jobService.download(done.getId(), owner);
        assertThat(artifact.filename()).isEqualTo("report.tr.pdf");
        try (PDDocument pdf = PDDocument.load(artifact.bytes())) {
            assertThat(pdf.getNumberOfPages()).isEqualTo(2);
            assertThat(new PDFTextStripper().getText(pdf)).contains("TR Page 1");
        }
    }

    @Test
    void pageWithoutTextOrOcrResult_completesWithWarning() {
        long owner = 1002L;
        creditLedger.grant(owner, 20, "test", null);
        List<List<String>> pages = new ArrayList<>();
        for (int i = 1; i <= 9; i++) {
            pages.add(List.of("Quarterly revenue grew in region " + i + " compared to last year."));
        }
        pages.add(List.of());
        byte[] mixed = TestPdfs.pages(pages);

        TranslationJob accepted = jobService.submit(owner, "en", "tr", "mixed.pdf", mixed);
        TranslationJob done = awaitFinished(accepted.getId());

        assertThat(done.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(done.getWarningCount()).isEqualTo(1);
        assertThat(done.getOcrPageCount()).isEqualTo(1);
        assertThat(done.getOcrFailedPages()).isEqualTo(1);
        assertThat(creditLedger.balance(owner)).isEqualTo(10);
    }

    @Test
    void documentAtPageLimit_isAcceptedAndDebitedPerPage() {
        long owner = 1003L;
        creditLedger.grant(owner, 200, "test", null);

        TranslationJob accepted = jobService.submit(owner, "tr", "en", "big.pdf", TestPdfs.textPages(150));

        assertThat(accepted.getPageCount()).isEqualTo(150);
        assertThat(creditLedger.balance(owner)).isEqualTo(50);
        assertThat(awaitFinished(accepted.getId()).getStatus()).isEqualTo(JobStatus.COMPLETED);
    }

    @Test
    void documentOverPageLimit_isRejectedWithoutDebit() {
        long owner = 1004L;
        creditLedger.grant(owner, 200, "test", null);

        assertThatThrownBy(() -> jobService.submit(owner, "tr", "en", "huge.pdf", TestPdfs.textPages(151)))
                .isInstanceOf(UnsupportedDocumentException.class);

        TranslationJob latest = latestJob();
        assertThat(latest.getOwnerId()).isEqualTo(owner);
        assertThat(latest.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(latest.getFailureReason()).isEqualTo(FailureReason.UNSUPPORTED_DOCUMENT);
        assertThat(creditLedger.balance(owner)).isEqualTo(200);
        assertThat(creditLedger.isDebited(latest.getId())).isFalse();
    }

    @Test
    void insufficientCredits_failsJobWithoutDebit() {
        long owner = 1005L;
        creditLedger.grant(owner, 1, "test", null);

        assertThatThrownBy(() -> jobService.submit(owner, "en", "tr", "two.pdf", TestPdfs.textPages(2)))
                .isInstanceOf(InsufficientCreditsException.class);

        TranslationJob latest = latestJob();
        assertThat(latest.getFailureReason()).isEqualTo(FailureReason.INSUFFICIENT_CREDITS);
        assertThat(creditLedger.balance(owner)).isEqualTo(1);
    }

    @Test
    void providerFailureOnEveryBatch_failsJobAndRefunds() {
        long owner = 1006L;
        creditLedger.grant(owner, 5, "test", null);
        when(translationProvider.translate(anyString(), anyString(), anyString(), anyString()))
                .thenThrow(ProviderException.permanent("stub", "invalid api key", null));

        // fresh text so no cached translation answers for the provider
        String run = UUID.randomUUID().toString();
        byte[] pdf = TestPdfs.pages(List.of(
                List.of("Sozlesme maddesi bir " + run),
                List.of("Sozlesme maddesi iki " + run),
                List.of("Sozlesme maddesi uc " + run)
        ));

        TranslationJob accepted = jobService.submit(owner, "tr", "en", "doc.pdf", pdf);
        TranslationJob done = awaitFinished(accepted.getId());

        assertThat(done.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(done.getFailureReason()).isEqualTo(FailureReason.PROVIDER_ERROR);
        assertThat(creditLedger.isRefunded(done.getId())).isTrue();
        assertThat(creditLedger.balance(owner)).isEqualTo(5);
    }

    private TranslationJob awaitFinished(UUID jobId) {
        await().atMost(Duration.ofSeconds(60))
                .pollInterval(Duration.ofMillis(100))
                .until(() -> jobService.get(jobId).getStatus().isTerminal());
        return jobService.get(jobId);
    }

    private TranslationJob latestJob() {
        return jobRepository.findByOrderByCreatedAtDesc(PageRequest.of(0, 1)).get(0);
    }

    private static String prefixed(String request) {
        return request.lines()
                .map(line -> line.matches("<<<\\d+>>>") ? line : "TR " + line)
                .collect(Collectors.joining("\n"));
    }
}
