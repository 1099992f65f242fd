package com.pdftranslator.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import com.pdftranslator.backend.services.ocr.OcrProperties;

@Configuration
public class AsyncExecutorConfig {

    public static final String JOB_EXECUTOR = "translationJobTaskExecutor";
    public static final String BATCH_EXECUTOR = "translationBatchExecutor";
    public static final String OCR_EXECUTOR = "ocrPageExecutor";
    public static final String PROVIDER_CALL_EXECUTOR = "providerCallExecutor";

    /**
     * Fixed-size job pool: at most {@code translator.worker.pool-size} jobs run at once, the rest queue.
     */
    @Bean(name = JOB_EXECUTOR)
    public ThreadPoolTaskExecutor translationJobTaskExecutor(TranslatorProperties properties) {
        int poolSize = Math.max(1, properties.getWorker().getPoolSize());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(Math.max(1, properties.getWorker().getQueueCapacity()));
        executor.setThreadNamePrefix("translation-job-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    @Bean(name = BATCH_EXECUTOR)
    public ThreadPoolTaskExecutor translationBatchExecutor(TranslatorProperties properties) {
        return capped("translation-batch-", properties.getTranslation().getMaxConcurrency());
    }

    @Bean(name = OCR_EXECUTOR)
    public ThreadPoolTaskExecutor ocrPageExecutor(OcrProperties ocrProperties) {
        return capped("ocr-page-", ocrProperties.getMaxConcurrency());
    }

    /**
     * Runs the blocking provider calls so callers can wait with a timeout. Timed-out calls keep
     * running here until the provider answers; their results are dropped.
     */
    @Bean(name = PROVIDER_CALL_EXECUTOR)
    public ThreadPoolTaskExecutor providerCallExecutor(TranslatorProperties properties, OcrProperties ocrProperties) {
        int core = Math.max(2, properties.getTranslation().getMaxConcurrency() + ocrProperties.getMaxConcurrency());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(core);
        executor.setMaxPoolSize(core * 4);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("provider-call-");
        executor.initialize();
        return executor;
    }

    private static ThreadPoolTaskExecutor capped(String prefix, int concurrency) {
        int size = Math.max(1, concurrency);
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(size);
        executor.setMaxPoolSize(size);
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix(prefix);
        executor.initialize();
        return executor;
    }
}
