package ru.tigran.nationalityengine.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Конфигурация thread pool для параллельных запросов метаданных стран
 */
@Slf4j
@Configuration
public class ThreadPoolConfig {

    /**
     * Executor для запросов к REST Countries в рамках одного предсказания.
     * При переполнении очереди задача выполняется в вызывающем потоке.
     */
    @Bean(name = "countryLookupExecutor")
    public Executor countryLookupExecutor(NationalityEngineProperties properties) {
        NationalityEngineProperties.Prediction prediction = properties.getPrediction();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(prediction.getLookupCorePoolSize());
        executor.setMaxPoolSize(prediction.getLookupMaxPoolSize());
        executor.setQueueCapacity(prediction.getLookupQueueCapacity());
        executor.setThreadNamePrefix("country-lookup-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();

        log.info("Country lookup executor initialized: core={}, max={}, queue={}",
                prediction.getLookupCorePoolSize(), prediction.getLookupMaxPoolSize(),
                prediction.getLookupQueueCapacity());

        return executor;
    }
}
