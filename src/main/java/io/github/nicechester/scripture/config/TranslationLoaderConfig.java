package io.github.nicechester.scripture.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pool that runs translation loads.
 *
 * Loads are not tied to the thread that asked for them; on shutdown the pool
 * lets in-flight loads finish before the context closes.
 */
@Slf4j
@Configuration
public class TranslationLoaderConfig {

    public static final String LOAD_EXECUTOR = "translationLoadExecutor";

    @Value("${scripture.translation.loader-threads:2}")
    private int loaderThreads;

    @Bean(name = LOAD_EXECUTOR)
    public ThreadPoolTaskExecutor translationLoadExecutor() {
        log.info("Initializing translation load executor with {} threads", loaderThreads);
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(loaderThreads);
        executor.setMaxPoolSize(loaderThreads);
        executor.setThreadNamePrefix("translation-load-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }
}
