package ru.tigran.researchsignalengine.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Конфигурация thread pool для параллельного анализа фреймворков кодбука.
 * Каждый анализ получает собственный снимок входных данных, общего изменяемого состояния нет.
 */
@Slf4j
@Configuration
public class ThreadPoolConfig {

    @Value("${analysis.executor.core-pool-size:2}")
    private int corePoolSize;

    @Value("${analysis.executor.max-pool-size:8}")
    private int maxPoolSize;

    @Value("${analysis.executor.queue-capacity:100}")
    private int queueCapacity;

    /**
     * Executor для задач анализа по фреймворкам.
     * При переполнении очереди задача выполняется в вызывающем потоке, а не теряется.
     */
    @Bean(name = "analysisExecutor")
    public Executor analysisExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("analysis-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy() {
            @Override
            public void rejectedExecution(Runnable r, ThreadPoolExecutor e) {
                log.warn("Analysis task queue is full, running in caller thread");
                super.rejectedExecution(r, e);
            }
        });
        executor.initialize();
        return executor;
    }
}
