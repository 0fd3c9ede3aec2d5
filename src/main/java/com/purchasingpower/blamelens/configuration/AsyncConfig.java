package com.purchasingpower.blamelens.configuration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Executor for blame lookups.
 *
 * Running {@code git blame} blocks on a child process, so it is kept off servlet and
 * reactor threads.
 */
@Slf4j
@Configuration
public class AsyncConfig {

    public static final String BLAME_EXECUTOR = "blameExecutor";
    public static final String PROCESS_OUTPUT_EXECUTOR = "processOutputExecutor";

    @Bean(name = BLAME_EXECUTOR)
    public Executor blameExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(8);
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("blame-");

        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(15);

        executor.initialize();

        log.info("Blame executor configured: core={}, max={}, queue={}",
                executor.getCorePoolSize(),
                executor.getMaxPoolSize(),
                executor.getQueueCapacity());

        return executor;
    }

    /**
     * Drains stdout and stderr of git processes. Separate from the blame pool, whose threads
     * wait on these reads.
     */
    @Bean(name = PROCESS_OUTPUT_EXECUTOR)
    public Executor processOutputExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(16);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("git-output-");

        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(15);

        executor.initialize();
        return executor;
    }
}
