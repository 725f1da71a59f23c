package com.server.skillsync.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * 匹配相关线程池
 * 关闭时等待正在执行的任务完成
 */
@Configuration
public class ExecutorConfig {
    private static final Logger logger = LoggerFactory.getLogger(ExecutorConfig.class);

    /**
     * 单次触发内并发评分与落库的线程池
     * 队列满时由提交线程自己执行，避免丢弃候选
     */
    @Bean(name = "matchScoringExecutor")
    public ThreadPoolTaskExecutor matchScoringExecutor(
            @Value("${matching.executor.scoring.core-pool-size:8}") int corePoolSize,
            @Value("${matching.executor.scoring.max-pool-size:16}") int maxPoolSize,
            @Value("${matching.executor.scoring.queue-capacity:500}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("match-scoring-");
        executor.setRejectedExecutionHandler((r, e) -> {
            logger.warn("评分线程池已满，由调用线程执行评分任务");
            new ThreadPoolExecutor.CallerRunsPolicy().rejectedExecution(r, e);
        });
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    /**
     * 定时对账批量执行触发的线程池
     */
    @Bean(name = "reconciliationExecutor")
    public ThreadPoolTaskExecutor reconciliationExecutor(
            @Value("${matching.executor.reconciliation.pool-size:10}") int poolSize) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("match-reconcile-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }
}
