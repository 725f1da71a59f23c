package com.server.skillsync.match.pipeline;

import com.server.skillsync.collaborator.ProjectIdeasClient;
import com.server.skillsync.collaborator.UserProfileClient;
import com.server.skillsync.collaborator.dto.ProjectSnapshot;
import com.server.skillsync.collaborator.dto.UserSnapshot;
import com.server.skillsync.config.MatchingConfig;
import com.server.skillsync.match.enums.TriggerSource;
import com.server.skillsync.match.exception.CollaboratorUnavailableException;
import com.server.skillsync.utils.DistributedLockHelper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 定时对账任务
 * 事件可能丢失，或者触发时协作服务不可用，这里定期对最近活跃的用户和项目重新生成匹配
 * 多实例部署时通过分布式锁保证同一时刻只有一个实例在执行
 */
@Component
@ConditionalOnProperty(name = "matching.reconciliation.enabled", havingValue = "true", matchIfMissing = true)
public class MatchReconciliationScheduler {
    private static final Logger logger = LoggerFactory.getLogger(MatchReconciliationScheduler.class);

    private final MatchingPipeline matchingPipeline;
    private final UserProfileClient userProfileClient;
    private final ProjectIdeasClient projectIdeasClient;
    private final DistributedLockHelper lockHelper;
    private final MatchingConfig matchingConfig;
    private final Executor reconciliationExecutor;

    public MatchReconciliationScheduler(MatchingPipeline matchingPipeline,
                                        UserProfileClient userProfileClient,
                                        ProjectIdeasClient projectIdeasClient,
                                        DistributedLockHelper lockHelper,
                                        MatchingConfig matchingConfig,
                                        @Qualifier("reconciliationExecutor") Executor reconciliationExecutor) {
        this.matchingPipeline = matchingPipeline;
        this.userProfileClient = userProfileClient;
        this.projectIdeasClient = projectIdeasClient;
        this.lockHelper = lockHelper;
        this.matchingConfig = matchingConfig;
        this.reconciliationExecutor = reconciliationExecutor;
    }

    @Scheduled(cron = "${matching.reconciliation.cron:0 0 * * * *}")
    public void scheduledReconciliation() {
        runReconciliation();
    }

    /**
     * 执行一轮对账
     *
     * @return 本轮统计，未拿到锁时返回 skipped
     */
    public ReconciliationReport runReconciliation() {
        MatchingConfig.ReconciliationConfig config = matchingConfig.getReconciliation();
        String lockKey = config.getLockKey();
        if (!lockHelper.tryLock(lockKey, 0, TimeUnit.SECONDS)) {
            logger.info("其他实例正在执行匹配对账，本轮跳过");
            return ReconciliationReport.skipped();
        }

        try {
            Instant since = Instant.now().minus(config.getRecencyWindow());
            logger.info("开始匹配对账，时间窗口起点: {}", since);

            List<MatchTrigger> triggers = new ArrayList<>();
            for (UserSnapshot user : fetchRecentUsers(since, config.getFetchLimit())) {
                triggers.add(MatchTrigger.forUser(user.id(), TriggerSource.RECONCILIATION));
            }
            for (ProjectSnapshot project : fetchRecentProjects(since, config.getFetchLimit())) {
                triggers.add(MatchTrigger.forProject(project.id(), TriggerSource.RECONCILIATION));
            }

            ReconciliationReport report = runInBatches(triggers, config);
            logger.info("匹配对账完成: 触发 {}，成功 {}，失败 {}，新建匹配 {}",
                    report.triggerCount(), report.succeededCount(), report.failedCount(),
                    report.createdMatchCount());
            return report;
        } finally {
            lockHelper.unlock(lockKey);
        }
    }

    private List<UserSnapshot> fetchRecentUsers(Instant since, int limit) {
        try {
            return userProfileClient.findRecentlyActiveUsers(since, limit);
        } catch (CollaboratorUnavailableException e) {
            logger.error("获取最近活跃用户失败，本轮跳过用户侧: {}", e.getMessage(), e);
            return List.of();
        }
    }

    private List<ProjectSnapshot> fetchRecentProjects(Instant since, int limit) {
        try {
            return projectIdeasClient.findRecentlyActiveProjects(since, limit);
        } catch (CollaboratorUnavailableException e) {
            logger.error("获取最近更新项目失败，本轮跳过项目侧: {}", e.getMessage(), e);
            return List.of();
        }
    }

    private ReconciliationReport runInBatches(List<MatchTrigger> triggers,
                                              MatchingConfig.ReconciliationConfig config) {
        int succeeded = 0;
        int failed = 0;
        int created = 0;

        for (int start = 0; start < triggers.size(); start += config.getBatchSize()) {
            List<MatchTrigger> batch = triggers.subList(start, Math.min(start + config.getBatchSize(), triggers.size()));
            List<CompletableFuture<MatchGenerationSummary>> futures = new ArrayList<>(batch.size());
            for (MatchTrigger trigger : batch) {
                futures.add(CompletableFuture.supplyAsync(() -> matchingPipeline.process(trigger), reconciliationExecutor));
            }

            Set<Integer> lateTriggers = awaitBatch(futures, config.getBatchTimeoutSeconds());

            for (int i = 0; i < futures.size(); i++) {
                CompletableFuture<MatchGenerationSummary> future = futures.get(i);
                MatchTrigger trigger = batch.get(i);
                if (lateTriggers.contains(i)) {
                    failed++;
                    logger.error("对账触发超时: side={}, id={}", trigger.side(), trigger.entityId());
                } else if (!future.isCompletedExceptionally()) {
                    succeeded++;
                    created += future.join().createdCount();
                } else {
                    failed++;
                    logFailure(trigger, future);
                }
            }
        }
        return new ReconciliationReport(true, triggers.size(), succeeded, failed, created);
    }

    /**
     * 等待一个批次的所有触发结束
     * 超过批次超时的触发记为超时，但仍会等它们跑完才返回，
     * 保证下一批次和释放锁都发生在本批次全部结束之后
     *
     * @return 超时时仍未完成的触发下标
     */
    private Set<Integer> awaitBatch(List<CompletableFuture<MatchGenerationSummary>> futures, long timeoutSeconds) {
        CompletableFuture<Void> all = CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]));
        try {
            all.get(timeoutSeconds, TimeUnit.SECONDS);
            return Set.of();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("等待对账批次时被中断");
        } catch (ExecutionException e) {
            // 单个触发的失败在逐个检查结果时记录
            logger.debug("对账批次中存在失败的触发");
            return Set.of();
        } catch (TimeoutException e) {
            logger.warn("对账批次在 {} 秒内未全部完成，继续等待以免与下一批次重叠", timeoutSeconds);
        }

        Set<Integer> late = new HashSet<>();
        for (int i = 0; i < futures.size(); i++) {
            if (!futures.get(i).isDone()) {
                late.add(i);
            }
        }
        // 结果在逐个检查时处理，这里只等待结束
        all.handle((result, ex) -> null).join();
        return late;
    }

    private void logFailure(MatchTrigger trigger, CompletableFuture<MatchGenerationSummary> future) {
        try {
            future.join();
        } catch (RuntimeException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            logger.error("对账触发失败: side={}, id={}", trigger.side(), trigger.entityId(), cause);
        }
    }
}
