package com.server.skillsync.match.pipeline;

import com.server.skillsync.match.entity.Match;
import com.server.skillsync.match.mq.MatchEventPublisher;
import com.server.skillsync.match.service.MatchCreationResult;
import com.server.skillsync.match.service.MatchService;
import com.server.skillsync.match.service.matcher.ComprehensiveMatchStrategy;
import com.server.skillsync.match.service.matcher.MatchCandidate;
import com.server.skillsync.match.service.matcher.MatchResult;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * 匹配生成管道，事件、手动触发和定时对账共用
 * 枚举候选 → 并发评分并落库 → 汇总 → 发布事件
 * 单个组合的评分或落库失败只记录并计数，不影响同一触发内的其他组合
 */
@Component
public class MatchingPipeline {
    private static final Logger logger = LoggerFactory.getLogger(MatchingPipeline.class);

    // Prometheus 导出名为 matching_requests_total
    static final String REQUEST_METRIC = "matching.requests";

    private final MatchCandidateEnumerator candidateEnumerator;
    private final ComprehensiveMatchStrategy matchStrategy;
    private final MatchService matchService;
    private final MatchEventPublisher eventPublisher;
    private final Executor matchScoringExecutor;
    private final MeterRegistry meterRegistry;

    public MatchingPipeline(MatchCandidateEnumerator candidateEnumerator,
                            ComprehensiveMatchStrategy matchStrategy,
                            MatchService matchService,
                            MatchEventPublisher eventPublisher,
                            @Qualifier("matchScoringExecutor") Executor matchScoringExecutor,
                            MeterRegistry meterRegistry) {
        this.candidateEnumerator = candidateEnumerator;
        this.matchStrategy = matchStrategy;
        this.matchService = matchService;
        this.eventPublisher = eventPublisher;
        this.matchScoringExecutor = matchScoringExecutor;
        this.meterRegistry = meterRegistry;
    }

    /**
     * 处理一次触发
     * 枚举阶段的异常直接抛出，由调用方决定是否重试
     *
     * @param trigger 触发信息
     * @return 本次触发的汇总
     */
    public MatchGenerationSummary process(MatchTrigger trigger) {
        logger.info("开始生成匹配: side={}, id={}, source={}",
                trigger.side(), trigger.entityId(), trigger.source());
        String metricType = trigger.side().getMetricTag();

        CandidateBatch batch;
        try {
            batch = candidateEnumerator.enumerate(trigger);
        } catch (RuntimeException e) {
            meterRegistry.counter(REQUEST_METRIC, "type", metricType, "status", "error").increment();
            throw e;
        }

        List<CompletableFuture<MatchCreationResult>> futures = new ArrayList<>(batch.candidates().size());
        for (MatchCandidate candidate : batch.candidates()) {
            futures.add(CompletableFuture
                    .supplyAsync(() -> scoreAndPersist(candidate, trigger), matchScoringExecutor)
                    .exceptionally(ex -> {
                        logger.error("评分或保存匹配失败: user={}, project={}",
                                candidate.userId(), candidate.projectId(), ex);
                        return null;
                    }));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<Match> created = new ArrayList<>();
        int duplicates = 0;
        int belowThreshold = 0;
        int failed = 0;
        for (CompletableFuture<MatchCreationResult> future : futures) {
            MatchCreationResult result = future.join();
            if (result == null) {
                failed++;
                continue;
            }
            switch (result.outcome()) {
                case CREATED -> created.add(result.match());
                case DUPLICATE -> duplicates++;
                case BELOW_THRESHOLD -> belowThreshold++;
            }
        }

        MatchGenerationSummary summary = new MatchGenerationSummary(
                trigger, batch.candidates().size(), duplicates, belowThreshold, failed, created);
        recordOutcomes(metricType, summary.createdCount(), failed);
        logger.info("匹配生成完成: side={}, id={}, 评估 {}，新建 {}，重复 {}，低于阈值 {}，失败 {}",
                trigger.side(), trigger.entityId(), summary.evaluatedCount(), summary.createdCount(),
                duplicates, belowThreshold, failed);

        eventPublisher.publishBatch(summary);
        return summary;
    }

    /**
     * success 按新建的匹配计数，error 按失败的组合计数
     * 枚举失败时整个触发只记一次 error
     */
    private void recordOutcomes(String metricType, int createdCount, int failedCount) {
        if (createdCount > 0) {
            meterRegistry.counter(REQUEST_METRIC, "type", metricType, "status", "success").increment(createdCount);
        }
        if (failedCount > 0) {
            meterRegistry.counter(REQUEST_METRIC, "type", metricType, "status", "error").increment(failedCount);
        }
    }

    private MatchCreationResult scoreAndPersist(MatchCandidate candidate, MatchTrigger trigger) {
        MatchResult result = matchStrategy.calculateMatch(candidate.user(), candidate.project());
        logger.debug("组合评分: user={}, project={}, score={}",
                candidate.userId(), candidate.projectId(), result.score());
        return matchService.createIfAbsent(candidate, result, trigger.source());
    }
}
