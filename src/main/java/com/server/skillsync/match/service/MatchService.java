package com.server.skillsync.match.service;

import com.server.skillsync.config.MatchingConfig;
import com.server.skillsync.match.entity.Match;
import com.server.skillsync.match.entity.MatchFeedback;
import com.server.skillsync.match.enums.MatchStatus;
import com.server.skillsync.match.enums.TriggerSource;
import com.server.skillsync.match.exception.InvalidStatusTransitionException;
import com.server.skillsync.match.exception.MatchNotFoundException;
import com.server.skillsync.match.repository.MatchRepository;
import com.server.skillsync.match.service.matcher.MatchCandidate;
import com.server.skillsync.match.service.matcher.MatchResult;
import com.server.skillsync.utils.exception.InvalidRequestException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDateTime;
import java.util.ArrayList;

/**
 * 匹配记录的存储与生命周期管理
 * 同一 (用户, 项目) 组合的唯一性由数据库唯一约束保证，这里不做任何加锁
 */
@Service
public class MatchService {
    private static final Logger logger = LoggerFactory.getLogger(MatchService.class);

    private static final Sort LIST_SORT = Sort.by(
            Sort.Order.desc("score"),
            Sort.Order.desc("createdAt"));

    private static final int MAX_CREATE_ATTEMPTS = 5;
    private static final long CREATE_RETRY_BACKOFF_MS = 20;

    private final MatchRepository matchRepository;
    private final MatchingConfig matchingConfig;
    private final TransactionTemplate creationTemplate;

    public MatchService(MatchRepository matchRepository,
                        MatchingConfig matchingConfig,
                        PlatformTransactionManager transactionManager) {
        this.matchRepository = matchRepository;
        this.matchingConfig = matchingConfig;
        this.creationTemplate = new TransactionTemplate(transactionManager);
        // 每次插入使用独立事务，唯一约束冲突只回滚当前这一条
        this.creationTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.creationTemplate.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
    }

    /**
     * 分数达到阈值且该组合尚无匹配时创建匹配记录
     * 并发创建同一组合时只有一个会成功，其余返回 DUPLICATE
     *
     * @param candidate 用户与项目
     * @param result    评分结果
     * @param source    触发来源
     * @return 创建结果
     */
    public MatchCreationResult createIfAbsent(MatchCandidate candidate, MatchResult result, TriggerSource source) {
        if (result.score() < matchingConfig.getCreationThreshold()) {
            logger.debug("匹配分数 {} 低于阈值 {}，丢弃: user={}, project={}",
                    result.score(), matchingConfig.getCreationThreshold(),
                    candidate.userId(), candidate.projectId());
            return MatchCreationResult.belowThreshold();
        }

        for (int attempt = 1; ; attempt++) {
            try {
                Match saved = creationTemplate.execute(status -> {
                    if (matchRepository.existsByUserIdAndProjectId(candidate.userId(), candidate.projectId())) {
                        return null;
                    }
                    return matchRepository.saveAndFlush(buildMatch(candidate, result, source));
                });
                if (saved == null) {
                    logger.debug("匹配已存在，跳过: user={}, project={}", candidate.userId(), candidate.projectId());
                    return MatchCreationResult.duplicate();
                }
                logger.info("创建匹配记录 {}: user={}, project={}, score={}",
                        saved.getId(), saved.getUserId(), saved.getProjectId(), saved.getScore());
                return MatchCreationResult.created(saved);
            } catch (DataIntegrityViolationException | ConcurrencyFailureException e) {
                // 并发插入同一组合时由唯一约束拦截，MySQL 下也可能表现为锁冲突
                if (matchRepository.existsByUserIdAndProjectId(candidate.userId(), candidate.projectId())) {
                    logger.debug("并发创建同一匹配，视为重复: user={}, project={}",
                            candidate.userId(), candidate.projectId());
                    return MatchCreationResult.duplicate();
                }
                // 对方事务尚未提交时冲突就可能被报告出来，稍等后重试
                if (attempt >= MAX_CREATE_ATTEMPTS) {
                    throw e;
                }
                logger.debug("唯一约束冲突但匹配尚不可见，第 {} 次重试: user={}, project={}",
                        attempt, candidate.userId(), candidate.projectId());
                backoff(attempt);
            }
        }
    }

    private void backoff(int attempt) {
        try {
            Thread.sleep(CREATE_RETRY_BACKOFF_MS * attempt);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("等待重试创建匹配时被中断", e);
        }
    }

    private Match buildMatch(MatchCandidate candidate, MatchResult result, TriggerSource source) {
        LocalDateTime now = LocalDateTime.now();
        Match match = new Match();
        match.setUserId(candidate.userId());
        match.setProjectId(candidate.projectId());
        match.setScore(result.score());
        match.setFactors(result.factors());
        match.setReasons(new ArrayList<>(result.reasons()));
        match.setStatus(MatchStatus.PENDING);
        match.setTriggerSource(source);
        match.setCreatedAt(now);
        match.setUpdatedAt(now);
        return match;
    }

    /**
     * 变更匹配状态
     *
     * @throws MatchNotFoundException            匹配不存在
     * @throws InvalidStatusTransitionException 不允许的状态迁移，包括同状态迁移
     */
    @Transactional
    public Match transitionStatus(Long matchId, MatchStatus newStatus) {
        Match match = findById(matchId);
        MatchStatus current = match.getStatus();
        if (!current.canTransitionTo(newStatus)) {
            throw new InvalidStatusTransitionException(matchId, current, newStatus);
        }
        match.setStatus(newStatus);
        match.setUpdatedAt(LocalDateTime.now());
        Match saved = matchRepository.save(match);
        logger.info("匹配 {} 状态变更: {} -> {}", matchId, current, newStatus);
        return saved;
    }

    /**
     * 附加反馈，覆盖之前的反馈，不影响状态
     */
    @Transactional
    public Match attachFeedback(Long matchId, int rating, String comment, Boolean helpful) {
        if (rating < 1 || rating > 5) {
            throw new InvalidRequestException("rating", "评分必须在1-5之间");
        }
        if (comment != null && comment.length() > 1000) {
            throw new InvalidRequestException("comment", "评论不能超过1000个字符");
        }
        Match match = findById(matchId);

        MatchFeedback feedback = new MatchFeedback();
        feedback.setRating(rating);
        feedback.setComment(comment);
        feedback.setHelpful(helpful);
        feedback.setSubmittedAt(LocalDateTime.now());

        match.setFeedback(feedback);
        match.setUpdatedAt(LocalDateTime.now());
        Match saved = matchRepository.save(match);
        logger.info("匹配 {} 收到反馈，评分: {}", matchId, rating);
        return saved;
    }

    @Transactional(readOnly = true)
    public Match findById(Long matchId) {
        return matchRepository.findById(matchId)
                .orElseThrow(() -> new MatchNotFoundException(matchId));
    }

    /**
     * 查询用户的匹配列表，按分数和创建时间倒序
     *
     * @param page 从 1 开始的页码
     */
    @Transactional(readOnly = true)
    public Page<Match> listByUser(String userId, int page, int limit, int minScore) {
        return matchRepository.findByUserIdAndScoreGreaterThanEqual(
                userId, minScore, toPageable(page, limit, minScore));
    }

    @Transactional(readOnly = true)
    public Page<Match> listByProject(String projectId, int page, int limit, int minScore) {
        return matchRepository.findByProjectIdAndScoreGreaterThanEqual(
                projectId, minScore, toPageable(page, limit, minScore));
    }

    private Pageable toPageable(int page, int limit, int minScore) {
        if (page < 1) {
            throw new InvalidRequestException("page", "页码必须从1开始");
        }
        if (limit < 1) {
            throw new InvalidRequestException("limit", "每页数量必须大于0");
        }
        if (minScore < 0 || minScore > 100) {
            throw new InvalidRequestException("minScore", "最低分数必须在0-100之间");
        }
        int size = Math.min(limit, matchingConfig.getQuery().getMaxPageSize());
        return PageRequest.of(page - 1, size, LIST_SORT);
    }
}
