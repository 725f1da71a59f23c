package com.server.skillsync.match.service;

import com.server.skillsync.config.MatchingConfig;
import com.server.skillsync.match.MatchFixtures;
import com.server.skillsync.match.entity.Match;
import com.server.skillsync.match.entity.MatchFactors;
import com.server.skillsync.match.enums.MatchStatus;
import com.server.skillsync.match.enums.TriggerSource;
import com.server.skillsync.match.exception.InvalidStatusTransitionException;
import com.server.skillsync.match.exception.MatchNotFoundException;
import com.server.skillsync.match.repository.MatchRepository;
import com.server.skillsync.match.service.matcher.MatchCandidate;
import com.server.skillsync.match.service.matcher.MatchResult;
import com.server.skillsync.utils.exception.InvalidRequestException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.data.domain.Page;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 每次插入都在独立事务中提交，所以测试本身不开启事务，结束后手动清理
 */
@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import({MatchService.class, MatchingConfig.class})
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@DisplayName("匹配存储与生命周期")
class MatchServiceTest {

    @Autowired
    private MatchService matchService;

    @Autowired
    private MatchRepository matchRepository;

    @AfterEach
    void cleanUp() {
        matchRepository.deleteAll();
    }

    private MatchResult scored(int score) {
        return new MatchResult(score, new MatchFactors(score, score, score, score, score), List.of("理由"));
    }

    @Test
    @DisplayName("达到阈值时创建 PENDING 状态的匹配")
    void createsPendingMatch() {
        MatchCandidate candidate = MatchFixtures.candidate("u1", "p1");

        MatchCreationResult result = matchService.createIfAbsent(candidate, scored(72), TriggerSource.EVENT);

        assertThat(result.outcome()).isEqualTo(MatchCreationResult.Outcome.CREATED);
        Match saved = matchRepository.findById(result.match().getId()).orElseThrow();
        assertThat(saved.getStatus()).isEqualTo(MatchStatus.PENDING);
        assertThat(saved.getScore()).isEqualTo(72);
        assertThat(saved.getReasons()).containsExactly("理由");
        assertThat(saved.getTriggerSource()).isEqualTo(TriggerSource.EVENT);
        assertThat(saved.getFeedback()).isNull();
    }

    @Test
    @DisplayName("阈值包含边界：30 创建，29 丢弃")
    void thresholdIsInclusive() {
        MatchCreationResult atThreshold = matchService.createIfAbsent(
                MatchFixtures.candidate("u1", "p1"), scored(30), TriggerSource.EVENT);
        MatchCreationResult belowThreshold = matchService.createIfAbsent(
                MatchFixtures.candidate("u1", "p2"), scored(29), TriggerSource.EVENT);

        assertThat(atThreshold.outcome()).isEqualTo(MatchCreationResult.Outcome.CREATED);
        assertThat(belowThreshold.outcome()).isEqualTo(MatchCreationResult.Outcome.BELOW_THRESHOLD);
        assertThat(matchRepository.existsByUserIdAndProjectId("u1", "p2")).isFalse();
    }

    @Test
    @DisplayName("重复创建同一组合不会修改已有匹配")
    void secondCreationIsNoOp() {
        MatchCandidate candidate = MatchFixtures.candidate("u1", "p1");
        Match original = matchService.createIfAbsent(candidate, scored(80), TriggerSource.EVENT).match();
        matchService.transitionStatus(original.getId(), MatchStatus.VIEWED);

        MatchCreationResult again = matchService.createIfAbsent(candidate, scored(95), TriggerSource.RECONCILIATION);

        assertThat(again.outcome()).isEqualTo(MatchCreationResult.Outcome.DUPLICATE);
        assertThat(again.match()).isNull();
        Match stored = matchRepository.findById(original.getId()).orElseThrow();
        assertThat(stored.getScore()).isEqualTo(80);
        assertThat(stored.getStatus()).isEqualTo(MatchStatus.VIEWED);
        assertThat(matchRepository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("用户侧与项目侧同时创建同一组合，只保留一条且都不报错")
    void concurrentCreationYieldsSingleMatch() throws Exception {
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<MatchCreationResult>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                TriggerSource source = i % 2 == 0 ? TriggerSource.EVENT : TriggerSource.RECONCILIATION;
                Callable<MatchCreationResult> task = () -> {
                    start.await();
                    return matchService.createIfAbsent(MatchFixtures.candidate("u1", "p1"), scored(64), source);
                };
                futures.add(executor.submit(task));
            }
            start.countDown();

            int created = 0;
            int duplicates = 0;
            for (Future<MatchCreationResult> future : futures) {
                MatchCreationResult result = future.get(30, TimeUnit.SECONDS);
                if (result.isCreated()) {
                    created++;
                } else if (result.outcome() == MatchCreationResult.Outcome.DUPLICATE) {
                    duplicates++;
                }
            }

            assertThat(created).isEqualTo(1);
            assertThat(duplicates).isEqualTo(threads - 1);
            assertThat(matchRepository.count()).isEqualTo(1);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("按 pending → viewed → interested → applied 逐级推进")
    void forwardTransitions() {
        Long id = matchService.createIfAbsent(MatchFixtures.candidate("u1", "p1"), scored(50), TriggerSource.MANUAL)
                .match().getId();

        matchService.transitionStatus(id, MatchStatus.VIEWED);
        matchService.transitionStatus(id, MatchStatus.INTERESTED);
        Match applied = matchService.transitionStatus(id, MatchStatus.APPLIED);

        assertThat(applied.getStatus()).isEqualTo(MatchStatus.APPLIED);
        assertThat(matchService.transitionStatus(id, MatchStatus.REJECTED).getStatus())
                .isEqualTo(MatchStatus.REJECTED);
    }

    @Test
    @DisplayName("跳级、回退和重复拒绝都抛出非法迁移异常，状态保持不变")
    void illegalTransitions() {
        Long id = matchService.createIfAbsent(MatchFixtures.candidate("u1", "p1"), scored(50), TriggerSource.MANUAL)
                .match().getId();

        assertThatThrownBy(() -> matchService.transitionStatus(id, MatchStatus.APPLIED))
                .isInstanceOf(InvalidStatusTransitionException.class);
        assertThatThrownBy(() -> matchService.transitionStatus(id, MatchStatus.PENDING))
                .isInstanceOf(InvalidStatusTransitionException.class);

        matchService.transitionStatus(id, MatchStatus.REJECTED);
        assertThatThrownBy(() -> matchService.transitionStatus(id, MatchStatus.REJECTED))
                .isInstanceOf(InvalidStatusTransitionException.class);
        assertThatThrownBy(() -> matchService.transitionStatus(id, MatchStatus.VIEWED))
                .isInstanceOf(InvalidStatusTransitionException.class);

        assertThat(matchService.findById(id).getStatus()).isEqualTo(MatchStatus.REJECTED);
    }

    @Test
    @DisplayName("匹配不存在")
    void unknownMatch() {
        assertThatThrownBy(() -> matchService.transitionStatus(999L, MatchStatus.VIEWED))
                .isInstanceOf(MatchNotFoundException.class);
        assertThatThrownBy(() -> matchService.attachFeedback(999L, 3, null, null))
                .isInstanceOf(MatchNotFoundException.class);
    }

    @Test
    @DisplayName("反馈在任何状态下都可附加，覆盖旧反馈且不改变状态")
    void feedbackReplacesPrevious() {
        Long id = matchService.createIfAbsent(MatchFixtures.candidate("u1", "p1"), scored(50), TriggerSource.MANUAL)
                .match().getId();
        matchService.transitionStatus(id, MatchStatus.REJECTED);

        matchService.attachFeedback(id, 2, "不太合适", false);
        Match updated = matchService.attachFeedback(id, 5, "其实很好", true);

        Match stored = matchService.findById(updated.getId());
        assertThat(stored.getStatus()).isEqualTo(MatchStatus.REJECTED);
        assertThat(stored.getFeedback().getRating()).isEqualTo(5);
        assertThat(stored.getFeedback().getComment()).isEqualTo("其实很好");
        assertThat(stored.getFeedback().getHelpful()).isTrue();
        assertThat(stored.getFeedback().getSubmittedAt()).isNotNull();
    }

    @Test
    @DisplayName("反馈评分超出范围")
    void feedbackRatingOutOfRange() {
        Long id = matchService.createIfAbsent(MatchFixtures.candidate("u1", "p1"), scored(50), TriggerSource.MANUAL)
                .match().getId();

        assertThatThrownBy(() -> matchService.attachFeedback(id, 0, null, null))
                .isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> matchService.attachFeedback(id, 6, null, null))
                .isInstanceOf(InvalidRequestException.class);
    }

    @Test
    @DisplayName("列表按分数倒序、过滤最低分并分页")
    void listsByScoreDescending() {
        int[] scores = {45, 90, 31, 77, 60};
        for (int i = 0; i < scores.length; i++) {
            matchService.createIfAbsent(MatchFixtures.candidate("u1", "p" + i), scored(scores[i]), TriggerSource.EVENT);
        }
        matchService.createIfAbsent(MatchFixtures.candidate("u2", "p0"), scored(99), TriggerSource.EVENT);

        Page<Match> firstPage = matchService.listByUser("u1", 1, 2, 40);
        Page<Match> secondPage = matchService.listByUser("u1", 2, 2, 40);

        assertThat(firstPage.getTotalElements()).isEqualTo(4);
        assertThat(firstPage.getTotalPages()).isEqualTo(2);
        assertThat(firstPage.getContent()).extracting(Match::getScore).containsExactly(90, 77);
        assertThat(secondPage.getContent()).extracting(Match::getScore).containsExactly(60, 45);

        Page<Match> byProject = matchService.listByProject("p0", 1, 20, 30);
        assertThat(byProject.getContent()).extracting(Match::getUserId).containsExactly("u2", "u1");
    }

    @Test
    @DisplayName("页码从1开始")
    void pageStartsAtOne() {
        assertThatThrownBy(() -> matchService.listByUser("u1", 0, 20, 30))
                .isInstanceOf(InvalidRequestException.class);
    }
}
