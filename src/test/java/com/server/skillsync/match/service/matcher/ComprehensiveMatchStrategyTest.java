package com.server.skillsync.match.service.matcher;

import com.server.skillsync.collaborator.dto.ProjectSnapshot;
import com.server.skillsync.collaborator.dto.UserSnapshot;
import com.server.skillsync.config.MatchingConfig;
import com.server.skillsync.match.entity.MatchFactors;
import com.server.skillsync.match.enums.MatchFactor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("综合匹配策略")
class ComprehensiveMatchStrategyTest {

    private MatchingConfig matchingConfig;
    private ComprehensiveMatchStrategy strategy;

    @BeforeEach
    void setUp() {
        matchingConfig = new MatchingConfig();
        strategy = new ComprehensiveMatchStrategy(matchingConfig, List.of(
                new SkillMatchStrategy(matchingConfig),
                new ExperienceMatchStrategy(matchingConfig),
                new AvailabilityMatchStrategy(matchingConfig),
                new LocationMatchStrategy(matchingConfig),
                new InterestMatchStrategy(matchingConfig)));
    }

    @Test
    @DisplayName("只有技能信息时其余维度取中性分，综合分按权重精确计算")
    void skillsOnlyUsesNeutralDefaults() {
        UserSnapshot user = UserSnapshot.builder()
                .id("u1")
                .skills(List.of("javascript", "react"))
                .active(true)
                .build();
        ProjectSnapshot project = ProjectSnapshot.builder()
                .id("p1")
                .requiredSkills(List.of("javascript", "react"))
                .optionalSkills(List.of("typescript"))
                .build();

        MatchResult result = strategy.calculateMatch(user, project);

        // 必需技能全部具备 70，可选技能 typescript 缺失 0
        assertThat(result.factors().getSkillMatch()).isEqualTo(70);
        assertThat(result.factors().getExperienceMatch()).isEqualTo(50);
        assertThat(result.factors().getAvailabilityMatch()).isEqualTo(50);
        assertThat(result.factors().getLocationMatch()).isEqualTo(50);
        assertThat(result.factors().getInterestMatch()).isEqualTo(50);
        // 0.4*70 + 0.2*50 + 0.15*50 + 0.1*50 + 0.15*50 = 58
        assertThat(result.score()).isEqualTo(58);
        assertThat(result.reasons()).isEmpty();
    }

    @Test
    @DisplayName("必需与可选技能全部具备时技能分为100")
    void fullSkillCoverageScoresHundred() {
        UserSnapshot user = UserSnapshot.builder()
                .id("u1")
                .skills(List.of("JavaScript", " react ", "TypeScript"))
                .active(true)
                .build();
        ProjectSnapshot project = ProjectSnapshot.builder()
                .id("p1")
                .requiredSkills(List.of("javascript", "react"))
                .optionalSkills(List.of("typescript"))
                .build();

        MatchResult result = strategy.calculateMatch(user, project);

        assertThat(result.factors().getSkillMatch()).isEqualTo(100);
        // 0.4*100 + 0.6*50 = 70
        assertThat(result.score()).isEqualTo(70);
        assertThat(result.reasons()).containsExactly("技能高度匹配：你具备项目所需技能的 100%");
    }

    @Test
    @DisplayName("项目没有必需技能时技能分为0且不抛异常")
    void zeroRequiredSkillsScoresZero() {
        UserSnapshot user = UserSnapshot.builder().id("u1").skills(List.of("java")).active(true).build();
        ProjectSnapshot project = ProjectSnapshot.builder()
                .id("p1")
                .requiredSkills(List.of())
                .optionalSkills(List.of("java"))
                .build();

        MatchResult result = strategy.calculateMatch(user, project);

        assertThat(result.factors().getSkillMatch()).isZero();
        // 0.4*0 + 0.6*50 = 30
        assertThat(result.score()).isEqualTo(30);
    }

    @Test
    @DisplayName("理由按维度顺序输出，且只有严格超过阈值的维度才输出")
    void reasonsFollowFactorOrderAndStrictThresholds() {
        UserSnapshot user = UserSnapshot.builder()
                .id("u1")
                .skills(List.of("java", "spring", "docker"))
                .experience("Mid Level")
                .availability("Full-time")
                .location("Berlin, Germany")
                .projectTypes(List.of("Web Development"))
                .interests(List.of("open source", "cloud native"))
                .active(true)
                .build();
        ProjectSnapshot project = ProjectSnapshot.builder()
                .id("p1")
                .requiredSkills(List.of("java", "spring"))
                .optionalSkills(List.of("docker"))
                .difficulty("Intermediate")
                .location("berlin, germany")
                .category("web development")
                .tags(List.of("cloud", "source"))
                .build();

        MatchResult result = strategy.calculateMatch(user, project);

        assertThat(result.factors().asMap()).containsExactlyInAnyOrderEntriesOf(Map.of(
                MatchFactor.SKILL, 100,
                MatchFactor.EXPERIENCE, 100,
                MatchFactor.AVAILABILITY, 100,
                MatchFactor.LOCATION, 100,
                MatchFactor.INTEREST, 100));
        assertThat(result.score()).isEqualTo(100);
        assertThat(result.reasons()).containsExactly(
                "技能高度匹配：你具备项目所需技能的 100%",
                "你的经验水平与项目难度非常契合",
                "你的可投入时间符合项目要求",
                "你与项目位于同一地点",
                "该项目符合你的兴趣和偏好");
    }

    @Test
    @DisplayName("维度分数恰好等于阈值时不输出理由")
    void reasonNotEmittedAtThreshold() {
        // 兴趣：类别命中 60 + 一半标签命中 20 = 80 > 70；经验相差一级 = 75，不超过 75
        UserSnapshot user = UserSnapshot.builder()
                .id("u1")
                .skills(List.of("go"))
                .experience("Senior Level")
                .projectTypes(List.of("devops"))
                .interests(List.of("kubernetes"))
                .active(true)
                .build();
        ProjectSnapshot project = ProjectSnapshot.builder()
                .id("p1")
                .requiredSkills(List.of("go"))
                .difficulty("Intermediate")
                .category("DevOps")
                .tags(List.of("kubernetes", "terraform"))
                .build();

        MatchResult result = strategy.calculateMatch(user, project);

        assertThat(result.factors().getExperienceMatch()).isEqualTo(75);
        assertThat(result.factors().getInterestMatch()).isEqualTo(80);
        assertThat(result.reasons()).containsExactly(
                "该项目符合你的兴趣和偏好");
    }

    @Test
    @DisplayName("综合分始终等于各维度加权和四舍五入")
    void scoreAlwaysEqualsWeightedSumOfFactors() {
        Map<MatchFactor, BigDecimal> weights = matchingConfig.getWeights().asMap();
        int[][] samples = {
                {0, 0, 0, 0, 0},
                {100, 100, 100, 100, 100},
                {33, 67, 85, 50, 40},
                {47, 25, 75, 33, 60},
                {1, 99, 3, 97, 5},
                // 0.4*45 + 0.2*50 + 0.15*50 + 0.1*50 + 0.15*50 = 48.0
                {45, 50, 50, 50, 50},
                // 0.4*13 + 0.2*0 + 0.15*0 + 0.1*0 + 0.15*30 = 9.7
                {13, 0, 0, 0, 30},
        };
        for (int[] sample : samples) {
            MatchFactors factors = new MatchFactors(sample[0], sample[1], sample[2], sample[3], sample[4]);
            BigDecimal expected = BigDecimal.ZERO;
            for (MatchFactor factor : MatchFactor.values()) {
                expected = expected.add(weights.get(factor).multiply(BigDecimal.valueOf(factors.get(factor))));
            }
            assertThat(strategy.aggregate(factors))
                    .isEqualTo(expected.setScale(0, RoundingMode.HALF_UP).intValue());
        }
    }

    @Test
    @DisplayName("加权和恰好为 .5 时向上取整")
    void aggregateRoundsHalfUp() {
        // 0.1*55 = 5.5，其余为 0
        MatchFactors factors = new MatchFactors(0, 0, 0, 55, 0);
        assertThat(strategy.aggregate(factors)).isEqualTo(6);
    }

    @Test
    @DisplayName("缺少某个维度的策略时拒绝创建")
    void missingFactorStrategyIsRejected() {
        assertThatThrownBy(() -> new ComprehensiveMatchStrategy(matchingConfig,
                List.of(new SkillMatchStrategy(matchingConfig))))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("EXPERIENCE");
    }
}
