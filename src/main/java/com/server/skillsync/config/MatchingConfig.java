package com.server.skillsync.config;

import com.server.skillsync.match.enums.MatchFactor;
import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.Setter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 匹配引擎配置类
 * 评分权重、各维度参数、创建阈值以及管道和对账任务的运行参数
 * 启动时绑定一次，运行期间不做动态调整
 */
@Setter
@Getter
@Configuration
@ConfigurationProperties(prefix = "matching")
public class MatchingConfig {

    private static final Logger logger = LoggerFactory.getLogger(MatchingConfig.class);

    // 创建阈值：综合分数达到该值才会持久化匹配记录（含边界）
    private int creationThreshold = 30;

    // 缺失数据时各维度的中性分
    private int neutralScore = 50;

    // 各维度权重，总和必须为 1.0
    private WeightsConfig weights = new WeightsConfig();

    // 各维度披露理由的阈值（严格大于时生成理由）
    private ReasonThresholdsConfig reasonThresholds = new ReasonThresholdsConfig();

    private SkillConfig skill = new SkillConfig();

    private ExperienceConfig experience = new ExperienceConfig();

    private AvailabilityConfig availability = new AvailabilityConfig();

    private InterestConfig interest = new InterestConfig();

    private EnumerationConfig enumeration = new EnumerationConfig();

    private PublishingConfig publishing = new PublishingConfig();

    private ReconciliationConfig reconciliation = new ReconciliationConfig();

    private QueryConfig query = new QueryConfig();

    /**
     * 配置验证
     */
    @PostConstruct
    public void validateConfig() {
        validateWeights();

        if (creationThreshold < 0 || creationThreshold > 100) {
            throw new IllegalStateException("创建阈值必须在0-100之间");
        }
        if (neutralScore < 0 || neutralScore > 100) {
            throw new IllegalStateException("中性分必须在0-100之间");
        }
        if (skill.getRequiredShare() + skill.getOptionalShare() != 100) {
            throw new IllegalStateException("技能维度的必需/可选占比之和必须为100");
        }
        if (interest.getCategoryShare() + interest.getTagShare() != 100) {
            throw new IllegalStateException("兴趣维度的类别/标签占比之和必须为100");
        }
        if (experience.getPenaltyPerLevel() <= 0) {
            throw new IllegalStateException("经验等级差惩罚分必须大于0");
        }
        if (enumeration.getProjectPageSize() <= 0 || enumeration.getUserPageSize() <= 0) {
            throw new IllegalStateException("候选枚举的分页大小必须大于0");
        }
        if (reconciliation.getBatchSize() <= 0) {
            throw new IllegalStateException("对账批次大小必须大于0");
        }

        logger.info("匹配配置加载完成，创建阈值: {}, 权重: {}", creationThreshold, weights.asMap());
    }

    private void validateWeights() {
        BigDecimal total = BigDecimal.ZERO;
        for (Map.Entry<MatchFactor, BigDecimal> entry : weights.asMap().entrySet()) {
            if (entry.getValue().signum() < 0) {
                throw new IllegalStateException(
                        String.format("维度%s的权重不能为负数", entry.getKey()));
            }
            total = total.add(entry.getValue());
        }
        if (total.compareTo(BigDecimal.ONE) != 0) {
            throw new IllegalStateException("各维度权重之和必须为1.0，当前为: " + total);
        }
    }

    /**
     * 维度权重配置
     */
    @Setter
    @Getter
    public static class WeightsConfig {
        private double skill = 0.40;
        private double experience = 0.20;
        private double availability = 0.15;
        private double location = 0.10;
        private double interest = 0.15;

        public Map<MatchFactor, BigDecimal> asMap() {
            Map<MatchFactor, BigDecimal> map = new EnumMap<>(MatchFactor.class);
            map.put(MatchFactor.SKILL, BigDecimal.valueOf(skill));
            map.put(MatchFactor.EXPERIENCE, BigDecimal.valueOf(experience));
            map.put(MatchFactor.AVAILABILITY, BigDecimal.valueOf(availability));
            map.put(MatchFactor.LOCATION, BigDecimal.valueOf(location));
            map.put(MatchFactor.INTEREST, BigDecimal.valueOf(interest));
            return map;
        }
    }

    /**
     * 匹配理由阈值配置
     */
    @Setter
    @Getter
    public static class ReasonThresholdsConfig {
        private int skill = 80;
        private int experience = 75;
        private int availability = 80;
        private int location = 90;
        private int interest = 70;

        public int thresholdOf(MatchFactor factor) {
            return switch (factor) {
                case SKILL -> skill;
                case EXPERIENCE -> experience;
                case AVAILABILITY -> availability;
                case LOCATION -> location;
                case INTEREST -> interest;
            };
        }
    }

    @Setter
    @Getter
    public static class SkillConfig {
        private int requiredShare = 70;   // 必需技能覆盖率占比
        private int optionalShare = 30;   // 可选技能覆盖率占比
    }

    @Setter
    @Getter
    public static class ExperienceConfig {
        private int penaltyPerLevel = 25;

        // 用户经验等级
        private Map<String, Integer> userLevels = new LinkedHashMap<>(Map.of(
                "Entry Level", 1,
                "Mid Level", 2,
                "Senior Level", 3,
                "Expert", 4
        ));

        // 项目难度等级
        private Map<String, Integer> projectLevels = new LinkedHashMap<>(Map.of(
                "Beginner", 1,
                "Intermediate", 2,
                "Advanced", 3
        ));
    }

    @Setter
    @Getter
    public static class AvailabilityConfig {
        private Map<String, Integer> scores = new LinkedHashMap<>(Map.of(
                "Full-time", 100,
                "Part-time", 75,
                "Weekends", 50,
                "Flexible", 85
        ));
    }

    @Setter
    @Getter
    public static class InterestConfig {
        private int categoryShare = 60;   // 项目类别命中占比
        private int tagShare = 40;        // 标签重合占比
    }

    /**
     * 候选枚举配置
     */
    @Setter
    @Getter
    public static class EnumerationConfig {
        private int projectPageSize = 100;
        // 项目侧触发时最多取回的候选用户数
        private int userPageSize = 100;
    }

    /**
     * 事件发布配置
     */
    @Setter
    @Getter
    public static class PublishingConfig {
        private int previewSize = 5;
        // 零匹配的触发也发布批次事件
        private boolean publishEmptyBatches = true;
        // 每条新匹配额外发布 match.created 事件
        private boolean publishPerMatchEvents = true;
    }

    /**
     * 定时对账配置
     */
    @Setter
    @Getter
    public static class ReconciliationConfig {
        private boolean enabled = true;
        private String cron = "0 0 * * * *";
        private Duration recencyWindow = Duration.ofHours(2);
        private int fetchLimit = 200;
        private int batchSize = 10;
        private long batchTimeoutSeconds = 300;
        private String lockKey = "matching:reconciliation:lock";
    }

    /**
     * 查询接口配置
     */
    @Setter
    @Getter
    public static class QueryConfig {
        private int defaultPageSize = 20;
        private int maxPageSize = 100;
    }
}
