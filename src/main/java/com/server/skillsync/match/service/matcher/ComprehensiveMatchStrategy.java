package com.server.skillsync.match.service.matcher;

import com.server.skillsync.collaborator.dto.ProjectSnapshot;
import com.server.skillsync.collaborator.dto.UserSnapshot;
import com.server.skillsync.config.MatchingConfig;
import com.server.skillsync.match.entity.MatchFactors;
import com.server.skillsync.match.enums.MatchFactor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 综合匹配策略
 * 各维度分数先四舍五入为整数，再按配置权重加权求和，
 * 加权过程使用 BigDecimal 精确计算，结果四舍五入并限制在 0-100
 * 纯计算、无状态，可被多个线程同时调用
 */
@Component
public class ComprehensiveMatchStrategy {

    private final MatchingConfig matchingConfig;
    private final Map<MatchFactor, FactorStrategy> strategies = new EnumMap<>(MatchFactor.class);

    public ComprehensiveMatchStrategy(MatchingConfig matchingConfig, List<FactorStrategy> factorStrategies) {
        this.matchingConfig = matchingConfig;
        for (FactorStrategy strategy : factorStrategies) {
            strategies.put(strategy.factor(), strategy);
        }
        for (MatchFactor factor : MatchFactor.values()) {
            if (!strategies.containsKey(factor)) {
                throw new IllegalStateException("缺少匹配维度的评分策略: " + factor);
            }
        }
    }

    public MatchResult calculateMatch(UserSnapshot user, ProjectSnapshot project) {
        Map<MatchFactor, Integer> factorScores = new EnumMap<>(MatchFactor.class);
        for (MatchFactor factor : MatchFactor.values()) {
            double raw = strategies.get(factor).calculate(user, project);
            factorScores.put(factor, roundHalfUp(raw));
        }
        MatchFactors factors = MatchFactors.of(factorScores);
        return new MatchResult(aggregate(factors), factors, generateReasons(factors));
    }

    /**
     * 按权重汇总各维度分数
     */
    public int aggregate(MatchFactors factors) {
        BigDecimal total = BigDecimal.ZERO;
        for (Map.Entry<MatchFactor, BigDecimal> entry : matchingConfig.getWeights().asMap().entrySet()) {
            total = total.add(entry.getValue().multiply(BigDecimal.valueOf(factors.get(entry.getKey()))));
        }
        int score = total.setScale(0, RoundingMode.HALF_UP).intValue();
        return Math.max(0, Math.min(100, score));
    }

    private List<String> generateReasons(MatchFactors factors) {
        List<String> reasons = new ArrayList<>();
        MatchingConfig.ReasonThresholdsConfig thresholds = matchingConfig.getReasonThresholds();
        for (MatchFactor factor : MatchFactor.values()) {
            int score = factors.get(factor);
            if (score > thresholds.thresholdOf(factor)) {
                reasons.add(strategies.get(factor).describe(score));
            }
        }
        return reasons;
    }

    private int roundHalfUp(double raw) {
        double clamped = Math.max(0.0, Math.min(100.0, raw));
        return BigDecimal.valueOf(clamped).setScale(0, RoundingMode.HALF_UP).intValue();
    }
}
