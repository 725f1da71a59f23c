package com.server.skillsync.match.service.matcher;

import com.server.skillsync.match.entity.MatchFactors;

import java.util.List;

// 评分结果：综合分数、各维度分数和理由
public record MatchResult(
        int score,                // 综合分数 0-100
        MatchFactors factors,     // 各维度取整后的分数
        List<String> reasons      // 按维度声明顺序排列的理由
) {
    public MatchResult {
        reasons = List.copyOf(reasons);
    }
}
