package com.server.skillsync.match.pipeline;

import com.server.skillsync.match.service.matcher.MatchCandidate;

import java.util.List;

// 一次触发枚举出的候选组合
public record CandidateBatch(
        MatchTrigger trigger,
        List<MatchCandidate> candidates,
        int fetchedCount,       // 从协作服务取回的对侧实体数
        int excludedCount       // 因已是成员、已匹配或不活跃而排除的数量
) {
    public CandidateBatch {
        candidates = List.copyOf(candidates);
    }

    public static CandidateBatch empty(MatchTrigger trigger) {
        return new CandidateBatch(trigger, List.of(), 0, 0);
    }

    public boolean isEmpty() {
        return candidates.isEmpty();
    }
}
