package com.server.skillsync.match.service;

import com.server.skillsync.match.entity.Match;

/**
 * createIfAbsent 的结果
 * 只有 CREATED 时 match 不为空
 */
public record MatchCreationResult(Outcome outcome, Match match) {

    public enum Outcome {
        CREATED,          // 新建了匹配记录
        DUPLICATE,        // 该组合已存在匹配，未做任何修改
        BELOW_THRESHOLD   // 分数低于创建阈值，已丢弃
    }

    public static MatchCreationResult created(Match match) {
        return new MatchCreationResult(Outcome.CREATED, match);
    }

    public static MatchCreationResult duplicate() {
        return new MatchCreationResult(Outcome.DUPLICATE, null);
    }

    public static MatchCreationResult belowThreshold() {
        return new MatchCreationResult(Outcome.BELOW_THRESHOLD, null);
    }

    public boolean isCreated() {
        return outcome == Outcome.CREATED;
    }
}
