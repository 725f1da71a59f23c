package com.server.skillsync.match.pipeline;

import com.server.skillsync.match.entity.Match;

import java.util.List;

/**
 * 一次触发的处理结果
 */
public record MatchGenerationSummary(
        MatchTrigger trigger,
        int evaluatedCount,
        int duplicateCount,
        int belowThresholdCount,
        int failedCount,
        List<Match> createdMatches
) {
    public MatchGenerationSummary {
        createdMatches = List.copyOf(createdMatches);
    }

    public int createdCount() {
        return createdMatches.size();
    }
}
