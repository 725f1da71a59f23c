package com.server.skillsync.match.controller.response;

import com.server.skillsync.match.pipeline.MatchGenerationSummary;
import lombok.Data;

import java.util.List;

/**
 * 手动生成匹配的响应
 */
@Data
public class MatchGenerationResponse {
    private String triggerSide;
    private String triggerId;
    private int evaluatedCount;
    private int matchCount;
    private int duplicateCount;
    private int belowThresholdCount;
    private int failedCount;
    private List<MatchResponse> matches;

    public static MatchGenerationResponse fromSummary(MatchGenerationSummary summary) {
        MatchGenerationResponse response = new MatchGenerationResponse();
        response.setTriggerSide(summary.trigger().side().getMetricTag());
        response.setTriggerId(summary.trigger().entityId());
        response.setEvaluatedCount(summary.evaluatedCount());
        response.setMatchCount(summary.createdCount());
        response.setDuplicateCount(summary.duplicateCount());
        response.setBelowThresholdCount(summary.belowThresholdCount());
        response.setFailedCount(summary.failedCount());
        response.setMatches(summary.createdMatches().stream()
                .map(MatchResponse::fromEntity)
                .toList());
        return response;
    }
}
