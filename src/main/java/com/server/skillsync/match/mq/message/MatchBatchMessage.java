package com.server.skillsync.match.mq.message;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.List;

/**
 * match.created-batch 事件，每次处理完一个触发发布一条
 * userId 与 projectId 只填写触发方的那一个
 */
@Setter
@Getter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MatchBatchMessage {

    private String triggerSide;

    private String triggerId;

    private String source;

    private String userId;

    private String projectId;

    private int evaluatedCount;

    private int matchCount;

    // 按分数取前 N 条
    private List<MatchPreview> topMatches;

    private LocalDateTime timestamp;
}
