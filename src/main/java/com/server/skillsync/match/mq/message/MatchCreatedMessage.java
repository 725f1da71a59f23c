package com.server.skillsync.match.mq.message;

import com.server.skillsync.match.entity.Match;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * match.created 事件，每条新建匹配发布一条
 */
@Setter
@Getter
public class MatchCreatedMessage {

    private Long matchId;

    private String userId;

    private String projectId;

    private int matchScore;

    private LocalDateTime timestamp;

    public static MatchCreatedMessage from(Match match) {
        MatchCreatedMessage message = new MatchCreatedMessage();
        message.setMatchId(match.getId());
        message.setUserId(match.getUserId());
        message.setProjectId(match.getProjectId());
        message.setMatchScore(match.getScore());
        message.setTimestamp(LocalDateTime.now());
        return message;
    }
}
