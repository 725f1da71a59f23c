package com.server.skillsync.match.mq.message;

import com.server.skillsync.match.entity.Match;
import lombok.Getter;
import lombok.Setter;

@Setter
@Getter
public class MatchPreview {

    private Long matchId;

    private String userId;

    private String projectId;

    private int matchScore;

    public static MatchPreview from(Match match) {
        MatchPreview preview = new MatchPreview();
        preview.setMatchId(match.getId());
        preview.setUserId(match.getUserId());
        preview.setProjectId(match.getProjectId());
        preview.setMatchScore(match.getScore());
        return preview;
    }
}
