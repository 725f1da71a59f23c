package com.server.skillsync.match.controller.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.server.skillsync.collaborator.dto.ProjectSnapshot;
import com.server.skillsync.collaborator.dto.UserSnapshot;
import com.server.skillsync.match.entity.Match;
import com.server.skillsync.match.entity.MatchFactors;
import com.server.skillsync.match.entity.MatchFeedback;
import com.server.skillsync.match.enums.MatchStatus;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 匹配响应对象
 * project / user 为查询时附加的对方详情，获取失败时为空
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MatchResponse {
    private Long id;
    private String userId;
    private String projectId;
    private int matchScore;
    private MatchFactors factors;
    private List<String> reasons;
    private MatchStatus status;
    private MatchFeedback feedback;
    private String triggerSource;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
    private ProjectSnapshot project;
    private UserSnapshot user;

    public static MatchResponse fromEntity(Match match) {
        MatchResponse response = new MatchResponse();
        response.setId(match.getId());
        response.setUserId(match.getUserId());
        response.setProjectId(match.getProjectId());
        response.setMatchScore(match.getScore());
        response.setFactors(match.getFactors());
        response.setReasons(match.getReasons());
        response.setStatus(match.getStatus());
        response.setFeedback(match.getFeedback());
        response.setTriggerSource(match.getTriggerSource() != null ? match.getTriggerSource().name() : null);
        response.setCreatedAt(match.getCreatedAt());
        response.setUpdatedAt(match.getUpdatedAt());
        return response;
    }
}
