package com.server.skillsync.match.service.matcher;

import com.server.skillsync.collaborator.dto.ProjectSnapshot;
import com.server.skillsync.collaborator.dto.UserSnapshot;

// 待评分的一对用户与项目
public record MatchCandidate(UserSnapshot user, ProjectSnapshot project) {

    public String userId() {
        return user.id();
    }

    public String projectId() {
        return project.id();
    }
}
