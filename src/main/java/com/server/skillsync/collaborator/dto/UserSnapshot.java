package com.server.skillsync.collaborator.dto;

import lombok.Builder;

import java.util.List;

/**
 * 用户服务返回的用户只读快照，只保留评分与展示需要的字段
 */
@Builder
public record UserSnapshot(
        String id,
        String username,
        List<String> skills,
        String experience,        // 经验等级，如 Mid Level
        String location,          // 逗号分隔的地点，如 "Berlin, Germany"
        String availability,      // 可用时间，如 Full-time
        List<String> projectTypes,
        List<String> interests,
        boolean active
) {
    public UserSnapshot {
        skills = skills == null ? List.of() : List.copyOf(skills);
        projectTypes = projectTypes == null ? List.of() : List.copyOf(projectTypes);
        interests = interests == null ? List.of() : List.copyOf(interests);
    }
}
