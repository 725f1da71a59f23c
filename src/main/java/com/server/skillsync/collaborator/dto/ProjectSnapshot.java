package com.server.skillsync.collaborator.dto;

import lombok.Builder;

import java.util.List;

/**
 * 项目服务返回的项目只读快照
 */
@Builder
public record ProjectSnapshot(
        String id,
        String title,
        List<String> requiredSkills,
        List<String> optionalSkills,
        String difficulty,        // 难度，如 Intermediate
        String estimatedDuration,
        String location,
        String category,
        List<String> tags,
        List<String> collaboratorIds,  // 已加入项目的成员，含项目所有者
        String status
) {
    public ProjectSnapshot {
        requiredSkills = requiredSkills == null ? List.of() : List.copyOf(requiredSkills);
        optionalSkills = optionalSkills == null ? List.of() : List.copyOf(optionalSkills);
        tags = tags == null ? List.of() : List.copyOf(tags);
        collaboratorIds = collaboratorIds == null ? List.of() : List.copyOf(collaboratorIds);
    }

    public boolean hasCollaborator(String userId) {
        return collaboratorIds.contains(userId);
    }
}
