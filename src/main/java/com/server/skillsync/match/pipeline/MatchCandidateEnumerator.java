package com.server.skillsync.match.pipeline;

import com.server.skillsync.collaborator.ProjectIdeasClient;
import com.server.skillsync.collaborator.UserProfileClient;
import com.server.skillsync.collaborator.dto.ProjectSnapshot;
import com.server.skillsync.collaborator.dto.UserSnapshot;
import com.server.skillsync.config.MatchingConfig;
import com.server.skillsync.match.repository.MatchRepository;
import com.server.skillsync.match.service.matcher.MatchCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 候选组合枚举
 * 用户侧触发：取一页活跃项目；项目侧触发：取一页具备项目必需技能的用户
 * 排除用户已是项目成员的组合和已有匹配记录的组合
 * 协作服务的任何失败都会使整个触发失败，不产生部分结果
 */
@Component
public class MatchCandidateEnumerator {
    private static final Logger logger = LoggerFactory.getLogger(MatchCandidateEnumerator.class);

    private final UserProfileClient userProfileClient;
    private final ProjectIdeasClient projectIdeasClient;
    private final MatchRepository matchRepository;
    private final MatchingConfig matchingConfig;

    public MatchCandidateEnumerator(UserProfileClient userProfileClient,
                                    ProjectIdeasClient projectIdeasClient,
                                    MatchRepository matchRepository,
                                    MatchingConfig matchingConfig) {
        this.userProfileClient = userProfileClient;
        this.projectIdeasClient = projectIdeasClient;
        this.matchRepository = matchRepository;
        this.matchingConfig = matchingConfig;
    }

    public CandidateBatch enumerate(MatchTrigger trigger) {
        return switch (trigger.side()) {
            case USER -> enumerateForUser(trigger);
            case PROJECT -> enumerateForProject(trigger);
        };
    }

    private CandidateBatch enumerateForUser(MatchTrigger trigger) {
        UserSnapshot user = userProfileClient.getUser(trigger.entityId());
        if (!user.active()) {
            logger.info("用户 {} 未激活，不生成匹配", user.id());
            return CandidateBatch.empty(trigger);
        }

        List<ProjectSnapshot> projects = projectIdeasClient.findActiveProjects(
                matchingConfig.getEnumeration().getProjectPageSize());
        List<ProjectSnapshot> eligible = projects.stream()
                .filter(project -> !project.hasCollaborator(user.id()))
                .toList();

        Set<String> matched = eligible.isEmpty()
                ? Set.of()
                : new HashSet<>(matchRepository.findMatchedProjectIds(
                        user.id(), eligible.stream().map(ProjectSnapshot::id).toList()));

        List<MatchCandidate> candidates = eligible.stream()
                .filter(project -> !matched.contains(project.id()))
                .map(project -> new MatchCandidate(user, project))
                .toList();

        logger.debug("用户 {} 的候选项目: 取回 {}，候选 {}", user.id(), projects.size(), candidates.size());
        return new CandidateBatch(trigger, candidates, projects.size(), projects.size() - candidates.size());
    }

    private CandidateBatch enumerateForProject(MatchTrigger trigger) {
        ProjectSnapshot project = projectIdeasClient.getProject(trigger.entityId());
        if (project.requiredSkills().isEmpty()) {
            logger.info("项目 {} 没有必需技能，不生成匹配", project.id());
            return CandidateBatch.empty(trigger);
        }

        List<UserSnapshot> users = userProfileClient.findUsersBySkills(
                project.requiredSkills(), matchingConfig.getEnumeration().getUserPageSize());
        List<UserSnapshot> eligible = users.stream()
                .filter(UserSnapshot::active)
                .filter(user -> !project.hasCollaborator(user.id()))
                .toList();

        Set<String> matched = eligible.isEmpty()
                ? Set.of()
                : new HashSet<>(matchRepository.findMatchedUserIds(
                        project.id(), eligible.stream().map(UserSnapshot::id).toList()));

        List<MatchCandidate> candidates = eligible.stream()
                .filter(user -> !matched.contains(user.id()))
                .map(user -> new MatchCandidate(user, project))
                .toList();

        logger.debug("项目 {} 的候选用户: 取回 {}，候选 {}", project.id(), users.size(), candidates.size());
        return new CandidateBatch(trigger, candidates, users.size(), users.size() - candidates.size());
    }
}
