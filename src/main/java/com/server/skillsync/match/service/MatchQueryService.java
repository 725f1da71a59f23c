package com.server.skillsync.match.service;

import com.server.skillsync.collaborator.ProjectIdeasClient;
import com.server.skillsync.collaborator.UserProfileClient;
import com.server.skillsync.collaborator.dto.ProjectSnapshot;
import com.server.skillsync.collaborator.dto.UserSnapshot;
import com.server.skillsync.match.controller.response.MatchPageResponse;
import com.server.skillsync.match.controller.response.MatchResponse;
import com.server.skillsync.match.entity.Match;
import com.server.skillsync.match.exception.MatchingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * 匹配查询
 * 列表中附加对方详情，详情获取失败时只记录日志，匹配本身照常返回
 */
@Service
public class MatchQueryService {
    private static final Logger logger = LoggerFactory.getLogger(MatchQueryService.class);

    private final MatchService matchService;
    private final UserProfileClient userProfileClient;
    private final ProjectIdeasClient projectIdeasClient;

    public MatchQueryService(MatchService matchService,
                             UserProfileClient userProfileClient,
                             ProjectIdeasClient projectIdeasClient) {
        this.matchService = matchService;
        this.userProfileClient = userProfileClient;
        this.projectIdeasClient = projectIdeasClient;
    }

    /**
     * 用户的匹配列表，附加项目详情
     */
    public MatchPageResponse listForUser(String userId, int page, int limit, int minScore, boolean withDetails) {
        Page<Match> matches = matchService.listByUser(userId, page, limit, minScore);
        Map<String, Optional<ProjectSnapshot>> projects = new HashMap<>();

        List<MatchResponse> responses = matches.getContent().stream()
                .map(match -> {
                    MatchResponse response = MatchResponse.fromEntity(match);
                    if (withDetails) {
                        projects.computeIfAbsent(match.getProjectId(),
                                        id -> fetchDetails(id, projectIdeasClient::getProject, "项目"))
                                .ifPresent(response::setProject);
                    }
                    return response;
                })
                .toList();

        logger.debug("用户 {} 第 {} 页匹配 {} 条，共 {} 条", userId, page, responses.size(), matches.getTotalElements());
        return MatchPageResponse.of(responses, page, matches.getTotalPages(), matches.getTotalElements());
    }

    /**
     * 项目的匹配列表，附加用户详情
     */
    public MatchPageResponse listForProject(String projectId, int page, int limit, int minScore, boolean withDetails) {
        Page<Match> matches = matchService.listByProject(projectId, page, limit, minScore);
        Map<String, Optional<UserSnapshot>> users = new HashMap<>();

        List<MatchResponse> responses = matches.getContent().stream()
                .map(match -> {
                    MatchResponse response = MatchResponse.fromEntity(match);
                    if (withDetails) {
                        users.computeIfAbsent(match.getUserId(),
                                        id -> fetchDetails(id, userProfileClient::getUser, "用户"))
                                .ifPresent(response::setUser);
                    }
                    return response;
                })
                .toList();

        logger.debug("项目 {} 第 {} 页匹配 {} 条，共 {} 条", projectId, page, responses.size(), matches.getTotalElements());
        return MatchPageResponse.of(responses, page, matches.getTotalPages(), matches.getTotalElements());
    }

    public MatchResponse getMatch(Long matchId) {
        return MatchResponse.fromEntity(matchService.findById(matchId));
    }

    private <T> Optional<T> fetchDetails(String id, Function<String, T> loader, String entityType) {
        try {
            return Optional.ofNullable(loader.apply(id));
        } catch (MatchingException e) {
            logger.warn("获取{} {} 详情失败，返回不带详情的匹配: {}", entityType, id, e.getMessage());
            return Optional.empty();
        }
    }
}
