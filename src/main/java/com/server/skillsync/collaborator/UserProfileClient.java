package com.server.skillsync.collaborator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.server.skillsync.collaborator.dto.UserSnapshot;
import com.server.skillsync.config.CollaboratorConfig;
import com.server.skillsync.match.exception.CollaboratorUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 用户服务只读客户端
 */
@Component
public class UserProfileClient extends CollaboratorClient {
    private static final Logger logger = LoggerFactory.getLogger(UserProfileClient.class);

    private static final String ENTITY_TYPE = "用户";

    private final CollaboratorConfig collaboratorConfig;

    public UserProfileClient(@Qualifier("collaboratorRestTemplate") RestTemplate restTemplate,
                             ObjectMapper objectMapper,
                             CollaboratorConfig collaboratorConfig) {
        super(restTemplate, objectMapper);
        this.collaboratorConfig = collaboratorConfig;
    }

    /**
     * 获取单个用户
     *
     * @throws com.server.skillsync.match.exception.SnapshotNotFoundException 用户不存在
     * @throws CollaboratorUnavailableException 用户服务不可用
     */
    public UserSnapshot getUser(String userId) {
        URI uri = UriComponentsBuilder.fromHttpUrl(collaboratorConfig.getUserServiceUrl())
                .path("/api/users/{id}")
                .buildAndExpand(userId)
                .encode()
                .toUri();
        JsonNode root = fetchEntity(uri, ENTITY_TYPE, userId);
        JsonNode userNode = root.has("user") ? root.path("user") : root;
        return toSnapshot(userNode);
    }

    /**
     * 查询具备任一指定技能的用户
     * 用户服务未遵守 limit 时在本地截断，保证候选集有上限
     */
    public List<UserSnapshot> findUsersBySkills(List<String> skills, int limit) {
        URI uri = UriComponentsBuilder.fromHttpUrl(collaboratorConfig.getUserServiceUrl())
                .path("/api/users/by-skills")
                .queryParam("skills", String.join(",", skills))
                .queryParam("limit", limit)
                .encode()
                .build()
                .toUri();
        List<UserSnapshot> users = toSnapshots(unwrapArray(fetchList(uri, ENTITY_TYPE), "users"));
        if (users.size() > limit) {
            logger.warn("用户服务返回 {} 个用户，超过上限 {}，已截断", users.size(), limit);
            users = users.subList(0, limit);
        }
        logger.debug("按技能 {} 查询到 {} 个用户", skills, users.size());
        return users;
    }

    /**
     * 查询指定时间之后活跃过的用户
     */
    public List<UserSnapshot> findRecentlyActiveUsers(Instant since, int limit) {
        URI uri = UriComponentsBuilder.fromHttpUrl(collaboratorConfig.getUserServiceUrl())
                .path("/api/users/recent")
                .queryParam("since", since.toString())
                .queryParam("limit", limit)
                .encode()
                .build()
                .toUri();
        return toSnapshots(unwrapArray(fetchList(uri, ENTITY_TYPE), "users"));
    }

    private List<UserSnapshot> toSnapshots(JsonNode array) {
        List<UserSnapshot> users = new ArrayList<>();
        for (JsonNode node : array) {
            if (idOf(node) == null) {
                logger.warn("忽略缺少 id 的用户记录");
                continue;
            }
            users.add(toSnapshot(node));
        }
        return users;
    }

    private UserSnapshot toSnapshot(JsonNode node) {
        String id = idOf(node);
        if (id == null) {
            throw new CollaboratorUnavailableException("用户服务返回的用户缺少 id");
        }
        JsonNode profile = node.path("profile");
        JsonNode preferences = node.path("preferences");
        JsonNode active = node.path("isActive");
        return UserSnapshot.builder()
                .id(id)
                .username(text(node.path("username")))
                .skills(textList(profile.path("skills")))
                .experience(text(profile.path("experience")))
                .location(text(profile.path("location")))
                .availability(text(preferences.path("availability")))
                .projectTypes(textList(preferences.path("projectTypes")))
                .interests(textList(preferences.path("interests")))
                // 未声明 isActive 的用户视为活跃
                .active(!active.isBoolean() || active.asBoolean())
                .build();
    }
}
