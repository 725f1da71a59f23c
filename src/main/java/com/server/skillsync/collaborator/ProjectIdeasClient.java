package com.server.skillsync.collaborator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.server.skillsync.collaborator.dto.ProjectSnapshot;
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
 * 项目服务只读客户端
 */
@Component
public class ProjectIdeasClient extends CollaboratorClient {
    private static final Logger logger = LoggerFactory.getLogger(ProjectIdeasClient.class);

    private static final String ENTITY_TYPE = "项目";
    private static final String ACTIVE_STATUS = "active";

    private final CollaboratorConfig collaboratorConfig;

    public ProjectIdeasClient(@Qualifier("collaboratorRestTemplate") RestTemplate restTemplate,
                              ObjectMapper objectMapper,
                              CollaboratorConfig collaboratorConfig) {
        super(restTemplate, objectMapper);
        this.collaboratorConfig = collaboratorConfig;
    }

    /**
     * 获取单个项目
     *
     * @throws com.server.skillsync.match.exception.SnapshotNotFoundException 项目不存在
     * @throws CollaboratorUnavailableException 项目服务不可用
     */
    public ProjectSnapshot getProject(String projectId) {
        URI uri = UriComponentsBuilder.fromHttpUrl(collaboratorConfig.getProjectServiceUrl())
                .path("/api/projects/{id}")
                .buildAndExpand(projectId)
                .encode()
                .toUri();
        JsonNode root = fetchEntity(uri, ENTITY_TYPE, projectId);
        JsonNode projectNode = root.has("project") ? root.path("project") : root;
        return toSnapshot(projectNode);
    }

    /**
     * 获取一页状态为 active 的项目
     */
    public List<ProjectSnapshot> findActiveProjects(int limit) {
        URI uri = UriComponentsBuilder.fromHttpUrl(collaboratorConfig.getProjectServiceUrl())
                .path("/api/projects")
                .queryParam("status", ACTIVE_STATUS)
                .queryParam("limit", limit)
                .encode()
                .build()
                .toUri();
        List<ProjectSnapshot> projects = toSnapshots(unwrapArray(fetchList(uri, ENTITY_TYPE), "projects"));
        logger.debug("获取到 {} 个活跃项目", projects.size());
        return projects;
    }

    /**
     * 查询指定时间之后有更新的项目
     */
    public List<ProjectSnapshot> findRecentlyActiveProjects(Instant since, int limit) {
        URI uri = UriComponentsBuilder.fromHttpUrl(collaboratorConfig.getProjectServiceUrl())
                .path("/api/projects/recent")
                .queryParam("since", since.toString())
                .queryParam("limit", limit)
                .encode()
                .build()
                .toUri();
        return toSnapshots(unwrapArray(fetchList(uri, ENTITY_TYPE), "projects"));
    }

    private List<ProjectSnapshot> toSnapshots(JsonNode array) {
        List<ProjectSnapshot> projects = new ArrayList<>();
        for (JsonNode node : array) {
            if (idOf(node) == null) {
                logger.warn("忽略缺少 id 的项目记录");
                continue;
            }
            projects.add(toSnapshot(node));
        }
        return projects;
    }

    private ProjectSnapshot toSnapshot(JsonNode node) {
        String id = idOf(node);
        if (id == null) {
            throw new CollaboratorUnavailableException("项目服务返回的项目缺少 id");
        }
        List<String> collaboratorIds = new ArrayList<>();
        String ownerId = text(node.path("owner"));
        if (ownerId != null) {
            collaboratorIds.add(ownerId);
        }
        for (JsonNode collaborator : node.path("collaborators")) {
            String userId = collaborator.isObject() ? text(collaborator.path("userId")) : text(collaborator);
            if (userId != null) {
                collaboratorIds.add(userId);
            }
        }
        return ProjectSnapshot.builder()
                .id(id)
                .title(text(node.path("title")))
                .requiredSkills(textList(node.path("requiredSkills")))
                .optionalSkills(textList(node.path("optionalSkills")))
                .difficulty(text(node.path("difficulty")))
                .estimatedDuration(text(node.path("estimatedDuration")))
                .location(text(node.path("location")))
                .category(text(node.path("category")))
                .tags(textList(node.path("tags")))
                .collaboratorIds(collaboratorIds)
                .status(text(node.path("status")))
                .build();
    }
}
