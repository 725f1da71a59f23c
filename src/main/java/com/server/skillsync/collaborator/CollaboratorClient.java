package com.server.skillsync.collaborator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.server.skillsync.match.exception.CollaboratorUnavailableException;
import com.server.skillsync.match.exception.SnapshotNotFoundException;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/**
 * 协作服务客户端的公共部分：发起 GET 请求并把失败统一转换为匹配模块的异常
 */
abstract class CollaboratorClient {

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    protected CollaboratorClient(RestTemplate restTemplate, ObjectMapper objectMapper) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
    }

    /**
     * 读取单个实体，404 转换为 SnapshotNotFoundException
     */
    protected JsonNode fetchEntity(URI uri, String entityType, String entityId) {
        try {
            return fetch(uri, entityType);
        } catch (HttpClientErrorException.NotFound e) {
            throw new SnapshotNotFoundException(entityType, entityId);
        }
    }

    /**
     * 读取实体列表，任何失败都视为协作服务不可用
     */
    protected JsonNode fetchList(URI uri, String entityType) {
        try {
            return fetch(uri, entityType);
        } catch (HttpClientErrorException.NotFound e) {
            throw new CollaboratorUnavailableException(entityType + "列表接口不存在: " + uri, e);
        }
    }

    private JsonNode fetch(URI uri, String entityType) {
        ResponseEntity<String> response;
        try {
            response = restTemplate.getForEntity(uri, String.class);
        } catch (HttpClientErrorException.NotFound e) {
            throw e;
        } catch (RestClientException e) {
            throw new CollaboratorUnavailableException(
                    String.format("调用%s服务失败: %s", entityType, e.getMessage()), e);
        }

        String body = response.getBody();
        if (body == null || body.isBlank()) {
            throw new CollaboratorUnavailableException(entityType + "服务返回了空响应: " + uri);
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new CollaboratorUnavailableException(entityType + "服务返回了无法解析的响应: " + uri, e);
        }
    }

    /**
     * 列表接口既可能直接返回数组，也可能包在某个字段里
     */
    protected static JsonNode unwrapArray(JsonNode root, String field) {
        if (root.isArray()) {
            return root;
        }
        JsonNode wrapped = root.path(field);
        if (wrapped.isArray()) {
            return wrapped;
        }
        throw new CollaboratorUnavailableException("响应中缺少列表字段: " + field);
    }

    protected static List<String> textList(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (!node.isArray()) {
            return values;
        }
        for (JsonNode item : node) {
            // 兼容 {"name": "java"} 形式的元素
            String value = item.isObject() ? item.path("name").asText(null) : item.asText(null);
            if (value != null && !value.isBlank()) {
                values.add(value.trim());
            }
        }
        return values;
    }

    protected static String text(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        String value = node.asText();
        return value.isBlank() ? null : value;
    }

    protected static String idOf(JsonNode node) {
        String id = text(node.path("_id"));
        return id != null ? id : text(node.path("id"));
    }
}
