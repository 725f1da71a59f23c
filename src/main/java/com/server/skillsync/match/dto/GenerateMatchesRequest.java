package com.server.skillsync.match.dto;

import lombok.Data;

/**
 * 手动生成匹配请求，userId 与 projectId 必须且只能提供一个
 */
@Data
public class GenerateMatchesRequest {
    private String userId;
    private String projectId;
}
