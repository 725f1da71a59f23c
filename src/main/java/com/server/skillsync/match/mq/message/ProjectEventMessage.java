package com.server.skillsync.match.mq.message;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Getter;
import lombok.Setter;

/**
 * 项目服务发布的项目事件（project.created 等）
 */
@Setter
@Getter
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProjectEventMessage {

    private String projectId;
}
