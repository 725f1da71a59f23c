package com.server.skillsync.match.mq.message;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Getter;
import lombok.Setter;

/**
 * 用户服务发布的用户事件（user.created / user.updated）
 */
@Setter
@Getter
@JsonIgnoreProperties(ignoreUnknown = true)
public class UserEventMessage {

    private String userId;
}
