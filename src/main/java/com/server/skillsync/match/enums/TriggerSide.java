package com.server.skillsync.match.enums;

import lombok.Getter;

/**
 * 触发方：用户侧触发时匹配活跃项目，项目侧触发时匹配具备技能的用户
 */
@Getter
public enum TriggerSide {
    USER("user"),
    PROJECT("project");

    private final String metricTag;

    TriggerSide(String metricTag) {
        this.metricTag = metricTag;
    }
}
