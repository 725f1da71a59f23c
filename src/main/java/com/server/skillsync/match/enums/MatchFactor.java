package com.server.skillsync.match.enums;

import lombok.Getter;

/**
 * 匹配维度，声明顺序即理由的输出顺序
 */
@Getter
public enum MatchFactor {
    SKILL("技能"),
    EXPERIENCE("经验"),
    AVAILABILITY("可用时间"),
    LOCATION("地点"),
    INTEREST("兴趣");

    private final String description;

    MatchFactor(String description) {
        this.description = description;
    }
}
