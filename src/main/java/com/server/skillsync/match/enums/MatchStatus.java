package com.server.skillsync.match.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

import java.util.Locale;

/**
 * 匹配状态
 * 只能沿 PENDING → VIEWED → INTERESTED → APPLIED 逐级前进，
 * 任何非终态都可以进入 REJECTED，REJECTED 为终态
 */
@Getter
public enum MatchStatus {
    PENDING("待查看"),
    VIEWED("已查看"),
    INTERESTED("感兴趣"),
    APPLIED("已申请"),
    REJECTED("已拒绝");

    private final String description;

    MatchStatus(String description) {
        this.description = description;
    }

    public boolean isTerminal() {
        return this == REJECTED;
    }

    /**
     * 判断是否允许从当前状态迁移到目标状态
     * 同状态迁移视为非法
     */
    public boolean canTransitionTo(MatchStatus target) {
        if (target == null || isTerminal() || target == this) {
            return false;
        }
        if (target == REJECTED) {
            return true;
        }
        return target.ordinal() == this.ordinal() + 1;
    }

    @JsonValue
    public String toWireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * 解析接口传入的状态值，大小写不敏感
     *
     * @return 对应的状态，无法识别时返回 null
     */
    @JsonCreator
    public static MatchStatus fromValue(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (MatchStatus status : values()) {
            if (status.name().equals(normalized)) {
                return status;
            }
        }
        return null;
    }
}
