package com.server.skillsync.match.exception;

import com.server.skillsync.match.enums.MatchStatus;
import lombok.Getter;

/**
 * 非法的匹配状态迁移
 */
@Getter
public class InvalidStatusTransitionException extends MatchingException {
    private static final String ERROR_CODE = "INVALID_STATUS_TRANSITION";

    private final MatchStatus from;
    private final MatchStatus to;

    public InvalidStatusTransitionException(Long matchId, MatchStatus from, MatchStatus to) {
        super(ERROR_CODE, String.format("匹配记录 %d 不能从 %s 变更为 %s",
                matchId, from.toWireValue(), to == null ? "null" : to.toWireValue()));
        this.from = from;
        this.to = to;
    }
}
