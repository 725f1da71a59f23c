package com.server.skillsync.match.exception;

/**
 * 匹配未找到异常
 */
public class MatchNotFoundException extends MatchingException {
    private static final String ERROR_CODE = "MATCH_NOT_FOUND";

    public MatchNotFoundException(Long matchId) {
        super(ERROR_CODE, String.format("匹配记录 %d 不存在", matchId));
    }
}
