package com.server.skillsync.match.exception;

import lombok.Getter;

/**
 * 匹配模块通用异常类
 */
@Getter
public class MatchingException extends RuntimeException {
    private final String errorCode;

    public MatchingException(String message) {
        super(message);
        this.errorCode = "MATCHING_ERROR";
    }

    public MatchingException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public MatchingException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
