package com.server.skillsync.match.exception;

/**
 * 用户服务或项目服务不可用（网络错误、超时、5xx 或无法解析的响应）
 * 属于可重试的失败
 */
public class CollaboratorUnavailableException extends MatchingException {
    private static final String ERROR_CODE = "COLLABORATOR_UNAVAILABLE";

    public CollaboratorUnavailableException(String message) {
        super(ERROR_CODE, message);
    }

    public CollaboratorUnavailableException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
