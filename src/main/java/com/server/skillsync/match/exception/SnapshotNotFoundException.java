package com.server.skillsync.match.exception;

/**
 * 触发匹配的用户或项目在协作服务中不存在，重试无意义
 */
public class SnapshotNotFoundException extends MatchingException {
    private static final String ERROR_CODE = "SNAPSHOT_NOT_FOUND";

    public SnapshotNotFoundException(String entityType, String entityId) {
        super(ERROR_CODE, String.format("%s %s 不存在", entityType, entityId));
    }
}
