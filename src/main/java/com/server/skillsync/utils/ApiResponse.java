package com.server.skillsync.utils;

import lombok.Getter;

import java.util.Collections;
import java.util.Map;

/**
 * API统一响应格式
 * 错误响应的 data 中携带 errorCode
 */
@Getter
public class ApiResponse {
    private final boolean success;
    private final String message;
    private final Object data;
    private final Map<String, Object> meta;

    private ApiResponse(boolean success, String message, Object data, Map<String, Object> meta) {
        this.success = success;
        this.message = message;
        this.data = data;
        this.meta = meta;
    }

    public static ApiResponse success(Object data) {
        return new ApiResponse(true, "操作成功", data, Collections.emptyMap());
    }

    /**
     * 创建错误响应
     *
     * @param message   错误消息
     * @param errorCode 错误码
     * @return API响应
     */
    public static ApiResponse error(String message, String errorCode) {
        return new ApiResponse(false, message, Map.of("errorCode", errorCode), Collections.emptyMap());
    }
}
