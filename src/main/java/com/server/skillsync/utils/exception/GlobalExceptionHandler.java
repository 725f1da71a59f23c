package com.server.skillsync.utils.exception;

import com.server.skillsync.match.exception.CollaboratorUnavailableException;
import com.server.skillsync.match.exception.InvalidStatusTransitionException;
import com.server.skillsync.match.exception.MatchNotFoundException;
import com.server.skillsync.match.exception.MatchingException;
import com.server.skillsync.match.exception.SnapshotNotFoundException;
import com.server.skillsync.utils.ApiResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * 全局异常处理，把异常映射为状态码和统一的错误响应
 */
@RestControllerAdvice
public class GlobalExceptionHandler {
    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(InvalidRequestException.class)
    public ResponseEntity<ApiResponse> handleInvalidRequest(InvalidRequestException e) {
        return error(HttpStatus.BAD_REQUEST, e.getMessage(), InvalidRequestException.ERROR_CODE);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse> handleValidation(MethodArgumentNotValidException e) {
        StringBuilder message = new StringBuilder("请求参数无效:");
        for (FieldError fieldError : e.getBindingResult().getFieldErrors()) {
            message.append(" ").append(fieldError.getField())
                    .append(" ").append(fieldError.getDefaultMessage()).append(";");
        }
        return error(HttpStatus.BAD_REQUEST, message.toString(), InvalidRequestException.ERROR_CODE);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ApiResponse> handleUnreadable(Exception e) {
        return error(HttpStatus.BAD_REQUEST, "请求格式错误", InvalidRequestException.ERROR_CODE);
    }

    @ExceptionHandler({MatchNotFoundException.class, SnapshotNotFoundException.class})
    public ResponseEntity<ApiResponse> handleNotFound(MatchingException e) {
        return error(HttpStatus.NOT_FOUND, e.getMessage(), e.getErrorCode());
    }

    @ExceptionHandler(InvalidStatusTransitionException.class)
    public ResponseEntity<ApiResponse> handleInvalidTransition(InvalidStatusTransitionException e) {
        return error(HttpStatus.CONFLICT, e.getMessage(), e.getErrorCode());
    }

    @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
    public ResponseEntity<ApiResponse> handleConcurrentModification(ObjectOptimisticLockingFailureException e) {
        logger.warn("匹配记录被并发修改: {}", e.getMessage());
        return error(HttpStatus.CONFLICT, "匹配记录已被其他请求修改，请重试", "CONCURRENT_MODIFICATION");
    }

    @ExceptionHandler(CollaboratorUnavailableException.class)
    public ResponseEntity<ApiResponse> handleCollaboratorUnavailable(CollaboratorUnavailableException e) {
        logger.error("协作服务不可用: {}", e.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage(), e.getErrorCode());
    }

    @ExceptionHandler(MatchingException.class)
    public ResponseEntity<ApiResponse> handleMatching(MatchingException e) {
        logger.error("匹配处理失败", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage(), e.getErrorCode());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse> handleUnexpected(Exception e) {
        // 框架自身的异常（如路径不存在）保留其状态码
        if (e instanceof ErrorResponse errorResponse) {
            return ResponseEntity.status(errorResponse.getStatusCode())
                    .body(ApiResponse.error(e.getMessage(), "REQUEST_ERROR"));
        }
        logger.error("未处理的异常", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "服务器内部错误", "INTERNAL_ERROR");
    }

    private ResponseEntity<ApiResponse> error(HttpStatus status, String message, String errorCode) {
        return ResponseEntity.status(status).body(ApiResponse.error(message, errorCode));
    }
}
