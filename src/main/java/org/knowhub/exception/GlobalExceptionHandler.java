package org.knowhub.exception;

import org.knowhub.utils.LogUtils;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.HashMap;
import java.util.Map;

@RestControllerAdvice
public class GlobalExceptionHandler {

    public static final String UNAVAILABLE_MESSAGE = "Knowledge service is temporarily unavailable, please try again later.";

    // 查询链路上的后端故障统一转成"暂时不可用"，不把内部错误暴露给用户
    @ExceptionHandler({RetrievalException.class, GenerationException.class, EmbeddingException.class})
    public ResponseEntity<Map<String, Object>> handleBackendUnavailable(CustomException ex) {
        LogUtils.logSystemError(ex.getClass().getSimpleName(), ex.getMessage(), ex);
        return build(HttpStatus.SERVICE_UNAVAILABLE, UNAVAILABLE_MESSAGE);
    }

    @ExceptionHandler(CustomException.class)
    public ResponseEntity<Map<String, Object>> handleCustomException(CustomException ex) {
        return build(ex.getStatus(), ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException ex) {
        return build(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    // 兜底，防止报出白页
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGeneralException(Exception ex) {
        LogUtils.logSystemError("GlobalExceptionHandler", ex.getMessage(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "服务器内部错误: " + ex.getMessage());
    }

    private ResponseEntity<Map<String, Object>> build(HttpStatus status, String message) {
        Map<String, Object> body = new HashMap<>();
        body.put("code", status.value());
        body.put("message", message);
        body.put("success", false);
        return new ResponseEntity<>(body, status);
    }
}
