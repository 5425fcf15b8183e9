package org.knowhub.exception;

import org.springframework.http.HttpStatus;

/**
 * 向量生成失败（输入非法或向量服务不可用）。
 */
public class EmbeddingException extends CustomException {

    public EmbeddingException(String message) {
        super(message, HttpStatus.SERVICE_UNAVAILABLE);
    }

    public EmbeddingException(String message, Throwable cause) {
        super(message, HttpStatus.SERVICE_UNAVAILABLE, cause);
    }
}
