package org.knowhub.exception;

import org.springframework.http.HttpStatus;

/**
 * 检索后端不可用，重试耗尽后抛出。
 */
public class RetrievalException extends CustomException {

    public RetrievalException(String message) {
        super(message, HttpStatus.SERVICE_UNAVAILABLE);
    }

    public RetrievalException(String message, Throwable cause) {
        super(message, HttpStatus.SERVICE_UNAVAILABLE, cause);
    }
}
