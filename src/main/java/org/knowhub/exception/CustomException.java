package org.knowhub.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * 业务异常基类，携带需要返回给调用方的 HTTP 状态码。
 */
@Getter
public class CustomException extends RuntimeException {

    private final HttpStatus status;

    public CustomException(String message, HttpStatus status) {
        super(message);
        this.status = status;
    }

    public CustomException(String message, HttpStatus status, Throwable cause) {
        super(message, cause);
        this.status = status;
    }
}
