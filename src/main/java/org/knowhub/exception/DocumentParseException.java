package org.knowhub.exception;

import org.springframework.http.HttpStatus;

/**
 * 文档无法解析：类型不支持、内容损坏或为空。按文档粒度失败。
 */
public class DocumentParseException extends CustomException {

    public DocumentParseException(String message) {
        super(message, HttpStatus.UNPROCESSABLE_ENTITY);
    }

    public DocumentParseException(String message, Throwable cause) {
        super(message, HttpStatus.UNPROCESSABLE_ENTITY, cause);
    }
}
