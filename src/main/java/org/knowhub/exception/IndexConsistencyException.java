package org.knowhub.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * 索引一致性被破坏。抛出后该文档进入挂起状态，需人工处理后才能继续写入。
 */
@Getter
public class IndexConsistencyException extends CustomException {

    private final String documentId;

    public IndexConsistencyException(String documentId, String message) {
        super(message, HttpStatus.CONFLICT);
        this.documentId = documentId;
    }
}
