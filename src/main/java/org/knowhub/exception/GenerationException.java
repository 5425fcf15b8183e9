package org.knowhub.exception;

import org.springframework.http.HttpStatus;

public class GenerationException extends CustomException {

    public GenerationException(String message) {
        super(message, HttpStatus.SERVICE_UNAVAILABLE);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, HttpStatus.SERVICE_UNAVAILABLE, cause);
    }
}
