package com.example.oralexam.domain.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Base class for every error the exam engine reports to its callers.
 * The status is the one the HTTP layer answers with.
 */
@Getter
public class BusinessException extends RuntimeException {

    private final HttpStatus status;

    public BusinessException(HttpStatus status, String message) {
        super(message);
        this.status = status;
    }

    public BusinessException(HttpStatus status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }
}
