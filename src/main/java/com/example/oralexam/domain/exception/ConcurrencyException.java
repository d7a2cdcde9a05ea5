package com.example.oralexam.domain.exception;

import org.springframework.http.HttpStatus;

/**
 * Another assignment for the same session is in flight or has just won the
 * DRAFT to ACTIVE transition. Safe to retry: the retry observes the stored result.
 */
public class ConcurrencyException extends BusinessException {

    public ConcurrencyException(String message) {
        super(HttpStatus.CONFLICT, message);
    }

    public ConcurrencyException(String message, Throwable cause) {
        super(HttpStatus.CONFLICT, message, cause);
    }
}
