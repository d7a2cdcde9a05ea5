package com.example.oralexam.domain.exception;

import org.springframework.http.HttpStatus;

/**
 * Catalog or quota configuration that no assignment can be computed from:
 * a requires cycle, a dangling task reference, a negative or unknown quota.
 */
public class ConfigException extends BusinessException {

    public ConfigException(String message) {
        super(HttpStatus.UNPROCESSABLE_ENTITY, message);
    }
}
