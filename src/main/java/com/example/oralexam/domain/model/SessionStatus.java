package com.example.oralexam.domain.model;

/**
 * Lifecycle of an exam session. Transitions only move forward:
 * DRAFT -> ACTIVE -> COMPLETED.
 */
public enum SessionStatus {
    DRAFT,
    ACTIVE,
    COMPLETED
}
