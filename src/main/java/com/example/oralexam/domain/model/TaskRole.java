package com.example.oralexam.domain.model;

/**
 * Why a task is part of a session: drawn for its category's quota, or pulled in
 * because a drawn task requires it.
 */
public enum TaskRole {
    QUOTA,
    DEPENDENCY
}
