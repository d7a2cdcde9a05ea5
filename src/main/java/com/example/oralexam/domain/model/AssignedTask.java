package com.example.oralexam.domain.model;

public record AssignedTask(
        int position,
        Long taskId,
        Long categoryId,
        TaskRole role
) {
}
