package com.example.oralexam.domain.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class DependencyConflictException extends BusinessException {

    private final Long taskId;
    private final Long conflictingTaskId;

    public DependencyConflictException(Long taskId, Long conflictingTaskId) {
        super(HttpStatus.CONFLICT,
                "Task " + taskId + " conflicts with task " + conflictingTaskId);
        this.taskId = taskId;
        this.conflictingTaskId = conflictingTaskId;
    }
}
