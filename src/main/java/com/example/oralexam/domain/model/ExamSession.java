package com.example.oralexam.domain.model;

import java.time.Instant;
import java.util.List;

public record ExamSession(
        Long id,
        Long groupId,
        String demoLabel,
        SessionStatus status,
        Long seed,
        Instant createdAt,
        Instant updatedAt,
        List<AssignedTask> assignedTasks
) {
    public ExamSession {
        assignedTasks = assignedTasks == null ? List.of() : List.copyOf(assignedTasks);
    }

    public List<Long> assignedTaskIds() {
        return assignedTasks.stream().map(AssignedTask::taskId).toList();
    }
}
