package com.example.oralexam.domain.dto;

import com.example.oralexam.domain.model.AssignedTask;
import com.example.oralexam.domain.model.ExamSession;
import com.example.oralexam.domain.model.SessionStatus;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class SessionResponse {
    private Long id;
    private Long groupId;
    private String demoLabel;
    private SessionStatus status;
    private Long seed;
    private Instant createdAt;
    private Instant updatedAt;
    private List<AssignedTask> assignedTasks;

    public static SessionResponse from(ExamSession session) {
        return SessionResponse.builder()
                .id(session.id())
                .groupId(session.groupId())
                .demoLabel(session.demoLabel())
                .status(session.status())
                .seed(session.seed())
                .createdAt(session.createdAt())
                .updatedAt(session.updatedAt())
                .assignedTasks(session.assignedTasks())
                .build();
    }
}
