package com.example.oralexam.domain.dto;

import com.example.oralexam.domain.model.SessionStatus;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

/**
 * Polled by the student screen. Carries no hints or solutions.
 */
@Getter
@Builder
public class StudentView {
    private Long sessionId;
    private SessionStatus status;
    private boolean ready;
    private long refreshIntervalMs;
    private List<TaskView> tasks;

    @Getter
    @Builder
    public static class TaskView {
        private int position;
        private Long taskId;
        private String title;
        private String categoryName;
        private String subcategory;
        private String promptMarkdown;
    }
}
