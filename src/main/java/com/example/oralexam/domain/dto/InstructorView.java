package com.example.oralexam.domain.dto;

import com.example.oralexam.domain.model.SessionStatus;
import com.example.oralexam.domain.model.StudentGroup;
import com.example.oralexam.domain.model.TaskRole;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

/**
 * Everything the examiner sees, solutions included. {@code pending} is true while the
 * session is still in DRAFT; {@code tasks} is empty then.
 */
@Getter
@Builder
public class InstructorView {
    private Long sessionId;
    private SessionStatus status;
    private boolean pending;
    private Long seed;
    private StudentGroup group;
    private String demoLabel;
    private Instant createdAt;
    private Instant updatedAt;
    private List<TaskView> tasks;

    @Getter
    @Builder
    public static class TaskView {
        private int position;
        private Long taskId;
        private String title;
        private Long categoryId;
        private String categoryName;
        private String subcategory;
        private TaskRole role;
        private String promptMarkdown;
        private String hintMarkdown;
        private String solutionMarkdown;
    }
}
