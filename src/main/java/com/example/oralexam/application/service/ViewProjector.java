package com.example.oralexam.application.service;

import com.example.oralexam.domain.dto.InstructorView;
import com.example.oralexam.domain.dto.StudentView;
import com.example.oralexam.domain.exception.NotFoundException;
import com.example.oralexam.domain.model.AssignedTask;
import com.example.oralexam.domain.model.Category;
import com.example.oralexam.domain.model.ExamSession;
import com.example.oralexam.domain.model.SessionStatus;
import com.example.oralexam.domain.model.StudentGroup;
import com.example.oralexam.domain.model.Task;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Builds the two read models of a session. Pure: no I/O, no state besides the poll interval.
 */
@Component
public class ViewProjector {

    private final long refreshIntervalMs;

    public ViewProjector(@Value("${oralexam.student-view.refresh-interval-ms}") long refreshIntervalMs) {
        this.refreshIntervalMs = Math.max(500, refreshIntervalMs);
    }

    public InstructorView instructorView(
            ExamSession session,
            StudentGroup group,
            Map<Long, Task> tasksById,
            Map<Long, Category> categoriesById
    ) {
        InstructorView.InstructorViewBuilder view = InstructorView.builder()
                .sessionId(session.id())
                .status(session.status())
                .seed(session.seed())
                .group(group)
                .demoLabel(session.demoLabel())
                .createdAt(session.createdAt())
                .updatedAt(session.updatedAt());

        if (session.status() == SessionStatus.DRAFT) {
            return view.pending(true).tasks(List.of()).build();
        }

        List<InstructorView.TaskView> tasks = new ArrayList<>(session.assignedTasks().size());
        for (AssignedTask assigned : session.assignedTasks()) {
            Task task = lookup(tasksById, assigned.taskId());
            Category category = categoriesById.get(task.categoryId());
            tasks.add(InstructorView.TaskView.builder()
                    .position(assigned.position())
                    .taskId(task.id())
                    .title(task.title())
                    .categoryId(task.categoryId())
                    .categoryName(category == null ? null : category.name())
                    .subcategory(task.subcategory())
                    .role(assigned.role())
                    .promptMarkdown(task.promptMarkdown())
                    .hintMarkdown(task.hintMarkdown())
                    .solutionMarkdown(task.solutionMarkdown())
                    .build());
        }
        return view.pending(false).tasks(tasks).build();
    }

    public StudentView studentView(
            ExamSession session,
            Map<Long, Task> tasksById,
            Map<Long, Category> categoriesById
    ) {
        StudentView.StudentViewBuilder view = StudentView.builder()
                .sessionId(session.id())
                .status(session.status())
                .refreshIntervalMs(refreshIntervalMs);

        if (session.status() == SessionStatus.DRAFT) {
            return view.ready(false).tasks(List.of()).build();
        }

        List<StudentView.TaskView> tasks = new ArrayList<>(session.assignedTasks().size());
        for (AssignedTask assigned : session.assignedTasks()) {
            Task task = lookup(tasksById, assigned.taskId());
            Category category = categoriesById.get(task.categoryId());
            tasks.add(StudentView.TaskView.builder()
                    .position(assigned.position())
                    .taskId(task.id())
                    .title(task.title())
                    .categoryName(category == null ? null : category.name())
                    .subcategory(task.subcategory())
                    .promptMarkdown(task.promptMarkdown())
                    .build());
        }
        return view.ready(true).tasks(tasks).build();
    }

    private static Task lookup(Map<Long, Task> tasksById, Long taskId) {
        Task task = tasksById.get(taskId);
        if (task == null) {
            throw NotFoundException.task(taskId);
        }
        return task;
    }
}
