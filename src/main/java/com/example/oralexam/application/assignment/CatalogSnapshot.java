package com.example.oralexam.application.assignment;

import com.example.oralexam.domain.model.Category;
import com.example.oralexam.domain.model.Task;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One consistent read of the catalog: categories plus their tasks, keyed by category id.
 */
public record CatalogSnapshot(
        List<Category> categories,
        Map<Long, List<Task>> tasksByCategory
) {
    public CatalogSnapshot {
        categories = List.copyOf(categories);
        Map<Long, List<Task>> copy = new LinkedHashMap<>();
        tasksByCategory.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        tasksByCategory = Collections.unmodifiableMap(copy);
    }

    public List<Task> tasksOf(Long categoryId) {
        return tasksByCategory.getOrDefault(categoryId, List.of());
    }

    public List<Task> allTasks() {
        return tasksByCategory.values().stream().flatMap(List::stream).toList();
    }
}
