package com.example.oralexam.application.assignment;

import com.example.oralexam.domain.model.Category;
import com.example.oralexam.domain.model.Task;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

final class Fixtures {

    private Fixtures() {
    }

    static Task task(long id, long categoryId) {
        return task(id, categoryId, Set.of(), Set.of());
    }

    static Task task(long id, long categoryId, Set<Long> requires, Set<Long> excludes) {
        return new Task(id, "Task " + id, categoryId, null,
                "prompt " + id, "hint " + id, "solution " + id, requires, excludes);
    }

    static CatalogSnapshot catalog(List<Category> categories, List<Task> tasks) {
        Map<Long, List<Task>> byCategory = new TreeMap<>();
        for (Task task : tasks) {
            byCategory.computeIfAbsent(task.categoryId(), k -> new ArrayList<>()).add(task);
        }
        return new CatalogSnapshot(categories, new LinkedHashMap<>(byCategory));
    }

    static Map<Long, Integer> quotas(List<Category> categories) {
        Map<Long, Integer> out = new LinkedHashMap<>();
        for (Category category : categories) {
            out.put(category.id(), category.quota());
        }
        return out;
    }
}
