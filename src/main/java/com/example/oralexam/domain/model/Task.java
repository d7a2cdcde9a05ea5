package com.example.oralexam.domain.model;

import java.util.Set;

public record Task(
        Long id,
        String title,
        Long categoryId,
        String subcategory,
        String promptMarkdown,
        String hintMarkdown,
        String solutionMarkdown,
        Set<Long> requires,
        Set<Long> excludes
) {
    public Task {
        requires = requires == null ? Set.of() : Set.copyOf(requires);
        excludes = excludes == null ? Set.of() : Set.copyOf(excludes);
    }
}
