package com.example.oralexam.infrastructure.catalog;

import com.example.oralexam.domain.model.Category;
import com.example.oralexam.domain.model.StudentGroup;
import com.example.oralexam.domain.model.Task;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only access to the task catalog and the roster. Catalog maintenance happens elsewhere.
 */
public interface CatalogReader {

    List<Category> listCategories();

    /**
     * Tasks keyed by category id, categories ascending and tasks ascending by id within each,
     * with their requires/excludes sets filled in.
     */
    Map<Long, List<Task>> listTasksByCategory();

    Optional<StudentGroup> findGroup(Long groupId);
}
