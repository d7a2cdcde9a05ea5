package com.example.oralexam.application.assignment;

import com.example.oralexam.domain.exception.ConfigException;
import com.example.oralexam.domain.exception.DependencyConflictException;
import com.example.oralexam.domain.exception.InsufficientTasksException;
import com.example.oralexam.domain.model.AssignedTask;
import com.example.oralexam.domain.model.Category;
import com.example.oralexam.domain.model.Task;
import com.example.oralexam.domain.model.TaskRole;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Draws the task set of one exam session.
 * <p>
 * Categories are processed in ascending id order. For each one, {@code quota} tasks are
 * sampled from the eligible pool and their requires-closures are pulled in. Tasks pulled in
 * for another category's pick do not count towards their own category's quota; if the
 * owning category later samples such a task it is promoted to a quota pick in place.
 * Withheld tasks are never sampled, but may still be pulled in as dependencies.
 * <p>
 * The engine is stateless; everything it needs is passed in, so identical inputs and seed
 * give an identical list.
 */
@Component
public class AssignmentEngine {

    private static final Logger log = LoggerFactory.getLogger(AssignmentEngine.class);

    public List<AssignedTask> assign(
            CatalogSnapshot catalog,
            Map<Long, Integer> quotas,
            DependencyGraph graph,
            Set<Long> withheldTaskIds,
            RandomSource random
    ) {
        validateQuotas(catalog, quotas);

        Map<Long, Long> categoryOfTask = new HashMap<>();
        for (Task task : catalog.allTasks()) {
            categoryOfTask.put(task.id(), task.categoryId());
        }

        // insertion order is the final position order
        Map<Long, TaskRole> selected = new LinkedHashMap<>();

        List<Category> ordered = new ArrayList<>(catalog.categories());
        ordered.sort(Comparator.comparing(Category::id));

        for (Category category : ordered) {
            int quota = quotas.get(category.id());
            if (quota == 0) {
                continue;
            }

            List<Task> pool = candidatePool(catalog.tasksOf(category.id()), selected, graph, withheldTaskIds);
            if (pool.size() < quota) {
                throw new InsufficientTasksException(category.name(), quota, pool.size());
            }

            List<Task> picks = random.sample(pool, quota);
            List<Long> dependencies = addPicks(picks, selected, graph);

            log.debug("event=category_drawn categoryId={} quota={} pool={} picks={} dependencies={}",
                    category.id(), quota, pool.size(),
                    picks.stream().map(Task::id).toList(), dependencies);
        }

        List<AssignedTask> out = new ArrayList<>(selected.size());
        int position = 1;
        for (Map.Entry<Long, TaskRole> e : selected.entrySet()) {
            out.add(new AssignedTask(position++, e.getKey(), categoryOfTask.get(e.getKey()), e.getValue()));
        }
        return out;
    }

    private List<Task> candidatePool(
            List<Task> categoryTasks,
            Map<Long, TaskRole> selected,
            DependencyGraph graph,
            Set<Long> withheldTaskIds
    ) {
        List<Task> pool = new ArrayList<>();
        for (Task task : categoryTasks) {
            TaskRole role = selected.get(task.id());
            if (role == TaskRole.QUOTA || withheldTaskIds.contains(task.id())) {
                continue;
            }
            if (role == TaskRole.DEPENDENCY) {
                // already present with its closure; drawing it again only changes its role
                pool.add(task);
                continue;
            }
            if (!clashesWithSelection(graph.closure(task.id()), selected.keySet(), graph)) {
                pool.add(task);
            }
        }
        return pool;
    }

    private static boolean clashesWithSelection(Set<Long> closure, Set<Long> selected, DependencyGraph graph) {
        for (Long member : closure) {
            for (Long other : selected) {
                if (graph.conflicting(member, other)) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Adds the picks and their closures to {@code selected}, or throws without touching it.
     *
     * @return ids pulled in as dependencies, in discovery order
     */
    private List<Long> addPicks(List<Task> picks, Map<Long, TaskRole> selected, DependencyGraph graph) {
        Set<Long> pickIds = new LinkedHashSet<>();
        for (Task pick : picks) {
            pickIds.add(pick.id());
        }

        Set<Long> accepted = new LinkedHashSet<>(selected.keySet());
        List<Long> dependencies = new ArrayList<>();

        for (Long pickId : pickIds) {
            for (Long member : graph.closure(pickId)) {
                if (accepted.contains(member)) {
                    continue;
                }
                for (Long other : accepted) {
                    if (graph.conflicting(member, other)) {
                        throw new DependencyConflictException(other, member);
                    }
                }
                accepted.add(member);
                if (!pickIds.contains(member)) {
                    dependencies.add(member);
                }
            }
        }

        for (Long pickId : pickIds) {
            selected.put(pickId, TaskRole.QUOTA);
        }
        for (Long dependency : dependencies) {
            selected.putIfAbsent(dependency, TaskRole.DEPENDENCY);
        }
        return dependencies;
    }

    private static void validateQuotas(CatalogSnapshot catalog, Map<Long, Integer> quotas) {
        Set<Long> known = new HashSet<>();
        for (Category category : catalog.categories()) {
            known.add(category.id());
        }

        for (Map.Entry<Long, Integer> e : quotas.entrySet()) {
            if (!known.contains(e.getKey())) {
                throw new ConfigException("Quota configured for unknown category " + e.getKey());
            }
            if (e.getValue() == null || e.getValue() < 0) {
                throw new ConfigException("Invalid quota " + e.getValue() + " for category " + e.getKey());
            }
        }
        for (Category category : catalog.categories()) {
            if (!quotas.containsKey(category.id())) {
                throw new ConfigException("No quota configured for category '" + category.name() + "'");
            }
        }
        for (Long categoryId : catalog.tasksByCategory().keySet()) {
            if (!known.contains(categoryId)) {
                throw new ConfigException("Tasks reference unknown category " + categoryId);
            }
        }
    }
}
