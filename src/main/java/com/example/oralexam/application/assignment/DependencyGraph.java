package com.example.oralexam.application.assignment;

import com.example.oralexam.domain.exception.ConfigException;
import com.example.oralexam.domain.exception.NotFoundException;
import com.example.oralexam.domain.model.Task;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Requires/excludes relations of a catalog snapshot.
 * <p>
 * Requires edges are directed and must be acyclic; excludes edges are stored as
 * recorded but every conflict check treats them as undirected.
 */
public final class DependencyGraph {

    private enum Color { WHITE, GRAY, BLACK }

    private final Map<Long, List<Long>> requires;
    private final Map<Long, Set<Long>> excludes;

    private DependencyGraph(Map<Long, List<Long>> requires, Map<Long, Set<Long>> excludes) {
        this.requires = requires;
        this.excludes = excludes;
    }

    public static DependencyGraph build(Collection<Task> tasks) {
        Map<Long, List<Long>> requires = new HashMap<>();
        Map<Long, Set<Long>> excludes = new HashMap<>();

        for (Task task : tasks) {
            requires.put(task.id(), List.copyOf(new TreeSet<>(task.requires())));
            excludes.put(task.id(), Collections.unmodifiableSet(new TreeSet<>(task.excludes())));
        }

        for (Map.Entry<Long, List<Long>> e : requires.entrySet()) {
            for (Long target : e.getValue()) {
                if (!requires.containsKey(target)) {
                    throw new ConfigException("Task " + e.getKey() + " requires unknown task " + target);
                }
            }
        }
        for (Map.Entry<Long, Set<Long>> e : excludes.entrySet()) {
            for (Long target : e.getValue()) {
                if (!excludes.containsKey(target)) {
                    throw new ConfigException("Task " + e.getKey() + " excludes unknown task " + target);
                }
            }
        }

        DependencyGraph graph = new DependencyGraph(requires, excludes);
        graph.rejectCycles();
        return graph;
    }

    /**
     * Task itself first, then everything it transitively requires, depth-first over ascending ids.
     */
    public Set<Long> closure(Long taskId) {
        requireKnown(taskId);
        Set<Long> out = new LinkedHashSet<>();
        Deque<Long> stack = new ArrayDeque<>();
        stack.push(taskId);
        while (!stack.isEmpty()) {
            Long current = stack.pop();
            if (!out.add(current)) {
                continue;
            }
            List<Long> deps = requires.get(current);
            for (int i = deps.size() - 1; i >= 0; i--) {
                if (!out.contains(deps.get(i))) {
                    stack.push(deps.get(i));
                }
            }
        }
        return out;
    }

    public Set<Long> conflictsWith(Long taskId) {
        requireKnown(taskId);
        return excludes.get(taskId);
    }

    public boolean conflicting(Long a, Long b) {
        Set<Long> ea = excludes.get(a);
        Set<Long> eb = excludes.get(b);
        return (ea != null && ea.contains(b)) || (eb != null && eb.contains(a));
    }

    private void requireKnown(Long taskId) {
        if (!requires.containsKey(taskId)) {
            throw NotFoundException.task(taskId);
        }
    }

    private void rejectCycles() {
        Map<Long, Color> colors = new HashMap<>();
        for (Long root : new TreeSet<>(requires.keySet())) {
            if (colors.getOrDefault(root, Color.WHITE) == Color.WHITE) {
                visit(root, colors);
            }
        }
    }

    private void visit(Long root, Map<Long, Color> colors) {
        List<Long> path = new ArrayList<>();
        Deque<Iterator<Long>> pending = new ArrayDeque<>();

        colors.put(root, Color.GRAY);
        path.add(root);
        pending.push(requires.get(root).iterator());

        while (!pending.isEmpty()) {
            Iterator<Long> edges = pending.peek();
            if (!edges.hasNext()) {
                pending.pop();
                colors.put(path.remove(path.size() - 1), Color.BLACK);
                continue;
            }
            Long next = edges.next();
            Color c = colors.getOrDefault(next, Color.WHITE);
            if (c == Color.GRAY) {
                List<Long> cycle = new ArrayList<>(path.subList(path.indexOf(next), path.size()));
                cycle.add(next);
                throw new ConfigException("Cyclic requires relation: " + cycle);
            }
            if (c == Color.WHITE) {
                colors.put(next, Color.GRAY);
                path.add(next);
                pending.push(requires.get(next).iterator());
            }
        }
    }
}
