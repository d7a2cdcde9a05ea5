package com.example.oralexam.infrastructure.catalog;

import com.example.oralexam.domain.model.Category;
import com.example.oralexam.domain.model.Student;
import com.example.oralexam.domain.model.StudentGroup;
import com.example.oralexam.domain.model.Task;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

@Component
public class JdbcCatalogReader implements CatalogReader {

    private static final Logger log = LoggerFactory.getLogger(JdbcCatalogReader.class);

    private final JdbcTemplate jdbcTemplate;

    public JdbcCatalogReader(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public List<Category> listCategories() {
        return jdbcTemplate.query("SELECT id, name, quota FROM categories ORDER BY id",
                (rs, i) -> new Category(rs.getLong("id"), rs.getString("name"), rs.getInt("quota")));
    }

    @Override
    public Map<Long, List<Task>> listTasksByCategory() {
        Map<Long, Set<Long>> requires = loadRelation("SELECT task_id, required_task_id FROM task_requires");
        Map<Long, Set<Long>> excludes = loadRelation("SELECT task_id, excluded_task_id FROM task_excludes");

        Map<Long, List<Task>> out = new LinkedHashMap<>();
        jdbcTemplate.query("""
                        SELECT id, title, category_id, subcategory, prompt_markdown, hint_markdown, solution_markdown
                        FROM tasks
                        ORDER BY category_id, id
                        """,
                rs -> {
                    long id = rs.getLong("id");
                    Task task = new Task(
                            id,
                            rs.getString("title"),
                            rs.getLong("category_id"),
                            rs.getString("subcategory"),
                            rs.getString("prompt_markdown"),
                            rs.getString("hint_markdown"),
                            rs.getString("solution_markdown"),
                            requires.getOrDefault(id, Set.of()),
                            excludes.getOrDefault(id, Set.of())
                    );
                    out.computeIfAbsent(task.categoryId(), k -> new ArrayList<>()).add(task);
                });

        log.debug("event=catalog_read categories={} tasks={}",
                out.size(), out.values().stream().mapToInt(List::size).sum());
        return out;
    }

    @Override
    public Optional<StudentGroup> findGroup(Long groupId) {
        List<String> labels = jdbcTemplate.queryForList(
                "SELECT label FROM student_groups WHERE id = ?", String.class, groupId);
        if (labels.isEmpty()) {
            return Optional.empty();
        }
        List<Student> students = jdbcTemplate.query(
                "SELECT id, full_name FROM students WHERE group_id = ? ORDER BY id",
                (rs, i) -> new Student(rs.getLong("id"), rs.getString("full_name")),
                groupId);
        return Optional.of(new StudentGroup(groupId, labels.get(0), students));
    }

    private Map<Long, Set<Long>> loadRelation(String sql) {
        Map<Long, Set<Long>> out = new HashMap<>();
        jdbcTemplate.query(sql, rs -> {
            out.computeIfAbsent(rs.getLong(1), k -> new HashSet<>()).add(rs.getLong(2));
        });
        return out;
    }
}
