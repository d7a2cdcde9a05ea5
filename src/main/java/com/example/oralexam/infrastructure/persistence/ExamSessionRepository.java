package com.example.oralexam.infrastructure.persistence;

import com.example.oralexam.domain.exception.ConcurrencyException;
import com.example.oralexam.domain.model.AssignedTask;
import com.example.oralexam.domain.model.ExamSession;
import com.example.oralexam.domain.model.SessionStatus;
import com.example.oralexam.domain.model.TaskRole;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
public class ExamSessionRepository {

    private static final String SESSION_COLUMNS =
            "id, group_id, demo_label, status, seed, created_at, updated_at";

    private final JdbcTemplate jdbcTemplate;

    public ExamSessionRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public ExamSession insertDraft(Long groupId, String demoLabel, Instant createdAt) {
        KeyHolder keys = new GeneratedKeyHolder();
        Timestamp ts = Timestamp.from(createdAt);
        jdbcTemplate.update(con -> {
            PreparedStatement ps = con.prepareStatement(
                    "INSERT INTO exam_sessions (group_id, demo_label, status, created_at, updated_at) VALUES (?, ?, ?, ?, ?)",
                    new String[]{"id"});
            if (groupId == null) {
                ps.setNull(1, Types.BIGINT);
            } else {
                ps.setLong(1, groupId);
            }
            ps.setString(2, demoLabel);
            ps.setString(3, SessionStatus.DRAFT.name());
            ps.setTimestamp(4, ts);
            ps.setTimestamp(5, ts);
            return ps;
        }, keys);

        Number id = keys.getKey();
        if (id == null) {
            throw new IllegalStateException("No id generated for exam session");
        }
        return new ExamSession(id.longValue(), groupId, demoLabel, SessionStatus.DRAFT, null, createdAt, createdAt, List.of());
    }

    public Optional<ExamSession> findById(Long sessionId) {
        List<ExamSession> rows = jdbcTemplate.query(
                "SELECT " + SESSION_COLUMNS + " FROM exam_sessions WHERE id = ?",
                (rs, i) -> mapSession(rs),
                sessionId);
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        ExamSession head = rows.get(0);
        return Optional.of(withTasks(head, findAssignedTasks(sessionId)));
    }

    public List<ExamSession> findRecent(int limit) {
        List<ExamSession> heads = jdbcTemplate.query(
                "SELECT " + SESSION_COLUMNS + " FROM exam_sessions ORDER BY created_at DESC, id DESC LIMIT ?",
                (rs, i) -> mapSession(rs),
                limit);
        return heads.stream()
                .map(s -> withTasks(s, findAssignedTasks(s.id())))
                .toList();
    }

    /**
     * Writes the assignment and flips DRAFT to ACTIVE in one transaction. The status
     * update is conditional, so a session activated by another writer is left untouched.
     */
    @Transactional
    public void activate(Long sessionId, long seed, List<AssignedTask> tasks, Instant at) {
        int updated = jdbcTemplate.update(
                "UPDATE exam_sessions SET status = ?, seed = ?, updated_at = ? WHERE id = ? AND status = ?",
                SessionStatus.ACTIVE.name(), seed, Timestamp.from(at), sessionId, SessionStatus.DRAFT.name());
        if (updated == 0) {
            throw new ConcurrencyException("Exam session " + sessionId + " is no longer in DRAFT");
        }
        if (tasks.isEmpty()) {
            return;
        }

        jdbcTemplate.batchUpdate(
                "INSERT INTO exam_session_tasks (session_id, task_order, task_id, category_id, role) VALUES (?, ?, ?, ?, ?)",
                tasks,
                tasks.size(),
                (ps, t) -> {
                    ps.setLong(1, sessionId);
                    ps.setInt(2, t.position());
                    ps.setLong(3, t.taskId());
                    ps.setLong(4, t.categoryId());
                    ps.setString(5, t.role().name());
                });
    }

    /**
     * @return true if this call moved the session to COMPLETED
     */
    public boolean complete(Long sessionId, Instant at) {
        return jdbcTemplate.update(
                "UPDATE exam_sessions SET status = ?, updated_at = ? WHERE id = ? AND status = ?",
                SessionStatus.COMPLETED.name(), Timestamp.from(at), sessionId, SessionStatus.ACTIVE.name()) == 1;
    }

    public Set<Long> findTaskIdsAssignedToGroup(Long groupId) {
        return new HashSet<>(jdbcTemplate.queryForList("""
                        SELECT DISTINCT t.task_id
                        FROM exam_session_tasks t
                        JOIN exam_sessions s ON s.id = t.session_id
                        WHERE s.group_id = ?
                        """,
                Long.class, groupId));
    }

    private List<AssignedTask> findAssignedTasks(Long sessionId) {
        return jdbcTemplate.query(
                "SELECT task_order, task_id, category_id, role FROM exam_session_tasks WHERE session_id = ? ORDER BY task_order",
                (rs, i) -> new AssignedTask(
                        rs.getInt("task_order"),
                        rs.getLong("task_id"),
                        rs.getLong("category_id"),
                        TaskRole.valueOf(rs.getString("role"))),
                sessionId);
    }

    private static ExamSession mapSession(ResultSet rs) throws SQLException {
        long groupId = rs.getLong("group_id");
        Long group = rs.wasNull() ? null : groupId;
        long seed = rs.getLong("seed");
        Long seedOrNull = rs.wasNull() ? null : seed;
        return new ExamSession(
                rs.getLong("id"),
                group,
                rs.getString("demo_label"),
                SessionStatus.valueOf(rs.getString("status")),
                seedOrNull,
                rs.getTimestamp("created_at").toInstant(),
                rs.getTimestamp("updated_at").toInstant(),
                List.of());
    }

    private static ExamSession withTasks(ExamSession s, List<AssignedTask> tasks) {
        return new ExamSession(s.id(), s.groupId(), s.demoLabel(), s.status(), s.seed(), s.createdAt(), s.updatedAt(), tasks);
    }
}
