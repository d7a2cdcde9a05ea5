package com.example.oralexam.infrastructure.persistence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.oralexam.application.service.CatalogFixture;
import com.example.oralexam.domain.exception.ConcurrencyException;
import com.example.oralexam.domain.model.AssignedTask;
import com.example.oralexam.domain.model.ExamSession;
import com.example.oralexam.domain.model.SessionStatus;
import com.example.oralexam.domain.model.TaskRole;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;

@SpringBootTest
class ExamSessionRepositoryTest {

    private static final Instant CREATED = Instant.parse("2024-05-01T10:00:00Z");
    private static final Instant LATER = Instant.parse("2024-05-01T10:05:00Z");

    @Autowired
    private ExamSessionRepository repository;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void setUp() {
        CatalogFixture.seed(jdbcTemplate);
    }

    @Test
    void secondActivationIsRejectedAndWritesNothing() {
        ExamSession session = repository.insertDraft(CatalogFixture.GROUP, null, CREATED);
        List<AssignedTask> first = List.of(
                new AssignedTask(1, 12L, CatalogFixture.BASICS, TaskRole.QUOTA),
                new AssignedTask(2, 22L, CatalogFixture.ALGORITHMS, TaskRole.QUOTA),
                new AssignedTask(3, 23L, CatalogFixture.ALGORITHMS, TaskRole.QUOTA));
        repository.activate(session.id(), 7L, first, LATER);

        List<AssignedTask> second = List.of(
                new AssignedTask(1, 11L, CatalogFixture.BASICS, TaskRole.QUOTA),
                new AssignedTask(2, 21L, CatalogFixture.ALGORITHMS, TaskRole.QUOTA));
        assertThatThrownBy(() -> repository.activate(session.id(), 8L, second, LATER))
                .isInstanceOf(ConcurrencyException.class);

        ExamSession stored = repository.findById(session.id()).orElseThrow();
        assertThat(stored.status()).isEqualTo(SessionStatus.ACTIVE);
        assertThat(stored.seed()).isEqualTo(7L);
        assertThat(stored.assignedTasks()).isEqualTo(first);
        assertThat(countAssignedRows(session.id())).isEqualTo(3);
    }

    @Test
    void failedInsertRollsBackTheStatusChange() {
        ExamSession session = repository.insertDraft(null, "rollback", CREATED);
        List<AssignedTask> duplicated = List.of(
                new AssignedTask(1, 11L, CatalogFixture.BASICS, TaskRole.QUOTA),
                new AssignedTask(2, 11L, CatalogFixture.BASICS, TaskRole.DEPENDENCY));

        assertThatThrownBy(() -> repository.activate(session.id(), 9L, duplicated, LATER))
                .isInstanceOf(DataIntegrityViolationException.class);

        ExamSession stored = repository.findById(session.id()).orElseThrow();
        assertThat(stored.status()).isEqualTo(SessionStatus.DRAFT);
        assertThat(stored.seed()).isNull();
        assertThat(countAssignedRows(session.id())).isZero();
    }

    @Test
    void completeOnlyMovesActiveSessions() {
        ExamSession session = repository.insertDraft(CatalogFixture.GROUP, null, CREATED);

        assertThat(repository.complete(session.id(), LATER)).isFalse();

        repository.activate(session.id(), 1L, List.of(), LATER);
        assertThat(repository.complete(session.id(), LATER)).isTrue();
        assertThat(repository.complete(session.id(), LATER)).isFalse();
        assertThat(repository.findById(session.id()).orElseThrow().status()).isEqualTo(SessionStatus.COMPLETED);
    }

    @Test
    void groupHistoryCoversAllSessionsOfTheGroup() {
        ExamSession a = repository.insertDraft(CatalogFixture.GROUP, null, CREATED);
        ExamSession b = repository.insertDraft(CatalogFixture.GROUP, null, CREATED);
        ExamSession demo = repository.insertDraft(null, "demo", CREATED);
        repository.activate(a.id(), 1L, List.of(new AssignedTask(1, 11L, CatalogFixture.BASICS, TaskRole.QUOTA)), LATER);
        repository.activate(b.id(), 2L, List.of(new AssignedTask(1, 22L, CatalogFixture.ALGORITHMS, TaskRole.QUOTA)), LATER);
        repository.activate(demo.id(), 3L, List.of(new AssignedTask(1, 23L, CatalogFixture.ALGORITHMS, TaskRole.QUOTA)), LATER);

        assertThat(repository.findTaskIdsAssignedToGroup(CatalogFixture.GROUP)).containsExactlyInAnyOrder(11L, 22L);
    }

    private int countAssignedRows(Long sessionId) {
        Integer n = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM exam_session_tasks WHERE session_id = ?", Integer.class, sessionId);
        return n == null ? 0 : n;
    }
}
