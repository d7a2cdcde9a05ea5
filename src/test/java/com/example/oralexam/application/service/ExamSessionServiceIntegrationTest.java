package com.example.oralexam.application.service;

import static com.example.oralexam.application.service.CatalogFixture.ALGORITHMS;
import static com.example.oralexam.application.service.CatalogFixture.GROUP;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.oralexam.domain.dto.InstructorView;
import com.example.oralexam.domain.dto.StudentView;
import com.example.oralexam.domain.exception.ConfigException;
import com.example.oralexam.domain.exception.DependencyConflictException;
import com.example.oralexam.domain.exception.InsufficientTasksException;
import com.example.oralexam.domain.exception.InvalidSessionStateException;
import com.example.oralexam.domain.exception.NotFoundException;
import com.example.oralexam.domain.model.AssignedTask;
import com.example.oralexam.domain.model.ExamSession;
import com.example.oralexam.domain.model.SessionStatus;
import com.example.oralexam.domain.model.TaskRole;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;

@SpringBootTest
class ExamSessionServiceIntegrationTest {

    @Autowired
    private ExamSessionService service;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private SessionLockRegistry lockRegistry;

    @BeforeEach
    void setUp() {
        CatalogFixture.seed(jdbcTemplate);
    }

    @Test
    void fullLifecycle() {
        ExamSession draft = service.createSession(GROUP);
        assertThat(draft.status()).isEqualTo(SessionStatus.DRAFT);
        assertThat(draft.assignedTasks()).isEmpty();

        StudentView waiting = service.getStudentView(draft.id());
        assertThat(waiting.isReady()).isFalse();
        assertThat(waiting.getStatus()).isEqualTo(SessionStatus.DRAFT);
        assertThat(service.getInstructorView(draft.id()).isPending()).isTrue();

        ExamSession active = service.computeAssignment(draft.id(), 42L);
        assertThat(active.status()).isEqualTo(SessionStatus.ACTIVE);
        assertThat(active.seed()).isEqualTo(42L);

        long quotaPicks = active.assignedTasks().stream().filter(t -> t.role() == TaskRole.QUOTA).count();
        assertThat(quotaPicks).isEqualTo(3);

        ExamSession stored = service.findSession(draft.id());
        assertThat(stored.status()).isEqualTo(SessionStatus.ACTIVE);
        assertThat(stored.seed()).isEqualTo(42L);
        assertThat(stored.assignedTasks()).isEqualTo(active.assignedTasks());

        InstructorView instructor = service.getInstructorView(draft.id());
        assertThat(instructor.isPending()).isFalse();
        assertThat(instructor.getGroup().students()).hasSize(2);
        assertThat(instructor.getTasks()).extracting(InstructorView.TaskView::getTaskId)
                .containsExactlyElementsOf(stored.assignedTaskIds());
        assertThat(instructor.getTasks()).allSatisfy(t -> assertThat(t.getSolutionMarkdown()).startsWith("solution for"));

        StudentView ready = service.getStudentView(draft.id());
        assertThat(ready.isReady()).isTrue();
        assertThat(ready.getTasks()).extracting(StudentView.TaskView::getTaskId)
                .containsExactlyElementsOf(stored.assignedTaskIds());

        ExamSession completed = service.completeSession(draft.id());
        assertThat(completed.status()).isEqualTo(SessionStatus.COMPLETED);
        assertThat(service.completeSession(draft.id()).status()).isEqualTo(SessionStatus.COMPLETED);
        assertThat(service.getStudentView(draft.id()).getStatus()).isEqualTo(SessionStatus.COMPLETED);
    }

    @Test
    void activeSessionIsNeverRecomputed() {
        ExamSession session = service.createSession(GROUP);
        ExamSession first = service.computeAssignment(session.id(), 1L);

        ExamSession again = service.computeAssignment(session.id(), 2L);

        assertThat(again.seed()).isEqualTo(1L);
        assertThat(again.assignedTasks()).isEqualTo(first.assignedTasks());
        assertThat(countAssignedRows(session.id())).isEqualTo(first.assignedTasks().size());
    }

    @Test
    void sameSeedGivesSameAssignmentAcrossSessions() {
        ExamSession a = service.computeAssignment(service.createSession(GROUP).id(), 777L);
        ExamSession b = service.computeAssignment(service.createSession(GROUP).id(), 777L);

        assertThat(b.assignedTaskIds()).isEqualTo(a.assignedTaskIds());
    }

    @Test
    void missingSeedIsDrawnAndRecorded() {
        ExamSession session = service.createSession(GROUP);

        ExamSession active = service.computeAssignment(session.id(), null);

        assertThat(active.seed()).isNotNull();
        assertThat(service.findSession(session.id()).seed()).isEqualTo(active.seed());
    }

    @Test
    void insufficientTasksLeaveSessionInDraft() {
        CatalogFixture.setQuota(jdbcTemplate, ALGORITHMS, 4);
        ExamSession session = service.createSession(GROUP);

        assertThatThrownBy(() -> service.computeAssignment(session.id(), 3L))
                .isInstanceOfSatisfying(InsufficientTasksException.class, e -> {
                    assertThat(e.getCategory()).isEqualTo("Algorithms");
                    assertThat(e.getRequired()).isEqualTo(4);
                    assertThat(e.getAvailable()).isEqualTo(3);
                });

        ExamSession stored = service.findSession(session.id());
        assertThat(stored.status()).isEqualTo(SessionStatus.DRAFT);
        assertThat(stored.seed()).isNull();
        assertThat(countAssignedRows(session.id())).isZero();
    }

    @Test
    void requiresCycleIsAConfigError() {
        jdbcTemplate.update("INSERT INTO task_requires (task_id, required_task_id) VALUES (?, ?)", 11L, 21L);
        ExamSession session = service.createSession(GROUP);

        assertThatThrownBy(() -> service.computeAssignment(session.id(), 3L))
                .isInstanceOf(ConfigException.class);
        assertThat(service.findSession(session.id()).status()).isEqualTo(SessionStatus.DRAFT);
    }

    @Test
    void conflictingClosuresLeaveSessionInDraft() {
        CatalogFixture.setQuota(jdbcTemplate, CatalogFixture.BASICS, 0);
        CatalogFixture.setQuota(jdbcTemplate, ALGORITHMS, 0);
        CatalogFixture.insertCategory(jdbcTemplate, 3L, "Prerequisites", 0);
        CatalogFixture.insertCategory(jdbcTemplate, 4L, "Main", 2);
        CatalogFixture.insertTask(jdbcTemplate, 1L, "Pointers", 3L);
        CatalogFixture.insertTask(jdbcTemplate, 2L, "References", 3L);
        CatalogFixture.insertTask(jdbcTemplate, 31L, "Linked list", 4L);
        CatalogFixture.insertTask(jdbcTemplate, 32L, "Ownership", 4L);
        jdbcTemplate.update("INSERT INTO task_excludes (task_id, excluded_task_id) VALUES (?, ?)", 1L, 2L);
        jdbcTemplate.update("INSERT INTO task_requires (task_id, required_task_id) VALUES (?, ?)", 31L, 1L);
        jdbcTemplate.update("INSERT INTO task_requires (task_id, required_task_id) VALUES (?, ?)", 32L, 2L);
        ExamSession session = service.createSession(GROUP);

        assertThatThrownBy(() -> service.computeAssignment(session.id(), 8L))
                .isInstanceOfSatisfying(DependencyConflictException.class, e ->
                        assertThat(Set.of(e.getTaskId(), e.getConflictingTaskId())).isEqualTo(Set.of(1L, 2L)));

        ExamSession stored = service.findSession(session.id());
        assertThat(stored.status()).isEqualTo(SessionStatus.DRAFT);
        assertThat(stored.seed()).isNull();
        assertThat(stored.assignedTasks()).isEmpty();
        assertThat(countAssignedRows(session.id())).isZero();
    }

    @Test
    void sessionLocksAreDroppedOnceAssignmentEnds() {
        ExamSession ok = service.createSession(GROUP);
        service.computeAssignment(ok.id(), 1L);
        assertThat(lockRegistry.size()).isZero();

        CatalogFixture.setQuota(jdbcTemplate, ALGORITHMS, 4);
        ExamSession failing = service.createSession(GROUP);
        assertThatThrownBy(() -> service.computeAssignment(failing.id(), 1L))
                .isInstanceOf(InsufficientTasksException.class);
        assertThat(lockRegistry.size()).isZero();

        assertThat(service.computeAssignment(ok.id(), 2L).seed()).isEqualTo(1L);
        assertThat(lockRegistry.size()).isZero();
    }

    @Test
    void failedSessionCanStillBeAssignedAfterCatalogFix() {
        CatalogFixture.setQuota(jdbcTemplate, ALGORITHMS, 4);
        ExamSession session = service.createSession(GROUP);
        assertThatThrownBy(() -> service.computeAssignment(session.id(), 3L))
                .isInstanceOf(InsufficientTasksException.class);

        CatalogFixture.setQuota(jdbcTemplate, ALGORITHMS, 2);

        assertThat(service.computeAssignment(session.id(), 3L).status()).isEqualTo(SessionStatus.ACTIVE);
    }

    @Test
    void unknownReferencesAreNotFound() {
        assertThatThrownBy(() -> service.createSession(999L)).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> service.computeAssignment(999L, 1L)).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> service.getStudentView(999L)).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> service.completeSession(999L)).isInstanceOf(NotFoundException.class);
    }

    @Test
    void draftSessionCannotBeCompleted() {
        ExamSession session = service.createSession(GROUP);

        assertThatThrownBy(() -> service.completeSession(session.id()))
                .isInstanceOf(InvalidSessionStateException.class);
    }

    @Test
    void demoSessionHasNoGroup() {
        ExamSession demo = service.createDemoSession("  Trial run ");

        ExamSession active = service.computeAssignment(demo.id(), 5L);

        assertThat(active.groupId()).isNull();
        assertThat(active.demoLabel()).isEqualTo("Trial run");
        InstructorView view = service.getInstructorView(demo.id());
        assertThat(view.getGroup()).isNull();
        assertThat(view.getTasks()).isNotEmpty();
    }

    @Test
    void recentSessionsAreNewestFirst() {
        ExamSession older = service.createSession(GROUP);
        ExamSession newer = service.createDemoSession("later");

        List<ExamSession> recent = service.listRecentSessions(10);

        assertThat(recent).extracting(ExamSession::id).containsExactly(newer.id(), older.id());
    }

    @Test
    void concurrentAssignmentsPersistOneResult() throws Exception {
        ExamSession session = service.createSession(GROUP);
        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            Callable<ExamSession> withSeedOne = () -> {
                start.await();
                return service.computeAssignment(session.id(), 1L);
            };
            Callable<ExamSession> withSeedTwo = () -> {
                start.await();
                return service.computeAssignment(session.id(), 2L);
            };
            Future<ExamSession> a = executor.submit(withSeedOne);
            Future<ExamSession> b = executor.submit(withSeedTwo);
            start.countDown();

            ExamSession ra = a.get(10, TimeUnit.SECONDS);
            ExamSession rb = b.get(10, TimeUnit.SECONDS);

            assertThat(ra.assignedTasks()).isEqualTo(rb.assignedTasks());
            assertThat(ra.seed()).isEqualTo(rb.seed());

            ExamSession stored = service.findSession(session.id());
            List<AssignedTask> persisted = stored.assignedTasks();
            assertThat(persisted).isEqualTo(ra.assignedTasks());
            assertThat(countAssignedRows(session.id())).isEqualTo(persisted.size());
        } finally {
            executor.shutdownNow();
        }
    }

    private int countAssignedRows(Long sessionId) {
        Integer n = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM exam_session_tasks WHERE session_id = ?", Integer.class, sessionId);
        return n == null ? 0 : n;
    }
}
