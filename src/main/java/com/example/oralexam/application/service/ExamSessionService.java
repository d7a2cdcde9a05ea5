package com.example.oralexam.application.service;

import com.example.oralexam.application.assignment.AssignmentEngine;
import com.example.oralexam.application.assignment.CatalogSnapshot;
import com.example.oralexam.application.assignment.DependencyGraph;
import com.example.oralexam.application.assignment.RandomSourceFactory;
import com.example.oralexam.domain.dto.InstructorView;
import com.example.oralexam.domain.dto.StudentView;
import com.example.oralexam.domain.exception.BusinessException;
import com.example.oralexam.domain.exception.InvalidSessionStateException;
import com.example.oralexam.domain.exception.NotFoundException;
import com.example.oralexam.domain.model.AssignedTask;
import com.example.oralexam.domain.model.Category;
import com.example.oralexam.domain.model.ExamSession;
import com.example.oralexam.domain.model.SessionStatus;
import com.example.oralexam.domain.model.StudentGroup;
import com.example.oralexam.domain.model.Task;
import com.example.oralexam.infrastructure.catalog.CatalogReader;
import com.example.oralexam.infrastructure.catalog.CategoryQuotaConfig;
import com.example.oralexam.infrastructure.persistence.ExamSessionRepository;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Exam session lifecycle: DRAFT -> ACTIVE -> COMPLETED.
 * <p>
 * The assignment is computed once, under the session's lock, and stored together with the
 * DRAFT to ACTIVE transition. Any failure before that leaves the session in DRAFT with
 * nothing persisted.
 */
@Service
public class ExamSessionService {

    private static final Logger log = LoggerFactory.getLogger(ExamSessionService.class);

    private final CatalogReader catalogReader;
    private final CategoryQuotaConfig quotaConfig;
    private final AssignmentEngine assignmentEngine;
    private final RandomSourceFactory randomSourceFactory;
    private final ExamSessionRepository sessionRepository;
    private final SessionLockRegistry lockRegistry;
    private final ViewProjector viewProjector;

    private final boolean excludeGroupHistory;

    public ExamSessionService(
            CatalogReader catalogReader,
            CategoryQuotaConfig quotaConfig,
            AssignmentEngine assignmentEngine,
            RandomSourceFactory randomSourceFactory,
            ExamSessionRepository sessionRepository,
            SessionLockRegistry lockRegistry,
            ViewProjector viewProjector,
            @Value("${oralexam.assignment.exclude-group-history:false}") boolean excludeGroupHistory
    ) {
        this.catalogReader = catalogReader;
        this.quotaConfig = quotaConfig;
        this.assignmentEngine = assignmentEngine;
        this.randomSourceFactory = randomSourceFactory;
        this.sessionRepository = sessionRepository;
        this.lockRegistry = lockRegistry;
        this.viewProjector = viewProjector;
        this.excludeGroupHistory = excludeGroupHistory;
    }

    public ExamSession createSession(Long groupId) {
        if (groupId == null) {
            throw new IllegalArgumentException("groupId is required");
        }
        catalogReader.findGroup(groupId).orElseThrow(() -> NotFoundException.group(groupId));

        ExamSession session = sessionRepository.insertDraft(groupId, null, Instant.now());
        log.info("event=session_created sessionId={} groupId={}", session.id(), groupId);
        return session;
    }

    /**
     * Session without a group, for trying out the catalog configuration.
     */
    public ExamSession createDemoSession(String label) {
        if (!StringUtils.hasText(label)) {
            throw new IllegalArgumentException("demo label is required");
        }
        ExamSession session = sessionRepository.insertDraft(null, label.trim(), Instant.now());
        log.info("event=session_created sessionId={} demoLabel={}", session.id(), session.demoLabel());
        return session;
    }

    /**
     * Draws the session's tasks and moves it to ACTIVE. A session that is already ACTIVE or
     * COMPLETED is returned as stored, whatever seed is passed.
     *
     * @param seed seed for the draw; {@code null} draws a fresh one, which is recorded on the session
     */
    public ExamSession computeAssignment(Long sessionId, Long seed) {
        try {
            return lockRegistry.withLock(sessionId, () -> assignUnderLock(sessionId, seed));
        } finally {
            // later calls are guarded by the DRAFT compare-and-set
            lockRegistry.release(sessionId);
        }
    }

    private ExamSession assignUnderLock(Long sessionId, Long seed) {
        ExamSession session = requireSession(sessionId);
        if (session.status() != SessionStatus.DRAFT) {
            log.info("event=assignment_reused sessionId={} status={} seed={}",
                    sessionId, session.status(), session.seed());
            return session;
        }

        long t0 = System.nanoTime();
        long effectiveSeed = seed != null ? seed : randomSourceFactory.newSeed();

        List<AssignedTask> tasks;
        try {
            CatalogSnapshot catalog = readCatalog();
            Map<Long, Integer> quotas = quotaConfig.quotas();
            Set<Long> withheld = excludeGroupHistory && session.groupId() != null
                    ? sessionRepository.findTaskIdsAssignedToGroup(session.groupId())
                    : Set.of();

            DependencyGraph graph = DependencyGraph.build(catalog.allTasks());
            tasks = assignmentEngine.assign(catalog, quotas, graph, withheld,
                    randomSourceFactory.create(effectiveSeed));
        } catch (BusinessException e) {
            log.warn("event=assignment_failed sessionId={} seed={} error={} msg={}",
                    sessionId, effectiveSeed, e.getClass().getSimpleName(), e.getMessage());
            throw e;
        }

        Instant now = Instant.now();
        sessionRepository.activate(sessionId, effectiveSeed, tasks, now);

        long t1 = System.nanoTime();
        log.info("event=assignment_computed sessionId={} seed={} tasks={} ms={}",
                sessionId, effectiveSeed, tasks.size(), (t1 - t0) / 1_000_000);

        return new ExamSession(session.id(), session.groupId(), session.demoLabel(),
                SessionStatus.ACTIVE, effectiveSeed, session.createdAt(), now, tasks);
    }

    /**
     * ACTIVE -> COMPLETED. Completing a COMPLETED session is a no-op.
     */
    public ExamSession completeSession(Long sessionId) {
        ExamSession session = requireSession(sessionId);
        switch (session.status()) {
            case DRAFT -> throw new InvalidSessionStateException(sessionId, session.status(), "complete");
            case COMPLETED -> {
                return session;
            }
            case ACTIVE -> {
                if (sessionRepository.complete(sessionId, Instant.now())) {
                    log.info("event=session_completed sessionId={}", sessionId);
                }
            }
        }
        return requireSession(sessionId);
    }

    public InstructorView getInstructorView(Long sessionId) {
        ExamSession session = requireSession(sessionId);
        StudentGroup group = session.groupId() == null
                ? null
                : catalogReader.findGroup(session.groupId()).orElse(null);

        if (session.status() == SessionStatus.DRAFT) {
            return viewProjector.instructorView(session, group, Map.of(), Map.of());
        }
        CatalogSnapshot catalog = readCatalog();
        return viewProjector.instructorView(session, group, tasksById(catalog), categoriesById(catalog));
    }

    public StudentView getStudentView(Long sessionId) {
        ExamSession session = requireSession(sessionId);
        if (session.status() == SessionStatus.DRAFT) {
            return viewProjector.studentView(session, Map.of(), Map.of());
        }
        CatalogSnapshot catalog = readCatalog();
        return viewProjector.studentView(session, tasksById(catalog), categoriesById(catalog));
    }

    public ExamSession findSession(Long sessionId) {
        return requireSession(sessionId);
    }

    public List<ExamSession> listRecentSessions(int limit) {
        return sessionRepository.findRecent(Math.max(1, limit));
    }

    private ExamSession requireSession(Long sessionId) {
        return sessionRepository.findById(sessionId)
                .orElseThrow(() -> NotFoundException.session(sessionId));
    }

    private CatalogSnapshot readCatalog() {
        return new CatalogSnapshot(catalogReader.listCategories(), catalogReader.listTasksByCategory());
    }

    private static Map<Long, Task> tasksById(CatalogSnapshot catalog) {
        Map<Long, Task> out = new HashMap<>();
        for (Task task : catalog.allTasks()) {
            out.put(task.id(), task);
        }
        return out;
    }

    private static Map<Long, Category> categoriesById(CatalogSnapshot catalog) {
        Map<Long, Category> out = new HashMap<>();
        for (Category category : catalog.categories()) {
            out.put(category.id(), category);
        }
        return out;
    }
}
