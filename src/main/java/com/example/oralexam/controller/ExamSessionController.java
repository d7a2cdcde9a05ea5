package com.example.oralexam.controller;

import com.example.oralexam.application.service.ExamSessionService;
import com.example.oralexam.domain.dto.ComputeAssignmentRequest;
import com.example.oralexam.domain.dto.CreateSessionRequest;
import com.example.oralexam.domain.dto.InstructorView;
import com.example.oralexam.domain.dto.ResponseData;
import com.example.oralexam.domain.dto.SessionResponse;
import com.example.oralexam.domain.dto.StudentView;
import com.example.oralexam.domain.exception.ConcurrencyException;
import com.example.oralexam.domain.model.ExamSession;
import jakarta.validation.Valid;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(path = "/api/exams", produces = MediaType.APPLICATION_JSON_VALUE)
public class ExamSessionController {

    private static final Logger log = LoggerFactory.getLogger(ExamSessionController.class);

    private final ExamSessionService examSessionService;
    private final int defaultRecentLimit;

    public ExamSessionController(
            ExamSessionService examSessionService,
            @Value("${oralexam.api.recent-sessions-limit:20}") int defaultRecentLimit
    ) {
        this.examSessionService = examSessionService;
        this.defaultRecentLimit = defaultRecentLimit;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ResponseData<SessionResponse>> create(@Valid @RequestBody CreateSessionRequest request) {
        ExamSession session = request.getGroupId() != null
                ? examSessionService.createSession(request.getGroupId())
                : examSessionService.createDemoSession(request.getDemoLabel());

        ResponseData<SessionResponse> response = ResponseData.<SessionResponse>builder()
                .status(HttpStatus.CREATED.value())
                .message("Exam session created")
                .data(SessionResponse.from(session))
                .build();

        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping
    public ResponseEntity<ResponseData<List<SessionResponse>>> recent(
            @RequestParam(name = "limit", required = false) Integer limit
    ) {
        List<SessionResponse> sessions = examSessionService
                .listRecentSessions(limit == null ? defaultRecentLimit : limit)
                .stream()
                .map(SessionResponse::from)
                .toList();

        return ResponseEntity.ok(ResponseData.<List<SessionResponse>>builder()
                .status(HttpStatus.OK.value())
                .message("Recent exam sessions")
                .data(sessions)
                .build());
    }

    @GetMapping("/{id}")
    public ResponseEntity<ResponseData<SessionResponse>> get(@PathVariable("id") Long id) {
        return ResponseEntity.ok(ResponseData.<SessionResponse>builder()
                .status(HttpStatus.OK.value())
                .message("Exam session")
                .data(SessionResponse.from(examSessionService.findSession(id)))
                .build());
    }

    /**
     * Lost races on the session lock are retried; the retry returns the stored assignment.
     */
    @Retryable(
            retryFor = {ConcurrencyException.class},
            maxAttemptsExpression = "#{${oralexam.api.concurrency-retries:2} + 1}",
            backoff = @Backoff(delay = 100, multiplier = 2.0)
    )
    @PostMapping("/{id}/assignment")
    public ResponseEntity<ResponseData<SessionResponse>> assign(
            @PathVariable("id") Long id,
            @RequestBody(required = false) ComputeAssignmentRequest request
    ) {
        Long seed = request == null ? null : request.getSeed();
        log.debug("event=api_assign sessionId={} seedGiven={}", id, seed != null);

        ExamSession session = examSessionService.computeAssignment(id, seed);

        return ResponseEntity.ok(ResponseData.<SessionResponse>builder()
                .status(HttpStatus.OK.value())
                .message("Tasks assigned")
                .data(SessionResponse.from(session))
                .build());
    }

    @GetMapping("/{id}/instructor")
    public ResponseEntity<ResponseData<InstructorView>> instructorView(@PathVariable("id") Long id) {
        InstructorView view = examSessionService.getInstructorView(id);
        return ResponseEntity.ok(ResponseData.<InstructorView>builder()
                .status(HttpStatus.OK.value())
                .message(view.isPending() ? "Not yet assigned" : "Assigned tasks")
                .data(view)
                .build());
    }

    @GetMapping("/{id}/student")
    public ResponseEntity<ResponseData<StudentView>> studentView(@PathVariable("id") Long id) {
        StudentView view = examSessionService.getStudentView(id);
        return ResponseEntity.ok(ResponseData.<StudentView>builder()
                .status(HttpStatus.OK.value())
                .message(view.isReady() ? "Tasks ready" : "Waiting for tasks")
                .data(view)
                .build());
    }

    @PostMapping("/{id}/complete")
    public ResponseEntity<ResponseData<SessionResponse>> complete(@PathVariable("id") Long id) {
        return ResponseEntity.ok(ResponseData.<SessionResponse>builder()
                .status(HttpStatus.OK.value())
                .message("Exam session completed")
                .data(SessionResponse.from(examSessionService.completeSession(id)))
                .build());
    }
}
