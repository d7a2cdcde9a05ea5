package com.example.oralexam.domain.exception;

import org.springframework.http.HttpStatus;

public class NotFoundException extends BusinessException {

    public NotFoundException(String message) {
        super(HttpStatus.NOT_FOUND, message);
    }

    public static NotFoundException session(Long sessionId) {
        return new NotFoundException("Exam session " + sessionId + " not found");
    }

    public static NotFoundException group(Long groupId) {
        return new NotFoundException("Student group " + groupId + " not found");
    }

    public static NotFoundException task(Long taskId) {
        return new NotFoundException("Task " + taskId + " not found");
    }
}
