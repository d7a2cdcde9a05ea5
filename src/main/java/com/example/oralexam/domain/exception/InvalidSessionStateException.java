package com.example.oralexam.domain.exception;

import com.example.oralexam.domain.model.SessionStatus;
import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class InvalidSessionStateException extends BusinessException {

    private final SessionStatus sessionStatus;

    public InvalidSessionStateException(Long sessionId, SessionStatus sessionStatus, String action) {
        super(HttpStatus.CONFLICT, "Cannot " + action + " exam session " + sessionId + " in status " + sessionStatus);
        this.sessionStatus = sessionStatus;
    }
}
