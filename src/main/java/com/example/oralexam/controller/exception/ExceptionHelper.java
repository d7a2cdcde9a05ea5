package com.example.oralexam.controller.exception;

import com.example.oralexam.domain.exception.DependencyConflictException;
import com.example.oralexam.domain.exception.InsufficientTasksException;
import com.example.oralexam.domain.exception.InvalidSessionStateException;
import java.util.LinkedHashMap;
import java.util.Map;

public class ExceptionHelper {

    public static String getTrace(Throwable ex) {
        StackTraceElement[] st = ex.getStackTrace();
        if (st != null && st.length > 0) {
            StackTraceElement e = st[0];
            return e.getClassName() + ":" + e.getLineNumber();
        }
        return null;
    }

    public static Map<String, Object> getDetails(Throwable ex) {
        Map<String, Object> details = new LinkedHashMap<>();
        if (ex instanceof InsufficientTasksException e) {
            details.put("category", e.getCategory());
            details.put("required", e.getRequired());
            details.put("available", e.getAvailable());
        } else if (ex instanceof DependencyConflictException e) {
            details.put("taskId", e.getTaskId());
            details.put("conflictingTaskId", e.getConflictingTaskId());
        } else if (ex instanceof InvalidSessionStateException e) {
            details.put("sessionStatus", e.getSessionStatus());
        }
        return details;
    }
}
