package com.example.oralexam.domain.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class InsufficientTasksException extends BusinessException {

    private final String category;
    private final int required;
    private final int available;

    public InsufficientTasksException(String category, int required, int available) {
        super(HttpStatus.UNPROCESSABLE_ENTITY,
                "Not enough eligible tasks in category '" + category + "': required="
                        + required + " available=" + available);
        this.category = category;
        this.required = required;
        this.available = available;
    }
}
