package com.example.oralexam.controller.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Date;
import java.util.Map;
import lombok.*;

@Builder
@Setter
@Getter
@AllArgsConstructor
@NoArgsConstructor
public class ErrorResponse {
    private String error;
    private String message;
    private int status;
    private String path;
    private Date timestamp;
    private String trace;

    // structured fields of the failure, e.g. category/required/available
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private Map<String, Object> details;
}
