package com.example.oralexam.domain.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class ComputeAssignmentRequest {

    /** Absent means a fresh seed is drawn and recorded on the session. */
    private Long seed;
}
