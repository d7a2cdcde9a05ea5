package com.example.oralexam.domain.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class CreateSessionRequest {

    @Positive
    private Long groupId;

    // only for sessions without a group
    @Size(max = 255)
    private String demoLabel;

    @JsonIgnore
    @AssertTrue(message = "either groupId or demoLabel is required")
    public boolean isTargetPresent() {
        return groupId != null || (demoLabel != null && !demoLabel.isBlank());
    }
}
