package com.example.oralexam.domain.model;

public record Student(
        Long id,
        String fullName
) {
}
