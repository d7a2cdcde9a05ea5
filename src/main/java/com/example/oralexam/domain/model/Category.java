package com.example.oralexam.domain.model;

public record Category(
        Long id,
        String name,
        int quota
) {
}
