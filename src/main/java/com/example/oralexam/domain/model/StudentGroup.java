package com.example.oralexam.domain.model;

import java.util.List;

public record StudentGroup(
        Long id,
        String label,
        List<Student> students
) {
    public StudentGroup {
        students = students == null ? List.of() : List.copyOf(students);
    }
}
