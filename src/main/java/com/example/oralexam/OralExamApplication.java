package com.example.oralexam;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OralExamApplication {

    public static void main(String[] args) {
        SpringApplication.run(OralExamApplication.class, args);
    }
}
