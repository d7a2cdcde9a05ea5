package com.example.oralexam.application.assignment;

import java.security.SecureRandom;
import org.springframework.stereotype.Component;

@Component
public class SeededRandomSourceFactory implements RandomSourceFactory {

    private final SecureRandom seeds = new SecureRandom();

    @Override
    public RandomSource create(long seed) {
        return new SeededRandomSource(seed);
    }

    @Override
    public long newSeed() {
        return seeds.nextLong();
    }
}
