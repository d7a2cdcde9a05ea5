package com.example.oralexam.application.assignment;

public interface RandomSourceFactory {

    RandomSource create(long seed);

    /**
     * Fresh, non-reproducible seed for callers that did not pass one.
     */
    long newSeed();
}
