package com.example.oralexam.application.assignment;

import java.util.List;

/**
 * Uniform sampler used for one assignment computation. Instances are not shared
 * between computations.
 */
public interface RandomSource {

    long seed();

    /**
     * Draws {@code count} distinct elements of {@code pool} uniformly, in draw order.
     */
    <T> List<T> sample(List<T> pool, int count);
}
