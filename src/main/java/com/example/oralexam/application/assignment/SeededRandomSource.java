package com.example.oralexam.application.assignment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

public class SeededRandomSource implements RandomSource {

    private final long seed;
    private final Random random;

    public SeededRandomSource(long seed) {
        this.seed = seed;
        this.random = new Random(seed);
    }

    @Override
    public long seed() {
        return seed;
    }

    @Override
    public <T> List<T> sample(List<T> pool, int count) {
        if (count < 0 || count > pool.size()) {
            throw new IllegalArgumentException("Cannot draw " + count + " from " + pool.size());
        }
        // partial Fisher-Yates: the first `count` slots end up holding the draw
        List<T> work = new ArrayList<>(pool);
        for (int i = 0; i < count; i++) {
            int j = i + random.nextInt(work.size() - i);
            Collections.swap(work, i, j);
        }
        return List.copyOf(work.subList(0, count));
    }
}
